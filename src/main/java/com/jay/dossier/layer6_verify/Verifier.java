package com.jay.dossier.layer6_verify;

import com.jay.dossier.config.DossierConfig;
import com.jay.dossier.layer2_calculate.CalculatorRegistry;
import com.jay.dossier.layer2_calculate.FinancialRatios;
import com.jay.dossier.layer2_calculate.MetricCalculator;
import com.jay.dossier.layer2_calculate.MetricNames;
import com.jay.dossier.layer2_calculate.StatementLines;
import com.jay.dossier.layer3_valuation.HurdleCalculator;
import com.jay.dossier.layer3_valuation.TerminalGrowthCalculator;
import com.jay.dossier.layer3_valuation.ValuationInputs;
import com.jay.dossier.layer3_valuation.WaccCalculator;
import com.jay.dossier.layer4_gates.GateDefinition;
import com.jay.dossier.layer4_gates.StageZeroGates;
import com.jay.dossier.model.CompanyQuarter;
import com.jay.dossier.model.GateRow;
import com.jay.dossier.model.Metric;
import com.jay.dossier.model.ProvenanceIssue;
import com.jay.dossier.model.QAResult;
import com.jay.dossier.model.ValuationBlock;
import com.jay.dossier.model.WaccEstimate;
import com.jay.dossier.model.enums.BusinessModel;
import com.jay.dossier.model.enums.GateResult;
import com.jay.dossier.model.enums.Hardness;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Layer 6 - Verifier.
 * Second, independent pass over a finished analysis. Re-derives a seeded sample of metrics from
 * the normalized quarter with its own calculator instances, then enforces the cross-field rules
 * that keep a dossier internally consistent.
 *
 * Every problem becomes a reason string; the dossier is PASS only when there are none.
 * A hard gate that fails is a legitimate verdict, not a QA problem. A hard gate with no
 * verdict is.
 */
@Slf4j
@Service
public class Verifier {

    private final DossierConfig config;
    private final CalculatorRegistry registry;
    private final WaccCalculator waccCalculator;
    private final TerminalGrowthCalculator terminalGrowthCalculator;
    private final HurdleCalculator hurdleCalculator;
    private final SourceAllowlist allowlist;
    private final List<String> requiredHardGates;

    public Verifier(DossierConfig config, CalculatorRegistry registry) {
        this.config = config;
        this.registry = registry;
        this.waccCalculator = new WaccCalculator(config);
        this.terminalGrowthCalculator = new TerminalGrowthCalculator(config);
        this.hurdleCalculator = new HurdleCalculator(config);
        this.allowlist = new SourceAllowlist(config.verifier().getAllowedDomains());
        this.requiredHardGates = StageZeroGates.table(config.gates()).stream()
            .filter(g -> g.hardness() == Hardness.Hard)
            .map(GateDefinition::id)
            .toList();
    }

    /** Unit and value produced by an independent derivation; an empty value means it came out NA. */
    record Recomputed(OptionalDouble value, String unit) {
    }

    public QAResult verify(VerificationRequest request) {
        List<String> reasons = new ArrayList<>();
        CompanyQuarter quarter = request.getLatestQuarter();
        Map<String, Metric> byName = request.getMetrics().stream()
            .collect(Collectors.toMap(Metric::getName, Function.identity(), (a, b) -> a));

        // ── Provenance problems found upstream ───────────────────────────────
        for (ProvenanceIssue issue : request.getProvenanceIssues()) {
            reasons.add(String.format("Provenance issue for %s: %s", issue.metric(), issue.reason()));
        }

        // ── Independent re-derivation of a seeded sample ─────────────────────
        List<Metric> population = request.getMetrics().stream()
            .filter(m -> m.getValue().isNumeric() && m.isDerived())
            .toList();
        DossierConfig.Verifier cfg = config.verifier();
        for (Metric metric : MetricSampler.sample(population, cfg.getSampleSize(), cfg.getSampleSeed())) {
            checkSampled(metric, request, reasons);
        }

        // ── Coverage ratios must share a period ──────────────────────────────
        Metric ebitCover = byName.get(MetricNames.EBIT_INTEREST);
        Metric fcfCover = byName.get(MetricNames.FCF_INTEREST);
        if (isNumeric(ebitCover) && isNumeric(fcfCover)
            && !Objects.equals(ebitCover.getPeriod(), fcfCover.getPeriod())) {
            reasons.add(String.format("Coverage ratios reference different periods: %s=%s, %s=%s",
                MetricNames.EBIT_INTEREST, ebitCover.getPeriod(), MetricNames.FCF_INTEREST, fcfCover.getPeriod()));
        }

        // ── Valuation consistency ────────────────────────────────────────────
        ValuationBlock valuation = request.getValuation();
        if (valuation != null && quarter != null) {
            checkShares(valuation, quarter, reasons);
        }
        if (valuation != null && request.getValuationInputs() != null) {
            double hurdle = hurdleCalculator.compute(request.getValuationInputs().getBusinessAttributes()).value();
            if (FinancialRatios.relativeError(valuation.getHurdle().value(), hurdle) > cfg.getRelativeTolerance()) {
                reasons.add(String.format("Hurdle IRR %s does not match recomputed %s",
                    fmt(valuation.getHurdle().value()), fmt(hurdle)));
            }
        }

        // ── Footnote reconciliation of near-term maturities ──────────────────
        if (quarter != null) {
            checkDebtDue(byName.get(MetricNames.DEBT_DUE_24M), quarter, reasons);
        }

        // ── Segment margins on reported revenue ──────────────────────────────
        for (Metric metric : request.getMetrics()) {
            if (MetricNames.isSegmentMargin(metric.getName()) && metric.getValue().isNumeric()) {
                checkSegmentMargin(metric, quarter, reasons);
            }
        }

        // ── Subscription metrics need a subscription business ────────────────
        BusinessModel model = request.getBusinessModel() == null ? BusinessModel.OTHER : request.getBusinessModel();
        if (!model.isSubscription()) {
            for (Metric metric : request.getMetrics()) {
                if (MetricNames.SUBSCRIPTION_METRICS.contains(metric.getName()) && !metric.getValue().isNa()) {
                    reasons.add(String.format("Subscription metric %s reported for %s business model",
                        metric.getName(), model));
                }
            }
        }

        // ── Every hard gate needs a verdict ──────────────────────────────────
        Map<String, GateRow> hardRows = request.getHardGates().stream()
            .collect(Collectors.toMap(GateRow::getGateId, Function.identity(), (a, b) -> a));
        for (String gate : requiredHardGates) {
            GateRow row = hardRows.get(gate);
            if (row == null || row.getResult() == GateResult.NA) {
                reasons.add("Missing " + gate + " verdict");
            }
        }

        // ── Source URLs ──────────────────────────────────────────────────────
        for (Metric metric : request.getMetrics()) {
            if (metric.getValue().isNa()
                && config.provenance().getSystemDocumentId().equals(metric.getProvenance().documentId())) continue;
            String url = metric.getProvenance().url();
            if (!allowlist.permits(url)) {
                reasons.add(String.format("Source URL for %s is not on the allowlist: %s", metric.getName(), url));
            }
        }

        QAResult result = QAResult.of(reasons);
        log.info("QA verdict: {} ({} reason(s))", result.status(), reasons.size());
        return result;
    }

    // ── Sample checks ────────────────────────────────────────────────────────

    private void checkSampled(Metric metric, VerificationRequest request, List<String> reasons) {
        Optional<Recomputed> derived = recompute(metric.getName(), request);
        if (derived.isEmpty()) {
            reasons.add(String.format("Metric %s has no independent derivation", metric.getName()));
            return;
        }
        Recomputed r = derived.get();
        double reported = metric.numeric().getAsDouble();
        if (r.value().isEmpty()) {
            reasons.add(String.format("Metric %s could not be re-derived (reported %s)", metric.getName(), fmt(reported)));
            return;
        }
        if (!Objects.equals(metric.getUnit(), r.unit())) {
            reasons.add(String.format("Metric %s unit mismatch: reported %s vs recomputed %s",
                metric.getName(), metric.getUnit(), r.unit()));
        }
        double recomputed = r.value().getAsDouble();
        double diff = FinancialRatios.relativeError(reported, recomputed);
        if (diff > config.verifier().getRelativeTolerance()) {
            reasons.add(String.format("Metric %s mismatch: reported %s vs recomputed %s (%.2f%% difference)",
                metric.getName(), fmt(reported), fmt(recomputed), diff * 100));
        }
    }

    /** Re-derivation table: the statement calculators plus the valuation rates. */
    Optional<Recomputed> recompute(String name, VerificationRequest request) {
        CompanyQuarter quarter = request.getLatestQuarter();
        if (quarter != null) {
            Optional<MetricCalculator> calculator = registry.find(name, quarter);
            if (calculator.isPresent()) {
                MetricCalculator c = calculator.get();
                return Optional.of(new Recomputed(c.apply(quarter), c.unitFor(quarter)));
            }
        }
        ValuationInputs inputs = request.getValuationInputs();
        if (inputs == null) return Optional.empty();
        if (MetricNames.WACC.equals(name)) {
            return Optional.of(new Recomputed(OptionalDouble.of(waccCalculator.compute(inputs, quarter).point()), "ratio"));
        }
        if (MetricNames.TERMINAL_GROWTH.equals(name)) {
            WaccEstimate wacc = waccCalculator.compute(inputs, quarter);
            double g = terminalGrowthCalculator.compute(inputs.getInflation(), inputs.getRealGrowth(), wacc.point()).value();
            return Optional.of(new Recomputed(OptionalDouble.of(g), "ratio"));
        }
        return Optional.empty();
    }

    // ── Cross-field rules ────────────────────────────────────────────────────

    private void checkShares(ValuationBlock valuation, CompanyQuarter quarter, List<String> reasons) {
        if (valuation.getSharesDiluted() == null) return;
        OptionalDouble reported = quarter.item(StatementLines.DILUTED_SHARES);
        if (reported.isEmpty()) {
            reasons.add(String.format("Reverse-DCF diluted shares %s cannot be matched: latest filing %s reports none",
                fmt(valuation.getSharesDiluted()), quarter.periodKey()));
        } else if (FinancialRatios.relativeError(valuation.getSharesDiluted(), reported.getAsDouble()) > 1e-9) {
            reasons.add(String.format("Reverse-DCF diluted shares %s differ from latest reported %s (%s)",
                fmt(valuation.getSharesDiluted()), fmt(reported.getAsDouble()), quarter.periodKey()));
        }
    }

    private void checkDebtDue(Metric debtDue, CompanyQuarter quarter, List<String> reasons) {
        OptionalDouble footnote = quarter.footnote(StatementLines.DEBT_DUE_24M);
        if (footnote.isEmpty()) return;
        if (!isNumeric(debtDue)) {
            reasons.add(String.format("%s could not be derived to reconcile with footnote figure %s",
                MetricNames.DEBT_DUE_24M, fmt(footnote.getAsDouble())));
            return;
        }
        double derived = debtDue.numeric().getAsDouble();
        if (FinancialRatios.relativeError(derived, footnote.getAsDouble()) > config.verifier().getRelativeTolerance()) {
            reasons.add(String.format("%s %s does not reconcile with footnote figure %s",
                MetricNames.DEBT_DUE_24M, fmt(derived), fmt(footnote.getAsDouble())));
        }
    }

    private void checkSegmentMargin(Metric metric, CompanyQuarter quarter, List<String> reasons) {
        String segment = MetricNames.segmentOf(metric.getName());
        boolean onReported = metric.getInputs().contains(MetricNames.SEGMENT_REVENUE_PREFIX + segment)
            && metric.getInputs().stream().noneMatch(i -> i.startsWith(MetricNames.SEGMENT_ADJUSTED_PREFIX));
        if (!onReported) {
            reasons.add(String.format("Segment margin %s is not computed on reported revenue (inputs %s)",
                metric.getName(), metric.getInputs()));
            return;
        }
        OptionalDouble expected = quarter == null ? OptionalDouble.empty()
            : CalculatorRegistry.segmentMargin(segment).apply(quarter);
        double reported = metric.numeric().getAsDouble();
        if (expected.isEmpty()) {
            reasons.add(String.format("Segment margin %s cannot be recomputed from reported segment revenue",
                metric.getName()));
        } else if (FinancialRatios.relativeError(reported, expected.getAsDouble())
            > config.verifier().getRelativeTolerance()) {
            reasons.add(String.format("Segment margin %s does not recompute on reported revenue: reported %s vs %s",
                metric.getName(), fmt(reported), fmt(expected.getAsDouble())));
        }
    }

    private static boolean isNumeric(Metric metric) {
        return metric != null && metric.getValue().isNumeric();
    }

    /** Plain decimal without exponent or trailing zeros, so reasons quote the exact figures. */
    static String fmt(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
