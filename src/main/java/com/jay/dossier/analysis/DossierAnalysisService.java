package com.jay.dossier.analysis;

import com.jay.dossier.layer1_normalize.NormalizationException;
import com.jay.dossier.layer1_normalize.StatementNormalizer;
import com.jay.dossier.layer2_calculate.MetricBuilder;
import com.jay.dossier.layer2_calculate.ProvenanceCatalog;
import com.jay.dossier.layer3_valuation.ValuationEngine;
import com.jay.dossier.layer4_gates.GateContext;
import com.jay.dossier.layer4_gates.GateEngine;
import com.jay.dossier.layer4_gates.PathSelector;
import com.jay.dossier.layer5_provenance.DocumentLookup;
import com.jay.dossier.layer5_provenance.ProvenanceValidator;
import com.jay.dossier.layer6_verify.VerificationRequest;
import com.jay.dossier.layer6_verify.Verifier;
import com.jay.dossier.layer7_monitor.DeltaEngine;
import com.jay.dossier.layer7_monitor.TriggerMonitor;
import com.jay.dossier.model.CompanyQuarter;
import com.jay.dossier.model.DeltaEntry;
import com.jay.dossier.model.DossierReport;
import com.jay.dossier.model.FiscalPeriod;
import com.jay.dossier.model.Metric;
import com.jay.dossier.model.MetricSnapshot;
import com.jay.dossier.model.ProvenanceIssue;
import com.jay.dossier.model.QAResult;
import com.jay.dossier.model.TriggerAlert;
import com.jay.dossier.model.ValuationBlock;
import com.jay.dossier.model.enums.BusinessModel;
import com.jay.dossier.store.DossierStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Runs the full dossier pipeline for one ticker:
 * normalize, calculate, value, select path, gate, check provenance, verify, then delta and triggers.
 *
 * {@link #analyse} only reads stored history; nothing is written until {@link #analyseAndCommit}
 * hands the finished report to the store in one atomic step.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DossierAnalysisService {

    private final StatementNormalizer normalizer;
    private final MetricBuilder metricBuilder;
    private final ValuationEngine valuationEngine;
    private final PathSelector pathSelector;
    private final GateEngine gateEngine;
    private final ProvenanceValidator provenanceValidator;
    private final Verifier verifier;
    private final DeltaEngine deltaEngine;
    private final TriggerMonitor triggerMonitor;
    private final DossierStore store;

    private record Run(DossierReport report, List<MetricSnapshot> snapshots) {
    }

    public DossierReport analyse(AnalysisRequest request) {
        return run(request).report();
    }

    public DossierReport analyseAndCommit(AnalysisRequest request) {
        Run run = run(request);
        store.commit(run.report(), run.snapshots());
        return run.report();
    }

    private Run run(AnalysisRequest request) {
        String ticker = request.getTicker().trim().toUpperCase(Locale.ROOT);
        log.info("Dossier analysis requested for {} as of {}", ticker, request.getAsOf());

        List<CompanyQuarter> history;
        try {
            history = normalizer.normalizeHistory(request.getFilings());
        } catch (NormalizationException e) {
            log.error("Normalization failed for {}: {}", ticker, e.getMessage());
            throw e;
        }
        if (history.isEmpty()) {
            throw new IllegalArgumentException("No filings supplied for " + ticker);
        }
        CompanyQuarter latest = history.get(history.size() - 1);
        BusinessModel businessModel = request.getBusinessModel() == null ? BusinessModel.OTHER : request.getBusinessModel();

        // ── Metrics and valuation ────────────────────────────────────────────
        ProvenanceCatalog catalog = request.getProvenance() == null ? ProvenanceCatalog.empty() : request.getProvenance();
        List<Metric> metrics = new ArrayList<>(metricBuilder.build(latest, catalog));
        ValuationBlock valuation = null;
        if (request.getValuation() != null) {
            valuation = valuationEngine.value(request.getValuation(), latest);
            metrics.addAll(valuationEngine.metrics(valuation, request.getValuation(), latest.periodKey()));
        }
        metrics.addAll(request.getSupplementalMetrics());
        Map<String, Metric> byName = new LinkedHashMap<>();
        metrics.forEach(m -> byName.putIfAbsent(m.getName(), m));

        // ── Path and gates ───────────────────────────────────────────────────
        PathSelector.PathDecision path = pathSelector.select(history, byName);
        GateEngine.GateReport gates = gateEngine.evaluate(
            GateContext.of(metrics, request.getAsOf(), businessModel, request.getEvidence()), path);

        // ── Provenance and verification ──────────────────────────────────────
        List<ProvenanceIssue> issues = provenanceValidator.validate(metrics, DocumentLookup.of(request.getDocuments()));
        QAResult qa = verifier.verify(VerificationRequest.builder()
            .metrics(metrics)
            .hardGates(gates.hardGates())
            .provenanceIssues(issues)
            .latestQuarter(latest)
            .valuation(valuation)
            .valuationInputs(request.getValuation())
            .businessModel(businessModel)
            .build());

        // ── Delta and triggers ───────────────────────────────────────────────
        List<MetricSnapshot> snapshots = history.stream().map(deltaEngine::snapshotOf).toList();
        SortedMap<String, DeltaEntry> delta = deltaEngine.compute(merge(store.history(ticker), snapshots));
        Map<String, Double> latestValues = new TreeMap<>();
        byName.values().forEach(m -> m.numeric().ifPresent(v -> latestValues.put(m.getName(), v)));
        List<TriggerAlert> alerts = triggerMonitor.evaluate(ticker, latestValues, request.getAsOf());

        DossierReport report = DossierReport.builder()
            .ticker(ticker)
            .asOf(request.getAsOf())
            .analyst(DossierReport.Analyst.builder()
                .period(latest.periodKey())
                .path(path.path())
                .pathReasons(path.reasons())
                .overall(gates.overall())
                .metrics(List.copyOf(metrics))
                .hardGates(gates.hardGates())
                .softGates(gates.softGates())
                .valuation(valuation)
                .provenanceIssues(issues)
                .build())
            .verifier(qa)
            .delta(delta)
            .triggers(alerts)
            .build();

        log.info("Dossier for {} {}: path {}, overall {}, QA {}, {} alert(s)",
            ticker, latest.periodKey(), path.path(), gates.overall(), qa.status(), alerts.size());
        return new Run(report, snapshots);
    }

    /** Stored snapshots overlaid with the ones computed from this request's filings. */
    private static List<MetricSnapshot> merge(List<MetricSnapshot> stored, List<MetricSnapshot> fresh) {
        Map<FiscalPeriod, MetricSnapshot> byPeriod = new TreeMap<>();
        stored.forEach(s -> byPeriod.put(s.period(), s));
        fresh.forEach(s -> byPeriod.put(s.period(), s));
        return new ArrayList<>(byPeriod.values());
    }
}
