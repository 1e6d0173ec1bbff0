package com.jay.dossier.layer4_gates;

import com.jay.dossier.config.DossierConfig;
import com.jay.dossier.layer2_calculate.MetricNames;
import com.jay.dossier.model.CompanyQuarter;
import com.jay.dossier.model.Metric;
import com.jay.dossier.model.enums.AnalysisPath;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Chooses the Mature or Emergent analysis path. Mature requires all four checks:
 * positive TTM free cash flow, non-negative operating income, net leverage within bound
 * (or net cash), and an unbroken run of segment disclosure.
 */
@Component
@RequiredArgsConstructor
public class PathSelector {

    private final DossierConfig config;

    public record PathDecision(AnalysisPath path, List<String> reasons) {
        public PathDecision {
            reasons = List.copyOf(reasons);
        }
    }

    public PathDecision select(List<CompanyQuarter> history, Map<String, Metric> metrics) {
        DossierConfig.Gates cfg = config.gates();
        List<String> reasons = new ArrayList<>();
        CompanyQuarter latest = history.stream().max(Comparator.comparing(CompanyQuarter::getPeriod))
            .orElseThrow(() -> new IllegalArgumentException("Path selection needs at least one quarter"));

        // ── Check 1: TTM free cash flow ──────────────────────────────────────
        Optional<Metric> fcf = Optional.ofNullable(metrics.get(MetricNames.FCF));
        boolean ttmFcf = fcf.map(m -> latest.ttmKey().equals(m.getPeriod())).orElse(false);
        OptionalDouble fcfValue = fcf.map(Metric::numeric).orElse(OptionalDouble.empty());
        if (!ttmFcf || fcfValue.isEmpty()) {
            reasons.add("TTM free cash flow unavailable");
        } else if (fcfValue.getAsDouble() <= 0) {
            reasons.add(String.format("TTM free cash flow %.0f is not positive", fcfValue.getAsDouble()));
        }

        // ── Check 2: GAAP operating income ───────────────────────────────────
        OptionalDouble ebit = value(metrics, MetricNames.OPERATING_INCOME);
        if (ebit.isEmpty()) {
            reasons.add("Operating income unavailable");
        } else if (ebit.getAsDouble() < 0) {
            reasons.add(String.format("Operating income %.0f is negative", ebit.getAsDouble()));
        }

        // ── Check 3: Net leverage or net cash ────────────────────────────────
        OptionalDouble netDebt = value(metrics, MetricNames.NET_DEBT);
        OptionalDouble leverage = value(metrics, MetricNames.NET_LEVERAGE);
        boolean netCash = netDebt.isPresent() && netDebt.getAsDouble() <= 0;
        boolean lowLeverage = leverage.isPresent() && leverage.getAsDouble() >= 0
            && leverage.getAsDouble() <= cfg.getMatureMaxLeverage();
        if (!netCash && !lowLeverage) {
            reasons.add(leverage.isPresent()
                ? String.format("Net leverage %.2fx exceeds %.1fx", leverage.getAsDouble(), cfg.getMatureMaxLeverage())
                : "Net leverage unavailable");
        }

        // ── Check 4: Segment disclosure history ──────────────────────────────
        int run = consecutiveSegmentQuarters(history);
        if (run < cfg.getSegmentHistoryQuarters()) {
            reasons.add(String.format("Only %d consecutive quarters of segment disclosure (need %d)",
                run, cfg.getSegmentHistoryQuarters()));
        }

        return new PathDecision(reasons.isEmpty() ? AnalysisPath.Mature : AnalysisPath.Emergent, reasons);
    }

    /** Length of the unbroken run of quarters with segment tables, counting back from the latest. */
    static int consecutiveSegmentQuarters(List<CompanyQuarter> history) {
        List<CompanyQuarter> sorted = history.stream()
            .sorted(Comparator.comparing(CompanyQuarter::getPeriod).reversed())
            .toList();
        int run = 0;
        CompanyQuarter expected = null;
        for (CompanyQuarter q : sorted) {
            if (expected != null && !q.getPeriod().equals(expected.getPeriod().previous())) break;
            if (!q.hasSegmentDisclosure()) break;
            run++;
            expected = q;
        }
        return run;
    }

    private static OptionalDouble value(Map<String, Metric> metrics, String name) {
        Metric m = metrics.get(name);
        return m == null ? OptionalDouble.empty() : m.numeric();
    }
}
