package com.jay.dossier.layer7_monitor;

import com.jay.dossier.layer2_calculate.FinancialRatios;
import com.jay.dossier.layer2_calculate.StatementLines;
import com.jay.dossier.model.CompanyQuarter;
import com.jay.dossier.model.DeltaEntry;
import com.jay.dossier.model.FiscalPeriod;
import com.jay.dossier.model.MetricSnapshot;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.jay.dossier.layer2_calculate.FinancialRatios.using;

/**
 * Layer 7 - Delta Engine.
 * Quarter-over-quarter and year-over-year change for each tracked metric, compared against the
 * snapshot keyed to the prior quarter and to the same quarter a year earlier.
 * Output depends only on the snapshots given, and map order is by metric name.
 */
@Component
public class DeltaEngine {

    /** Tracked quarterly values, in report order. */
    private static final Map<String, Function<CompanyQuarter, OptionalDouble>> TRACKED = new LinkedHashMap<>();

    static {
        TRACKED.put("Revenue", q -> q.item(StatementLines.REVENUE));
        TRACKED.put("Gross Profit", q -> using(v -> FinancialRatios.grossProfit(v[0], v[1]),
            q.item(StatementLines.REVENUE), q.item(StatementLines.COST_OF_REVENUE)));
        TRACKED.put("Operating Income", q -> q.item(StatementLines.OPERATING_INCOME));
        TRACKED.put("CFO", q -> q.item(StatementLines.CFO));
        TRACKED.put("FCF", q -> using(v -> FinancialRatios.freeCashFlow(v[0], v[1]),
            q.item(StatementLines.CFO), q.item(StatementLines.CAPEX)));
        // CFO alone when no CapEx is disclosed
        TRACKED.put("Owner Earnings", q -> using(v -> OptionalDouble.of(v[0] - Math.abs(q.item(StatementLines.CAPEX).orElse(0))),
            q.item(StatementLines.CFO)));
        TRACKED.put("Net Debt", q -> using(v -> FinancialRatios.netDebt(v[0], v[1]),
            q.item(StatementLines.TOTAL_DEBT), q.item(StatementLines.CASH)));
        TRACKED.put("Accruals Ratio", q -> using(v -> FinancialRatios.accrualsRatio(v[0], v[1], v[2]),
            q.item(StatementLines.NET_INCOME), q.item(StatementLines.CFO), q.item(StatementLines.TOTAL_ASSETS)));
        TRACKED.put("Accounts Receivable", q -> q.item(StatementLines.ACCOUNTS_RECEIVABLE));
        TRACKED.put("Inventory", q -> q.item(StatementLines.INVENTORY));
        TRACKED.put("Diluted Shares", q -> q.item(StatementLines.DILUTED_SHARES));
    }

    public Set<String> trackedMetrics() {
        return TRACKED.keySet();
    }

    public MetricSnapshot snapshotOf(CompanyQuarter quarter) {
        Map<String, Double> values = new TreeMap<>();
        TRACKED.forEach((name, extractor) -> {
            OptionalDouble v = extractor.apply(quarter);
            if (v.isPresent()) values.put(name, v.getAsDouble());
        });
        return MetricSnapshot.of(quarter.getTicker(), quarter.getPeriod(), values);
    }

    /**
     * Deltas for the most recent snapshot in the history. Every tracked metric gets an entry;
     * comparisons whose base is missing are NA, and percent changes against a zero base are NA.
     */
    public SortedMap<String, DeltaEntry> compute(Collection<MetricSnapshot> history) {
        SortedMap<String, DeltaEntry> out = new TreeMap<>();
        if (history.isEmpty()) return out;

        Map<FiscalPeriod, MetricSnapshot> byPeriod = history.stream()
            .collect(Collectors.toMap(MetricSnapshot::period, Function.identity(), (a, b) -> b));
        MetricSnapshot current = byPeriod.values().stream()
            .max(Comparator.comparing(MetricSnapshot::period))
            .orElseThrow();
        MetricSnapshot prior = byPeriod.get(current.period().previous());
        MetricSnapshot yearAgo = byPeriod.get(current.period().minusYears(1));

        for (String metric : TRACKED.keySet()) {
            Double now = current.values().get(metric);
            Double qoqBase = prior == null ? null : prior.values().get(metric);
            Double yoyBase = yearAgo == null ? null : yearAgo.values().get(metric);
            out.put(metric, new DeltaEntry(metric, now,
                absolute(now, qoqBase), percent(now, qoqBase),
                absolute(now, yoyBase), percent(now, yoyBase)));
        }
        return out;
    }

    static Double absolute(Double current, Double base) {
        return current == null || base == null ? null : current - base;
    }

    /** Change relative to the magnitude of the base, so a shrinking loss reads as an improvement. */
    static Double percent(Double current, Double base) {
        if (current == null || base == null || base == 0) return null;
        return (current - base) / Math.abs(base);
    }
}
