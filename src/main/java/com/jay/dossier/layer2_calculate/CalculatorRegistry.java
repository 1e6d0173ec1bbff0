package com.jay.dossier.layer2_calculate;

import com.jay.dossier.config.DossierConfig;
import com.jay.dossier.model.CompanyQuarter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeSet;
import java.util.function.Function;

import static com.jay.dossier.layer2_calculate.FinancialRatios.using;
import static com.jay.dossier.layer2_calculate.StatementLines.*;

/**
 * Ordered table of every statement-derived metric. The same table feeds the metric builder and
 * the verifier's independent re-derivation, so both paths compute from identical definitions.
 */
@Component
public class CalculatorRegistry {

    private final List<MetricCalculator> calculators;

    public CalculatorRegistry(DossierConfig config) {
        double taxRate = config.valuation().getDefaultTaxRate();
        List<MetricCalculator> table = new ArrayList<>();

        // ── Scale ────────────────────────────────────────────────────────────
        table.add(calc(MetricNames.REVENUE, UnitKind.CURRENCY, List.of(REVENUE), List.of(),
            q -> q.flow(REVENUE)));
        table.add(calc(MetricNames.GROSS_PROFIT, UnitKind.CURRENCY, List.of(REVENUE, COST_OF_REVENUE), List.of(),
            q -> using(v -> FinancialRatios.grossProfit(v[0], v[1]), q.flow(REVENUE), q.flow(COST_OF_REVENUE))));
        table.add(calc(MetricNames.OPERATING_INCOME, UnitKind.CURRENCY, List.of(OPERATING_INCOME), List.of(),
            q -> q.flow(OPERATING_INCOME)));
        table.add(calc(MetricNames.CFO, UnitKind.CURRENCY, List.of(CFO), List.of(),
            q -> q.flow(CFO)));
        table.add(calc(MetricNames.FCF, UnitKind.CURRENCY, List.of(CFO, CAPEX), List.of(),
            CalculatorRegistry::fcf));
        table.add(calc(MetricNames.CASH, UnitKind.CURRENCY, List.of(), List.of(CASH),
            q -> q.item(CASH)));

        // ── Margins and working capital ──────────────────────────────────────
        table.add(calc(MetricNames.GROSS_MARGIN, UnitKind.RATIO, List.of(REVENUE, COST_OF_REVENUE), List.of(),
            q -> using(v -> FinancialRatios.ratio(v[0] - Math.abs(v[1]), v[0]),
                q.flow(REVENUE), q.flow(COST_OF_REVENUE))));
        table.add(calc(MetricNames.DSO, UnitKind.DAYS, List.of(REVENUE), List.of(ACCOUNTS_RECEIVABLE),
            q -> dso(q)));
        table.add(calc(MetricNames.DIH, UnitKind.DAYS, List.of(COST_OF_REVENUE), List.of(INVENTORY),
            q -> dih(q)));
        table.add(calc(MetricNames.DPO, UnitKind.DAYS, List.of(COST_OF_REVENUE), List.of(ACCOUNTS_PAYABLE),
            q -> dpo(q)));
        table.add(calc(MetricNames.CCC, UnitKind.DAYS, List.of(REVENUE, COST_OF_REVENUE),
            List.of(ACCOUNTS_RECEIVABLE, INVENTORY, ACCOUNTS_PAYABLE),
            q -> using(v -> OptionalDouble.of(v[0] + v[1] - v[2]), dso(q), dih(q), dpo(q))));
        table.add(calc(MetricNames.ACCRUALS_RATIO, UnitKind.RATIO, List.of(NET_INCOME, CFO), List.of(TOTAL_ASSETS),
            q -> using(v -> FinancialRatios.accrualsRatio(v[0], v[1], v[2]),
                q.flow(NET_INCOME), q.flow(CFO), q.item(TOTAL_ASSETS))));

        // ── Leverage and returns ─────────────────────────────────────────────
        table.add(calc(MetricNames.NET_DEBT, UnitKind.CURRENCY, List.of(), List.of(TOTAL_DEBT, CASH),
            q -> using(v -> FinancialRatios.netDebt(v[0], v[1]), q.item(TOTAL_DEBT), q.item(CASH))));
        table.add(calc(MetricNames.EBITDA, UnitKind.CURRENCY, List.of(OPERATING_INCOME, DEPRECIATION), List.of(),
            q -> using(v -> OptionalDouble.of(v[0] + v[1]), q.flow(OPERATING_INCOME), q.flow(DEPRECIATION))));
        table.add(calc(MetricNames.NET_LEVERAGE, UnitKind.RATIO, List.of(OPERATING_INCOME, DEPRECIATION),
            List.of(TOTAL_DEBT, CASH),
            q -> using(v -> FinancialRatios.ratio(v[2] - v[3], (v[0] + v[1]) * annualization(q, OPERATING_INCOME, DEPRECIATION)),
                q.flow(OPERATING_INCOME), q.flow(DEPRECIATION), q.item(TOTAL_DEBT), q.item(CASH))));
        table.add(calc(MetricNames.ROIC, UnitKind.RATIO, List.of(OPERATING_INCOME),
            List.of(TOTAL_EQUITY, TOTAL_DEBT, CASH),
            q -> using(v -> FinancialRatios.roic(v[0] * annualization(q, OPERATING_INCOME), taxRate, v[1], v[2], v[3]),
                q.flow(OPERATING_INCOME), q.item(TOTAL_EQUITY), q.item(TOTAL_DEBT), q.item(CASH))));
        table.add(calc(MetricNames.EBIT_INTEREST, UnitKind.RATIO, List.of(OPERATING_INCOME, INTEREST_EXPENSE), List.of(),
            q -> using(v -> FinancialRatios.interestCoverage(v[0], v[1]),
                q.flow(OPERATING_INCOME), q.flow(INTEREST_EXPENSE))));
        table.add(calc(MetricNames.FCF_INTEREST, UnitKind.RATIO, List.of(CFO, CAPEX, INTEREST_EXPENSE), List.of(),
            q -> using(v -> FinancialRatios.interestCoverage(v[0], v[1]), fcf(q), q.flow(INTEREST_EXPENSE))));

        // ── Liquidity ────────────────────────────────────────────────────────
        table.add(calc(MetricNames.DEBT_DUE_24M, UnitKind.CURRENCY, List.of(),
            List.of(DEBT_MATURITY_Y1, DEBT_MATURITY_Y2),
            CalculatorRegistry::debtDue24m));
        table.add(calc(MetricNames.DEBT_COVERAGE_24M, UnitKind.RATIO, List.of(CFO, CAPEX),
            List.of(CASH, UNDRAWN_REVOLVER, DEBT_MATURITY_Y1, DEBT_MATURITY_Y2),
            q -> using(v -> FinancialRatios.debtCoverage24m(v[0], q.footnote(UNDRAWN_REVOLVER).orElse(0),
                    v[1] * annualization(q, CFO, CAPEX), v[2]),
                q.item(CASH), fcf(q), debtDue24m(q))));
        table.add(calc(MetricNames.RUNWAY_MONTHS, UnitKind.MONTHS, List.of(), List.of(CASH, CFO, CAPEX),
            q -> using(v -> FinancialRatios.runwayMonths(v[0], v[1] - Math.abs(v[2])),
                q.item(CASH), q.item(CFO), q.item(CAPEX))));
        table.add(calc(MetricNames.DILUTED_SHARES, UnitKind.SHARES, List.of(), List.of(DILUTED_SHARES),
            q -> q.item(DILUTED_SHARES)));

        // ── Unit economics ───────────────────────────────────────────────────
        table.add(calc(MetricNames.TAKE_RATE, UnitKind.RATIO, List.of(), List.of(REVENUE, GROSS_BOOKINGS),
            q -> using(v -> FinancialRatios.ratio(v[0], v[1]), q.item(REVENUE), q.kpi(GROSS_BOOKINGS))));
        table.add(calc(MetricNames.NRR, UnitKind.RATIO, List.of(), List.of(NET_REVENUE_RETENTION),
            q -> q.kpi(NET_REVENUE_RETENTION)));
        table.add(calc(MetricNames.GRR, UnitKind.RATIO, List.of(), List.of(GROSS_REVENUE_RETENTION),
            q -> q.kpi(GROSS_REVENUE_RETENTION)));

        this.calculators = List.copyOf(table);
    }

    /** The fixed statement-level table, in report order. */
    public List<MetricCalculator> calculators() {
        return calculators;
    }

    /**
     * Fixed table, then the segment count, then one margin calculator per disclosed segment,
     * segments in name order.
     */
    public List<MetricCalculator> forQuarter(CompanyQuarter quarter) {
        List<MetricCalculator> all = new ArrayList<>(calculators);
        TreeSet<String> segments = new TreeSet<>(quarter.getSegments().keySet());
        all.add(segmentCount(segments));
        for (String segment : segments) {
            all.add(segmentMargin(segment));
        }
        return all;
    }

    public Optional<MetricCalculator> find(String name, CompanyQuarter quarter) {
        return forQuarter(quarter).stream().filter(c -> c.name().equals(name)).findFirst();
    }

    /** Number of disclosed segments; zero when the filing has no segment note. */
    public static MetricCalculator segmentCount(Collection<String> segments) {
        List<String> inputs = segments.stream().map(s -> MetricNames.SEGMENT_OPERATING_PREFIX + s).toList();
        return calc(MetricNames.SEGMENT_COUNT, UnitKind.COUNT, List.of(), inputs,
            q -> OptionalDouble.of(q.getSegments().size()));
    }

    /** Segment operating income over the segment's reported revenue. */
    public static MetricCalculator segmentMargin(String segment) {
        return calc(MetricNames.SEGMENT_MARGIN_PREFIX + segment, UnitKind.RATIO, List.of(),
            List.of(MetricNames.SEGMENT_OPERATING_PREFIX + segment, MetricNames.SEGMENT_REVENUE_PREFIX + segment),
            q -> {
                Map<String, Double> lines = q.getSegments().get(segment);
                if (lines == null) return OptionalDouble.empty();
                Double income = lines.get(SEGMENT_OPERATING_INCOME);
                Double revenue = lines.get(SEGMENT_REVENUE);
                if (income == null || revenue == null) return OptionalDouble.empty();
                return FinancialRatios.ratio(income, revenue);
            });
    }

    // ── Shared formulas ──────────────────────────────────────────────────────

    private static OptionalDouble fcf(CompanyQuarter q) {
        return using(v -> FinancialRatios.freeCashFlow(v[0], v[1]), q.flow(CFO), q.flow(CAPEX));
    }

    private static OptionalDouble debtDue24m(CompanyQuarter q) {
        return using(v -> OptionalDouble.of(v[0] + v[1]), q.footnote(DEBT_MATURITY_Y1), q.footnote(DEBT_MATURITY_Y2));
    }

    private static OptionalDouble dso(CompanyQuarter q) {
        return using(v -> FinancialRatios.daysOutstanding(v[0], v[1], periodDays(q, REVENUE)),
            q.item(ACCOUNTS_RECEIVABLE), q.flow(REVENUE));
    }

    private static OptionalDouble dih(CompanyQuarter q) {
        return using(v -> FinancialRatios.daysOutstanding(v[0], v[1], periodDays(q, COST_OF_REVENUE)),
            q.item(INVENTORY), q.flow(COST_OF_REVENUE));
    }

    private static OptionalDouble dpo(CompanyQuarter q) {
        return using(v -> FinancialRatios.daysOutstanding(v[0], v[1], periodDays(q, COST_OF_REVENUE)),
            q.item(ACCOUNTS_PAYABLE), q.flow(COST_OF_REVENUE));
    }

    private static double periodDays(CompanyQuarter q, String flowItem) {
        return q.hasTtm(flowItem) ? FinancialRatios.DAYS_PER_YEAR : FinancialRatios.DAYS_PER_YEAR / 4;
    }

    /** 1 when every flow is already trailing-twelve-month, 4 to annualize a single quarter. */
    private static double annualization(CompanyQuarter q, String... flowItems) {
        for (String item : flowItems) {
            if (!q.hasTtm(item)) return 4;
        }
        return 1;
    }

    private static MetricCalculator calc(String name, UnitKind unit, List<String> flowInputs, List<String> pointInputs,
                                         Function<CompanyQuarter, OptionalDouble> formula) {
        return new MetricCalculator(name, unit, flowInputs, pointInputs, formula);
    }
}
