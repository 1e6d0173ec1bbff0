package com.jay.dossier.layer2_calculate;

import java.util.Set;

/** Names under which metrics appear in a dossier. */
public final class MetricNames {

    private MetricNames() {}

    public static final String REVENUE           = "Revenue";
    public static final String GROSS_PROFIT      = "Gross Profit";
    public static final String OPERATING_INCOME  = "Operating Income";
    public static final String CFO               = "CFO";
    public static final String FCF               = "FCF";
    public static final String CASH              = "Cash";
    public static final String GROSS_MARGIN      = "Gross Margin";
    public static final String DSO               = "DSO";
    public static final String DIH               = "DIH";
    public static final String DPO               = "DPO";
    public static final String CCC               = "CCC";
    public static final String ACCRUALS_RATIO    = "Accruals Ratio";
    public static final String NET_DEBT          = "Net Debt";
    public static final String EBITDA            = "EBITDA";
    public static final String NET_LEVERAGE      = "Net Debt / EBITDA";
    public static final String ROIC              = "ROIC";
    public static final String EBIT_INTEREST     = "EBIT / Interest";
    public static final String FCF_INTEREST      = "FCF / Interest";
    public static final String DEBT_DUE_24M      = "Debt Due 24M";
    public static final String DEBT_COVERAGE_24M = "24M Debt Coverage";
    public static final String RUNWAY_MONTHS     = "Runway Months";
    public static final String DILUTED_SHARES    = "Diluted Shares";
    public static final String SEGMENT_COUNT     = "Segment Count";
    public static final String TAKE_RATE         = "Take Rate";
    public static final String NRR               = "NRR";
    public static final String GRR               = "GRR";

    public static final String SEGMENT_MARGIN_PREFIX    = "Segment Margin: ";
    public static final String SEGMENT_REVENUE_PREFIX   = "Segment Revenue: ";
    public static final String SEGMENT_ADJUSTED_PREFIX  = "Segment Adjusted Revenue: ";
    public static final String SEGMENT_OPERATING_PREFIX = "Segment Operating Income: ";

    // ── Valuation ────────────────────────────────────────────────────────────
    public static final String RISK_FREE_RATE      = "Risk-Free Rate";
    public static final String EQUITY_RISK_PREMIUM = "Equity Risk Premium";
    public static final String BETA                = "Beta";
    public static final String COST_OF_DEBT        = "Cost of Debt";
    public static final String INFLATION           = "Inflation";
    public static final String REAL_GROWTH         = "Real Growth";
    public static final String WACC                = "WACC-point";
    public static final String TERMINAL_GROWTH     = "Terminal Growth";

    /** Metrics that only make sense for recurring-revenue businesses. */
    public static final Set<String> SUBSCRIPTION_METRICS = Set.of(
        NRR, GRR, "ARR", "Net New ARR", "Churn", "Logo Retention");

    public static boolean isSegmentMargin(String name) {
        return name.startsWith(SEGMENT_MARGIN_PREFIX);
    }

    public static String segmentOf(String segmentMetricName) {
        return segmentMetricName.substring(segmentMetricName.indexOf(": ") + 2);
    }
}
