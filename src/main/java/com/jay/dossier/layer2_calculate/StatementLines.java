package com.jay.dossier.layer2_calculate;

/** Canonical line-item names the extraction collaborator maps filings onto. */
public final class StatementLines {

    private StatementLines() {}

    // ── Income statement ─────────────────────────────────────────────────────
    public static final String REVENUE           = "Revenue";
    public static final String COST_OF_REVENUE   = "Cost of Revenue";
    public static final String OPERATING_INCOME  = "Operating Income";
    public static final String INTEREST_EXPENSE  = "Interest Expense";
    public static final String NET_INCOME        = "Net Income";
    public static final String DEPRECIATION      = "Depreciation & Amortization";
    public static final String DILUTED_SHARES    = "Diluted Shares";

    // ── Balance sheet ────────────────────────────────────────────────────────
    public static final String CASH                = "Cash";
    public static final String ACCOUNTS_RECEIVABLE = "Accounts Receivable";
    public static final String INVENTORY           = "Inventory";
    public static final String ACCOUNTS_PAYABLE    = "Accounts Payable";
    public static final String TOTAL_ASSETS        = "Total Assets";
    public static final String TOTAL_DEBT          = "Total Debt";
    public static final String TOTAL_EQUITY        = "Total Equity";

    // ── Cash flow ────────────────────────────────────────────────────────────
    public static final String CFO            = "CFO";
    public static final String CAPEX          = "CapEx";

    // ── Footnotes ────────────────────────────────────────────────────────────
    public static final String DEBT_DUE_24M     = "Debt Due 24M";
    public static final String DEBT_MATURITY_Y1 = "Debt Maturity Y1";
    public static final String DEBT_MATURITY_Y2 = "Debt Maturity Y2";
    public static final String UNDRAWN_REVOLVER = "Undrawn Revolver";

    // ── KPIs ─────────────────────────────────────────────────────────────────
    public static final String GROSS_BOOKINGS          = "Gross Bookings";
    public static final String NET_REVENUE_RETENTION   = "Net Revenue Retention";
    public static final String GROSS_REVENUE_RETENTION = "Gross Revenue Retention";

    // ── Segment table lines ──────────────────────────────────────────────────
    public static final String SEGMENT_REVENUE          = "Revenue";
    public static final String SEGMENT_OPERATING_INCOME = "Operating Income";
}
