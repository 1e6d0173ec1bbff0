package com.jay.dossier.layer4_gates;

import com.jay.dossier.config.DossierConfig;
import com.jay.dossier.layer2_calculate.MetricNames;
import com.jay.dossier.model.GateRow;
import com.jay.dossier.model.enums.GateResult;
import com.jay.dossier.model.enums.Hardness;

import java.util.List;
import java.util.OptionalDouble;

/**
 * The first-pass screen every dossier runs: hard gates that can reject the thesis outright,
 * then soft gates that may pass under watch with a flip trigger.
 */
public final class StageZeroGates {

    public static final String CIRCLE_OF_COMPETENCE  = "Circle of Competence";
    public static final String FRAUD_CONTROLS        = "Fraud/Controls";
    public static final String IMMINENT_SOLVENCY     = "Imminent Solvency";
    public static final String VALUATION             = "Valuation";
    public static final String FINAL_DECISION        = "Final Decision Gate";
    public static final String ACCOUNTING_SANITY     = "Accounting Sanity";
    public static final String BALANCE_SHEET_SURVIVAL = "Balance-sheet Survival";
    public static final String UNIT_ECONOMICS        = "Unit Economics";
    public static final String INDUSTRY              = "Industry";
    public static final String MOAT                  = "Moat";
    public static final String MANAGEMENT            = "Management";

    private StageZeroGates() {}

    public static List<GateDefinition> table(DossierConfig.Gates cfg) {
        return List.of(
            // ── Hard gates ───────────────────────────────────────────────────
            hard(CIRCLE_OF_COMPETENCE, "Revenue > 0 and segment disclosure present",
                List.of(MetricNames.REVENUE, MetricNames.SEGMENT_COUNT),
                (ctx, prior) -> {
                    OptionalDouble revenue = ctx.value(MetricNames.REVENUE);
                    OptionalDouble segments = ctx.value(MetricNames.SEGMENT_COUNT);
                    if (revenue.isEmpty() || segments.isEmpty()) return GateVerdict.na();
                    return revenue.getAsDouble() > 0 && segments.getAsDouble() > 0
                        ? GateVerdict.pass() : GateVerdict.fail();
                }),
            hard(FRAUD_CONTROLS, String.format("|Accruals Ratio| <= %.2f", cfg.getAccrualsHardBound()),
                List.of(MetricNames.ACCRUALS_RATIO),
                (ctx, prior) -> {
                    OptionalDouble accruals = ctx.value(MetricNames.ACCRUALS_RATIO);
                    if (accruals.isEmpty()) return GateVerdict.na();
                    return Math.abs(accruals.getAsDouble()) <= cfg.getAccrualsHardBound()
                        ? GateVerdict.pass() : GateVerdict.fail();
                }),
            hard(IMMINENT_SOLVENCY,
                String.format("Net Debt / EBITDA <= %.1fx or FCF > 0", cfg.getMaxSolvencyLeverage()),
                List.of(MetricNames.NET_LEVERAGE, MetricNames.NET_DEBT, MetricNames.FCF),
                (ctx, prior) -> {
                    OptionalDouble leverage = ctx.value(MetricNames.NET_LEVERAGE);
                    OptionalDouble fcf = ctx.value(MetricNames.FCF);
                    boolean leverageOk = leverage.isPresent()
                        && withinLeverage(leverage.getAsDouble(), ctx.value(MetricNames.NET_DEBT), cfg.getMaxSolvencyLeverage());
                    boolean fcfOk = fcf.isPresent() && fcf.getAsDouble() > 0;
                    if (leverageOk || fcfOk) return GateVerdict.pass();
                    if (leverage.isEmpty() || fcf.isEmpty()) return GateVerdict.na();
                    return GateVerdict.fail();
                }),
            hard(VALUATION, "ROIC >= WACC-point", List.of(MetricNames.ROIC, MetricNames.WACC),
                (ctx, prior) -> {
                    OptionalDouble roic = ctx.value(MetricNames.ROIC);
                    OptionalDouble wacc = ctx.value(MetricNames.WACC);
                    if (roic.isEmpty() || wacc.isEmpty()) return GateVerdict.na();
                    return roic.getAsDouble() >= wacc.getAsDouble() ? GateVerdict.pass() : GateVerdict.fail();
                }),
            hard(FINAL_DECISION, "All preceding hard gates pass", List.of(),
                (ctx, prior) -> {
                    List<GateResult> hard = prior.stream()
                        .filter(r -> r.getHardness() == Hardness.Hard)
                        .map(GateRow::getResult)
                        .toList();
                    if (hard.contains(GateResult.FAIL)) return GateVerdict.fail();
                    if (hard.contains(GateResult.NA)) return GateVerdict.na();
                    return GateVerdict.pass();
                }),

            // ── Soft gates ───────────────────────────────────────────────────
            soft(ACCOUNTING_SANITY, String.format("|Accruals Ratio| <= %.2f", cfg.getAccrualsSoftBound()),
                List.of(MetricNames.ACCRUALS_RATIO), false,
                (ctx, prior) -> {
                    OptionalDouble accruals = ctx.value(MetricNames.ACCRUALS_RATIO);
                    if (accruals.isEmpty()) return GateVerdict.na();
                    return Math.abs(accruals.getAsDouble()) <= cfg.getAccrualsSoftBound()
                        ? GateVerdict.pass()
                        : GateVerdict.softPass(String.format("Accruals ratio back within +/-%.0f%%",
                            cfg.getAccrualsSoftBound() * 100));
                }),
            soft(BALANCE_SHEET_SURVIVAL, "Cash > 0 and FCF > 0", List.of(MetricNames.CASH, MetricNames.FCF), false,
                (ctx, prior) -> {
                    OptionalDouble cash = ctx.value(MetricNames.CASH);
                    OptionalDouble fcf = ctx.value(MetricNames.FCF);
                    if (cash.isEmpty() || fcf.isEmpty()) return GateVerdict.na();
                    return cash.getAsDouble() > 0 && fcf.getAsDouble() > 0
                        ? GateVerdict.pass()
                        : GateVerdict.softPass("Free cash flow turns positive with cash on hand");
                }),
            soft(UNIT_ECONOMICS,
                String.format("NRR >= %.0f%% when reported, else Take Rate > %.0f%%",
                    cfg.getMinNetRevenueRetention() * 100, cfg.getMinTakeRate() * 100),
                List.of(MetricNames.NRR, MetricNames.TAKE_RATE), false,
                (ctx, prior) -> {
                    OptionalDouble nrr = ctx.value(MetricNames.NRR);
                    if (nrr.isPresent()) {
                        return nrr.getAsDouble() >= cfg.getMinNetRevenueRetention()
                            ? GateVerdict.pass()
                            : GateVerdict.softPass(String.format("Net revenue retention recovers to %.0f%%",
                                cfg.getMinNetRevenueRetention() * 100));
                    }
                    OptionalDouble takeRate = ctx.value(MetricNames.TAKE_RATE);
                    if (takeRate.isEmpty()) return GateVerdict.na();
                    return takeRate.getAsDouble() > cfg.getMinTakeRate()
                        ? GateVerdict.pass()
                        : GateVerdict.softPass(String.format("Take rate above %.0f%%", cfg.getMinTakeRate() * 100));
                }),
            qualitative(INDUSTRY, "Industry structure supports durable returns",
                "Industry thesis confirmed by primary-source evidence"),
            qualitative(MOAT, "Competitive advantage evidenced in filings",
                "Moat evidence confirmed in the next filing"),
            qualitative(MANAGEMENT, "Management alignment and capital allocation",
                "Management alignment confirmed from proxy disclosures")
        );
    }

    /**
     * A negative ratio is only comfortable when the company holds net cash; with positive net
     * debt it means EBITDA is negative.
     */
    static boolean withinLeverage(double leverage, OptionalDouble netDebt, double max) {
        if (leverage >= 0) return leverage <= max;
        return netDebt.isPresent() && netDebt.getAsDouble() <= 0;
    }

    private static GateDefinition hard(String id, String rule, List<String> metrics, GateDefinition.Rule fn) {
        return new GateDefinition(id, Hardness.Hard, rule, metrics, false, fn);
    }

    private static GateDefinition soft(String id, String rule, List<String> metrics, boolean qualitative,
                                       GateDefinition.Rule fn) {
        return new GateDefinition(id, Hardness.Soft, rule, metrics, qualitative, fn);
    }

    /** Judgement gates stay under watch until a reviewer resolves them. */
    private static GateDefinition qualitative(String id, String rule, String flipCondition) {
        return soft(id, rule, List.of(), true, (ctx, prior) -> GateVerdict.softPass(flipCondition));
    }
}
