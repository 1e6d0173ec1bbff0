package com.jay.dossier.layer3_valuation;

import com.jay.dossier.config.DossierConfig;
import com.jay.dossier.layer2_calculate.MetricNames;
import com.jay.dossier.layer2_calculate.StatementLines;
import com.jay.dossier.model.CompanyQuarter;
import com.jay.dossier.model.ValuationInput;
import com.jay.dossier.model.WaccEstimate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * CAPM cost of equity plus after-tax cost of debt, weighted by market values.
 * The discretionary equity adjustment is clamped to the configured bound.
 */
@Component
@RequiredArgsConstructor
public class WaccCalculator {

    private final DossierConfig config;

    public WaccEstimate compute(ValuationInputs in, CompanyQuarter latest) {
        DossierConfig.Valuation cfg = config.valuation();

        int maxAdj = cfg.getMaxEquityAdjustmentBps();
        int adjBps = Math.max(-maxAdj, Math.min(maxAdj, in.getEquityAdjustmentBps()));
        double costOfEquity = in.getRiskFreeRate().value()
            + in.getBeta().value() * in.getEquityRiskPremium().value()
            + adjBps / 10_000.0;

        double taxRate = taxRate(in);
        double costOfDebtAfterTax = in.getCostOfDebt().value() * (1 - taxRate);

        double equity = marketEquity(in, latest);
        double debt = marketDebt(in, latest);
        double total = equity + debt;
        double equityWeight = total > 0 ? equity / total : 1.0;
        double debtWeight = total > 0 ? debt / total : 0.0;

        double point = equityWeight * costOfEquity + debtWeight * costOfDebtAfterTax;
        double band = cfg.getWaccBandBps() / 10_000.0;

        Map<String, ValuationInput> inputs = new LinkedHashMap<>();
        inputs.put(MetricNames.RISK_FREE_RATE, in.getRiskFreeRate());
        inputs.put(MetricNames.EQUITY_RISK_PREMIUM, in.getEquityRiskPremium());
        inputs.put(MetricNames.BETA, in.getBeta());
        inputs.put(MetricNames.COST_OF_DEBT, in.getCostOfDebt());

        return new WaccEstimate(point, Math.max(0.0, point - band), point + band,
            costOfEquity, costOfDebtAfterTax, equityWeight, debtWeight, inputs);
    }

    double taxRate(ValuationInputs in) {
        return in.getTaxRate() != null ? in.getTaxRate() : config.valuation().getDefaultTaxRate();
    }

    /** Supplied market capitalization, else price times diluted shares. */
    static double marketEquity(ValuationInputs in, CompanyQuarter latest) {
        if (in.getMarketEquity() != null) return in.getMarketEquity();
        Double shares = in.getSharesDiluted() != null ? in.getSharesDiluted()
            : latest == null ? null : boxed(latest.item(StatementLines.DILUTED_SHARES));
        return shares == null ? 0.0 : in.getPrice() * shares;
    }

    /** Supplied market value of debt, else book total debt, else zero. */
    static double marketDebt(ValuationInputs in, CompanyQuarter latest) {
        if (in.getMarketDebt() != null) return in.getMarketDebt();
        if (latest == null) return 0.0;
        return latest.item(StatementLines.TOTAL_DEBT).orElse(0.0);
    }

    static Double boxed(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }
}
