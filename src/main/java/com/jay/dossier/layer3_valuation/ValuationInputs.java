package com.jay.dossier.layer3_valuation;

import com.jay.dossier.model.ValuationInput;
import com.jay.dossier.model.enums.ScenarioName;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Market and policy assumptions for one valuation run. Nullable fields are resolved from the
 * latest normalized quarter or from configured defaults.
 */
@Value
@Builder
public class ValuationInputs {
    ValuationInput riskFreeRate;
    ValuationInput equityRiskPremium;
    ValuationInput beta;
    /** Pre-tax cost of debt. */
    ValuationInput costOfDebt;
    Double taxRate;
    int equityAdjustmentBps;
    Double marketEquity;
    Double marketDebt;

    ValuationInput inflation;
    ValuationInput realGrowth;

    double price;
    Double sharesDiluted;
    Double netDebt;
    Double ttmFcf;

    @Singular Map<ScenarioName, List<Double>> growthSchedules;
    @Singular List<String> businessAttributes;
}
