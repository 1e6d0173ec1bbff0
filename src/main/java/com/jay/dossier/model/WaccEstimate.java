package com.jay.dossier.model;

import java.util.Map;

public record WaccEstimate(double point,
                           double lower,
                           double upper,
                           double costOfEquity,
                           double costOfDebtAfterTax,
                           double equityWeight,
                           double debtWeight,
                           Map<String, ValuationInput> inputs) {

    public WaccEstimate {
        inputs = Map.copyOf(inputs);
    }
}
