package com.jay.dossier.layer3_valuation;

import com.jay.dossier.config.DossierConfig;
import com.jay.dossier.layer2_calculate.MetricNames;
import com.jay.dossier.model.TerminalGrowth;
import com.jay.dossier.model.ValuationInput;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/** Long-run inflation plus real growth, held at least the configured spread below WACC. */
@Component
@RequiredArgsConstructor
public class TerminalGrowthCalculator {

    private final DossierConfig config;

    public TerminalGrowth compute(ValuationInput inflation, ValuationInput realGrowth, double wacc) {
        DossierConfig.Valuation cfg = config.valuation();
        double i = inflation != null ? inflation.value() : cfg.getDefaultInflation();
        double r = realGrowth != null ? realGrowth.value() : cfg.getDefaultRealGrowth();

        double raw = i + r;
        double cap = wacc - cfg.getTerminalGrowthCapSpread();
        boolean capped = raw > cap;

        Map<String, ValuationInput> inputs = new LinkedHashMap<>();
        if (inflation != null)  inputs.put(MetricNames.INFLATION, inflation);
        if (realGrowth != null) inputs.put(MetricNames.REAL_GROWTH, realGrowth);
        return new TerminalGrowth(capped ? cap : raw, i, r, capped, inputs);
    }
}
