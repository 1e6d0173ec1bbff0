package com.jay.dossier.layer3_valuation;

import com.jay.dossier.config.DossierConfig;
import com.jay.dossier.model.HurdleRate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Base hurdle IRR adjusted by named basis-point steps for business-model attributes.
 * Each attribute counts once; attributes without a configured step are skipped.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HurdleCalculator {

    private final DossierConfig config;

    public HurdleRate compute(List<String> attributes) {
        DossierConfig.Hurdle cfg = config.valuation().getHurdle();
        Set<String> distinct = new LinkedHashSet<>();
        attributes.forEach(a -> distinct.add(a.trim().toLowerCase()));

        List<HurdleRate.Adjustment> trail = new ArrayList<>();
        double value = cfg.getBase();
        for (String attribute : distinct) {
            Integer bps = cfg.getAdjustmentsBps().get(attribute);
            if (bps == null) {
                log.warn("No hurdle adjustment configured for attribute '{}', ignoring", attribute);
                continue;
            }
            trail.add(new HurdleRate.Adjustment(attribute, bps));
            value += bps / 10_000.0;
        }
        return new HurdleRate(cfg.getBase(), Math.max(0.0, value), trail);
    }
}
