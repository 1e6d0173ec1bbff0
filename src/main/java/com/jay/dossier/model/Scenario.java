package com.jay.dossier.model;

import com.jay.dossier.model.enums.ScenarioName;

import java.util.List;

/** Five-year free-cash-flow path and the IRR it implies at the current price; a null IRR is NA. */
public record Scenario(ScenarioName name, List<Double> growthSchedule, List<Double> fcfPath, Double irr) {

    public Scenario {
        growthSchedule = List.copyOf(growthSchedule);
        fcfPath = List.copyOf(fcfPath);
    }
}
