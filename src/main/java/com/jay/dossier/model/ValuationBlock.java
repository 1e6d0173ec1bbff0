package com.jay.dossier.model;

import com.jay.dossier.model.enums.ScenarioName;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class ValuationBlock {
    WaccEstimate wacc;
    TerminalGrowth terminalGrowth;
    HurdleRate hurdle;
    Map<ScenarioName, Scenario> scenarios;
    SensitivityGrid sensitivity;
    double price;
    /** Null when the input could not be resolved; every scenario is then NA. */
    Double sharesDiluted;
    Double netDebt;
    Double ttmFcf;

    public Scenario scenario(ScenarioName name) {
        return scenarios.get(name);
    }
}
