package com.jay.dossier.model;

import java.util.Map;

/** Long-run growth; {@code capped} records that the WACC spread cap bound the raw inflation + real growth sum. */
public record TerminalGrowth(double value, double inflation, double realGrowth, boolean capped,
                             Map<String, ValuationInput> inputs) {

    public TerminalGrowth {
        inputs = Map.copyOf(inputs);
    }
}
