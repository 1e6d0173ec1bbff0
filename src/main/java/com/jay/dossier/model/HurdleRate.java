package com.jay.dossier.model;

import java.util.List;

public record HurdleRate(double base, double value, List<Adjustment> adjustments) {

    public HurdleRate {
        adjustments = List.copyOf(adjustments);
    }

    /** One named basis-point adjustment applied on top of the base hurdle. */
    public record Adjustment(String name, int bps) {
    }
}
