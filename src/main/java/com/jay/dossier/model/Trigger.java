package com.jay.dossier.model;

import com.jay.dossier.model.enums.Comparison;

import java.time.LocalDate;

/** A monitored condition: {@code metric <comparison> threshold} must hold until the deadline. */
public record Trigger(String ticker, String metric, double threshold, Comparison comparison, LocalDate deadline) {

    public String describe() {
        return String.format("%s %s %s", metric, comparison.operator(), threshold);
    }
}
