package com.jay.dossier.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Condition a monitored metric is expected to satisfy against its threshold.
 * A trigger breaches when the current value no longer satisfies it.
 */
public enum Comparison {
    GTE("gte"),
    LTE("lte"),
    GT("gt"),
    LT("lt"),
    EQ("eq");

    private final String operator;

    Comparison(String operator) { this.operator = operator; }

    @JsonValue
    public String operator() { return operator; }

    public boolean holds(double value, double threshold, double eqTolerance) {
        return switch (this) {
            case GTE -> value >= threshold;
            case LTE -> value <= threshold;
            case GT  -> value > threshold;
            case LT  -> value < threshold;
            case EQ  -> Math.abs(value - threshold) <= eqTolerance;
        };
    }

    public static Optional<Comparison> parse(String operator) {
        if (operator == null) return Optional.empty();
        String op = operator.trim().toLowerCase();
        return Arrays.stream(values()).filter(c -> c.operator.equals(op)).findFirst();
    }
}
