package com.jay.dossier.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Numeric, categorical, or NA. NA is "insufficient evidence" and serializes as JSON null.
 */
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class MetricValue {

    private static final MetricValue NA = new MetricValue(null, null);

    private final Double number;
    private final String category;

    public static MetricValue of(double number) {
        if (!Double.isFinite(number)) return NA;
        return new MetricValue(number, null);
    }

    public static MetricValue of(OptionalDouble number) {
        return number.isPresent() ? of(number.getAsDouble()) : NA;
    }

    public static MetricValue category(String category) {
        return category == null ? NA : new MetricValue(null, category);
    }

    public static MetricValue na() {
        return NA;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    static MetricValue fromJson(Object raw) {
        if (raw == null) return NA;
        if (raw instanceof Number n) return of(n.doubleValue());
        return category(raw.toString());
    }

    @JsonValue
    Object json() {
        return number != null ? number : category;
    }

    public boolean isNumeric() { return number != null; }

    public boolean isNa() { return number == null && category == null; }

    public OptionalDouble numeric() {
        return number == null ? OptionalDouble.empty() : OptionalDouble.of(number);
    }

    public Optional<String> categorical() {
        return Optional.ofNullable(category);
    }

    @Override
    public String toString() {
        if (number != null) return String.valueOf(number);
        return category != null ? category : "NA";
    }
}
