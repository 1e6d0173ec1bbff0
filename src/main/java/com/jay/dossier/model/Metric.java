package com.jay.dossier.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * A calculated or observed figure attached to a dossier.
 * Construction fails without provenance, so every number in a report is citable.
 */
@Value
public class Metric {
    String name;
    MetricValue value;
    String unit;
    String period;
    Provenance provenance;
    /** Names of the line items or metrics this value was derived from; empty for observed inputs. */
    List<String> inputs;
    /** Macro or market valuation input, which may cite Macro/Market documents. */
    boolean marketInput;

    @Builder(toBuilder = true)
    private Metric(String name, MetricValue value, String unit, String period, Provenance provenance,
                   @Singular List<String> inputs, boolean marketInput) {
        this.name = Objects.requireNonNull(name, "metric name");
        if (provenance == null) {
            throw new IllegalStateException("Metric '" + name + "' has no provenance");
        }
        this.value = value == null ? MetricValue.na() : value;
        this.unit = unit;
        this.period = period;
        this.provenance = provenance;
        this.inputs = List.copyOf(inputs);
        this.marketInput = marketInput;
    }

    @JsonIgnore
    public OptionalDouble numeric() {
        return value.numeric();
    }

    @JsonIgnore
    public boolean isDerived() {
        return !inputs.isEmpty();
    }
}
