package com.jay.dossier.model;

import java.util.Collections;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.SortedMap;
import java.util.TreeMap;

/** Tracked quarterly values for one ticker and period; NA values are simply absent. */
public record MetricSnapshot(String ticker, FiscalPeriod period, SortedMap<String, Double> values) {

    public MetricSnapshot {
        values = Collections.unmodifiableSortedMap(new TreeMap<>(values));
    }

    public static MetricSnapshot of(String ticker, FiscalPeriod period, Map<String, Double> values) {
        return new MetricSnapshot(ticker, period, new TreeMap<>(values));
    }

    public OptionalDouble value(String metric) {
        Double v = values.get(metric);
        return v == null ? OptionalDouble.empty() : OptionalDouble.of(v);
    }
}
