package com.jay.dossier.layer6_verify;

import com.jay.dossier.model.Metric;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Picks the metrics the verifier re-derives. The population is sorted by name before a seeded
 * shuffle, so the same metric set and seed always yield the same sample.
 */
public final class MetricSampler {

    private MetricSampler() {}

    public static List<Metric> sample(Collection<Metric> population, int size, long seed) {
        List<Metric> sorted = new ArrayList<>(population);
        sorted.sort(Comparator.comparing(Metric::getName).thenComparing(Metric::getPeriod,
            Comparator.nullsFirst(Comparator.naturalOrder())));
        Collections.shuffle(sorted, new Random(seed));
        return List.copyOf(sorted.subList(0, Math.min(size, sorted.size())));
    }
}
