package com.jay.dossier.layer4_gates;

import com.jay.dossier.model.EvidenceSpan;
import com.jay.dossier.model.Metric;
import com.jay.dossier.model.enums.BusinessModel;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Everything a gate may read: the metric set, the analysis date, the business model tag and the
 * ranked evidence spans supplied for qualitative gates.
 */
public record GateContext(Map<String, Metric> metrics,
                          LocalDate asOf,
                          BusinessModel businessModel,
                          Map<String, List<EvidenceSpan>> evidence) {

    public GateContext {
        metrics = Map.copyOf(metrics);
        evidence = Map.copyOf(evidence);
    }

    public static GateContext of(Collection<Metric> metrics, LocalDate asOf, BusinessModel businessModel,
                                 Map<String, List<EvidenceSpan>> evidence) {
        Map<String, Metric> byName = new LinkedHashMap<>();
        metrics.forEach(m -> byName.putIfAbsent(m.getName(), m));
        return new GateContext(byName, asOf, businessModel, evidence == null ? Map.of() : evidence);
    }

    /** Numeric value of a metric, empty when the metric is absent, NA or categorical. */
    public OptionalDouble value(String metric) {
        Metric m = metrics.get(metric);
        return m == null ? OptionalDouble.empty() : m.numeric();
    }

    public List<EvidenceSpan> evidenceFor(String gateId) {
        return evidence.getOrDefault(gateId, List.of()).stream()
            .sorted(Comparator.comparingInt(EvidenceSpan::rank))
            .toList();
    }
}
