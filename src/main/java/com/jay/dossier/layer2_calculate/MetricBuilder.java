package com.jay.dossier.layer2_calculate;

import com.jay.dossier.config.DossierConfig;
import com.jay.dossier.model.CompanyQuarter;
import com.jay.dossier.model.Metric;
import com.jay.dossier.model.MetricValue;
import com.jay.dossier.model.Provenance;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Layer 2 - Metric Builder.
 * Runs the calculator table over the latest normalized quarter and wraps each result into a
 * cited Metric. Missing inputs produce an explicit NA metric rather than a gap in the report.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricBuilder {

    private final DossierConfig config;
    private final CalculatorRegistry registry;

    public List<Metric> build(CompanyQuarter quarter, ProvenanceCatalog catalog) {
        List<Metric> metrics = new ArrayList<>();
        int na = 0;
        for (MetricCalculator calculator : registry.forQuarter(quarter)) {
            OptionalDouble value = calculator.apply(quarter);
            if (value.isEmpty()) na++;
            metrics.add(Metric.builder()
                .name(calculator.name())
                .value(MetricValue.of(value))
                .unit(calculator.unitFor(quarter))
                .period(calculator.periodFor(quarter))
                .provenance(provenanceFor(calculator.name(), calculator.inputs(), catalog))
                .inputs(calculator.inputs())
                .build());
        }
        log.debug("{} {}: built {} metrics ({} NA)", quarter.getTicker(), quarter.periodKey(), metrics.size(), na);
        return metrics;
    }

    /**
     * Citation for a metric: its own catalog entry, else the entry of its first input that has one,
     * else the system-derived marker, which the provenance validator will flag.
     */
    public Provenance provenanceFor(String name, List<String> inputs, ProvenanceCatalog catalog) {
        return catalog.lookup(name)
            .or(() -> inputs.stream().map(catalog::lookup).flatMap(Optional::stream).findFirst())
            .orElseGet(this::systemDerived);
    }

    public Provenance systemDerived() {
        DossierConfig.Provenance p = config.provenance();
        return new Provenance(p.getSystemDocumentId(), "n/a", p.getSystemQuote(), p.getSystemUrl());
    }
}
