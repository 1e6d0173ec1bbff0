package com.jay.dossier.layer4_gates;

import com.jay.dossier.model.GateRow;
import com.jay.dossier.model.enums.Hardness;

import java.util.List;

/**
 * A named gate: a pure rule over the context and the rows evaluated before it.
 * Qualitative gates get the retriever's evidence spans attached to their row.
 */
public record GateDefinition(String id,
                             Hardness hardness,
                             String rule,
                             List<String> metricIds,
                             boolean qualitative,
                             Rule evaluate) {

    @FunctionalInterface
    public interface Rule {
        GateVerdict apply(GateContext context, List<GateRow> prior);
    }

    public GateDefinition {
        metricIds = List.copyOf(metricIds);
    }
}
