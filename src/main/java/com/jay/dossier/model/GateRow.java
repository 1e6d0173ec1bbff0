package com.jay.dossier.model;

import com.jay.dossier.model.enums.GateResult;
import com.jay.dossier.model.enums.Hardness;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Objects;

/**
 * One evaluated gate. A Soft-Pass row cannot exist without a dated flip trigger.
 */
@Value
public class GateRow {
    String gateId;
    Hardness hardness;
    GateResult result;
    String rule;
    List<String> metricIds;
    FlipTrigger flipTrigger;
    List<EvidenceSpan> evidence;

    @Builder
    private GateRow(String gateId, Hardness hardness, GateResult result, String rule,
                    @Singular List<String> metricIds, FlipTrigger flipTrigger,
                    @Singular("evidenceSpan") List<EvidenceSpan> evidence) {
        this.gateId = Objects.requireNonNull(gateId, "gateId");
        this.hardness = Objects.requireNonNull(hardness, "hardness");
        this.result = Objects.requireNonNull(result, "result");
        if (result == GateResult.SOFT_PASS
            && (flipTrigger == null || flipTrigger.deadline() == null)) {
            throw new IllegalStateException("Soft-Pass gate '" + gateId + "' requires a dated flip trigger");
        }
        this.rule = rule;
        this.metricIds = List.copyOf(metricIds);
        this.flipTrigger = flipTrigger;
        this.evidence = List.copyOf(evidence);
    }
}
