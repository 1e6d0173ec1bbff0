package com.jay.dossier.layer4_gates;

import com.jay.dossier.config.DossierConfig;
import com.jay.dossier.model.FlipTrigger;
import com.jay.dossier.model.GateRow;
import com.jay.dossier.model.enums.AnalysisPath;
import com.jay.dossier.model.enums.GateResult;
import com.jay.dossier.model.enums.Hardness;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Layer 4 - Gate Engine.
 * Evaluates every gate in table order and always returns the full set of rows.
 * A failed hard gate decides the overall verdict but does not stop evaluation, so the
 * dossier stays fully inspectable.
 *
 * Gate rules are pure: the same metrics and as-of date always give the same rows.
 */
@Slf4j
@Service
public class GateEngine {

    private final DossierConfig config;
    private final List<GateDefinition> gates;

    public GateEngine(DossierConfig config) {
        this.config = config;
        this.gates = StageZeroGates.table(config.gates());
    }

    public record GateReport(List<GateRow> hardGates, List<GateRow> softGates, AnalysisPath overall) {
        public GateReport {
            hardGates = List.copyOf(hardGates);
            softGates = List.copyOf(softGates);
        }

        public boolean anyHardFail() {
            return hardGates.stream().anyMatch(r -> r.getResult() == GateResult.FAIL);
        }
    }

    public GateReport evaluate(GateContext context, PathSelector.PathDecision path) {
        List<GateRow> rows = new ArrayList<>();
        for (GateDefinition gate : gates) {
            GateVerdict verdict = gate.evaluate().apply(context, List.copyOf(rows));
            GateRow row = toRow(gate, verdict, context);
            log.debug("Gate {} [{}] -> {}", gate.id(), gate.hardness(), row.getResult());
            rows.add(row);
        }

        List<GateRow> hard = rows.stream().filter(r -> r.getHardness() == Hardness.Hard).toList();
        List<GateRow> soft = rows.stream().filter(r -> r.getHardness() == Hardness.Soft).toList();
        boolean hardFail = hard.stream().anyMatch(r -> r.getResult() == GateResult.FAIL);
        AnalysisPath overall = hardFail ? AnalysisPath.Fail : path.path();

        if (hardFail) {
            log.info("Hard gate failure: {}", hard.stream()
                .filter(r -> r.getResult() == GateResult.FAIL).map(GateRow::getGateId).toList());
        }
        return new GateReport(hard, soft, overall);
    }

    public List<GateDefinition> gates() {
        return gates;
    }

    private GateRow toRow(GateDefinition gate, GateVerdict verdict, GateContext context) {
        GateRow.GateRowBuilder row = GateRow.builder()
            .gateId(gate.id())
            .hardness(gate.hardness())
            .result(verdict.result())
            .rule(gate.rule())
            .metricIds(gate.metricIds());
        if (verdict.result() == GateResult.SOFT_PASS) {
            row.flipTrigger(new FlipTrigger(verdict.flipCondition(),
                context.asOf().plusDays(config.gates().getFlipTriggerHorizonDays())));
        }
        if (gate.qualitative()) {
            row.evidence(context.evidenceFor(gate.id()));
        }
        return row.build();
    }
}
