package com.jay.dossier.model;

import com.jay.dossier.model.enums.AnalysisPath;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.SortedMap;

/**
 * The persisted per-ticker dossier. Every section is always present, whatever the QA verdict.
 */
@Value
@Builder(toBuilder = true)
public class DossierReport {
    String ticker;
    LocalDate asOf;
    Analyst analyst;
    QAResult verifier;
    SortedMap<String, DeltaEntry> delta;
    List<TriggerAlert> triggers;

    @Value
    @Builder
    public static class Analyst {
        String period;
        AnalysisPath path;
        List<String> pathReasons;
        AnalysisPath overall;
        List<Metric> metrics;
        List<GateRow> hardGates;
        List<GateRow> softGates;
        ValuationBlock valuation;
        List<ProvenanceIssue> provenanceIssues;
    }
}
