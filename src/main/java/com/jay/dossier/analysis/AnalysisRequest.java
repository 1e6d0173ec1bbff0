package com.jay.dossier.analysis;

import com.jay.dossier.layer1_normalize.RawFiling;
import com.jay.dossier.layer2_calculate.ProvenanceCatalog;
import com.jay.dossier.layer3_valuation.ValuationInputs;
import com.jay.dossier.model.Document;
import com.jay.dossier.model.EvidenceSpan;
import com.jay.dossier.model.Metric;
import com.jay.dossier.model.enums.BusinessModel;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Inputs for one dossier run, as materialized by the fetching, extraction and retrieval collaborators.
 */
@Value
@Builder
public class AnalysisRequest {
    String ticker;
    LocalDate asOf;
    @Singular List<RawFiling> filings;
    @Singular List<Document> documents;
    ProvenanceCatalog provenance;
    ValuationInputs valuation;
    BusinessModel businessModel;
    /** gate id -> ranked spans for the qualitative gates */
    @Singular("evidenceFor") Map<String, List<EvidenceSpan>> evidence;
    /** Metrics reported by the extraction collaborator beyond the calculator table, e.g. KPI disclosures. */
    @Singular List<Metric> supplementalMetrics;
}
