package com.jay.dossier.layer6_verify;

import com.jay.dossier.layer3_valuation.ValuationInputs;
import com.jay.dossier.model.CompanyQuarter;
import com.jay.dossier.model.GateRow;
import com.jay.dossier.model.Metric;
import com.jay.dossier.model.ProvenanceIssue;
import com.jay.dossier.model.ValuationBlock;
import com.jay.dossier.model.enums.BusinessModel;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/** Everything the verifier reads. It is handed copies and never writes back. */
@Value
@Builder
public class VerificationRequest {
    @Singular List<Metric> metrics;
    @Singular List<GateRow> hardGates;
    @Singular List<ProvenanceIssue> provenanceIssues;
    CompanyQuarter latestQuarter;
    ValuationBlock valuation;
    ValuationInputs valuationInputs;
    BusinessModel businessModel;
}
