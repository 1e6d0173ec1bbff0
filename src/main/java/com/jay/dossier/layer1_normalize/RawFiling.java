package com.jay.dossier.layer1_normalize;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * Extraction output for one fiscal quarter. Segment and footnote tables carry their own
 * scale hints and fall back to the income statement and balance sheet hints respectively.
 */
@Value
@Builder
public class RawFiling {
    String ticker;
    int fiscalYear;
    int fiscalQuarter;
    RawStatement incomeStatement;
    RawStatement balanceSheet;
    RawStatement cashFlow;
    @Singular Map<String, Map<String, Double>> segments;
    String segmentScaleHint;
    @Singular Map<String, Double> footnotes;
    String footnoteScaleHint;
    /** Units of base currency per unit of the keyed currency. */
    @Singular Map<String, Double> fxRates;
    @Singular("kpi") Map<String, Double> kpis;
}
