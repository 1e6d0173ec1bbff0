package com.jay.dossier.layer1_normalize;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.LocalDate;
import java.util.Map;

/** One statement as extracted, before scale and currency normalization. */
@Value
@Builder
public class RawStatement {
    LocalDate periodEnd;
    String currency;
    /** Free-text scale marker from the statement header, e.g. "(in millions, except per share data)". */
    String scaleHint;
    @Singular Map<String, Double> items;
}
