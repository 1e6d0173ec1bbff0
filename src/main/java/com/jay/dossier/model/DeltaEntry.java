package com.jay.dossier.model;

/** Change of one tracked metric; a null field means NA. */
public record DeltaEntry(String metric,
                         Double current,
                         Double qoqAbsolute,
                         Double qoqPercent,
                         Double yoyAbsolute,
                         Double yoyPercent) {
}
