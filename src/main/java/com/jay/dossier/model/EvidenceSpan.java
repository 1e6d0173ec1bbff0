package com.jay.dossier.model;

/** Ranked quoted span from the evidence retriever; rank 1 is the strongest. */
public record EvidenceSpan(String documentId, String quote, String url, int rank) {
}
