package com.jay.dossier.model;

/** Citation for a number: where it came from and the quoted words that support it. */
public record Provenance(String documentId, String pageOrSection, String quote, String url) {
}
