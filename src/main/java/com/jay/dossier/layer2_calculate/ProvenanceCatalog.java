package com.jay.dossier.layer2_calculate;

import com.jay.dossier.model.Provenance;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Citations the extraction collaborator recorded while reading the filings, keyed by metric
 * or line-item name.
 */
public final class ProvenanceCatalog {

    private final Map<String, Provenance> entries;

    private ProvenanceCatalog(Map<String, Provenance> entries) {
        this.entries = Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    public static ProvenanceCatalog of(Map<String, Provenance> entries) {
        return new ProvenanceCatalog(entries);
    }

    public static ProvenanceCatalog empty() {
        return new ProvenanceCatalog(Map.of());
    }

    public Optional<Provenance> lookup(String name) {
        return Optional.ofNullable(entries.get(name));
    }

    public Map<String, Provenance> entries() {
        return entries;
    }
}
