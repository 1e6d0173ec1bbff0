package com.jay.dossier.layer5_provenance;

import com.jay.dossier.model.Document;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Read access to the document store, by document id. */
@FunctionalInterface
public interface DocumentLookup {

    Optional<Document> find(String documentId);

    static DocumentLookup of(Collection<Document> documents) {
        Map<String, Document> byId = documents.stream()
            .collect(Collectors.toUnmodifiableMap(Document::getId, Function.identity(), (a, b) -> a));
        return id -> Optional.ofNullable(id == null ? null : byId.get(id));
    }
}
