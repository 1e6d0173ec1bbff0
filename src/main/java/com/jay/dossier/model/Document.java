package com.jay.dossier.model;

import com.jay.dossier.model.enums.SourceType;
import lombok.Builder;
import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;

/**
 * Point-in-time source document as supplied by the document store.
 * Never mutated after ingestion; the content hash pins the exact text.
 */
@Value
@Builder
public class Document {
    String id;
    String ticker;
    SourceType sourceType;
    Instant retrievedAt;
    String contentHash;
    String text;
    String url;

    public static Document of(String id, String ticker, SourceType sourceType,
                              Instant retrievedAt, String text, String url) {
        return Document.builder()
            .id(id)
            .ticker(ticker)
            .sourceType(sourceType)
            .retrievedAt(retrievedAt)
            .contentHash(sha256(text))
            .text(text)
            .url(url)
            .build();
    }

    static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
