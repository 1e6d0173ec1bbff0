package com.jay.dossier.model;

public record ProvenanceIssue(String metric, String reason) {

    @Override
    public String toString() {
        return metric + ": " + reason;
    }
}
