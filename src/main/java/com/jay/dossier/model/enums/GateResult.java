package com.jay.dossier.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum GateResult {
    PASS("Pass"),
    SOFT_PASS("Soft-Pass"),
    FAIL("Fail"),
    NA("NA");

    private final String label;

    GateResult(String label) { this.label = label; }

    @JsonValue
    public String label() { return label; }

    @Override
    public String toString() { return label; }
}
