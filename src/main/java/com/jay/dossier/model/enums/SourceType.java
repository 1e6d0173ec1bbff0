package com.jay.dossier.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/** Origin of a stored document. Filings and IR material are primary; Macro/Market only back valuation inputs. */
public enum SourceType {
    FORM_10K("10-K", true),
    FORM_10Q("10-Q", true),
    FORM_6K("6-K", true),
    FORM_8K("8-K", true),
    PROXY("Proxy", true),
    IR("IR", true),
    MACRO("Macro", false),
    MARKET("Market", false);

    private final String label;
    private final boolean primary;

    SourceType(String label, boolean primary) {
        this.label = label;
        this.primary = primary;
    }

    @JsonValue
    public String label() { return label; }

    public boolean isPrimary() { return primary; }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static SourceType fromLabel(String label) {
        return Arrays.stream(values())
            .filter(t -> t.label.equalsIgnoreCase(label))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown source type: " + label));
    }
}
