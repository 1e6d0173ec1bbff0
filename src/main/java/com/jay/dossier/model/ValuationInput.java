package com.jay.dossier.model;

/** A scalar valuation assumption together with its citation. */
public record ValuationInput(double value, Provenance provenance) {

    public static ValuationInput of(double value, Provenance provenance) {
        return new ValuationInput(value, provenance);
    }
}
