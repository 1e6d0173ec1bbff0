package com.jay.dossier.layer1_normalize;

/**
 * Raised when a filing cannot be turned into a comparable period: statements that do not
 * describe the same period end, a currency without a conversion rate, or duplicate periods.
 */
public class NormalizationException extends RuntimeException {

    public NormalizationException(String message) {
        super(message);
    }
}
