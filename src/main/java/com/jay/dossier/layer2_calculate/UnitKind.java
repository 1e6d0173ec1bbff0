package com.jay.dossier.layer2_calculate;

public enum UnitKind {
    CURRENCY,
    RATIO,
    DAYS,
    MONTHS,
    SHARES,
    COUNT;

    public String label(String currency) {
        return switch (this) {
            case CURRENCY -> currency;
            case RATIO    -> "ratio";
            case DAYS     -> "days";
            case MONTHS   -> "months";
            case SHARES   -> "shares";
            case COUNT    -> "count";
        };
    }
}
