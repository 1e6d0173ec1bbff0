package com.jay.dossier.model.enums;

public enum BusinessModel {
    SUBSCRIPTION,
    MARKETPLACE,
    TRANSACTIONAL,
    INDUSTRIAL,
    FINANCIAL,
    OTHER;

    public boolean isSubscription() {
        return this == SUBSCRIPTION;
    }
}
