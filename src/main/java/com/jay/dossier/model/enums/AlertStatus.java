package com.jay.dossier.model.enums;

public enum AlertStatus {
    BREACH,
    PENDING,
    EXPIRED
}
