package com.jay.dossier.model.enums;

public enum QaStatus {
    PASS,
    BLOCKER
}
