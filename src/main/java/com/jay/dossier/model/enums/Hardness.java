package com.jay.dossier.model.enums;

public enum Hardness {
    Hard,
    Soft
}
