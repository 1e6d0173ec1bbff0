package com.jay.dossier.model.enums;

public enum AnalysisPath {
    Mature,
    Emergent,
    Fail
}
