package com.jay.dossier.model.enums;

/** Declared in pessimistic-to-optimistic order; IRRs must not decrease along it. */
public enum ScenarioName {
    Bear,
    Base,
    Bull
}
