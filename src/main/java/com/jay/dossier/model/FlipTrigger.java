package com.jay.dossier.model;

import java.time.LocalDate;

public record FlipTrigger(String description, LocalDate deadline) {

    @Override
    public String toString() {
        return description + " by " + deadline;
    }
}
