package com.jay.dossier.model;

import com.jay.dossier.model.enums.AlertStatus;

public record TriggerAlert(Trigger trigger, AlertStatus status, String message, long daysRemaining, Double currentValue) {
}
