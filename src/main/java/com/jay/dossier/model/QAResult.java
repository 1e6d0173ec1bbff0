package com.jay.dossier.model;

import com.jay.dossier.model.enums.QaStatus;

import java.util.List;

public record QAResult(QaStatus status, List<String> reasons) {

    public QAResult {
        reasons = List.copyOf(reasons);
    }

    /** PASS exactly when there is nothing to report. */
    public static QAResult of(List<String> reasons) {
        return new QAResult(reasons.isEmpty() ? QaStatus.PASS : QaStatus.BLOCKER, reasons);
    }

    public boolean passed() {
        return status == QaStatus.PASS;
    }
}
