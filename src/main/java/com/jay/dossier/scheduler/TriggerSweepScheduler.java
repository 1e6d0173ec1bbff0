package com.jay.dossier.scheduler;

import com.jay.dossier.layer7_monitor.TriggerMonitor;
import com.jay.dossier.layer8_report.DossierReportGenerator;
import com.jay.dossier.model.TriggerAlert;
import com.jay.dossier.store.DossierStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Daily trigger sweep.
 * Re-evaluates every registered trigger against the last committed metric values and rewrites
 * only the triggers section of each stored dossier. Deadlines expire here even when no new
 * filing arrives.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TriggerSweepScheduler {

    private final TriggerMonitor monitor;
    private final DossierStore store;
    private final DossierReportGenerator reportGenerator;

    // ── Daily sweep ──────────────────────────────────────────────────────────

    @Scheduled(cron = "${dossier.sweep-cron:0 0 6 * * *}")
    public void dailySweep() {
        log.info("=== TRIGGER SWEEP ===");
        int updated = sweep(LocalDate.now());
        log.info("Trigger sweep complete: {} dossier(s) updated", updated);
    }

    /** Returns the number of stored dossiers whose triggers section was rewritten. */
    public int sweep(LocalDate today) {
        int updated = 0;
        for (String ticker : monitor.tickers()) {
            try {
                Map<String, Double> latest = store.latestMetrics(ticker);
                List<TriggerAlert> alerts = monitor.evaluate(ticker, latest, today);
                if (store.updateTriggerAlerts(ticker, alerts)) {
                    updated++;
                    if (!alerts.isEmpty()) {
                        log.info("Triggers for {}:\n{}", ticker, reportGenerator.renderAlerts(alerts));
                    }
                } else {
                    log.debug("No committed dossier for {}, skipping trigger sweep", ticker);
                }
            } catch (Exception e) {
                log.error("Trigger sweep failed for {}: {}", ticker, e.getMessage());
            }
        }
        return updated;
    }
}
