package com.jay.dossier.store;

import com.jay.dossier.TestFixtures;
import com.jay.dossier.config.DossierConfig;
import com.jay.dossier.entity.DossierReportRecord;
import com.jay.dossier.layer7_monitor.TriggerConfigException;
import com.jay.dossier.layer7_monitor.TriggerMonitor;
import com.jay.dossier.model.DossierReport;
import com.jay.dossier.model.FiscalPeriod;
import com.jay.dossier.model.Metric;
import com.jay.dossier.model.MetricSnapshot;
import com.jay.dossier.model.MetricValue;
import com.jay.dossier.model.QAResult;
import com.jay.dossier.model.Trigger;
import com.jay.dossier.model.TriggerAlert;
import com.jay.dossier.model.enums.AlertStatus;
import com.jay.dossier.model.enums.AnalysisPath;
import com.jay.dossier.model.enums.Comparison;
import com.jay.dossier.repository.DossierReportRepository;
import com.jay.dossier.repository.MetricSnapshotRepository;
import com.jay.dossier.repository.TriggerRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class DossierStoreTest {

    private static final LocalDate DEADLINE = LocalDate.of(2025, 6, 30);

    @Autowired private TriggerRecordRepository triggerRepo;
    @Autowired private DossierReportRepository reportRepo;
    @Autowired private MetricSnapshotRepository snapshotRepo;
    @Autowired private PlatformTransactionManager transactionManager;

    private TriggerMonitor monitor;
    private DossierStore store;

    @BeforeEach
    void setUp() {
        monitor = new TriggerMonitor(new DossierConfig());
        store = newStore(monitor);
        store.init();
    }

    private DossierStore newStore(TriggerMonitor triggerMonitor) {
        return new DossierStore(triggerRepo, reportRepo, snapshotRepo, triggerMonitor, new TickerLocks(), transactionManager);
    }

    // ── Triggers ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("Registered triggers are reloaded into a fresh monitor")
    void triggersSurviveReload() {
        // Arrange
        store.registerTrigger("acme", "Gross Margin", 0.22, "gte", DEADLINE);
        store.registerTrigger("ACME", "Net Debt", 1.0e10, "lte", DEADLINE);

        // Act
        TriggerMonitor reloaded = new TriggerMonitor(new DossierConfig());
        newStore(reloaded).init();

        // Assert
        List<Trigger> triggers = reloaded.triggers("ACME");
        assertEquals(2, triggers.size());
        assertEquals("Gross Margin", triggers.get(0).metric());
        assertEquals(Comparison.GTE, triggers.get(0).comparison());
        assertEquals(DEADLINE, triggers.get(0).deadline());
    }

    @Test
    @DisplayName("Re-registering a metric updates the stored row in place")
    void reRegisterUpdates() {
        store.registerTrigger("ACME", "Gross Margin", 0.22, "gte", DEADLINE);
        store.registerTrigger("ACME", "Gross Margin", 0.18, "gt", DEADLINE.plusMonths(3));

        assertEquals(1, triggerRepo.count());
        Trigger stored = store.loadTriggers().get(0);
        assertEquals(0.18, stored.threshold());
        assertEquals(Comparison.GT, stored.comparison());
    }

    @Test
    @DisplayName("An invalid trigger is rejected before anything is stored")
    void invalidTriggerNotPersisted() {
        assertThrows(TriggerConfigException.class,
            () -> store.registerTrigger("ACME", "Gross Margin", 0.22, "greater", DEADLINE));

        assertEquals(0, triggerRepo.count());
        assertTrue(monitor.triggers("ACME").isEmpty());
    }

    @Test
    @DisplayName("Removing a trigger deletes it from storage and the monitor")
    void removeTrigger() {
        store.registerTrigger("ACME", "Gross Margin", 0.22, "gte", DEADLINE);

        assertTrue(store.removeTrigger("acme", "Gross Margin"));
        assertFalse(store.removeTrigger("ACME", "Gross Margin"));
        assertEquals(0, triggerRepo.count());
        assertTrue(monitor.triggers("ACME").isEmpty());
    }

    @Test
    @DisplayName("Removal matches the trimmed metric name used at registration")
    void removeTriggerTrimsMetricName() {
        store.registerTrigger("ACME", " Gross Margin ", 0.22, "gte", DEADLINE);

        assertTrue(store.removeTrigger(" acme ", " Gross Margin"));
        assertEquals(0, triggerRepo.count());
        assertTrue(monitor.triggers("ACME").isEmpty());
    }

    // ── Dossiers ─────────────────────────────────────────────────────────────

    @Test
    @DisplayName("A committed dossier exposes its snapshots, sections and latest metric values")
    void commitAndRead() {
        // Arrange
        List<MetricSnapshot> snapshots = List.of(
            MetricSnapshot.of("ACME", new FiscalPeriod(2024, 4), Map.of("Revenue", 5.0e9)),
            MetricSnapshot.of("ACME", new FiscalPeriod(2024, 3), Map.of("Revenue", 4.9e9)));

        // Act
        store.commit(report(), snapshots);

        // Assert
        List<MetricSnapshot> history = store.history("acme");
        assertEquals(2, history.size());
        assertEquals(new FiscalPeriod(2024, 3), history.get(0).period());
        assertEquals(5.0e9, history.get(1).values().get("Revenue"));

        DossierReportRecord record = store.findReport("ACME").orElseThrow();
        assertEquals("PASS", record.getQaStatus());
        assertEquals("Mature", record.getOverall());
        assertEquals("2024-Q4", record.getPeriod());
        assertTrue(record.getAnalystJson().contains("\"Gross Margin\""));

        Map<String, Double> latest = store.latestMetrics("ACME");
        assertEquals(0.6, latest.get("Gross Margin"));
        assertFalse(latest.containsKey("ROIC"), "NA metrics carry no value");
    }

    @Test
    @DisplayName("Committing the same period again overwrites its snapshot")
    void recommitOverwritesSnapshot() {
        FiscalPeriod q4 = new FiscalPeriod(2024, 4);
        store.commit(report(), List.of(MetricSnapshot.of("ACME", q4, Map.of("Revenue", 5.0e9))));
        store.commit(report(), List.of(MetricSnapshot.of("ACME", q4, Map.of("Revenue", 5.2e9))));

        assertEquals(1, snapshotRepo.count());
        assertEquals(5.2e9, store.history("ACME").get(0).values().get("Revenue"));
    }

    @Test
    @DisplayName("Updating alerts rewrites only the triggers section")
    void updateTriggerAlerts() {
        store.commit(report(), List.of());
        String analystBefore = store.findReport("ACME").orElseThrow().getAnalystJson();
        Trigger trigger = monitor.validate("ACME", "Gross Margin", 0.7, "gte", DEADLINE);
        TriggerAlert alert = new TriggerAlert(trigger, AlertStatus.BREACH, "Gross Margin gte 0.7 breached: current 0.6", 135, 0.6);

        assertTrue(store.updateTriggerAlerts("ACME", List.of(alert)));
        assertFalse(store.updateTriggerAlerts("NONE", List.of(alert)));

        DossierReportRecord record = store.findReport("ACME").orElseThrow();
        assertEquals(analystBefore, record.getAnalystJson());
        assertTrue(record.getTriggersJson().contains("BREACH"));
    }

    @Test
    @DisplayName("Unknown tickers have empty history and no latest metrics")
    void unknownTicker() {
        assertTrue(store.history("NONE").isEmpty());
        assertTrue(store.latestMetrics("NONE").isEmpty());
        assertTrue(store.findReport("NONE").isEmpty());
    }

    private static DossierReport report() {
        Metric grossMargin = Metric.builder()
            .name("Gross Margin")
            .value(MetricValue.of(0.6))
            .unit("ratio")
            .period("TTM-2024Q4")
            .provenance(TestFixtures.filingCite("Cost of revenue was $2,000 million"))
            .input("Revenue")
            .input("Cost of Revenue")
            .build();
        Metric roic = Metric.builder()
            .name("ROIC")
            .value(MetricValue.na())
            .period("TTM-2024Q4")
            .provenance(TestFixtures.filingCite("Operating income was $1,900 million"))
            .build();
        return DossierReport.builder()
            .ticker("ACME")
            .asOf(TestFixtures.AS_OF)
            .analyst(DossierReport.Analyst.builder()
                .period("2024-Q4")
                .path(AnalysisPath.Mature)
                .pathReasons(List.of("Positive trailing free cash flow"))
                .overall(AnalysisPath.Mature)
                .metrics(List.of(grossMargin, roic))
                .hardGates(List.of())
                .softGates(List.of())
                .provenanceIssues(List.of())
                .build())
            .verifier(QAResult.of(List.of()))
            .delta(new TreeMap<>())
            .triggers(List.of())
            .build();
    }
}
