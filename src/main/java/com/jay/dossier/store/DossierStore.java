package com.jay.dossier.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jay.dossier.entity.DossierReportRecord;
import com.jay.dossier.entity.MetricSnapshotRecord;
import com.jay.dossier.entity.TriggerRecord;
import com.jay.dossier.layer7_monitor.TriggerMonitor;
import com.jay.dossier.model.DossierReport;
import com.jay.dossier.model.FiscalPeriod;
import com.jay.dossier.model.Metric;
import com.jay.dossier.model.MetricSnapshot;
import com.jay.dossier.model.Trigger;
import com.jay.dossier.model.TriggerAlert;
import com.jay.dossier.model.enums.Comparison;
import com.jay.dossier.repository.DossierReportRepository;
import com.jay.dossier.repository.MetricSnapshotRepository;
import com.jay.dossier.repository.TriggerRecordRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * The only gateway to durable state: trigger definitions, metric snapshots and committed dossiers.
 *
 * Every write for a ticker takes that ticker's lock and runs in one transaction, so concurrent
 * analyses of the same ticker cannot interleave and a dossier is either fully stored or not at all.
 * Trigger definitions are loaded into the monitor at startup; pending state is flushed on shutdown.
 */
@Slf4j
@Component
public class DossierStore {

    private static final TypeReference<TreeMap<String, Double>> VALUES = new TypeReference<>() {};

    private final TriggerRecordRepository triggerRepo;
    private final DossierReportRepository reportRepo;
    private final MetricSnapshotRepository snapshotRepo;
    private final TriggerMonitor monitor;
    private final TickerLocks locks;
    private final TransactionTemplate tx;
    private final ObjectMapper json = DossierJson.canonical();

    public DossierStore(TriggerRecordRepository triggerRepo,
                        DossierReportRepository reportRepo,
                        MetricSnapshotRepository snapshotRepo,
                        TriggerMonitor monitor,
                        TickerLocks locks,
                        PlatformTransactionManager transactionManager) {
        this.triggerRepo = triggerRepo;
        this.reportRepo = reportRepo;
        this.snapshotRepo = snapshotRepo;
        this.monitor = monitor;
        this.locks = locks;
        this.tx = new TransactionTemplate(transactionManager);
    }

    // ── Lifecycle ────────────────────────────────────────────────────────────

    @PostConstruct
    public void init() {
        monitor.load(loadTriggers());
    }

    @PreDestroy
    public void shutdown() {
        locks.drain();
        tx.executeWithoutResult(status -> {
            triggerRepo.flush();
            snapshotRepo.flush();
            reportRepo.flush();
        });
        log.info("DossierStore flushed and closed");
    }

    // ── Triggers ─────────────────────────────────────────────────────────────

    /**
     * Validates, persists and registers a trigger, replacing any existing one for the same metric.
     * Invalid input throws TriggerConfigException before anything is written.
     */
    public Trigger registerTrigger(String ticker, String metric, Double threshold, String comparison, LocalDate deadline) {
        Trigger trigger = monitor.validate(ticker, metric, threshold, comparison, deadline);
        locks.run(trigger.ticker(), () -> {
            tx.executeWithoutResult(status -> {
                LocalDateTime now = LocalDateTime.now();
                TriggerRecord record = triggerRepo.findByTickerAndMetric(trigger.ticker(), trigger.metric())
                    .orElseGet(() -> TriggerRecord.builder()
                        .ticker(trigger.ticker())
                        .metric(trigger.metric())
                        .createdAt(now)
                        .build());
                record.setThreshold(trigger.threshold());
                record.setComparison(trigger.comparison().operator());
                record.setDeadline(trigger.deadline());
                record.setUpdatedAt(now);
                triggerRepo.save(record);
            });
            monitor.upsert(trigger);
        });
        log.info("Registered trigger {} {} (deadline {})", trigger.ticker(), trigger.describe(), trigger.deadline());
        return trigger;
    }

    public boolean removeTrigger(String ticker, String metric) {
        String key = TriggerMonitor.normalizeTicker(ticker);
        String name = TriggerMonitor.normalizeMetric(metric);
        return locks.withLock(key, () -> {
            Long deleted = tx.execute(status -> triggerRepo.deleteByTickerAndMetric(key, name));
            monitor.remove(key, name);
            return deleted != null && deleted > 0;
        });
    }

    public List<Trigger> loadTriggers() {
        return triggerRepo.findAll().stream()
            .sorted(Comparator.comparing(TriggerRecord::getTicker).thenComparing(TriggerRecord::getMetric))
            .map(r -> new Trigger(r.getTicker(), r.getMetric(), r.getThreshold(),
                Comparison.parse(r.getComparison()).orElseThrow(() -> new IllegalStateException(
                    "Stored trigger " + r.getTicker() + " " + r.getMetric() + " has invalid operator " + r.getComparison())),
                r.getDeadline()))
            .toList();
    }

    // ── Dossiers ─────────────────────────────────────────────────────────────

    /**
     * Stores a completed dossier together with the snapshots it was computed from, atomically.
     * Serialization happens before the transaction opens, so a bad report writes nothing.
     */
    public void commit(DossierReport report, Collection<MetricSnapshot> snapshots) {
        String ticker = report.getTicker().toUpperCase();
        LocalDateTime now = LocalDateTime.now();

        DossierReportRecord record = DossierReportRecord.builder()
            .ticker(ticker)
            .asOf(report.getAsOf())
            .period(report.getAnalyst().getPeriod())
            .qaStatus(report.getVerifier().status().name())
            .overall(report.getAnalyst().getOverall().name())
            .analystJson(write(report.getAnalyst()))
            .verifierJson(write(report.getVerifier()))
            .deltaJson(write(report.getDelta()))
            .triggersJson(write(report.getTriggers()))
            .latestMetricsJson(write(numericValues(report.getAnalyst().getMetrics())))
            .committedAt(now)
            .triggersUpdatedAt(now)
            .build();
        Map<String, String> snapshotJson = new TreeMap<>();
        snapshots.forEach(s -> snapshotJson.put(s.period().key(), write(s.values())));

        locks.run(ticker, () -> tx.executeWithoutResult(status -> {
            snapshotJson.forEach((periodKey, values) -> {
                MetricSnapshotRecord row = snapshotRepo.findByTickerAndPeriodKey(ticker, periodKey)
                    .orElseGet(() -> MetricSnapshotRecord.builder().ticker(ticker).periodKey(periodKey).build());
                row.setValuesJson(values);
                row.setRecordedAt(now);
                snapshotRepo.save(row);
            });
            reportRepo.save(record);
        }));
        log.info("Committed dossier {} {} (QA {}, {} snapshot(s))",
            ticker, record.getPeriod(), record.getQaStatus(), snapshots.size());
    }

    public List<MetricSnapshot> history(String ticker) {
        String key = ticker.toUpperCase();
        return snapshotRepo.findByTickerOrderByPeriodKeyAsc(key).stream()
            .map(r -> MetricSnapshot.of(key, FiscalPeriod.parse(r.getPeriodKey()), read(r.getValuesJson())))
            .toList();
    }

    public Optional<DossierReportRecord> findReport(String ticker) {
        return reportRepo.findById(ticker.toUpperCase());
    }

    /** Metric values of the last committed dossier, empty when none was committed. */
    public Map<String, Double> latestMetrics(String ticker) {
        return findReport(ticker)
            .<Map<String, Double>>map(r -> read(r.getLatestMetricsJson()))
            .orElse(Map.of());
    }

    /** Rewrites only the triggers section of the stored dossier. Returns false when there is no dossier. */
    public boolean updateTriggerAlerts(String ticker, List<TriggerAlert> alerts) {
        String key = ticker.toUpperCase();
        String alertsJson = write(alerts);
        return locks.withLock(key, () -> Boolean.TRUE.equals(tx.execute(status -> {
            Optional<DossierReportRecord> record = reportRepo.findById(key);
            if (record.isEmpty()) return false;
            record.get().setTriggersJson(alertsJson);
            record.get().setTriggersUpdatedAt(LocalDateTime.now());
            reportRepo.save(record.get());
            return true;
        })));
    }

    // ── JSON ─────────────────────────────────────────────────────────────────

    String write(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize dossier section", e);
        }
    }

    private TreeMap<String, Double> read(String valuesJson) {
        if (valuesJson == null || valuesJson.isBlank()) return new TreeMap<>();
        try {
            return json.readValue(valuesJson, VALUES);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to read stored metric values", e);
        }
    }

    private static SortedMap<String, Double> numericValues(List<Metric> metrics) {
        SortedMap<String, Double> values = new TreeMap<>();
        metrics.forEach(m -> m.numeric().ifPresent(v -> values.putIfAbsent(m.getName(), v)));
        return values;
    }
}
