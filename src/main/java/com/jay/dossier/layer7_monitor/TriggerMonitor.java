package com.jay.dossier.layer7_monitor;

import com.jay.dossier.config.DossierConfig;
import com.jay.dossier.model.Trigger;
import com.jay.dossier.model.TriggerAlert;
import com.jay.dossier.model.enums.AlertStatus;
import com.jay.dossier.model.enums.Comparison;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Layer 7 - Trigger Monitor.
 * Holds the registered trigger definitions per ticker and projects them into alerts against the
 * latest metric values. Evaluation only reads definitions; alerts are recomputed, never stored edits.
 *
 * Definitions reach this registry through DossierStore, which persists them first.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TriggerMonitor {

    private final DossierConfig config;

    // ticker -> metric -> definition
    private final Map<String, Map<String, Trigger>> registry = new ConcurrentHashMap<>();

    /**
     * Builds a trigger from raw registration input, rejecting anything that could not be evaluated later.
     */
    public Trigger validate(String ticker, String metric, Double threshold, String comparison, LocalDate deadline) {
        if (ticker == null || ticker.isBlank()) {
            throw new TriggerConfigException("Trigger needs a ticker");
        }
        if (metric == null || metric.isBlank()) {
            throw new TriggerConfigException("Trigger for " + ticker + " needs a metric name");
        }
        Comparison op = Comparison.parse(comparison).orElseThrow(() -> new TriggerConfigException(String.format(
            "Unknown comparison operator '%s' for %s %s (expected gte, lte, gt, lt or eq)", comparison, ticker, metric)));
        if (threshold == null || !Double.isFinite(threshold)) {
            throw new TriggerConfigException(String.format(
                "Threshold for %s %s must be a finite number, got %s", ticker, metric, threshold));
        }
        if (deadline == null) {
            throw new TriggerConfigException(String.format("Trigger %s %s needs a deadline", ticker, metric));
        }
        return new Trigger(normalizeTicker(ticker), normalizeMetric(metric), threshold, op, deadline);
    }

    /** Adds or replaces the definition for (ticker, metric). */
    public void upsert(Trigger trigger) {
        registry.computeIfAbsent(trigger.ticker(), k -> new ConcurrentSkipListMap<>())
            .put(trigger.metric(), trigger);
    }

    public boolean remove(String ticker, String metric) {
        Map<String, Trigger> byMetric = registry.get(normalizeTicker(ticker));
        return byMetric != null && metric != null && byMetric.remove(normalizeMetric(metric)) != null;
    }

    /** Replaces the whole registry, used when definitions are reloaded from storage. */
    public void load(Collection<Trigger> triggers) {
        registry.clear();
        triggers.forEach(this::upsert);
        log.info("Trigger monitor loaded {} definition(s) for {} ticker(s)", triggers.size(), registry.size());
    }

    public List<Trigger> triggers(String ticker) {
        Map<String, Trigger> byMetric = registry.get(normalizeTicker(ticker));
        return byMetric == null ? List.of() : List.copyOf(byMetric.values());
    }

    public Set<String> tickers() {
        return new TreeSet<>(registry.keySet());
    }

    public List<TriggerAlert> evaluate(String ticker, Map<String, Double> latest, LocalDate today) {
        return evaluate(triggers(ticker), latest, today);
    }

    /**
     * One alert per trigger that needs attention:
     * EXPIRED once the deadline has passed without the condition holding,
     * PENDING while there is no current value,
     * BREACH when the current value fails the condition.
     * Triggers whose condition holds produce nothing.
     */
    public List<TriggerAlert> evaluate(Collection<Trigger> triggers, Map<String, Double> latest, LocalDate today) {
        double eqTolerance = config.monitor().getEqTolerance();
        List<TriggerAlert> alerts = new ArrayList<>();
        List<Trigger> ordered = triggers.stream()
            .sorted(Comparator.comparing(Trigger::metric).thenComparing(Trigger::deadline))
            .toList();

        for (Trigger trigger : ordered) {
            long daysRemaining = ChronoUnit.DAYS.between(today, trigger.deadline());
            Double value = latest.get(trigger.metric());
            boolean holds = value != null && trigger.comparison().holds(value, trigger.threshold(), eqTolerance);

            if (today.isAfter(trigger.deadline()) && !holds) {
                alerts.add(new TriggerAlert(trigger, AlertStatus.EXPIRED, String.format(
                    "%s unresolved past deadline %s (current %s)", trigger.describe(), trigger.deadline(),
                    value == null ? "NA" : value), daysRemaining, value));
            } else if (value == null) {
                alerts.add(new TriggerAlert(trigger, AlertStatus.PENDING, String.format(
                    "%s awaiting data, %d day(s) to deadline", trigger.describe(), daysRemaining),
                    daysRemaining, null));
            } else if (!holds) {
                alerts.add(new TriggerAlert(trigger, AlertStatus.BREACH, String.format(
                    "%s breached: current %s", trigger.describe(), value), daysRemaining, value));
            }
        }
        return alerts;
    }

    /** Registry keys: tickers upper-cased, metric names trimmed. Storage uses the same keys. */
    public static String normalizeTicker(String ticker) {
        return ticker.trim().toUpperCase(Locale.ROOT);
    }

    public static String normalizeMetric(String metric) {
        return metric.trim();
    }
}
