package com.jay.dossier.scheduler;

import com.jay.dossier.config.DossierConfig;
import com.jay.dossier.layer7_monitor.TriggerMonitor;
import com.jay.dossier.layer8_report.DossierReportGenerator;
import com.jay.dossier.model.TriggerAlert;
import com.jay.dossier.model.enums.AlertStatus;
import com.jay.dossier.store.DossierStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TriggerSweepSchedulerTest {

    private static final LocalDate DEADLINE = LocalDate.of(2025, 6, 30);

    @Mock
    private DossierStore store;

    private TriggerMonitor monitor;
    private TriggerSweepScheduler scheduler;

    @BeforeEach
    void setUp() {
        monitor = new TriggerMonitor(new DossierConfig());
        monitor.upsert(monitor.validate("ACME", "Gross Margin", 0.22, "gte", DEADLINE));
        monitor.upsert(monitor.validate("BETA", "Net Debt", 0.0, "lte", DEADLINE));
        scheduler = new TriggerSweepScheduler(monitor, store, new DossierReportGenerator());
    }

    @Test
    @DisplayName("Each ticker's alerts are recomputed from its stored metrics and written back")
    @SuppressWarnings("unchecked")
    void sweepRewritesAlerts() {
        // Arrange
        when(store.latestMetrics("ACME")).thenReturn(Map.of("Gross Margin", 0.20));
        when(store.latestMetrics("BETA")).thenReturn(Map.of("Net Debt", -5.0e8));
        when(store.updateTriggerAlerts(eq("ACME"), anyList())).thenReturn(true);
        when(store.updateTriggerAlerts(eq("BETA"), anyList())).thenReturn(true);

        // Act
        int updated = scheduler.sweep(LocalDate.of(2025, 2, 15));

        // Assert
        assertEquals(2, updated);
        ArgumentCaptor<List<TriggerAlert>> acme = ArgumentCaptor.forClass(List.class);
        verify(store).updateTriggerAlerts(eq("ACME"), acme.capture());
        assertEquals(AlertStatus.BREACH, acme.getValue().get(0).status());
        verify(store).updateTriggerAlerts("BETA", List.of());
    }

    @Test
    @DisplayName("Deadlines expire on the sweep even without new filings")
    @SuppressWarnings("unchecked")
    void sweepExpiresPastDeadline() {
        when(store.latestMetrics(anyString())).thenReturn(Map.of());
        when(store.updateTriggerAlerts(anyString(), anyList())).thenReturn(true);

        scheduler.sweep(DEADLINE.plusDays(1));

        ArgumentCaptor<List<TriggerAlert>> alerts = ArgumentCaptor.forClass(List.class);
        verify(store, times(2)).updateTriggerAlerts(anyString(), alerts.capture());
        alerts.getAllValues().forEach(list -> assertEquals(AlertStatus.EXPIRED, list.get(0).status()));
    }

    @Test
    @DisplayName("A failing ticker does not stop the sweep, and tickers without a dossier are not counted")
    void failureIsolatedPerTicker() {
        when(store.latestMetrics("ACME")).thenThrow(new IllegalStateException("corrupt metrics"));
        when(store.latestMetrics("BETA")).thenReturn(Map.of());
        when(store.updateTriggerAlerts(eq("BETA"), anyList())).thenReturn(false);

        assertEquals(0, scheduler.sweep(LocalDate.of(2025, 2, 15)));
        verify(store).updateTriggerAlerts(eq("BETA"), anyList());
        verify(store, never()).updateTriggerAlerts(eq("ACME"), anyList());
    }
}
