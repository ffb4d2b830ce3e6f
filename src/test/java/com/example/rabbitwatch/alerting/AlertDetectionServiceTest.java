package com.example.rabbitwatch.alerting;

import com.example.rabbitwatch.domain.Alert;
import com.example.rabbitwatch.domain.MetricsSnapshot;
import com.example.rabbitwatch.domain.NodeMetrics;
import com.example.rabbitwatch.domain.RabbitServer;
import com.example.rabbitwatch.domain.ThresholdSet;
import com.example.rabbitwatch.exception.MetricsUnavailableException;
import com.example.rabbitwatch.gateway.AlertEvent;
import com.example.rabbitwatch.gateway.AlertEventsWebSocketHandler;
import com.example.rabbitwatch.monitoring.MetricsSource;
import com.example.rabbitwatch.notification.AlertNotificationService;
import com.example.rabbitwatch.repository.RabbitServerRepository;
import com.example.rabbitwatch.repository.ResolvedAlertRepository;
import com.example.rabbitwatch.service.ThresholdService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.core.task.TaskRejectedException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AlertDetectionServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private MetricsSource metricsSource;
    @Mock
    private ThresholdService thresholdService;
    @Mock
    private ResolvedAlertRepository resolvedAlertRepository;
    @Mock
    private RabbitServerRepository serverRepository;
    @Mock
    private AlertNotificationService notificationService;
    @Mock
    private AlertEventsWebSocketHandler alertEvents;

    private final ActiveAlertStore activeAlerts = new ActiveAlertStore();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private AlertDetectionService service;
    private RabbitServer server;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        service = new AlertDetectionService(metricsSource, thresholdService, new AlertClassifier(),
                new AlertLifecycleTracker(clock), activeAlerts, resolvedAlertRepository, serverRepository,
                notificationService, alertEvents, meterRegistry, clock);
        server = RabbitServer.builder().id("srv-1").workspaceId("ws-1").name("prod")
                .managementUrl("http://rabbit:15672").build();
        when(thresholdService.getThresholds("ws-1")).thenReturn(ThresholdSet.defaults());
    }

    private MetricsSnapshot snapshotWithMemory(double memoryPercent) {
        NodeMetrics node = NodeMetrics.builder().name("rabbit@n1").running(true)
                .memoryUsedPercent(memoryPercent).build();
        return new MetricsSnapshot("srv-1", "prod", NOW, List.of(node), List.of(), null);
    }

    @Test
    @DisplayName("A new condition is stored, counted and notified")
    void newAlertIsNotified() throws Exception {
        when(metricsSource.fetchSnapshot(eq(server), any())).thenReturn(snapshotWithMemory(97));

        DetectionResult result = service.runDetectionCycle(server);

        assertEquals(DetectionResult.Outcome.SUCCESS, result.outcome());
        assertEquals(1, result.newlyActive());
        assertEquals(1, activeAlerts.get("ws-1", "srv-1").size());
        verify(notificationService).notifyNewAlerts(eq(server), anyList());
        assertEquals(1.0, meterRegistry.get("rabbitwatch.alerts.transitions").tag("transition", "new")
                .counter().count());
        assertEquals(RabbitServer.CheckStatus.SUCCESS, server.getLastCheckStatus());
        assertEquals(NOW, server.getLastCheckAt());
        verify(serverRepository).save(server);
    }

    @Test
    @DisplayName("A continuing condition is not notified again")
    void continuationIsNotRenotified() throws Exception {
        when(metricsSource.fetchSnapshot(eq(server), any()))
                .thenReturn(snapshotWithMemory(97))
                .thenReturn(snapshotWithMemory(98));

        service.runDetectionCycle(server);
        DetectionResult second = service.runDetectionCycle(server);

        assertEquals(0, second.newlyActive());
        assertEquals(1, second.active());
        verify(notificationService, times(1)).notifyNewAlerts(any(), anyList());
    }

    @Test
    @DisplayName("A cleared condition is persisted as resolved and pushed to browsers")
    void clearedConditionResolves() throws Exception {
        when(metricsSource.fetchSnapshot(eq(server), any()))
                .thenReturn(snapshotWithMemory(97))
                .thenReturn(snapshotWithMemory(50));

        service.runDetectionCycle(server);
        DetectionResult second = service.runDetectionCycle(server);

        assertEquals(1, second.newlyResolved());
        assertTrue(activeAlerts.get("ws-1", "srv-1").isEmpty());
        verify(resolvedAlertRepository).saveAll(anyList());
        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(alertEvents).publish(eq("ws-1"), eq(AlertEvent.ALERT_RESOLVED), payload.capture());
        assertTrue(((Alert) payload.getValue()).isResolved());
    }

    @Test
    @DisplayName("A failed poll skips the cycle and leaves active alerts untouched")
    void failedPollLeavesAlertsActive() throws Exception {
        when(metricsSource.fetchSnapshot(eq(server), any()))
                .thenReturn(snapshotWithMemory(97))
                .thenThrow(new MetricsUnavailableException("connection refused"));

        service.runDetectionCycle(server);
        DetectionResult second = service.runDetectionCycle(server);

        assertEquals(DetectionResult.Outcome.SKIPPED, second.outcome());
        assertEquals(1, activeAlerts.get("ws-1", "srv-1").size());
        verify(resolvedAlertRepository, never()).saveAll(anyList());
        assertEquals(RabbitServer.CheckStatus.SKIPPED, server.getLastCheckStatus());
        assertEquals(1, meterRegistry.get("rabbitwatch.detection.cycle").tag("outcome", "skipped")
                .timer().count());
    }

    @Test
    @DisplayName("An unexpected error fails the cycle without throwing")
    void unexpectedErrorFailsCycle() throws Exception {
        when(metricsSource.fetchSnapshot(eq(server), any())).thenThrow(new IllegalStateException("boom"));

        DetectionResult result = service.runDetectionCycle(server);

        assertEquals(DetectionResult.Outcome.FAILED, result.outcome());
        assertEquals(RabbitServer.CheckStatus.FAILED, server.getLastCheckStatus());
        verifyNoInteractions(notificationService);
    }

    @Test
    @DisplayName("A rejected notification hand-off does not fail the cycle")
    void rejectedHandOffKeepsCycleSuccessful() throws Exception {
        when(metricsSource.fetchSnapshot(eq(server), any())).thenReturn(snapshotWithMemory(99));
        doThrow(new TaskRejectedException("notify pool full"))
                .when(notificationService).notifyNewAlerts(eq(server), anyList());

        DetectionResult result = service.runDetectionCycle(server);

        assertEquals(DetectionResult.Outcome.SUCCESS, result.outcome());
        assertEquals(1, result.newlyActive());
        assertEquals(1, activeAlerts.get("ws-1", "srv-1").size());
        assertEquals(RabbitServer.CheckStatus.SUCCESS, server.getLastCheckStatus());
    }

    @Test
    @DisplayName("A failed resolution push does not fail the cycle")
    void failedResolutionPushKeepsCycleSuccessful() throws Exception {
        when(metricsSource.fetchSnapshot(eq(server), any()))
                .thenReturn(snapshotWithMemory(97))
                .thenReturn(snapshotWithMemory(50));
        when(alertEvents.publish(anyString(), eq(AlertEvent.ALERT_RESOLVED), any()))
                .thenThrow(new IllegalStateException("socket gone"));

        service.runDetectionCycle(server);
        DetectionResult second = service.runDetectionCycle(server);

        assertEquals(DetectionResult.Outcome.SUCCESS, second.outcome());
        assertEquals(1, second.newlyResolved());
        verify(resolvedAlertRepository).saveAll(anyList());
    }
}
