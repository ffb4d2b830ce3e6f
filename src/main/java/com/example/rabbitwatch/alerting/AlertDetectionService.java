package com.example.rabbitwatch.alerting;

import com.example.rabbitwatch.domain.Alert;
import com.example.rabbitwatch.domain.CandidateAlert;
import com.example.rabbitwatch.domain.MetricsSnapshot;
import com.example.rabbitwatch.domain.RabbitServer;
import com.example.rabbitwatch.domain.ResolvedAlertRecord;
import com.example.rabbitwatch.domain.ThresholdSet;
import com.example.rabbitwatch.exception.MetricsUnavailableException;
import com.example.rabbitwatch.gateway.AlertEvent;
import com.example.rabbitwatch.gateway.AlertEventsWebSocketHandler;
import com.example.rabbitwatch.monitoring.MetricsSource;
import com.example.rabbitwatch.notification.AlertNotificationService;
import com.example.rabbitwatch.repository.RabbitServerRepository;
import com.example.rabbitwatch.repository.ResolvedAlertRepository;
import com.example.rabbitwatch.service.ThresholdService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One detection cycle: poll, classify, reconcile, persist, notify.
 *
 * Cycles for the same server are serialized on the server's lock. A failed
 * poll skips the cycle and leaves the active alerts as they were; only a
 * successful poll can resolve anything. Notification is handed off and
 * never holds up or fails the cycle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertDetectionService {

    private final MetricsSource metricsSource;
    private final ThresholdService thresholdService;
    private final AlertClassifier classifier;
    private final AlertLifecycleTracker tracker;
    private final ActiveAlertStore activeAlerts;
    private final ResolvedAlertRepository resolvedAlertRepository;
    private final RabbitServerRepository serverRepository;
    private final AlertNotificationService notificationService;
    private final AlertEventsWebSocketHandler alertEvents;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public DetectionResult runDetectionCycle(RabbitServer server) {
        String workspaceId = server.getWorkspaceId();
        ReentrantLock lock = activeAlerts.lockFor(workspaceId, server.getId());
        Timer.Sample sample = Timer.start(meterRegistry);
        lock.lock();
        DetectionResult result;
        try {
            result = detect(server);
        } catch (RuntimeException e) {
            log.error("Detection cycle failed for {}: {}", server.getName(), e.getMessage(), e);
            result = new DetectionResult(server.getId(), DetectionResult.Outcome.FAILED,
                    activeAlerts.get(workspaceId, server.getId()).size(), 0, 0, clock.instant(),
                    "Detection cycle failed");
        } finally {
            lock.unlock();
        }

        sample.stop(Timer.builder("rabbitwatch.detection.cycle")
                .tag("outcome", result.outcome().getValue())
                .register(meterRegistry));
        recordCheck(server, result);
        return result;
    }

    private DetectionResult detect(RabbitServer server) {
        String workspaceId = server.getWorkspaceId();
        Instant now = clock.instant();
        List<Alert> previouslyActive = activeAlerts.get(workspaceId, server.getId());

        MetricsSnapshot snapshot;
        try {
            snapshot = metricsSource.fetchSnapshot(server, now);
        } catch (MetricsUnavailableException e) {
            log.warn("Skipping detection for {}: {}", server.getName(), e.getMessage());
            return new DetectionResult(server.getId(), DetectionResult.Outcome.SKIPPED,
                    previouslyActive.size(), 0, 0, now, e.getMessage());
        }

        ThresholdSet thresholds = thresholdService.getThresholds(workspaceId);
        List<CandidateAlert> candidates = classifier.classify(snapshot, thresholds);
        AlertLifecycleTracker.ReconcileResult reconciled = tracker.reconcile(candidates, previouslyActive);

        if (!reconciled.newlyResolved().isEmpty()) {
            resolvedAlertRepository.saveAll(reconciled.newlyResolved().stream()
                    .map(alert -> ResolvedAlertRecord.from(workspaceId, alert))
                    .toList());
        }
        activeAlerts.replace(workspaceId, server.getId(), reconciled.active());

        if (reconciled.hasTransitions()) {
            log.info("Server {}: {} new, {} resolved, {} active",
                    server.getName(), reconciled.newlyActive().size(), reconciled.newlyResolved().size(),
                    reconciled.active().size());
            countTransitions("new", reconciled.newlyActive().size());
            countTransitions("resolved", reconciled.newlyResolved().size());
        }

        publishResolutions(server, reconciled.newlyResolved());
        handOffNewAlerts(server, reconciled.newlyActive());

        return new DetectionResult(server.getId(), DetectionResult.Outcome.SUCCESS,
                reconciled.active().size(), reconciled.newlyActive().size(), reconciled.newlyResolved().size(),
                now, null);
    }

    private void publishResolutions(RabbitServer server, List<Alert> resolved) {
        for (Alert alert : resolved) {
            try {
                alertEvents.publish(server.getWorkspaceId(), AlertEvent.ALERT_RESOLVED, alert);
            } catch (RuntimeException e) {
                log.error("Could not push resolution of {} on {}: {}", alert.getId(), server.getName(), e.getMessage());
            }
        }
    }

    /** Alerts handed off here are already active; a failed hand-off does not fail the cycle. */
    private void handOffNewAlerts(RabbitServer server, List<Alert> newlyActive) {
        if (newlyActive.isEmpty()) {
            return;
        }
        try {
            notificationService.notifyNewAlerts(server, newlyActive);
        } catch (RuntimeException e) {
            log.error("Could not hand off {} new alert(s) on {} for notification: {}",
                    newlyActive.size(), server.getName(), e.getMessage());
        }
    }

    private void countTransitions(String transition, int count) {
        if (count == 0) {
            return;
        }
        Counter.builder("rabbitwatch.alerts.transitions")
                .tag("transition", transition)
                .register(meterRegistry)
                .increment(count);
    }

    private void recordCheck(RabbitServer server, DetectionResult result) {
        server.setLastCheckAt(result.checkedAt());
        server.setLastCheckStatus(switch (result.outcome()) {
            case SUCCESS -> RabbitServer.CheckStatus.SUCCESS;
            case SKIPPED -> RabbitServer.CheckStatus.SKIPPED;
            case FAILED -> RabbitServer.CheckStatus.FAILED;
        });
        try {
            serverRepository.save(server);
        } catch (RuntimeException e) {
            log.error("Could not record check status for {}: {}", server.getName(), e.getMessage());
        }
    }
}
