package com.example.rabbitwatch.notification;

import com.example.rabbitwatch.domain.Alert;
import com.example.rabbitwatch.domain.AlertSeverity;
import com.example.rabbitwatch.domain.RabbitServer;
import com.example.rabbitwatch.domain.Workspace;
import com.example.rabbitwatch.gateway.AlertEvent;
import com.example.rabbitwatch.gateway.AlertEventsWebSocketHandler;
import com.example.rabbitwatch.repository.WorkspaceRepository;
import com.example.rabbitwatch.service.ChannelConfigService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Sends newly active alerts to every channel a workspace has enabled:
 * email, Slack, webhooks and connected browsers.
 *
 * Runs off the detection thread. Nothing thrown here reaches the cycle
 * that produced the alerts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertNotificationService {

    private final WorkspaceRepository workspaceRepository;
    private final ChannelConfigService channelConfigService;
    private final NotificationDispatcher dispatcher;
    private final AlertEventsWebSocketHandler alertEvents;
    private final MeterRegistry meterRegistry;

    @Async("notificationExecutor")
    public void notifyNewAlerts(RabbitServer server, List<Alert> newlyActive) {
        if (newlyActive == null || newlyActive.isEmpty()) {
            return;
        }
        try {
            deliver(server, newlyActive);
        } catch (Exception e) {
            log.error("Notification for {} new alert(s) on {} failed: {}",
                    newlyActive.size(), server.getName(), e.getMessage(), e);
        }
    }

    /**
     * Synchronous form of {@link #notifyNewAlerts}, returning one entry per
     * channel that received a delivery attempt.
     */
    public List<ChannelDelivery> deliver(RabbitServer server, List<Alert> newlyActive) {
        Optional<Workspace> found = workspaceRepository.findById(server.getWorkspaceId());
        if (found.isEmpty()) {
            log.warn("Workspace {} of server {} not found, dropping {} notification(s)",
                    server.getWorkspaceId(), server.getName(), newlyActive.size());
            return List.of();
        }
        Workspace workspace = found.get();
        AlertBatch batch = new AlertBatch(workspace.getId(), workspace.getName(),
                server.getId(), server.getName(), newlyActive);

        pushToBrowsers(workspace, batch);

        List<ChannelTarget> targets = targetsFor(workspace);
        if (targets.isEmpty()) {
            log.debug("No notification channels enabled for workspace {}", workspace.getId());
            return List.of();
        }

        List<ChannelDelivery> deliveries = dispatcher.dispatchAll(targets, batch);
        for (ChannelDelivery delivery : deliveries) {
            DeliveryResult result = delivery.result();
            if (result.success()) {
                log.info("Delivered {} alert(s) for {} via {} channel {} in {} attempt(s)",
                        batch.size(), server.getName(), delivery.type().getValue(),
                        delivery.channelId(), result.attempts());
            } else {
                log.error("Delivery via {} channel {} failed after {} attempt(s): {}",
                        delivery.type().getValue(), delivery.channelId(), result.attempts(), result.error());
            }
            Counter.builder("rabbitwatch.notifications.delivery")
                    .tag("channel", delivery.type().getValue())
                    .tag("outcome", result.success() ? "success" : "failure")
                    .register(meterRegistry)
                    .increment();
        }
        return deliveries;
    }

    List<ChannelTarget> targetsFor(Workspace workspace) {
        List<ChannelTarget> targets = new ArrayList<>();
        if (workspace.isEmailNotificationsEnabled()
                && workspace.getContactEmail() != null && !workspace.getContactEmail().isBlank()) {
            targets.add(ChannelTarget.email(workspace));
        }
        channelConfigService.enabledSlackConfigs(workspace.getId())
                .forEach(config -> targets.add(ChannelTarget.slack(config)));
        channelConfigService.enabledWebhooks(workspace.getId())
                .forEach(config -> targets.add(ChannelTarget.webhook(config)));
        return targets;
    }

    private void pushToBrowsers(Workspace workspace, AlertBatch batch) {
        if (!workspace.isBrowserNotificationsEnabled()) {
            return;
        }
        Set<AlertSeverity> severities = workspace.getBrowserNotificationSeverities() == null
                || workspace.getBrowserNotificationSeverities().isEmpty()
                ? AlertSeverity.all() : workspace.getBrowserNotificationSeverities();
        for (Alert alert : batch.withSeverities(severities).alerts()) {
            alertEvents.publish(workspace.getId(), AlertEvent.ALERT_NEW, alert);
        }
    }
}
