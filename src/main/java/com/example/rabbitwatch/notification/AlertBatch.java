package com.example.rabbitwatch.notification;

import com.example.rabbitwatch.domain.Alert;
import com.example.rabbitwatch.domain.AlertSeverity;
import com.example.rabbitwatch.domain.AlertSummary;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Newly active alerts from one detection cycle of one server, with the
 * names the payloads need.
 */
public record AlertBatch(String workspaceId, String workspaceName, String serverId, String serverName,
                         List<Alert> alerts) {

    public AlertBatch {
        alerts = List.copyOf(alerts);
    }

    public boolean isEmpty() {
        return alerts.isEmpty();
    }

    public int size() {
        return alerts.size();
    }

    /** The same batch restricted to the given severities. */
    public AlertBatch withSeverities(Set<AlertSeverity> severities) {
        return new AlertBatch(workspaceId, workspaceName, serverId, serverName,
                alerts.stream().filter(a -> severities.contains(a.getSeverity())).toList());
    }

    public AlertSeverity worstSeverity() {
        AlertSeverity worst = null;
        for (Alert alert : alerts) {
            if (alert.getSeverity().isWorseThan(worst)) {
                worst = alert.getSeverity();
            }
        }
        return worst != null ? worst : AlertSeverity.INFO;
    }

    public AlertSummary summary() {
        return AlertSummary.of(alerts);
    }

    /** The vhost carried by the most alerts; on a tie, the one seen first. */
    public Optional<String> mostCommonVhost() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Alert alert : alerts) {
            if (alert.getVhost() != null && !alert.getVhost().isEmpty()) {
                counts.merge(alert.getVhost(), 1, Integer::sum);
            }
        }
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return Optional.ofNullable(best);
    }
}
