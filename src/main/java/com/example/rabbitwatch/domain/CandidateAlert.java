package com.example.rabbitwatch.domain;

import com.example.rabbitwatch.alerting.AlertFingerprint;
import lombok.Builder;

/**
 * Classifier output for one detected condition, before the lifecycle
 * tracker decides whether it is new or a continuation.
 */
@Builder
public record CandidateAlert(
        String serverId,
        String serverName,
        AlertSeverity severity,
        AlertCategory category,
        String title,
        String description,
        AlertDetails details,
        AlertSource source,
        String vhost) {

    public String key() {
        return AlertFingerprint.of(serverId, category, source.type(), source.name(), vhost);
    }
}
