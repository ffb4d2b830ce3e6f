package com.example.rabbitwatch.notification;

import com.example.rabbitwatch.domain.Alert;
import com.example.rabbitwatch.domain.AlertSummary;

import java.time.Instant;
import java.util.List;

/**
 * Body of a generic webhook delivery.
 */
public record WebhookPayload(String version, String event, Instant timestamp, Ref workspace, Ref server,
                             List<Alert> alerts, AlertSummary summary) {

    public static final String EVENT_ALERT_NOTIFICATION = "alert.notification";

    public record Ref(String id, String name) {
    }
}
