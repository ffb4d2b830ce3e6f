package com.example.rabbitwatch.gateway;

import java.time.Instant;

/**
 * Envelope pushed to browsers, e.g. {@code alert.new} or {@code alert.resolved}.
 */
public record AlertEvent(String event, String workspaceId, Object data, Instant timestamp) {

    public static final String ALERT_NEW = "alert.new";
    public static final String ALERT_RESOLVED = "alert.resolved";
    public static final String CONNECTED = "gateway.connected";
    public static final String PONG = "pong";
}
