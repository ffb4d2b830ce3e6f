package com.example.rabbitwatch.domain;

import lombok.Builder;

import java.time.Instant;

/**
 * Point-in-time metrics for one queue. {@code consumerUtilization} is the
 * percentage of the publish rate being delivered, null when unknown.
 */
@Builder
public record QueueMetrics(
        String name,
        String vhost,
        long messages,
        long messagesReady,
        long messagesUnacknowledged,
        int consumers,
        Double consumerUtilization,
        double publishRate,
        double deliverRate,
        Instant idleSince) {
}
