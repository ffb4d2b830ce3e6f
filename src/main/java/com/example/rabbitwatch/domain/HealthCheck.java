package com.example.rabbitwatch.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

/**
 * Direct probe of a server's health, independent of threshold alerts.
 * {@code checks} holds connectivity, nodes, memory, disk and queues in that order.
 */
public record HealthCheck(HealthStatus overall, Map<String, ComponentCheck> checks, Instant timestamp) {

    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public record ComponentCheck(HealthStatus status, String message, Map<String, Object> details) {

        public static ComponentCheck of(HealthStatus status, String message) {
            return new ComponentCheck(status, message, Map.of());
        }
    }
}
