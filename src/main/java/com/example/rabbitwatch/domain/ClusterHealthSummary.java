package com.example.rabbitwatch.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.List;

/**
 * Roll-up of a server's active alerts.
 */
public record ClusterHealthSummary(ClusterHealth clusterHealth, AlertSummary summary, List<String> issues,
                                   Instant timestamp) {

    public enum ClusterHealth {
        HEALTHY("healthy"),
        DEGRADED("degraded"),
        CRITICAL("critical");

        private final String value;

        ClusterHealth(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }
}
