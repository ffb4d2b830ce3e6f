package com.example.rabbitwatch.alerting;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;

/**
 * Outcome of one detection cycle for one server.
 */
public record DetectionResult(String serverId, Outcome outcome, int active, int newlyActive, int newlyResolved,
                              Instant checkedAt, String message) {

    public enum Outcome {
        SUCCESS("success"),
        SKIPPED("skipped"),
        FAILED("failed");

        private final String value;

        Outcome(String value) {
            this.value = value;
        }

        @JsonValue
        public String getValue() {
            return value;
        }
    }
}
