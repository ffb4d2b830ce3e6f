package com.example.rabbitwatch.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of one health-check component.
 */
public enum HealthStatus {
    HEALTHY("healthy"),
    WARNING("warning"),
    CRITICAL("critical");

    private final String value;

    HealthStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public HealthStatus worst(HealthStatus other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
