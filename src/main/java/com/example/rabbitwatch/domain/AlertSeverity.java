package com.example.rabbitwatch.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Alert severity, ordered critical > warning > info.
 */
public enum AlertSeverity {
    CRITICAL("critical", 3),
    WARNING("warning", 2),
    INFO("info", 1);

    private final String value;
    private final int rank;

    AlertSeverity(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getRank() {
        return rank;
    }

    public boolean isWorseThan(AlertSeverity other) {
        return other == null || rank > other.rank;
    }

    @JsonCreator
    public static AlertSeverity fromValue(String value) {
        for (AlertSeverity severity : values()) {
            if (severity.value.equalsIgnoreCase(value)) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unknown alert severity: " + value);
    }

    public static Set<AlertSeverity> all() {
        return EnumSet.allOf(AlertSeverity.class);
    }
}
