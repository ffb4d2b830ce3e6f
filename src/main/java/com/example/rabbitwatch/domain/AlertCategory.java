package com.example.rabbitwatch.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The metric family an alert belongs to.
 */
public enum AlertCategory {
    MEMORY("memory"),
    DISK("disk"),
    CONNECTION("connection"),
    QUEUE("queue"),
    NODE("node"),
    PERFORMANCE("performance");

    private final String value;

    AlertCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static AlertCategory fromValue(String value) {
        for (AlertCategory category : values()) {
            if (category.value.equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown alert category: " + value);
    }
}
