package com.example.rabbitwatch.notification;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ChannelType {
    EMAIL("email"),
    SLACK("slack"),
    WEBHOOK("webhook");

    private final String value;

    ChannelType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
