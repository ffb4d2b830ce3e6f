package com.example.rabbitwatch.notification;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Incoming-webhook message body: legacy attachments for the alert list,
 * plus an optional actions block with the dashboard button.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record SlackMessage(
        String text,
        String username,
        @JsonProperty("icon_emoji") String iconEmoji,
        List<Block> blocks,
        List<Attachment> attachments) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Attachment(String color, String title, String text, List<Field> fields) {
    }

    public record Field(String title, String value, @JsonProperty("short") boolean isShort) {
    }

    public record Block(String type, List<Button> elements) {
    }

    public record Button(String type, Text text, String url, String style) {
    }

    public record Text(String type, String text) {
    }
}
