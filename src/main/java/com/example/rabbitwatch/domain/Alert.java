package com.example.rabbitwatch.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * An alert known to the lifecycle tracker, active or resolved.
 * The {@code id} is the deterministic identity key, stable across poll cycles.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Alert {

    private String id;
    private String serverId;
    private String serverName;
    private AlertSeverity severity;
    private AlertCategory category;
    private String title;
    private String description;
    private AlertDetails details;
    /** First detection of the current occurrence. */
    private Instant timestamp;
    private boolean resolved;
    private Instant resolvedAt;
    private AlertSource source;
    private String vhost;
}
