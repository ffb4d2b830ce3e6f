package com.example.rabbitwatch.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A RabbitMQ cluster registered for monitoring, reached through its
 * management plugin's HTTP API.
 */
@Entity
@Table(name = "rabbit_servers")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RabbitServer {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(name = "workspace_id", nullable = false)
    private String workspaceId;

    /** Base URL of the management API, e.g. http://rabbit-1:15672 */
    @Column(name = "management_url", nullable = false, length = 1024)
    private String managementUrl;

    private String username;

    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String password;

    /** Connection ceiling for the connections-percent check. Null falls back to node socket limits. */
    @Column(name = "max_connections")
    private Long maxConnections;

    @Column(name = "poll_interval_seconds")
    @Builder.Default
    private int pollIntervalSeconds = 60;

    @Builder.Default
    private boolean enabled = true;

    @Column(name = "last_check_at")
    private Instant lastCheckAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_check_status")
    private CheckStatus lastCheckStatus;

    public enum CheckStatus {
        SUCCESS, SKIPPED, FAILED
    }
}
