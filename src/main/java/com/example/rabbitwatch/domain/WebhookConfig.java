package com.example.rabbitwatch.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A generic HTTP webhook channel. When a secret is set, each delivery is
 * signed with HMAC-SHA256 over the request body.
 */
@Entity
@Table(name = "webhook_configs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "workspace_id", nullable = false)
    private String workspaceId;

    @Column(nullable = false, length = 1024)
    private String url;

    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    private String secret;

    @Builder.Default
    private boolean enabled = true;

    /** Payload version sent in the body and the version header. */
    @Builder.Default
    private String version = "v1";

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "webhook_config_severities", joinColumns = @JoinColumn(name = "webhook_config_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "severity")
    @Builder.Default
    private Set<AlertSeverity> severities = new LinkedHashSet<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "webhook_config_servers", joinColumns = @JoinColumn(name = "webhook_config_id"))
    @Column(name = "server_id")
    @Builder.Default
    private Set<String> serverIds = new LinkedHashSet<>();

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /** Whether a secret is configured, exposed in place of the secret itself. */
    @JsonProperty("hasSecret")
    public boolean hasSecret() {
        return secret != null && !secret.isBlank();
    }
}
