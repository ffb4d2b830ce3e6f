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
 * A Slack incoming-webhook channel. A workspace may have several.
 */
@Entity
@Table(name = "slack_configs")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SlackConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "workspace_id", nullable = false)
    private String workspaceId;

    /** Incoming webhook URL; it embeds the channel credential so it is never echoed back. */
    @JsonProperty(access = JsonProperty.Access.WRITE_ONLY)
    @Column(name = "webhook_url", nullable = false, length = 1024)
    private String webhookUrl;

    /** Display-only label for the target channel, e.g. "#ops-alerts". */
    @Column(name = "channel_name")
    private String channelName;

    @Builder.Default
    private boolean enabled = true;

    /** Empty means every severity. */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "slack_config_severities", joinColumns = @JoinColumn(name = "slack_config_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "severity")
    @Builder.Default
    private Set<AlertSeverity> severities = new LinkedHashSet<>();

    /** Empty means every server. */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "slack_config_servers", joinColumns = @JoinColumn(name = "slack_config_id"))
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
}
