package com.example.rabbitwatch.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A resolved alert, kept until the retention window expires.
 * {@code alertKey} is the identity key the alert had while active; the
 * same key can appear on several rows when a condition recurs.
 */
@Entity
@Table(name = "resolved_alerts", indexes = {
        @Index(name = "idx_resolved_alerts_server", columnList = "workspace_id, server_id"),
        @Index(name = "idx_resolved_alerts_resolved_at", columnList = "resolved_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResolvedAlertRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "alert_key", nullable = false, length = 1024)
    private String alertKey;

    @Column(name = "workspace_id", nullable = false)
    private String workspaceId;

    @Column(name = "server_id", nullable = false)
    private String serverId;

    @Column(name = "server_name")
    private String serverName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AlertSeverity severity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private AlertCategory category;

    private String title;

    @Column(length = 2048)
    private String description;

    @Convert(converter = AlertDetailsConverter.class)
    @Column(length = 4096)
    private AlertDetails details;

    @Enumerated(EnumType.STRING)
    @Column(name = "source_type")
    private SourceType sourceType;

    @Column(name = "source_name")
    private String sourceName;

    private String vhost;

    @Column(name = "detected_at", nullable = false)
    private Instant detectedAt;

    @Column(name = "resolved_at", nullable = false)
    private Instant resolvedAt;

    public static ResolvedAlertRecord from(String workspaceId, Alert alert) {
        return ResolvedAlertRecord.builder()
                .alertKey(alert.getId())
                .workspaceId(workspaceId)
                .serverId(alert.getServerId())
                .serverName(alert.getServerName())
                .severity(alert.getSeverity())
                .category(alert.getCategory())
                .title(alert.getTitle())
                .description(alert.getDescription())
                .details(alert.getDetails())
                .sourceType(alert.getSource() != null ? alert.getSource().type() : null)
                .sourceName(alert.getSource() != null ? alert.getSource().name() : null)
                .vhost(alert.getVhost())
                .detectedAt(alert.getTimestamp())
                .resolvedAt(alert.getResolvedAt())
                .build();
    }

    public Alert toAlert() {
        return Alert.builder()
                .id(alertKey)
                .serverId(serverId)
                .serverName(serverName)
                .severity(severity)
                .category(category)
                .title(title)
                .description(description)
                .details(details)
                .timestamp(detectedAt)
                .resolved(true)
                .resolvedAt(resolvedAt)
                .source(sourceType != null ? new AlertSource(sourceType, sourceName) : null)
                .vhost(vhost)
                .build();
    }
}
