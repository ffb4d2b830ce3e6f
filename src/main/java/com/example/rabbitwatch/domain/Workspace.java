package com.example.rabbitwatch.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Tenant boundary. Carries the workspace-level notification settings;
 * Slack and webhook channels live in their own tables.
 */
@Entity
@Table(name = "workspaces")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Workspace {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String name;

    @Column(name = "owner_id", nullable = false)
    private String ownerId;

    @Column(name = "contact_email")
    private String contactEmail;

    @Column(name = "email_notifications_enabled")
    @Builder.Default
    private boolean emailNotificationsEnabled = false;

    /** Severities that trigger email. Empty means all. */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "workspace_notification_severities", joinColumns = @JoinColumn(name = "workspace_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "severity")
    @Builder.Default
    private Set<AlertSeverity> notificationSeverities = new LinkedHashSet<>();

    /** Servers whose alerts are emailed. Empty means all. */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "workspace_notification_servers", joinColumns = @JoinColumn(name = "workspace_id"))
    @Column(name = "server_id")
    @Builder.Default
    private Set<String> notificationServerIds = new LinkedHashSet<>();

    @Column(name = "browser_notifications_enabled")
    @Builder.Default
    private boolean browserNotificationsEnabled = false;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "workspace_browser_severities", joinColumns = @JoinColumn(name = "workspace_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "severity")
    @Builder.Default
    private Set<AlertSeverity> browserNotificationSeverities = new LinkedHashSet<>();
}
