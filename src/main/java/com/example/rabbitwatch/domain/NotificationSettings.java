package com.example.rabbitwatch.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.Set;

/**
 * Workspace-level notification settings as read and written through the
 * API. In an update every field is optional; null leaves the stored value.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NotificationSettings(
        Boolean emailNotificationsEnabled,
        String contactEmail,
        Set<AlertSeverity> notificationSeverities,
        Set<String> notificationServerIds,
        Boolean browserNotificationsEnabled,
        Set<AlertSeverity> browserNotificationSeverities) {

    /** The effective view of a workspace, with unset severity sets read as all severities. */
    public static NotificationSettings of(Workspace workspace) {
        return new NotificationSettings(
                workspace.isEmailNotificationsEnabled(),
                workspace.getContactEmail(),
                orAll(workspace.getNotificationSeverities()),
                Set.copyOf(workspace.getNotificationServerIds()),
                workspace.isBrowserNotificationsEnabled(),
                orAll(workspace.getBrowserNotificationSeverities()));
    }

    private static Set<AlertSeverity> orAll(Set<AlertSeverity> severities) {
        return severities == null || severities.isEmpty() ? AlertSeverity.all() : Set.copyOf(severities);
    }
}
