package com.example.rabbitwatch.service;

import com.example.rabbitwatch.domain.NotificationSettings;
import com.example.rabbitwatch.domain.Workspace;
import com.example.rabbitwatch.repository.WorkspaceRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;

/**
 * Reads and merge-updates a workspace's notification settings.
 * Only the owner may write.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationSettingsService {

    private final WorkspaceRepository workspaceRepository;
    private final PlanService planService;

    public NotificationSettings getSettings(String workspaceId) {
        return NotificationSettings.of(planService.requireWorkspace(workspaceId));
    }

    @Transactional
    public NotificationSettings updateSettings(String workspaceId, String userId, NotificationSettings update) {
        Workspace workspace = planService.requireWorkspace(workspaceId);
        planService.requireOwner(workspaceId, userId);
        if (update == null) {
            return NotificationSettings.of(workspace);
        }

        if (update.emailNotificationsEnabled() != null) {
            workspace.setEmailNotificationsEnabled(update.emailNotificationsEnabled());
        }
        if (update.contactEmail() != null) {
            workspace.setContactEmail(update.contactEmail().isBlank() ? null : update.contactEmail().trim());
        }
        if (update.notificationSeverities() != null) {
            workspace.setNotificationSeverities(new LinkedHashSet<>(update.notificationSeverities()));
        }
        if (update.notificationServerIds() != null) {
            workspace.setNotificationServerIds(new LinkedHashSet<>(update.notificationServerIds()));
        }
        if (update.browserNotificationsEnabled() != null) {
            workspace.setBrowserNotificationsEnabled(update.browserNotificationsEnabled());
        }
        if (update.browserNotificationSeverities() != null) {
            workspace.setBrowserNotificationSeverities(new LinkedHashSet<>(update.browserNotificationSeverities()));
        }

        Workspace saved = workspaceRepository.save(workspace);
        log.info("Updated notification settings for workspace {}", workspaceId);
        return NotificationSettings.of(saved);
    }
}
