package com.example.rabbitwatch.service;

import com.example.rabbitwatch.domain.AlertSeverity;
import com.example.rabbitwatch.domain.SlackConfig;
import com.example.rabbitwatch.domain.WebhookConfig;
import com.example.rabbitwatch.exception.InvalidRequestException;
import com.example.rabbitwatch.exception.ResourceNotFoundException;
import com.example.rabbitwatch.repository.SlackConfigRepository;
import com.example.rabbitwatch.repository.WebhookConfigRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Slack and webhook channel configuration for a workspace. Reads are open
 * to members; writes are owner-only.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChannelConfigService {

    private final SlackConfigRepository slackConfigRepository;
    private final WebhookConfigRepository webhookConfigRepository;
    private final PlanService planService;

    // ── Slack ──

    public List<SlackConfig> listSlackConfigs(String workspaceId) {
        planService.requireWorkspace(workspaceId);
        return slackConfigRepository.findByWorkspaceId(workspaceId);
    }

    public List<SlackConfig> enabledSlackConfigs(String workspaceId) {
        return slackConfigRepository.findByWorkspaceIdAndEnabled(workspaceId, true);
    }

    @Transactional
    public SlackConfig createSlackConfig(String workspaceId, String userId, SlackConfigRequest request) {
        planService.requireWorkspace(workspaceId);
        planService.requireOwner(workspaceId, userId);
        requireHttpUrl(request.webhookUrl(), "webhookUrl");

        SlackConfig config = SlackConfig.builder()
                .workspaceId(workspaceId)
                .webhookUrl(request.webhookUrl().trim())
                .channelName(request.channelName())
                .enabled(request.enabled() == null || request.enabled())
                .severities(copy(request.severities()))
                .serverIds(copy(request.serverIds()))
                .build();
        SlackConfig saved = slackConfigRepository.save(config);
        log.info("Created Slack channel {} for workspace {}", saved.getId(), workspaceId);
        return saved;
    }

    @Transactional
    public SlackConfig updateSlackConfig(String workspaceId, String configId, String userId,
                                         SlackConfigRequest request) {
        planService.requireWorkspace(workspaceId);
        planService.requireOwner(workspaceId, userId);
        SlackConfig config = slackConfigRepository.findByIdAndWorkspaceId(configId, workspaceId)
                .orElseThrow(() -> new ResourceNotFoundException("Slack config", configId));

        if (request.webhookUrl() != null) {
            requireHttpUrl(request.webhookUrl(), "webhookUrl");
            config.setWebhookUrl(request.webhookUrl().trim());
        }
        if (request.channelName() != null) config.setChannelName(request.channelName());
        if (request.enabled() != null) config.setEnabled(request.enabled());
        if (request.severities() != null) config.setSeverities(copy(request.severities()));
        if (request.serverIds() != null) config.setServerIds(copy(request.serverIds()));
        return slackConfigRepository.save(config);
    }

    @Transactional
    public void deleteSlackConfig(String workspaceId, String configId, String userId) {
        planService.requireWorkspace(workspaceId);
        planService.requireOwner(workspaceId, userId);
        SlackConfig config = slackConfigRepository.findByIdAndWorkspaceId(configId, workspaceId)
                .orElseThrow(() -> new ResourceNotFoundException("Slack config", configId));
        slackConfigRepository.delete(config);
        log.info("Deleted Slack channel {} from workspace {}", configId, workspaceId);
    }

    // ── Webhooks ──

    public List<WebhookConfig> listWebhooks(String workspaceId) {
        planService.requireWorkspace(workspaceId);
        return webhookConfigRepository.findByWorkspaceId(workspaceId);
    }

    public List<WebhookConfig> enabledWebhooks(String workspaceId) {
        return webhookConfigRepository.findByWorkspaceIdAndEnabled(workspaceId, true);
    }

    @Transactional
    public WebhookConfig createWebhook(String workspaceId, String userId, WebhookConfigRequest request) {
        planService.requireWorkspace(workspaceId);
        planService.requireOwner(workspaceId, userId);
        requireHttpUrl(request.url(), "url");

        WebhookConfig config = WebhookConfig.builder()
                .workspaceId(workspaceId)
                .url(request.url().trim())
                .secret(blankToNull(request.secret()))
                .enabled(request.enabled() == null || request.enabled())
                .severities(copy(request.severities()))
                .serverIds(copy(request.serverIds()))
                .build();
        WebhookConfig saved = webhookConfigRepository.save(config);
        log.info("Created webhook {} for workspace {}", saved.getId(), workspaceId);
        return saved;
    }

    @Transactional
    public WebhookConfig updateWebhook(String workspaceId, String webhookId, String userId,
                                       WebhookConfigRequest request) {
        planService.requireWorkspace(workspaceId);
        planService.requireOwner(workspaceId, userId);
        WebhookConfig config = webhookConfigRepository.findByIdAndWorkspaceId(webhookId, workspaceId)
                .orElseThrow(() -> new ResourceNotFoundException("Webhook", webhookId));

        if (request.url() != null) {
            requireHttpUrl(request.url(), "url");
            config.setUrl(request.url().trim());
        }
        // An empty string clears the secret; null leaves it alone.
        if (request.secret() != null) config.setSecret(blankToNull(request.secret()));
        if (request.enabled() != null) config.setEnabled(request.enabled());
        if (request.severities() != null) config.setSeverities(copy(request.severities()));
        if (request.serverIds() != null) config.setServerIds(copy(request.serverIds()));
        return webhookConfigRepository.save(config);
    }

    @Transactional
    public void deleteWebhook(String workspaceId, String webhookId, String userId) {
        planService.requireWorkspace(workspaceId);
        planService.requireOwner(workspaceId, userId);
        WebhookConfig config = webhookConfigRepository.findByIdAndWorkspaceId(webhookId, workspaceId)
                .orElseThrow(() -> new ResourceNotFoundException("Webhook", webhookId));
        webhookConfigRepository.delete(config);
        log.info("Deleted webhook {} from workspace {}", webhookId, workspaceId);
    }

    private static void requireHttpUrl(String url, String field) {
        if (url == null || url.isBlank() || HttpUrl.parse(url.trim()) == null) {
            throw new InvalidRequestException(field + " must be an http(s) URL");
        }
    }

    private static <T> Set<T> copy(Set<T> values) {
        return values != null ? new LinkedHashSet<>(values) : new LinkedHashSet<>();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    public record SlackConfigRequest(String webhookUrl, String channelName, Boolean enabled,
                                     Set<AlertSeverity> severities, Set<String> serverIds) {
    }

    public record WebhookConfigRequest(String url, String secret, Boolean enabled,
                                       Set<AlertSeverity> severities, Set<String> serverIds) {
    }
}
