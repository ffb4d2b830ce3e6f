package com.example.rabbitwatch.notification;

import com.example.rabbitwatch.domain.AlertSeverity;
import com.example.rabbitwatch.domain.SlackConfig;
import com.example.rabbitwatch.domain.WebhookConfig;
import com.example.rabbitwatch.domain.Workspace;

import java.util.Set;

/**
 * One enabled destination for a batch: where to send it and which alerts
 * it wants. Empty severity or server sets mean "all".
 *
 * @param endpoint webhook URL for Slack and webhook channels, recipient address for email
 * @param secret   HMAC key for webhooks; null otherwise
 * @param version  payload version for webhooks; null otherwise
 */
public record ChannelTarget(String channelId, ChannelType type, String endpoint, String secret, String version,
                            Set<AlertSeverity> severities, Set<String> serverIds) {

    public ChannelTarget {
        severities = severities == null || severities.isEmpty() ? AlertSeverity.all() : Set.copyOf(severities);
        serverIds = serverIds == null ? Set.of() : Set.copyOf(serverIds);
    }

    public static ChannelTarget slack(SlackConfig config) {
        return new ChannelTarget(config.getId(), ChannelType.SLACK, config.getWebhookUrl(), null, null,
                config.getSeverities(), config.getServerIds());
    }

    public static ChannelTarget webhook(WebhookConfig config) {
        return new ChannelTarget(config.getId(), ChannelType.WEBHOOK, config.getUrl(), config.getSecret(),
                config.getVersion() != null ? config.getVersion() : "v1",
                config.getSeverities(), config.getServerIds());
    }

    /** The workspace contact address, filtered by the workspace's email settings. */
    public static ChannelTarget email(Workspace workspace) {
        return new ChannelTarget("email:" + workspace.getId(), ChannelType.EMAIL, workspace.getContactEmail(),
                null, null, workspace.getNotificationSeverities(), workspace.getNotificationServerIds());
    }

    public boolean allowsServer(String serverId) {
        return serverIds.isEmpty() || serverIds.contains(serverId);
    }

    /**
     * The part of {@code batch} this channel should receive. Empty when the
     * server is not allowed or no alert has a subscribed severity.
     */
    public AlertBatch select(AlertBatch batch) {
        if (!allowsServer(batch.serverId())) {
            return batch.withSeverities(Set.of());
        }
        return batch.withSeverities(severities);
    }

    /** Endpoint safe for log lines. */
    public String describe() {
        if (endpoint == null) {
            return type.getValue();
        }
        if (type == ChannelType.EMAIL) {
            return "email " + endpoint;
        }
        return type.getValue() + " " + (endpoint.length() > 50 ? endpoint.substring(0, 50) + "..." : endpoint);
    }
}
