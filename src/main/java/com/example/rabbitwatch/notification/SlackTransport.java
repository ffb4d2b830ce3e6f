package com.example.rabbitwatch.notification;

import com.example.rabbitwatch.config.RabbitWatchProperties;
import com.example.rabbitwatch.domain.Alert;
import com.example.rabbitwatch.domain.AlertSeverity;
import com.example.rabbitwatch.domain.AlertSummary;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Slack incoming-webhook channel.
 *
 * A message carries one summary attachment coloured by the worst severity,
 * up to {@value #MAX_DETAIL_ATTACHMENTS} per-alert attachments and, when
 * alerts overflow, a single "... and N more" attachment.
 */
@Slf4j
@Component
public class SlackTransport extends HttpChannelTransport<SlackMessage> {

    static final int MAX_DETAIL_ATTACHMENTS = 10;
    static final String OVERFLOW_COLOR = "#cccccc";

    private final ObjectMapper objectMapper;
    private final RabbitWatchProperties properties;

    public SlackTransport(OkHttpClient httpClient, ObjectMapper objectMapper, RabbitWatchProperties properties) {
        super(httpClient, properties.getNotifications().getTimeoutSeconds());
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public ChannelType type() {
        return ChannelType.SLACK;
    }

    @Override
    public SlackMessage buildPayload(ChannelTarget target, AlertBatch batch) {
        List<Alert> alerts = batch.alerts();
        AlertSummary summary = batch.summary();

        String summaryText = String.format("*%d alert%s* detected on *%s* in workspace *%s*",
                alerts.size(), alerts.size() == 1 ? "" : "s", batch.serverName(), batch.workspaceName());
        List<String> counts = new ArrayList<>();
        if (summary.critical() > 0) counts.add(summary.critical() + " critical");
        if (summary.warning() > 0) counts.add(summary.warning() + " warning");
        if (summary.info() > 0) counts.add(summary.info() + " info");

        List<SlackMessage.Attachment> attachments = new ArrayList<>();
        attachments.add(new SlackMessage.Attachment(color(batch.worstSeverity()), summaryText,
                String.join(", ", counts), List.of()));
        alerts.stream()
                .limit(MAX_DETAIL_ATTACHMENTS)
                .map(this::detailAttachment)
                .forEach(attachments::add);
        int overflow = alerts.size() - MAX_DETAIL_ATTACHMENTS;
        if (overflow > 0) {
            attachments.add(new SlackMessage.Attachment(OVERFLOW_COLOR,
                    String.format("... and %d more alert%s", overflow, overflow == 1 ? "" : "s"), "", List.of()));
        }

        List<SlackMessage.Block> blocks = dashboardUrl(batch)
                .map(url -> List.of(new SlackMessage.Block("actions", List.of(new SlackMessage.Button("button",
                        new SlackMessage.Text("plain_text", "View Alerts in Dashboard"), url, "primary")))))
                .orElse(List.of());

        RabbitWatchProperties.NotificationConfig.SlackConfig slack = properties.getNotifications().getSlack();
        return new SlackMessage(summaryText, slack.getUsername(), slack.getIconEmoji(), blocks, attachments);
    }

    @Override
    public Integer send(ChannelTarget target, SlackMessage payload)
            throws TransientDeliveryException, TerminalDeliveryException {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new TerminalDeliveryException("Could not serialize Slack message", e);
        }
        HttpReply reply = post(target.endpoint(), json, Map.of());
        if (!"ok".equals(reply.body())) {
            log.warn("Unexpected Slack response from {} (HTTP {}): {}",
                    target.describe(), reply.statusCode(), reply.body());
        }
        return reply.statusCode();
    }

    private SlackMessage.Attachment detailAttachment(Alert alert) {
        List<SlackMessage.Field> fields = new ArrayList<>();
        fields.add(new SlackMessage.Field("Severity", alert.getSeverity().getValue(), true));
        fields.add(new SlackMessage.Field("Category", alert.getCategory().getValue(), true));
        if (alert.getSource() != null) {
            fields.add(new SlackMessage.Field("Source",
                    alert.getSource().type().getValue() + ": " + alert.getSource().name(), true));
        }
        if (alert.getVhost() != null) {
            fields.add(new SlackMessage.Field("Virtual Host", alert.getVhost(), true));
        }
        if (alert.getDetails() != null && alert.getDetails().current() != null) {
            fields.add(new SlackMessage.Field("Current Value", String.valueOf(alert.getDetails().current()), true));
        }
        if (alert.getDetails() != null && alert.getDetails().threshold() != null) {
            fields.add(new SlackMessage.Field("Threshold", formatNumber(alert.getDetails().threshold()), true));
        }
        return new SlackMessage.Attachment(color(alert.getSeverity()),
                alert.getSeverity().getValue().toUpperCase(Locale.ROOT) + ": " + alert.getTitle(),
                alert.getDescription(), fields);
    }

    private Optional<String> dashboardUrl(AlertBatch batch) {
        String base = properties.getNotifications().getDashboardUrl();
        if (base == null || base.isBlank() || batch.serverId() == null) {
            return Optional.empty();
        }
        HttpUrl parsed = HttpUrl.parse(base.endsWith("/") ? base + "alerts" : base + "/alerts");
        if (parsed == null) {
            log.warn("Ignoring malformed dashboard URL {}", base);
            return Optional.empty();
        }
        HttpUrl.Builder url = parsed.newBuilder().addQueryParameter("serverId", batch.serverId());
        batch.mostCommonVhost().ifPresent(vhost -> url.addQueryParameter("vhost", vhost));
        return Optional.of(url.build().toString());
    }

    static String color(AlertSeverity severity) {
        return switch (severity) {
            case CRITICAL -> "danger";
            case WARNING -> "warning";
            case INFO -> "good";
        };
    }

    private static String formatNumber(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
