package com.example.rabbitwatch.notification;

import com.example.rabbitwatch.config.RabbitWatchProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generic HTTP webhook channel. When the target has a secret, the body is
 * signed with HMAC-SHA256 and the hex digest sent as
 * {@code X-RabbitWatch-Signature: sha256=<hex>}.
 */
@Slf4j
@Component
public class WebhookTransport extends HttpChannelTransport<WebhookPayload> {

    static final String HEADER_EVENT = "X-RabbitWatch-Event";
    static final String HEADER_VERSION = "X-RabbitWatch-Version";
    static final String HEADER_TIMESTAMP = "X-RabbitWatch-Timestamp";
    static final String HEADER_SIGNATURE = "X-RabbitWatch-Signature";

    private final ObjectMapper objectMapper;
    private final RabbitWatchProperties properties;
    private final Clock clock;

    public WebhookTransport(OkHttpClient httpClient, ObjectMapper objectMapper,
                            RabbitWatchProperties properties, Clock clock) {
        super(httpClient, properties.getNotifications().getTimeoutSeconds());
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public ChannelType type() {
        return ChannelType.WEBHOOK;
    }

    @Override
    public WebhookPayload buildPayload(ChannelTarget target, AlertBatch batch) {
        return new WebhookPayload(
                target.version() != null ? target.version() : "v1",
                WebhookPayload.EVENT_ALERT_NOTIFICATION,
                clock.instant(),
                new WebhookPayload.Ref(batch.workspaceId(), batch.workspaceName()),
                new WebhookPayload.Ref(batch.serverId(), batch.serverName()),
                batch.alerts(),
                batch.summary());
    }

    @Override
    public Integer send(ChannelTarget target, WebhookPayload payload)
            throws TransientDeliveryException, TerminalDeliveryException {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new TerminalDeliveryException("Could not serialize webhook payload", e);
        }

        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("User-Agent", properties.getNotifications().getWebhook().getUserAgent());
        headers.put(HEADER_EVENT, payload.event());
        headers.put(HEADER_VERSION, payload.version());
        headers.put(HEADER_TIMESTAMP, payload.timestamp().toString());
        if (target.secret() != null && !target.secret().isBlank()) {
            headers.put(HEADER_SIGNATURE, "sha256=" + sign(json, target.secret()));
        }
        return post(target.endpoint(), json, headers).statusCode();
    }

    static String sign(String body, String secret) throws TerminalDeliveryException {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA256"));
            return HexFormat.of().formatHex(mac.doFinal(body.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new TerminalDeliveryException("Could not sign webhook payload", e);
        }
    }
}
