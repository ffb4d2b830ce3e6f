package com.example.rabbitwatch.notification;

import com.example.rabbitwatch.config.RabbitWatchProperties;
import com.example.rabbitwatch.domain.Alert;
import com.example.rabbitwatch.domain.AlertSeverity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SlackTransportTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RabbitWatchProperties properties = new RabbitWatchProperties();
    private final FakeHttp http = new FakeHttp();
    private SlackTransport transport;

    private final ChannelTarget target = new ChannelTarget("slack-1", ChannelType.SLACK,
            "https://hooks.slack.test/services/T000/B000/XXXX", null, null,
            Set.of(AlertSeverity.CRITICAL, AlertSeverity.WARNING), Set.of());

    @BeforeEach
    void setUp() {
        properties.getNotifications().setDashboardUrl("https://app.rabbitwatch.test");
        transport = new SlackTransport(http.client(), objectMapper, properties);
    }

    private static AlertBatch batch(List<Alert> alerts) {
        return new AlertBatch("ws-1", "Acme", "srv-1", "prod", alerts);
    }

    @Test
    @DisplayName("Twelve alerts give a summary, ten details and one overflow attachment")
    void overflowAttachment() {
        List<Alert> alerts = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            alerts.add(FakeHttp.alert("a" + i, i == 0 ? AlertSeverity.CRITICAL : AlertSeverity.WARNING, null));
        }

        SlackMessage message = transport.buildPayload(target, batch(alerts));

        assertEquals(12, message.attachments().size());
        assertEquals("danger", message.attachments().get(0).color());
        assertEquals("1 critical, 11 warning", message.attachments().get(0).text());
        assertEquals("CRITICAL: Alert a0", message.attachments().get(1).title());
        SlackMessage.Attachment overflow = message.attachments().get(11);
        assertEquals(SlackTransport.OVERFLOW_COLOR, overflow.color());
        assertEquals("... and 2 more alerts", overflow.title());
    }

    @Test
    @DisplayName("The dashboard button links the server and the most common vhost")
    void dashboardButton() {
        SlackMessage message = transport.buildPayload(target, batch(List.of(
                FakeHttp.alert("q1", AlertSeverity.WARNING, "/"),
                FakeHttp.alert("q2", AlertSeverity.WARNING, "billing"),
                FakeHttp.alert("q3", AlertSeverity.WARNING, "billing"))));

        SlackMessage.Button button = message.blocks().get(0).elements().get(0);
        assertEquals("View Alerts in Dashboard", button.text().text());
        assertEquals("https://app.rabbitwatch.test/alerts?serverId=srv-1&vhost=billing", button.url());
    }

    @Test
    @DisplayName("No dashboard URL means no button")
    void noDashboardNoButton() {
        properties.getNotifications().setDashboardUrl("");

        SlackMessage message = transport.buildPayload(target,
                batch(List.of(FakeHttp.alert("n1", AlertSeverity.CRITICAL, null))));

        assertTrue(message.blocks().isEmpty());
    }

    @Test
    @DisplayName("The message is posted as JSON")
    void postsJson() throws Exception {
        http.reply(200, "ok");

        Integer status = transport.send(target, transport.buildPayload(target,
                batch(List.of(FakeHttp.alert("n1", AlertSeverity.CRITICAL, null)))));

        assertEquals(200, status);
        assertEquals("POST", http.requests.get(0).method());
        JsonNode body = objectMapper.readTree(http.bodies.get(0));
        assertEquals(":rabbit:", body.path("icon_emoji").asText());
        assertEquals("Severity", body.path("attachments").get(1).path("fields").get(0).path("title").asText());
        assertTrue(body.path("attachments").get(1).path("fields").get(0).path("short").asBoolean());
    }

    @Test
    @DisplayName("A 2xx reply other than ok still counts as delivered")
    void nonOkBodyStillSucceeds() throws Exception {
        http.reply(200, "accepted");

        assertEquals(200, transport.send(target, transport.buildPayload(target,
                batch(List.of(FakeHttp.alert("n1", AlertSeverity.CRITICAL, null))))));
    }

    @Test
    @DisplayName("5xx and 429 are transient, other 4xx terminal, I/O errors transient")
    void errorClassification() {
        SlackMessage payload = transport.buildPayload(target,
                batch(List.of(FakeHttp.alert("n1", AlertSeverity.CRITICAL, null))));
        http.reply(503, "unavailable").reply(429, "slow down").reply(404, "no_service")
                .fail(new IOException("connection reset"));

        assertThrows(TransientDeliveryException.class, () -> transport.send(target, payload));
        assertThrows(TransientDeliveryException.class, () -> transport.send(target, payload));
        TerminalDeliveryException terminal = assertThrows(TerminalDeliveryException.class,
                () -> transport.send(target, payload));
        assertEquals(404, terminal.getStatusCode());
        assertThrows(TransientDeliveryException.class, () -> transport.send(target, payload));
    }

    @Test
    @DisplayName("Attachment titles do not depend on the default locale")
    void titleIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            SlackMessage message = transport.buildPayload(target,
                    batch(List.of(FakeHttp.alert("i1", AlertSeverity.INFO, null))));

            assertEquals("INFO: Alert i1", message.attachments().get(1).title());
        } finally {
            Locale.setDefault(previous);
        }
    }
}
