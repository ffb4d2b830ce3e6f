package com.example.rabbitwatch.gateway;

import com.example.rabbitwatch.config.AppConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AlertEventsWebSocketHandlerTest {

    private final ObjectMapper objectMapper = new AppConfig().objectMapper();
    private final AlertEventsWebSocketHandler handler = new AlertEventsWebSocketHandler(objectMapper,
            Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC));

    private static WebSocketSession session(String id, String query) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.getUri()).thenReturn(URI.create("ws://localhost:8080/ws/alerts" + query));
        when(session.isOpen()).thenReturn(true);
        return session;
    }

    private List<JsonNode> sent(WebSocketSession session, int times) throws IOException {
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session, times(times)).sendMessage(captor.capture());
        return captor.getAllValues().stream().map(m -> {
            try {
                return objectMapper.readTree(m.getPayload());
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
        }).toList();
    }

    @Test
    void workspaceIdIsReadFromTheQuery() {
        assertEquals("ws-1", AlertEventsWebSocketHandler.workspaceIdOf(URI.create("ws://h/ws/alerts?workspaceId=ws-1")));
        assertNull(AlertEventsWebSocketHandler.workspaceIdOf(URI.create("ws://h/ws/alerts?workspaceId=")));
        assertNull(AlertEventsWebSocketHandler.workspaceIdOf(URI.create("ws://h/ws/alerts")));
        assertNull(AlertEventsWebSocketHandler.workspaceIdOf(null));
    }

    @Test
    void sessionWithoutWorkspaceIsClosed() throws Exception {
        WebSocketSession session = session("s1", "");

        handler.afterConnectionEstablished(session);

        ArgumentCaptor<CloseStatus> status = ArgumentCaptor.forClass(CloseStatus.class);
        verify(session).close(status.capture());
        assertEquals(CloseStatus.POLICY_VIOLATION.getCode(), status.getValue().getCode());
        assertEquals(0, handler.getActiveSessionCount());
    }

    @Test
    void connectedSessionIsGreeted() throws Exception {
        WebSocketSession session = session("s1", "?workspaceId=ws-1");

        handler.afterConnectionEstablished(session);

        JsonNode greeting = sent(session, 1).get(0);
        assertEquals(AlertEvent.CONNECTED, greeting.path("event").asText());
        assertEquals("ws-1", greeting.path("workspaceId").asText());
        assertEquals("s1", greeting.path("data").path("sessionId").asText());
        assertEquals("2026-03-01T12:00:00Z", greeting.path("timestamp").asText());
        assertEquals(1, handler.getActiveSessionCount());
    }

    @Test
    void eventsReachOnlyTheirWorkspace() throws Exception {
        WebSocketSession first = session("s1", "?workspaceId=ws-1");
        WebSocketSession second = session("s2", "?workspaceId=ws-1");
        WebSocketSession other = session("s3", "?workspaceId=ws-2");
        handler.afterConnectionEstablished(first);
        handler.afterConnectionEstablished(second);
        handler.afterConnectionEstablished(other);

        int delivered = handler.publish("ws-1", AlertEvent.ALERT_NEW, Map.of("id", "a-1"));

        assertEquals(2, delivered);
        JsonNode event = sent(first, 2).get(1);
        assertEquals(AlertEvent.ALERT_NEW, event.path("event").asText());
        assertEquals("a-1", event.path("data").path("id").asText());
        sent(second, 2);
        sent(other, 1);
    }

    @Test
    void failedSendAffectsOnlyThatSession() throws Exception {
        WebSocketSession broken = session("s1", "?workspaceId=ws-1");
        WebSocketSession healthy = session("s2", "?workspaceId=ws-1");
        handler.afterConnectionEstablished(broken);
        handler.afterConnectionEstablished(healthy);
        doThrow(new IOException("reset")).when(broken).sendMessage(any());

        assertEquals(1, handler.publish("ws-1", AlertEvent.ALERT_RESOLVED, Map.of("id", "a-1")));
    }

    @Test
    void pingIsAnsweredWithPong() throws Exception {
        WebSocketSession session = session("s1", "?workspaceId=ws-1");
        handler.afterConnectionEstablished(session);

        handler.handleTextMessage(session, new TextMessage("{\"type\":\"ping\"}"));
        handler.handleTextMessage(session, new TextMessage("not json"));

        assertEquals(AlertEvent.PONG, sent(session, 2).get(1).path("event").asText());
    }

    @Test
    void closedSessionIsForgotten() throws Exception {
        WebSocketSession session = session("s1", "?workspaceId=ws-1");
        handler.afterConnectionEstablished(session);

        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        assertEquals(0, handler.getActiveSessionCount());
        assertEquals(0, handler.publish("ws-1", AlertEvent.ALERT_NEW, Map.of()));
    }
}
