package com.example.rabbitwatch.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Alerts feed for browsers at {@code /ws/alerts?workspaceId=...}.
 *
 * Each connection subscribes to one workspace. Events are pushed to every
 * open session of that workspace; a failed send is logged and affects only
 * that session.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertEventsWebSocketHandler extends TextWebSocketHandler {

    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, AlertEventSession> sessions = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        String workspaceId = workspaceIdOf(session.getUri());
        if (workspaceId == null) {
            log.warn("Rejecting alerts session {} without workspaceId", session.getId());
            session.close(CloseStatus.POLICY_VIOLATION.withReason("workspaceId is required"));
            return;
        }

        AlertEventSession eventSession = AlertEventSession.builder()
                .sessionId(session.getId())
                .workspaceId(workspaceId)
                .webSocketSession(new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT))
                .connectedAt(clock.instant())
                .lastSeen(clock.instant())
                .build();
        sessions.put(session.getId(), eventSession);
        log.info("Alerts session connected: {} for workspace {} (total: {})",
                session.getId(), workspaceId, sessions.size());

        send(eventSession, new AlertEvent(AlertEvent.CONNECTED, workspaceId,
                Map.of("sessionId", session.getId()), clock.instant()));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        AlertEventSession eventSession = sessions.get(session.getId());
        if (eventSession == null) {
            return;
        }
        eventSession.touch();
        try {
            JsonNode node = objectMapper.readTree(message.getPayload());
            if ("ping".equals(node.path("type").asText())) {
                send(eventSession, new AlertEvent(AlertEvent.PONG, eventSession.getWorkspaceId(), null, clock.instant()));
            }
        } catch (IOException e) {
            log.debug("Ignoring unreadable message on session {}: {}", session.getId(), e.getMessage());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        sessions.remove(session.getId());
        log.info("Alerts session disconnected: {} (reason: {}, total: {})",
                session.getId(), status.getReason(), sessions.size());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("Transport error for alerts session {}: {}", session.getId(), exception.getMessage());
        sessions.remove(session.getId());
    }

    /**
     * Push an event to every open session of a workspace.
     *
     * @return the number of sessions the event was written to
     */
    public int publish(String workspaceId, String event, Object data) {
        AlertEvent envelope = new AlertEvent(event, workspaceId, data, clock.instant());
        int delivered = 0;
        for (AlertEventSession session : sessions.values()) {
            if (workspaceId.equals(session.getWorkspaceId()) && session.isAlive() && send(session, envelope)) {
                delivered++;
            }
        }
        return delivered;
    }

    public int getActiveSessionCount() {
        return sessions.size();
    }

    private boolean send(AlertEventSession session, AlertEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event);
            session.getWebSocketSession().sendMessage(new TextMessage(json));
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("Failed to push {} to session {}: {}", event.event(), session.getSessionId(), e.getMessage());
            return false;
        }
    }

    static String workspaceIdOf(URI uri) {
        if (uri == null) {
            return null;
        }
        String workspaceId = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst("workspaceId");
        return workspaceId == null || workspaceId.isBlank() ? null : workspaceId;
    }
}
