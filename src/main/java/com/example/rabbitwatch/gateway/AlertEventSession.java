package com.example.rabbitwatch.gateway;

import lombok.Builder;
import lombok.Data;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;

/**
 * A browser connected to the alerts feed of one workspace.
 */
@Data
@Builder
public class AlertEventSession {

    private final String sessionId;
    private final String workspaceId;
    private final WebSocketSession webSocketSession;
    private final Instant connectedAt;
    private Instant lastSeen;

    public void touch() {
        this.lastSeen = Instant.now();
    }

    public boolean isAlive() {
        return webSocketSession != null && webSocketSession.isOpen();
    }
}
