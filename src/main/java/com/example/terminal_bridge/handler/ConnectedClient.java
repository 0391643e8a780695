package com.example.terminal_bridge.handler;

import lombok.Getter;
import lombok.Setter;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;

/**
 * Bookkeeping for one live socket. The token stays null until authentication.
 */
@Getter
public class ConnectedClient {

    private final String connectionId;
    private final WebSocketSession session;
    private final Instant connectedAt;

    @Setter
    private volatile String token;
    @Setter
    private volatile boolean authenticated;
    @Setter
    private volatile Instant lastHeartbeat;

    public ConnectedClient(WebSocketSession session, Instant now) {
        this.connectionId = session.getId();
        this.session = session;
        this.connectedAt = now;
        this.lastHeartbeat = now;
    }

    public boolean isOpen() {
        return session.isOpen();
    }
}
