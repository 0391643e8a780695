package com.example.terminal_bridge.terminal;

import com.example.terminal_bridge.dto.TerminalInfo;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * One shell process bound to a (token, terminalId) slot. Only
 * {@link TerminalSessionManager} mutates it.
 */
@Getter
@Builder
public class TerminalSession {

    private final String id;
    private final String token;
    private final String terminalId;
    private final String name;
    private final String color;
    private final Instant createdAt;

    @Getter(AccessLevel.PACKAGE)
    private final TerminalProcess process;

    private volatile boolean active;
    // set once the slot was explicitly terminated or reaped
    private volatile boolean closed;
    private volatile Instant lastActivity;
    private volatile int cols;
    private volatile int rows;

    public static String key(String token, String terminalId) {
        return token + ":" + terminalId;
    }

    public String getKey() {
        return key(token, terminalId);
    }

    synchronized void touch(Instant now) {
        if (lastActivity == null || now.isAfter(lastActivity)) {
            lastActivity = now;
        }
    }

    void markExited() {
        active = false;
    }

    void markClosed() {
        closed = true;
        active = false;
    }

    void updateSize(int cols, int rows) {
        this.cols = cols;
        this.rows = rows;
    }

    public TerminalInfo toInfo() {
        return TerminalInfo.builder()
                .id(id)
                .terminalId(terminalId)
                .name(name)
                .color(color)
                .active(active)
                .createdAt(createdAt)
                .lastActivity(lastActivity)
                .cols(cols)
                .rows(rows)
                .build();
    }
}
