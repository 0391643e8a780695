package com.example.terminal_bridge.terminal;

/**
 * Receives events raised by {@link TerminalSessionManager}. Every event is
 * tagged with the owning token and terminal slot.
 */
public interface TerminalEventListener {

    void onOutput(String token, String terminalId, String data);

    void onExit(String token, String terminalId, int exitCode);

    default void onCreated(TerminalSession session) {
    }

    /**
     * Raised when a sweep (idle or memory pressure) removes a slot, not on explicit close.
     */
    default void onReclaimed(TerminalSession session, String reason) {
    }
}
