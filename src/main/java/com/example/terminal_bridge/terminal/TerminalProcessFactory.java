package com.example.terminal_bridge.terminal;

public interface TerminalProcessFactory {

    /**
     * Spawns a shell for a terminal slot.
     *
     * @throws com.example.terminal_bridge.exception.BridgeException with
     *         {@code SPAWN_FAILURE} when no strategy can start the process
     */
    TerminalProcess spawn(TerminalSpawnSpec spec);
}
