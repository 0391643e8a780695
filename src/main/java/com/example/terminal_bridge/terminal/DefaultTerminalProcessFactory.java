package com.example.terminal_bridge.terminal;

import com.example.terminal_bridge.config.BridgeProperties;
import com.example.terminal_bridge.config.BridgeProperties.ProcessMode;
import com.example.terminal_bridge.exception.BridgeException;
import com.example.terminal_bridge.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.SystemUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Picks the pty or pipe strategy according to {@code bridge.terminal.process-mode}.
 * In {@code AUTO} mode the first pty failure switches all later spawns to pipes.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DefaultTerminalProcessFactory implements TerminalProcessFactory {

    private final BridgeProperties properties;

    private volatile boolean ptyUnavailable = false;

    @Override
    public TerminalProcess spawn(TerminalSpawnSpec spec) {
        ProcessMode mode = properties.getTerminal().getProcessMode();

        if (mode == ProcessMode.PIPE) {
            return spawnPipe(spec);
        }

        if (mode == ProcessMode.PTY || !ptyUnavailable) {
            try {
                return PtyTerminalProcess.spawn(spec);
            } catch (Exception | LinkageError e) {
                if (mode == ProcessMode.PTY) {
                    throw new BridgeException(ErrorCode.SPAWN_FAILURE,
                            "Failed to start terminal: " + e.getMessage(), e);
                }
                ptyUnavailable = true;
                log.warn("⚠️ Native pty unavailable ({}), falling back to pipe terminals", e.getMessage());
            }
        }
        return spawnPipe(spec);
    }

    private TerminalProcess spawnPipe(TerminalSpawnSpec spec) {
        try {
            return PipeTerminalProcess.spawn(withInteractiveFlag(spec));
        } catch (Exception e) {
            throw new BridgeException(ErrorCode.SPAWN_FAILURE,
                    "Failed to start terminal: " + e.getMessage(), e);
        }
    }

    // Without a tty the shell only prompts when asked to be interactive
    private static TerminalSpawnSpec withInteractiveFlag(TerminalSpawnSpec spec) {
        List<String> command = spec.getCommand();
        if (SystemUtils.IS_OS_WINDOWS || command.contains("-i")) {
            return spec;
        }
        List<String> interactive = new ArrayList<>(command);
        interactive.add(1, "-i");
        return spec.toBuilder().command(interactive).build();
    }
}
