package com.example.terminal_bridge.terminal;

import com.example.terminal_bridge.config.BridgeProperties;
import com.example.terminal_bridge.exception.BridgeException;
import com.example.terminal_bridge.exception.ErrorCode;
import org.apache.commons.lang3.SystemUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

class DefaultTerminalProcessFactoryTest {

    private BridgeProperties properties;
    private DefaultTerminalProcessFactory factory;

    @BeforeEach
    void setUp() {
        assumeFalse(SystemUtils.IS_OS_WINDOWS);
        properties = new BridgeProperties();
        properties.getTerminal().setProcessMode(BridgeProperties.ProcessMode.PIPE);
        factory = new DefaultTerminalProcessFactory(properties);
    }

    @Test
    void spawn_pipeMode_startsPipeProcess() {
        TerminalProcess process = factory.spawn(spec("/bin/sh"));
        try {
            assertThat(process).isInstanceOf(PipeTerminalProcess.class);
            assertThat(process.isAlive()).isTrue();
        } finally {
            process.kill();
        }
    }

    @Test
    void spawn_missingShell_throwsSpawnFailure() {
        assertThatThrownBy(() -> factory.spawn(spec("/definitely/not/a/shell")))
                .isInstanceOf(BridgeException.class)
                .extracting(e -> ((BridgeException) e).getCode())
                .isEqualTo(ErrorCode.SPAWN_FAILURE);
    }

    private static TerminalSpawnSpec spec(String shell) {
        return TerminalSpawnSpec.builder()
                .command(List.of(shell))
                .cols(80)
                .rows(24)
                .build();
    }
}
