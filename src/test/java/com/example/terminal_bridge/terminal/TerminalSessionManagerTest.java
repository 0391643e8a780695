package com.example.terminal_bridge.terminal;

import com.example.terminal_bridge.config.BridgeProperties;
import com.example.terminal_bridge.exception.BridgeException;
import com.example.terminal_bridge.exception.ErrorCode;
import com.example.terminal_bridge.support.MutableClock;
import org.apache.commons.lang3.SystemUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

class TerminalSessionManagerTest {

    private static final String TOKEN_A = "11111111-1111-1111-1111-111111111111";
    private static final String TOKEN_B = "22222222-2222-2222-2222-222222222222";
    private static final String TOKEN_C = "33333333-3333-3333-3333-333333333333";

    private BridgeProperties properties;
    private MutableClock clock;
    private final List<FakeTerminalProcess> spawned = Collections.synchronizedList(new ArrayList<>());
    private final List<TerminalSpawnSpec> specs = Collections.synchronizedList(new ArrayList<>());
    private final RecordingListener listener = new RecordingListener();
    private TerminalSessionManager manager;

    @BeforeEach
    void setUp() {
        properties = new BridgeProperties();
        properties.getTerminal().setMaxSessionsPerToken(2);
        properties.getTerminal().setMaxSessionsGlobal(3);
        properties.getTerminal().setShell("/bin/sh");
        properties.getTerminal().setBannerDelay(Duration.ofHours(1));
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));

        manager = new TerminalSessionManager(properties, spec -> {
            specs.add(spec);
            FakeTerminalProcess process = new FakeTerminalProcess();
            spawned.add(process);
            return process;
        }, clock);
        manager.setHeapUsageSupplier(() -> 0L);
        manager.addListener(listener);
    }

    @AfterEach
    void tearDown() {
        manager.shutdown();
    }

    @Test
    void create_newSlot_spawnsAndStartsShell() {
        TerminalSession session = manager.create(TOKEN_A, "t1", "Work", null);

        assertThat(session.getTerminalId()).isEqualTo("t1");
        assertThat(session.getName()).isEqualTo("Work");
        assertThat(session.getColor()).isEqualTo("blue");
        assertThat(session.isActive()).isTrue();
        assertThat(session.getCols()).isEqualTo(80);
        assertThat(session.getRows()).isEqualTo(24);
        assertThat(spawned).hasSize(1);
        assertThat(spawned.get(0).started).isTrue();
        assertThat(specs.get(0).getCommand()).containsExactly("/bin/sh");
        assertThat(listener.created).containsExactly("t1");
    }

    @Test
    void create_withoutTerminalId_generatesIdAndDefaultName() {
        TerminalSession session = manager.create(TOKEN_A, null, null, "green");

        assertThat(session.getTerminalId()).matches("term_\\d+_[a-z0-9]{5}");
        assertThat(session.getName()).isEqualTo("Terminal " + session.getTerminalId().substring(5, 9));
        assertThat(session.getColor()).isEqualTo("green");
    }

    @Test
    void create_duplicateSlot_throwsSlotAlreadyExists() {
        manager.create(TOKEN_A, "t1", null, null);

        assertThatThrownBy(() -> manager.create(TOKEN_A, "t1", null, null))
                .isInstanceOf(BridgeException.class)
                .extracting(e -> ((BridgeException) e).getCode())
                .isEqualTo(ErrorCode.SLOT_ALREADY_EXISTS);
        assertThat(spawned).hasSize(1);
    }

    @Test
    void create_sameSlotIdUnderDifferentTokens_areIndependent() {
        manager.create(TOKEN_A, "t1", null, null);
        manager.create(TOKEN_B, "t1", null, null);

        assertThat(manager.getSession(TOKEN_A, "t1")).isNotSameAs(manager.getSession(TOKEN_B, "t1"));
        assertThat(manager.listByToken(TOKEN_A)).hasSize(1);
        assertThat(manager.listByToken(TOKEN_B)).hasSize(1);
    }

    @Test
    void create_overPerTokenLimit_throwsCapacityExceeded() {
        manager.create(TOKEN_A, "t1", null, null);
        manager.create(TOKEN_A, "t2", null, null);

        assertThatThrownBy(() -> manager.create(TOKEN_A, "t3", null, null))
                .isInstanceOf(BridgeException.class)
                .hasMessage("Maximum terminals per session (2) reached");
        assertThat(manager.listAll()).extracting(TerminalSession::getTerminalId).containsExactlyInAnyOrder("t1", "t2");
        assertThat(spawned).hasSize(2);
        assertThat(manager.getSession(TOKEN_A, "t3")).isNull();
    }

    @Test
    void create_overGlobalLimit_throwsCapacityExceeded() {
        manager.create(TOKEN_A, "t1", null, null);
        manager.create(TOKEN_A, "t2", null, null);
        manager.create(TOKEN_B, "t1", null, null);

        assertThatThrownBy(() -> manager.create(TOKEN_C, "t1", null, null))
                .isInstanceOf(BridgeException.class)
                .hasMessage("Maximum total terminals (3) reached")
                .extracting(e -> ((BridgeException) e).getCode())
                .isEqualTo(ErrorCode.CAPACITY_EXCEEDED);
    }

    @Test
    void output_isTaggedWithTokenAndSlotAndRefreshesActivity() {
        TerminalSession session = manager.create(TOKEN_A, "t1", null, null);
        clock.advance(Duration.ofMinutes(3));

        spawned.get(0).emit("hello\r\n");

        assertThat(listener.outputs).containsExactly(TOKEN_A + "|t1|hello\r\n");
        assertThat(session.getLastActivity()).isEqualTo(clock.instant());
    }

    @Test
    void write_forwardsToProcessOnlyWhileActive() {
        manager.create(TOKEN_A, "t1", null, null);

        assertThat(manager.write(TOKEN_A, "t1", "ls\r")).isTrue();
        assertThat(spawned.get(0).written).containsExactly("ls\r");
        assertThat(manager.write(TOKEN_A, "missing", "ls\r")).isFalse();
        assertThat(manager.write(TOKEN_B, "t1", "ls\r")).isFalse();

        spawned.get(0).exit(0);
        assertThat(manager.write(TOKEN_A, "t1", "ls\r")).isFalse();
    }

    @Test
    void processExit_marksSessionInactiveAndNotifies() {
        TerminalSession session = manager.create(TOKEN_A, "t1", null, null);

        spawned.get(0).exit(3);

        assertThat(session.isActive()).isFalse();
        assertThat(manager.getSession(TOKEN_A, "t1")).isSameAs(session);
        assertThat(manager.listActive()).isEmpty();
        assertThat(listener.exits).containsExactly(TOKEN_A + "|t1|3");
    }

    @Test
    void terminate_singleSlot_killsWithoutExitEvent() {
        manager.create(TOKEN_A, "t1", null, null);

        assertThat(manager.terminate(TOKEN_A, "t1")).isTrue();

        assertThat(spawned.get(0).isAlive()).isFalse();
        assertThat(manager.getSession(TOKEN_A, "t1")).isNull();
        assertThat(listener.exits).isEmpty();
        assertThat(manager.terminate(TOKEN_A, "t1")).isFalse();
    }

    @Test
    void terminate_withoutSlot_closesEverySlotOfTokenOnly() {
        manager.create(TOKEN_A, "t1", null, null);
        manager.create(TOKEN_A, "t2", null, null);
        manager.create(TOKEN_B, "t1", null, null);

        assertThat(manager.terminate(TOKEN_A, null)).isTrue();

        assertThat(manager.listByToken(TOKEN_A)).isEmpty();
        assertThat(manager.listByToken(TOKEN_B)).hasSize(1);
    }

    @Test
    void resize_updatesDimensionsAndRejectsNonPositive() {
        TerminalSession session = manager.create(TOKEN_A, "t1", null, null);

        assertThat(manager.resize(TOKEN_A, "t1", 120, 40)).isTrue();
        assertThat(session.getCols()).isEqualTo(120);
        assertThat(session.getRows()).isEqualTo(40);
        assertThat(spawned.get(0).cols).isEqualTo(120);

        assertThat(manager.resize(TOKEN_A, "t1", 0, 40)).isFalse();
        assertThat(manager.resize(TOKEN_A, "t1", 100, -1)).isFalse();
        assertThat(session.getCols()).isEqualTo(120);
    }

    @Test
    void cleanupInactiveSessions_reclaimsOnlyIdleSlots() {
        manager.create(TOKEN_A, "old", null, null);
        clock.advance(Duration.ofMinutes(31));
        manager.create(TOKEN_A, "fresh", null, null);

        assertThat(manager.cleanupInactiveSessions()).isEqualTo(1);

        assertThat(manager.getSession(TOKEN_A, "old")).isNull();
        assertThat(manager.getSession(TOKEN_A, "fresh")).isNotNull();
        assertThat(listener.reclaimed).containsExactly("old|idle");
        assertThat(listener.exits).isEmpty();
    }

    @Test
    void cleanupInactiveSessions_alsoRemovesExitedSlots() {
        manager.create(TOKEN_A, "t1", null, null);
        spawned.get(0).exit(0);
        clock.advance(Duration.ofMinutes(45));

        assertThat(manager.cleanupInactiveSessions()).isEqualTo(1);
        assertThat(manager.listAll()).isEmpty();
    }

    @Test
    void create_underMemoryPressure_reclaimsIdleSlotsFirst() {
        properties.getTerminal().setAggressiveIdleTimeout(Duration.ofMinutes(5));
        manager.setHeapUsageSupplier(() -> manager.listAll().isEmpty() ? 0L : Long.MAX_VALUE);

        manager.create(TOKEN_A, "idle", null, null);
        clock.advance(Duration.ofMinutes(10));

        TerminalSession fresh = manager.create(TOKEN_A, "fresh", null, null);

        assertThat(fresh.isActive()).isTrue();
        assertThat(manager.getSession(TOKEN_A, "idle")).isNull();
        assertThat(listener.reclaimed).containsExactly("idle|memory pressure");
    }

    @Test
    void create_underPersistentMemoryPressure_stillSpawnsAfterSweep() {
        properties.getTerminal().setAggressiveIdleTimeout(Duration.ofMinutes(5));
        manager.setHeapUsageSupplier(() -> Long.MAX_VALUE);

        TerminalSession session = manager.create(TOKEN_A, "t1", null, null);

        assertThat(session.isActive()).isTrue();
        assertThat(spawned).hasSize(1);
        assertThat(listener.reclaimed).isEmpty();
    }

    @Test
    void write_afterTerminate_fails() {
        manager.create(TOKEN_A, "t1", null, null);
        FakeTerminalProcess process = spawned.get(0);

        assertThat(manager.terminate(TOKEN_A, "t1")).isTrue();

        assertThat(manager.write(TOKEN_A, "t1", "ls\r")).isFalse();
        assertThat(manager.resize(TOKEN_A, "t1", 100, 40)).isFalse();
        assertThat(process.written).isEmpty();
        assertThat(manager.getSession(TOKEN_A, "t1")).isNull();
    }

    @Test
    void banner_isSentToActiveSlotAfterDelay() throws InterruptedException {
        properties.getTerminal().setBannerDelay(Duration.ofMillis(10));

        manager.create(TOKEN_A, "t1", null, null);

        long deadline = System.currentTimeMillis() + 2000;
        while (listener.outputs.isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertThat(listener.outputs).hasSize(1);
        assertThat(listener.outputs.get(0))
                .startsWith(TOKEN_A + "|t1|")
                .contains("Terminal Bridge Connected")
                .contains("Terminal ID: t1")
                .contains("Session ID: 11111111...");
    }

    @Test
    void getResourceUsage_reportsCountsAndLimits() {
        manager.create(TOKEN_A, "t1", null, null);
        manager.create(TOKEN_A, "t2", null, null);
        spawned.get(1).exit(0);

        ResourceUsage usage = manager.getResourceUsage();

        assertThat(usage.getActiveSessions()).isEqualTo(1);
        assertThat(usage.getTotalSessions()).isEqualTo(2);
        assertThat(usage.getMaxSessionsPerToken()).isEqualTo(2);
        assertThat(usage.getMaxSessionsGlobal()).isEqualTo(3);
        assertThat(usage.isUnderMemoryPressure()).isFalse();
    }

    @Test
    void resolveShellCommand_configuredShellUsesConfiguredArgs() {
        BridgeProperties.Terminal config = new BridgeProperties.Terminal();
        config.setShell("/bin/zsh");
        config.setShellArgs(List.of("-f"));

        assertThat(TerminalSessionManager.resolveShellCommand(config)).containsExactly("/bin/zsh", "-f");
    }

    @Test
    void resolveShellCommand_defaultUnixShellIsLogin() {
        assumeFalse(SystemUtils.IS_OS_WINDOWS);

        List<String> command = TerminalSessionManager.resolveShellCommand(new BridgeProperties.Terminal());

        assertThat(command).hasSize(2);
        assertThat(command.get(1)).isEqualTo("-l");
    }

    @Test
    void defaultName_usesFirstCharactersAfterPrefix() {
        assertThat(TerminalSessionManager.defaultName("term_1700000000000_abcde")).isEqualTo("Terminal 1700");
        assertThat(TerminalSessionManager.defaultName("xy")).isEqualTo("Terminal xy");
    }

    private static class RecordingListener implements TerminalEventListener {
        final List<String> outputs = Collections.synchronizedList(new ArrayList<>());
        final List<String> exits = Collections.synchronizedList(new ArrayList<>());
        final List<String> created = Collections.synchronizedList(new ArrayList<>());
        final List<String> reclaimed = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void onOutput(String token, String terminalId, String data) {
            outputs.add(token + "|" + terminalId + "|" + data);
        }

        @Override
        public void onExit(String token, String terminalId, int exitCode) {
            exits.add(token + "|" + terminalId + "|" + exitCode);
        }

        @Override
        public void onCreated(TerminalSession session) {
            created.add(session.getTerminalId());
        }

        @Override
        public void onReclaimed(TerminalSession session, String reason) {
            reclaimed.add(session.getTerminalId() + "|" + reason);
        }
    }
}
