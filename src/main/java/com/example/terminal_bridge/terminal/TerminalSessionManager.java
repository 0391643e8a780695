package com.example.terminal_bridge.terminal;

import com.example.terminal_bridge.config.BridgeProperties;
import com.example.terminal_bridge.exception.BridgeException;
import com.example.terminal_bridge.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.RandomStringUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.SystemUtils;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import java.util.stream.Collectors;

/**
 * Owns every live shell process, keyed by (token, terminalId).
 */
@Service
@Slf4j
public class TerminalSessionManager {

    static final String DEFAULT_COLOR = "blue";

    private final BridgeProperties.Terminal config;
    private final TerminalProcessFactory processFactory;
    private final Clock clock;

    private final Map<String, TerminalSession> sessions = new ConcurrentHashMap<>();
    private final List<TerminalEventListener> listeners = new CopyOnWriteArrayList<>();
    // guards capacity check + spawn + insert
    private final ReentrantLock createLock = new ReentrantLock();
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "terminal-manager");
        t.setDaemon(true);
        return t;
    });
    private final List<String> shellCommand;

    private volatile LongSupplier heapUsed = () -> {
        Runtime runtime = Runtime.getRuntime();
        return runtime.totalMemory() - runtime.freeMemory();
    };

    public TerminalSessionManager(BridgeProperties properties, TerminalProcessFactory processFactory, Clock clock) {
        this.config = properties.getTerminal();
        this.processFactory = processFactory;
        this.clock = clock;
        this.shellCommand = resolveShellCommand(config);
    }

    @PostConstruct
    public void startMemoryMonitor() {
        long interval = config.getMemoryCheckInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::checkMemoryPressure, interval, interval, TimeUnit.MILLISECONDS);
        log.info("✅ Terminal manager ready: shell={}, perToken={}, global={}",
                shellCommand, config.getMaxSessionsPerToken(), config.getMaxSessionsGlobal());
    }

    public void addListener(TerminalEventListener listener) {
        listeners.add(listener);
    }

    void setHeapUsageSupplier(LongSupplier supplier) {
        this.heapUsed = supplier;
    }

    // ============= LIFECYCLE =============

    /**
     * Spawns a shell for the slot. {@code terminalId}, {@code name} and {@code color} may be null.
     *
     * @throws BridgeException SLOT_ALREADY_EXISTS, CAPACITY_EXCEEDED or SPAWN_FAILURE
     */
    public TerminalSession create(String token, String terminalId, String name, String color) {
        String slot = StringUtils.isBlank(terminalId) ? generateTerminalId() : terminalId;
        String key = TerminalSession.key(token, slot);
        TerminalSession session;

        createLock.lock();
        try {
            if (sessions.containsKey(key)) {
                throw BridgeException.slotAlreadyExists(token, slot);
            }
            long forToken = sessions.values().stream().filter(s -> s.getToken().equals(token)).count();
            if (forToken >= config.getMaxSessionsPerToken()) {
                throw BridgeException.capacityExceeded("Maximum terminals per session ("
                        + config.getMaxSessionsPerToken() + ") reached");
            }
            if (sessions.size() >= config.getMaxSessionsGlobal()) {
                throw BridgeException.capacityExceeded("Maximum total terminals ("
                        + config.getMaxSessionsGlobal() + ") reached");
            }
            // pressure only reclaims; the caps above are the only rejections
            if (isUnderMemoryPressure()) {
                reclaimOlderThan(config.getAggressiveIdleTimeout(), "memory pressure");
            }

            TerminalProcess process = processFactory.spawn(TerminalSpawnSpec.builder()
                    .command(shellCommand)
                    .workingDirectory(resolveWorkingDirectory())
                    .cols(config.getDefaultCols())
                    .rows(config.getDefaultRows())
                    .build());

            Instant now = clock.instant();
            session = TerminalSession.builder()
                    .id(UUID.randomUUID().toString())
                    .token(token)
                    .terminalId(slot)
                    .name(StringUtils.isBlank(name) ? defaultName(slot) : name)
                    .color(StringUtils.isBlank(color) ? DEFAULT_COLOR : color)
                    .createdAt(now)
                    .lastActivity(now)
                    .active(true)
                    .cols(config.getDefaultCols())
                    .rows(config.getDefaultRows())
                    .process(process)
                    .build();

            wire(session, process);
            sessions.put(key, session);
            process.start();
        } finally {
            createLock.unlock();
        }

        log.info("✅ Terminal created: token={}, terminalId={}, pid={}", token, slot, session.getProcess().pid());
        scheduleBanner(session);
        listeners.forEach(l -> l.onCreated(session));
        return session;
    }

    private void wire(TerminalSession session, TerminalProcess process) {
        String token = session.getToken();
        String slot = session.getTerminalId();

        process.onData(data -> {
            session.touch(clock.instant());
            for (TerminalEventListener listener : listeners) {
                listener.onOutput(token, slot, data);
            }
        });

        process.onExit(exitCode -> {
            session.markExited();
            if (session.isClosed()) {
                return;
            }
            log.info("🔚 Terminal exited: token={}, terminalId={}, exitCode={}", token, slot, exitCode);
            for (TerminalEventListener listener : listeners) {
                listener.onExit(token, slot, exitCode);
            }
        });
    }

    private void scheduleBanner(TerminalSession session) {
        scheduler.schedule(() -> {
            if (!session.isActive()) {
                return;
            }
            String banner = "\r\n🖥️  Terminal Bridge Connected\r\n"
                    + "Terminal ID: " + session.getTerminalId() + "\r\n"
                    + "Session ID: " + StringUtils.left(session.getToken(), 8) + "...\r\n"
                    + "Platform: " + SystemUtils.OS_NAME + "\r\n\r\n";
            for (TerminalEventListener listener : listeners) {
                listener.onOutput(session.getToken(), session.getTerminalId(), banner);
            }
        }, config.getBannerDelay().toMillis(), TimeUnit.MILLISECONDS);
    }

    // ============= I/O =============

    public boolean write(String token, String terminalId, String data) {
        TerminalSession session = getSession(token, terminalId);
        if (session == null || !session.isActive()) {
            return false;
        }
        try {
            session.getProcess().write(data);
            session.touch(clock.instant());
            return true;
        } catch (IOException e) {
            log.warn("⚠️ Write failed for {}: {}", session.getKey(), e.getMessage());
            return false;
        }
    }

    public boolean resize(String token, String terminalId, int cols, int rows) {
        TerminalSession session = getSession(token, terminalId);
        if (session == null || !session.isActive() || cols <= 0 || rows <= 0) {
            return false;
        }
        try {
            session.getProcess().resize(cols, rows);
        } catch (RuntimeException e) {
            log.warn("⚠️ Resize failed for {}: {}", session.getKey(), e.getMessage());
            return false;
        }
        session.updateSize(cols, rows);
        session.touch(clock.instant());
        return true;
    }

    /**
     * Kills one slot, or every slot of the token when {@code terminalId} is null.
     *
     * @return true if at least one session was removed
     */
    public boolean terminate(String token, String terminalId) {
        if (terminalId != null) {
            TerminalSession removed = sessions.remove(TerminalSession.key(token, terminalId));
            if (removed == null) {
                return false;
            }
            destroy(removed);
            log.info("🗑️ Terminal closed: token={}, terminalId={}", token, terminalId);
            return true;
        }

        List<TerminalSession> owned = listByToken(token);
        int removedCount = 0;
        for (TerminalSession session : owned) {
            if (sessions.remove(session.getKey(), session)) {
                destroy(session);
                removedCount++;
            }
        }
        if (removedCount > 0) {
            log.info("🗑️ Closed {} terminal(s) for token={}", removedCount, token);
        }
        return removedCount > 0;
    }

    private void destroy(TerminalSession session) {
        session.markClosed();
        try {
            session.getProcess().kill();
        } catch (RuntimeException e) {
            log.warn("⚠️ Failed to kill terminal {}: {}", session.getKey(), e.getMessage());
        }
    }

    // ============= QUERIES =============

    public TerminalSession getSession(String token, String terminalId) {
        if (token == null || terminalId == null) {
            return null;
        }
        return sessions.get(TerminalSession.key(token, terminalId));
    }

    public List<TerminalSession> listByToken(String token) {
        return sessions.values().stream()
                .filter(s -> s.getToken().equals(token))
                .sorted(Comparator.comparing(TerminalSession::getCreatedAt))
                .collect(Collectors.toList());
    }

    public List<TerminalSession> listActive() {
        return sessions.values().stream()
                .filter(TerminalSession::isActive)
                .collect(Collectors.toList());
    }

    public List<TerminalSession> listAll() {
        return new ArrayList<>(sessions.values());
    }

    // ============= RECLAMATION =============

    /**
     * Removes every session, running or exited, idle longer than {@code bridge.terminal.idle-timeout}.
     */
    public int cleanupInactiveSessions() {
        return reclaimOlderThan(config.getIdleTimeout(), "idle");
    }

    public int checkMemoryPressure() {
        if (!isUnderMemoryPressure()) {
            return 0;
        }
        log.warn("⚠️ Heap usage above {}% of {} bytes, reclaiming idle terminals",
                Math.round(config.getMemoryPressureRatio() * 100), config.estimatedMemoryCeilingBytes());
        return reclaimOlderThan(config.getAggressiveIdleTimeout(), "memory pressure");
    }

    public boolean isUnderMemoryPressure() {
        return heapUsed.getAsLong() > config.estimatedMemoryCeilingBytes() * config.getMemoryPressureRatio();
    }

    private int reclaimOlderThan(Duration threshold, String reason) {
        Instant cutoff = clock.instant().minus(threshold);
        int reclaimed = 0;
        for (TerminalSession session : listAll()) {
            if (session.getLastActivity().isBefore(cutoff) && sessions.remove(session.getKey(), session)) {
                destroy(session);
                reclaimed++;
                for (TerminalEventListener listener : listeners) {
                    listener.onReclaimed(session, reason);
                }
            }
        }
        if (reclaimed > 0) {
            log.info("🧹 Reclaimed {} terminal(s) ({})", reclaimed, reason);
        }
        return reclaimed;
    }

    public ResourceUsage getResourceUsage() {
        Runtime runtime = Runtime.getRuntime();
        return ResourceUsage.builder()
                .activeSessions(listActive().size())
                .totalSessions(sessions.size())
                .maxSessionsPerToken(config.getMaxSessionsPerToken())
                .maxSessionsGlobal(config.getMaxSessionsGlobal())
                .heapUsedBytes(heapUsed.getAsLong())
                .heapCommittedBytes(runtime.totalMemory())
                .heapMaxBytes(runtime.maxMemory())
                .memoryCeilingBytes(config.estimatedMemoryCeilingBytes())
                .underMemoryPressure(isUnderMemoryPressure())
                .build();
    }

    @PreDestroy
    public void shutdown() {
        log.info("🛑 Shutting down {} terminal(s)", sessions.size());
        scheduler.shutdownNow();
        for (TerminalSession session : listAll()) {
            sessions.remove(session.getKey());
            destroy(session);
        }
    }

    // ============= DEFAULTS =============

    static List<String> resolveShellCommand(BridgeProperties.Terminal config) {
        List<String> command = new ArrayList<>();
        if (StringUtils.isNotBlank(config.getShell())) {
            command.add(config.getShell());
            if (config.getShellArgs() != null) {
                command.addAll(config.getShellArgs());
            }
            return command;
        }
        if (SystemUtils.IS_OS_WINDOWS) {
            command.add(StringUtils.defaultIfBlank(System.getenv("COMSPEC"), "cmd.exe"));
        } else {
            command.add(StringUtils.defaultIfBlank(System.getenv("SHELL"), "/bin/bash"));
            command.add("-l");
        }
        if (config.getShellArgs() != null && !config.getShellArgs().isEmpty()) {
            command = new ArrayList<>(command.subList(0, 1));
            command.addAll(config.getShellArgs());
        }
        return command;
    }

    private String resolveWorkingDirectory() {
        return StringUtils.defaultIfBlank(config.getWorkingDirectory(), SystemUtils.USER_HOME);
    }

    static String generateTerminalId() {
        return "term_" + System.currentTimeMillis() + "_" + RandomStringUtils.randomAlphanumeric(5).toLowerCase();
    }

    static String defaultName(String terminalId) {
        int underscore = terminalId.indexOf('_');
        String suffix = underscore >= 0 ? terminalId.substring(underscore + 1) : terminalId;
        return "Terminal " + StringUtils.left(suffix, 4);
    }
}
