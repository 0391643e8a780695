package com.example.terminal_bridge.routing;

import com.example.terminal_bridge.config.BridgeProperties;
import com.example.terminal_bridge.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.SystemUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Classifies a command line and runs it as an agent tool, a known tool or a
 * plain shell command. Never throws: every failure becomes a {@link RouteResult}.
 */
@Service
@Slf4j
public class CommandRoutingEngine {

    private static final Logger commandLogger = LoggerFactory.getLogger("commandLogger");

    private static final long READER_DRAIN_TIMEOUT_MS = 2000;
    private static final long KILL_GRACE_MS = 1000;

    private final CommandParser parser;
    private final CommandHistoryManager historyManager;
    private final OutputFormatter outputFormatter;
    private final ToolDetectionService toolDetection;
    private final Clock clock;
    private final Duration commandTimeout;

    private final Map<String, AgentToolConfig> agentConfigs = new ConcurrentHashMap<>();
    // token:terminalId -> running routed command
    private final Map<String, RunningCommand> activeProcesses = new ConcurrentHashMap<>();
    private final List<RoutingEventListener> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService ioExecutor;

    public CommandRoutingEngine(CommandParser parser,
                                CommandHistoryManager historyManager,
                                OutputFormatter outputFormatter,
                                ToolDetectionService toolDetection,
                                BridgeProperties properties,
                                Clock clock) {
        this.parser = parser;
        this.historyManager = historyManager;
        this.outputFormatter = outputFormatter;
        this.toolDetection = toolDetection;
        this.clock = clock;
        this.commandTimeout = properties.getRouting().getCommandTimeout();

        AtomicInteger threadCount = new AtomicInteger();
        this.ioExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "route-io-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        initializeAgentConfigs();
    }

    private void initializeAgentConfigs() {
        agentConfigs.put("claude-code", AgentToolConfig.builder()
                .name("Claude Code")
                .executable("claude")
                .interceptMode(AgentToolConfig.InterceptMode.FULL)
                .responseFormat(AgentToolConfig.ResponseFormat.STREAMING)
                .timeoutMs(300_000)
                .build());
        agentConfigs.put("gemini", AgentToolConfig.builder()
                .name("Gemini CLI")
                .executable("gemini")
                .interceptMode(AgentToolConfig.InterceptMode.COMMANDS)
                .responseFormat(AgentToolConfig.ResponseFormat.BATCH)
                .timeoutMs(180_000)
                .build());
    }

    public void addListener(RoutingEventListener listener) {
        listeners.add(listener);
    }

    public CommandInfo parse(String commandLine) {
        return parser.parse(commandLine);
    }

    // ============= ROUTING =============

    public RouteResult route(String token, String terminalId, String commandLine, String workingDirectory) {
        long start = clock.millis();
        CommandInfo info = parser.parse(commandLine);
        Outcome outcome;
        try {
            outcome = dispatch(token, terminalId, StringUtils.trimToEmpty(commandLine), info, workingDirectory);
        } catch (RuntimeException e) {
            log.error("❌ Routing failed for terminal {}: {}", terminalId, e.getMessage(), e);
            outcome = Outcome.rejected(RouteResult.builder()
                    .success(false)
                    .handled(false)
                    .error("Routing failed: " + e.getMessage())
                    .commandInfo(info)
                    .build());
        }

        long duration = clock.millis() - start;
        RouteResult result = outcome.result;
        result.setDurationMs(duration);

        historyManager.addCommand(token, terminalId, info,
                outcome.rawOutput, result.getError(), result.getExitCode(), duration);
        commandLogger.info("TOKEN={}|SLOT={}|TOOL={}|EXIT={}|DURATION={}ms",
                token, terminalId, StringUtils.defaultString(info.getTool(), "-"),
                result.getExitCode() != null ? result.getExitCode() : "-", duration);

        for (RoutingEventListener listener : listeners) {
            try {
                listener.onCommandRouted(token, terminalId, result);
            } catch (RuntimeException e) {
                log.warn("⚠️ Routing listener failed: {}", e.getMessage());
            }
        }
        return result;
    }

    private Outcome dispatch(String token, String terminalId, String line, CommandInfo info, String cwd) {
        if (info.getCommand().isEmpty()) {
            return Outcome.rejected(failure(info, false, "Empty command", null));
        }

        if (info.isAgentTool() && info.getTool() != null) {
            AgentToolConfig config = agentConfigs.get(info.getTool());
            if (config == null) {
                return Outcome.rejected(failure(info, false,
                        "No configuration found for agent tool: " + info.getTool(), ErrorCode.NOT_FOUND));
            }
            if (config.getInterceptMode() == AgentToolConfig.InterceptMode.NONE) {
                return runInShell(token, terminalId, line, info, cwd);
            }
            List<String> command = new ArrayList<>();
            command.add(config.getExecutable());
            if (config.getArgs() != null) {
                command.addAll(config.getArgs());
            }
            command.addAll(info.getArgs());
            return run(token, terminalId, info, command, cwd, Duration.ofMillis(config.getTimeoutMs()),
                    Strategy.AGENT, config.getResponseFormat());
        }

        if (info.getTool() != null) {
            ToolInfo detected = toolDetection.detectTool(info.getTool());
            if (detected != null && detected.isInstalled()) {
                List<String> command = new ArrayList<>();
                command.add(info.getCommand());
                command.addAll(info.getArgs());
                return run(token, terminalId, info, command, cwd, commandTimeout, Strategy.TOOL, null);
            }
        }

        return runInShell(token, terminalId, line, info, cwd);
    }

    private Outcome runInShell(String token, String terminalId, String line, CommandInfo info, String cwd) {
        List<String> shell = SystemUtils.IS_OS_WINDOWS
                ? List.of("cmd.exe", "/c", line)
                : List.of("sh", "-c", line);
        return run(token, terminalId, info, shell, cwd, commandTimeout, Strategy.SHELL, null);
    }

    private Outcome run(String token, String terminalId, CommandInfo info, List<String> command, String cwd,
                        Duration timeout, Strategy strategy, AgentToolConfig.ResponseFormat format) {
        RunningCommand running = new RunningCommand(token, terminalId, info.getTool(),
                String.join(" ", command), clock.instant());
        String key = processKey(token, terminalId);
        if (activeProcesses.putIfAbsent(key, running) != null) {
            return Outcome.rejected(failure(info, strategy != Strategy.SHELL,
                    "A command is already running in terminal " + terminalId, null));
        }

        try {
            boolean streaming = strategy == Strategy.AGENT && format == AgentToolConfig.ResponseFormat.STREAMING;
            Execution execution = execute(running, command, cwd, timeout, strategy, streaming);

            if (strategy == Strategy.AGENT && !streaming && execution.spawnError == null) {
                emitAgentOutput(token, terminalId, info.getTool(), execution.stdout, "stdout");
                emitAgentOutput(token, terminalId, info.getTool(), execution.stderr, "stderr");
            }
            return toOutcome(info, strategy, timeout, execution);
        } finally {
            activeProcesses.remove(key, running);
        }
    }

    private Execution execute(RunningCommand running, List<String> command, String cwd, Duration timeout,
                              Strategy strategy, boolean streaming) {
        ProcessBuilder builder = new ProcessBuilder(command);
        if (StringUtils.isNotBlank(cwd)) {
            builder.directory(new File(cwd));
        }
        if (strategy == Strategy.AGENT) {
            builder.environment().put("TERM", "xterm-256color");
            builder.environment().put("COLUMNS", "80");
            builder.environment().put("LINES", "24");
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            log.warn("⚠️ Spawn failed for {}: {}", command.get(0), e.getMessage());
            return Execution.spawnFailed(e.getMessage());
        }
        running.attach(process);
        try {
            process.getOutputStream().close();
        } catch (IOException e) {
            log.debug("Could not close stdin of {}: {}", command.get(0), e.getMessage());
        }

        StringBuffer stdout = new StringBuffer();
        StringBuffer stderr = new StringBuffer();
        String tool = running.tool;
        Future<?> outReader = ioExecutor.submit(() -> drain(process.getInputStream(), stdout,
                chunk -> {
                    if (streaming) {
                        emitAgentOutput(running.token, running.terminalId, tool, chunk, "stdout");
                    }
                }));
        Future<?> errReader = ioExecutor.submit(() -> drain(process.getErrorStream(), stderr,
                chunk -> {
                    if (streaming) {
                        emitAgentOutput(running.token, running.terminalId, tool, chunk, "stderr");
                    }
                }));

        boolean finished;
        try {
            finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyTree(process);
            awaitReader(outReader);
            awaitReader(errReader);
            return new Execution(null, stdout.toString(), stderr.toString(), false, true, null);
        }

        if (!finished) {
            log.warn("⏰ Routed command timed out after {}ms in terminal {}", timeout.toMillis(), running.terminalId);
            destroyTree(process);
            awaitReader(outReader);
            awaitReader(errReader);
            return new Execution(null, stdout.toString(), stderr.toString(), true, false, null);
        }

        awaitReader(outReader);
        awaitReader(errReader);
        return new Execution(process.exitValue(), stdout.toString(), stderr.toString(),
                false, running.killed, null);
    }

    private Outcome toOutcome(CommandInfo info, Strategy strategy, Duration timeout, Execution execution) {
        boolean handled = strategy != Strategy.SHELL;

        if (execution.spawnError != null) {
            String prefix = strategy == Strategy.AGENT ? "Failed to execute agent tool: "
                    : strategy == Strategy.TOOL ? "Failed to execute tool: " : "Failed to execute command: ";
            return new Outcome(failure(info, handled, prefix + execution.spawnError, ErrorCode.SPAWN_FAILURE), null);
        }

        if (execution.timedOut) {
            String what = strategy == Strategy.AGENT ? "Agent tool" : "Command";
            RouteResult result = failure(info, handled,
                    what + " timeout after " + timeout.toMillis() + "ms", ErrorCode.TIMEOUT);
            result.setOutput(render(info, handled, execution.stdout));
            return new Outcome(result, execution.stdout);
        }

        if (execution.killed) {
            RouteResult result = failure(info, handled, "Process killed", null);
            result.setExitCode(execution.exitCode);
            result.setOutput(render(info, handled, execution.stdout));
            return new Outcome(result, execution.stdout);
        }

        RouteResult result = RouteResult.builder()
                .success(execution.exitCode != null && execution.exitCode == 0)
                .handled(handled)
                .output(render(info, handled, execution.stdout))
                .error(StringUtils.isEmpty(execution.stderr) ? null : execution.stderr)
                .exitCode(execution.exitCode)
                .commandInfo(info)
                .build();
        return new Outcome(result, execution.stdout);
    }

    private String render(CommandInfo info, boolean handled, String raw) {
        return handled ? outputFormatter.format(info, raw).getHtml() : raw;
    }

    private static RouteResult failure(CommandInfo info, boolean handled, String error, ErrorCode code) {
        return RouteResult.builder()
                .success(false)
                .handled(handled)
                .error(error)
                .errorCode(code)
                .commandInfo(info)
                .build();
    }

    private static void drain(InputStream stream, StringBuffer sink, Consumer<String> onChunk) {
        try (Reader in = new InputStreamReader(stream, StandardCharsets.UTF_8)) {
            char[] buffer = new char[4096];
            int read;
            while ((read = in.read(buffer)) != -1) {
                String chunk = new String(buffer, 0, read);
                sink.append(chunk);
                onChunk.accept(chunk);
            }
        } catch (IOException e) {
            log.debug("Routed output stream closed: {}", e.getMessage());
        }
    }

    private static void awaitReader(Future<?> reader) {
        try {
            reader.get(READER_DRAIN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // a detached grandchild may still hold the pipe open
            reader.cancel(true);
        } catch (ExecutionException e) {
            log.warn("⚠️ Output reader failed: {}", e.getCause().getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyTree(Process process) {
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
        try {
            if (!process.waitFor(KILL_GRACE_MS, TimeUnit.MILLISECONDS)) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }

    private void emitAgentOutput(String token, String terminalId, String tool, String chunk, String stream) {
        if (StringUtils.isEmpty(chunk)) {
            return;
        }
        for (RoutingEventListener listener : listeners) {
            try {
                listener.onAgentOutput(token, terminalId, tool, chunk, stream);
            } catch (RuntimeException e) {
                log.warn("⚠️ Agent output listener failed: {}", e.getMessage());
            }
        }
    }

    // ============= PROCESS CONTROL =============

    private static String processKey(String token, String terminalId) {
        return token + ":" + terminalId;
    }

    /**
     * Kills the routed command running in {@code terminalId} under any token.
     */
    public boolean killProcess(String terminalId) {
        boolean found = false;
        for (RunningCommand running : new ArrayList<>(activeProcesses.values())) {
            if (running.terminalId.equals(terminalId)) {
                found |= killProcess(running.token, running.terminalId);
            }
        }
        return found;
    }

    public boolean killProcess(String token, String terminalId) {
        String key = processKey(token, terminalId);
        RunningCommand running = activeProcesses.get(key);
        if (running == null) {
            return false;
        }
        running.kill();
        activeProcesses.remove(key, running);
        log.info("🛑 Killed routed command: token={}, terminalId={}", token, terminalId);
        return true;
    }

    public int killProcessesForToken(String token) {
        int killed = 0;
        for (RunningCommand running : new ArrayList<>(activeProcesses.values())) {
            if (running.token.equals(token) && killProcess(running.token, running.terminalId)) {
                killed++;
            }
        }
        return killed;
    }

    public boolean isRunning(String token, String terminalId) {
        return activeProcesses.containsKey(processKey(token, terminalId));
    }

    public List<ActiveProcessInfo> getActiveProcesses() {
        return activeProcesses.values().stream()
                .map(RunningCommand::toInfo)
                .sorted(Comparator.comparing(ActiveProcessInfo::getStartedAt))
                .collect(Collectors.toList());
    }

    // ============= AGENT TOOLS =============

    public void addAgentTool(String name, AgentToolConfig config) {
        if (StringUtils.isBlank(config.getName())) {
            config.setName(name);
        }
        agentConfigs.put(name, config);
        parser.addAgentTool(name);
        if (!toolDetection.isRegistered(name)) {
            toolDetection.registerTool(ToolInfo.builder()
                    .name(name)
                    .displayName(config.getName())
                    .category(ToolCategory.AI)
                    .executable(config.getExecutable())
                    .description("Custom agent tool")
                    .build());
        }
        log.info("➕ Agent tool registered: {} -> {}", name, config.getExecutable());
    }

    public boolean removeAgentTool(String name) {
        boolean removed = agentConfigs.remove(name) != null;
        parser.removeAgentTool(name);
        if (removed) {
            log.info("➖ Agent tool removed: {}", name);
        }
        return removed;
    }

    public Map<String, AgentToolConfig> getAgentTools() {
        return new TreeMap<>(agentConfigs);
    }

    // ============= HISTORY =============

    public CommandHistory getTerminalHistory(String uuid, String terminalId) {
        return historyManager.getTerminalHistory(uuid, terminalId);
    }

    public CommandHistory getToolHistory(String uuid, String tool) {
        return historyManager.getToolHistory(uuid, tool);
    }

    public List<CommandHistory> getUserToolHistories(String uuid) {
        return historyManager.getUserToolHistories(uuid);
    }

    public List<HistoryEntry> getRecentCommands(String uuid, String tool, int limit) {
        return historyManager.getRecentCommands(uuid, tool, limit);
    }

    public HistoryStats getHistoryStats(String uuid) {
        return historyManager.getHistoryStats(uuid);
    }

    public void clearUserHistory(String uuid) {
        historyManager.clearUserHistory(uuid);
    }

    public boolean clearToolHistory(String uuid, String tool) {
        return historyManager.clearToolHistory(uuid, tool);
    }

    @PreDestroy
    public void shutdown() {
        for (RunningCommand running : new ArrayList<>(activeProcesses.values())) {
            killProcess(running.token, running.terminalId);
        }
        ioExecutor.shutdownNow();
    }

    // ============= INTERNALS =============

    private enum Strategy {
        AGENT, TOOL, SHELL
    }

    private static final class RunningCommand {
        final String token;
        final String terminalId;
        final String tool;
        final String commandLine;
        final Instant startedAt;
        volatile Process process;
        volatile boolean killed;

        RunningCommand(String token, String terminalId, String tool, String commandLine, Instant startedAt) {
            this.token = token;
            this.terminalId = terminalId;
            this.tool = tool;
            this.commandLine = commandLine;
            this.startedAt = startedAt;
        }

        synchronized void attach(Process process) {
            this.process = process;
            if (killed) {
                destroyTree(process);
            }
        }

        synchronized void kill() {
            killed = true;
            if (process != null && process.isAlive()) {
                destroyTree(process);
            }
        }

        ActiveProcessInfo toInfo() {
            Process current = process;
            return ActiveProcessInfo.builder()
                    .terminalId(terminalId)
                    .uuid(token)
                    .tool(tool)
                    .command(commandLine)
                    .pid(current != null ? current.pid() : -1)
                    .startedAt(startedAt)
                    .build();
        }
    }

    private static final class Execution {
        final Integer exitCode;
        final String stdout;
        final String stderr;
        final boolean timedOut;
        final boolean killed;
        final String spawnError;

        Execution(Integer exitCode, String stdout, String stderr, boolean timedOut, boolean killed, String spawnError) {
            this.exitCode = exitCode;
            this.stdout = stdout;
            this.stderr = stderr;
            this.timedOut = timedOut;
            this.killed = killed;
            this.spawnError = spawnError;
        }

        static Execution spawnFailed(String message) {
            return new Execution(null, "", "", false, false, message);
        }
    }

    private static final class Outcome {
        final RouteResult result;
        final String rawOutput;

        Outcome(RouteResult result, String rawOutput) {
            this.result = result;
            this.rawOutput = rawOutput;
        }

        static Outcome rejected(RouteResult result) {
            return new Outcome(result, null);
        }
    }
}
