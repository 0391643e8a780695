package com.example.terminal_bridge.routing;

import com.example.terminal_bridge.config.BridgeProperties;
import com.example.terminal_bridge.exception.ErrorCode;
import org.apache.commons.lang3.SystemUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

class CommandRoutingEngineTest {

    private static final String TOKEN = "11111111-1111-1111-1111-111111111111";

    private ToolDetectionService toolDetection;
    private CommandRoutingEngine engine;
    private final Recorder recorder = new Recorder();

    @BeforeEach
    void setUp() {
        assumeFalse(SystemUtils.IS_OS_WINDOWS);
        BridgeProperties properties = new BridgeProperties();
        properties.getRouting().setCommandTimeout(Duration.ofSeconds(2));
        Clock clock = Clock.systemUTC();

        toolDetection = new ToolDetectionService(properties, clock);
        CommandParser parser = new CommandParser(toolDetection, clock);
        engine = new CommandRoutingEngine(parser, new CommandHistoryManager(properties), new OutputFormatter(),
                toolDetection, properties, clock);
        engine.addListener(recorder);
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.shutdown();
        }
    }

    @Test
    void route_unknownProgram_fallsBackToShell() {
        RouteResult result = engine.route(TOKEN, "t1", "echo hello", null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isHandled()).isFalse();
        assertThat(result.getOutput()).isEqualTo("hello\n");
        assertThat(result.getExitCode()).isZero();
        assertThat(result.getError()).isNull();
        assertThat(result.getErrorCode()).isNull();
        assertThat(result.getCommandInfo().getCommand()).isEqualTo("echo");

        CommandHistory history = engine.getTerminalHistory(TOKEN, "t1");
        assertThat(history.getCommands()).hasSize(1);
        assertThat(history.getCommands().get(0).getOutput()).isEqualTo("hello\n");
        assertThat(recorder.routed).containsExactly("t1");
    }

    @Test
    void route_nonZeroExit_isUnsuccessfulWithExitCode() {
        RouteResult result = engine.route(TOKEN, "t1", "echo broken 1>&2; exit 3", null);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getExitCode()).isEqualTo(3);
        assertThat(result.getError()).isEqualTo("broken\n");
        assertThat(engine.getTerminalHistory(TOKEN, "t1").getCommands().get(0).getExitCode()).isEqualTo(3);
    }

    @Test
    void route_usesWorkingDirectory(@TempDir Path dir) throws Exception {
        RouteResult result = engine.route(TOKEN, "t1", "pwd", dir.toString());

        assertThat(result.getOutput().trim()).isEqualTo(dir.toRealPath().toString());
    }

    @Test
    void route_installedTool_isHandledAndFormatted() {
        toolDetection.registerTool(ToolInfo.builder()
                .name("echo")
                .displayName("echo")
                .category(ToolCategory.SYSTEM)
                .executable("echo")
                .build());

        RouteResult result = engine.route(TOKEN, "t1", "echo all ok", null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isHandled()).isTrue();
        assertThat(result.getOutput()).isEqualTo("all <span class=\"system-success\">ok</span>\n");
        assertThat(engine.getToolHistory(TOKEN, "echo").getCommands()).hasSize(1);
        assertThat(engine.getToolHistory(TOKEN, "echo").getCommands().get(0).getOutput()).isEqualTo("all ok\n");
    }

    @Test
    void route_streamingAgent_emitsChunksWhileRunning() {
        engine.addAgentTool("talker", AgentToolConfig.builder()
                .executable("sh")
                .args(List.of("-c", "echo chunk-one"))
                .build());

        RouteResult result = engine.route(TOKEN, "t1", "talker", null);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isHandled()).isTrue();
        assertThat(result.getCommandInfo().isAgentTool()).isTrue();
        assertThat(result.getOutput()).isEqualTo("chunk-one\n");
        assertThat(String.join("", recorder.agentChunks)).isEqualTo("talker|chunk-one\n|stdout");
    }

    @Test
    void route_batchAgent_emitsOutputOnceAfterExit() {
        engine.addAgentTool("batcher", AgentToolConfig.builder()
                .executable("sh")
                .args(List.of("-c", "echo first; echo second"))
                .responseFormat(AgentToolConfig.ResponseFormat.BATCH)
                .build());

        engine.route(TOKEN, "t1", "batcher", null);

        assertThat(recorder.agentChunks).containsExactly("batcher|first\nsecond\n|stdout");
    }

    @Test
    void route_agentWithInterceptNone_runsLineThroughShell() {
        engine.addAgentTool("quiet", AgentToolConfig.builder()
                .executable("sh")
                .args(List.of("-c", "echo intercepted"))
                .interceptMode(AgentToolConfig.InterceptMode.NONE)
                .build());

        RouteResult result = engine.route(TOKEN, "t1", "quiet", null);

        assertThat(result.getCommandInfo().isAgentTool()).isTrue();
        assertThat(result.isHandled()).isFalse();
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getExitCode()).isEqualTo(127);
        assertThat(recorder.agentChunks).isEmpty();
    }

    @Test
    void route_agentExceedingTimeout_isKilledWithTimeoutCode() {
        engine.addAgentTool("sleeper", AgentToolConfig.builder()
                .executable("sleep")
                .timeoutMs(300)
                .build());

        long start = System.currentTimeMillis();
        RouteResult result = engine.route(TOKEN, "t1", "sleeper 10", null);

        assertThat(System.currentTimeMillis() - start).isGreaterThanOrEqualTo(300).isLessThan(8000);
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.TIMEOUT);
        assertThat(result.getError()).isEqualTo("Agent tool timeout after 300ms");
        assertThat(engine.isRunning(TOKEN, "t1")).isFalse();
    }

    @Test
    void route_shellCommandExceedingTimeout_reportsCommandTimeout() {
        long start = System.currentTimeMillis();
        RouteResult result = engine.route(TOKEN, "t1", "sleep 10", null);

        assertThat(System.currentTimeMillis() - start).isGreaterThanOrEqualTo(2000);
        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.TIMEOUT);
        assertThat(result.getError()).isEqualTo("Command timeout after 2000ms");
        assertThat(result.isHandled()).isFalse();
    }

    @Test
    void killProcess_stopsRunningCommand() throws Exception {
        engine.addAgentTool("sleeper", AgentToolConfig.builder()
                .executable("sleep")
                .timeoutMs(30_000)
                .build());

        CompletableFuture<RouteResult> pending =
                CompletableFuture.supplyAsync(() -> engine.route(TOKEN, "t1", "sleeper 20", null));
        awaitRunning("t1");

        assertThat(engine.getActiveProcesses()).extracting(ActiveProcessInfo::getTerminalId).containsExactly("t1");
        RouteResult busy = engine.route(TOKEN, "t1", "echo hi", null);
        assertThat(busy.getError()).isEqualTo("A command is already running in terminal t1");

        assertThat(engine.killProcess("other-token", "t1")).isFalse();
        assertThat(engine.killProcess(TOKEN, "t1")).isTrue();

        RouteResult result = pending.get(10, TimeUnit.SECONDS);
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("Process killed");
        assertThat(engine.isRunning(TOKEN, "t1")).isFalse();
    }

    @Test
    void killProcessesForToken_stopsOnlyThatToken() throws Exception {
        engine.addAgentTool("sleeper", AgentToolConfig.builder()
                .executable("sleep")
                .timeoutMs(30_000)
                .build());

        CompletableFuture<RouteResult> pending =
                CompletableFuture.supplyAsync(() -> engine.route(TOKEN, "t2", "sleeper 20", null));
        awaitRunning("t2");

        assertThat(engine.killProcessesForToken("someone-else")).isZero();
        assertThat(engine.killProcessesForToken(TOKEN)).isEqualTo(1);
        assertThat(pending.get(10, TimeUnit.SECONDS).getError()).isEqualTo("Process killed");
    }

    @Test
    void route_missingAgentExecutable_reportsSpawnFailure() {
        engine.addAgentTool("ghost", AgentToolConfig.builder()
                .executable("/definitely/missing/agent")
                .build());

        RouteResult result = engine.route(TOKEN, "t1", "ghost --help", null);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.SPAWN_FAILURE);
        assertThat(result.getError()).startsWith("Failed to execute agent tool: ");
    }

    @Test
    void route_agentToolWithoutConfig_isRejected() {
        toolDetection.registerTool(ToolInfo.builder().name("cursor").category(ToolCategory.AI).build());

        RouteResult result = engine.route(TOKEN, "t1", "cursor .", null);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getErrorCode()).isEqualTo(ErrorCode.NOT_FOUND);
        assertThat(result.getError()).isEqualTo("No configuration found for agent tool: cursor");
    }

    @Test
    void route_emptyLine_isRejected() {
        RouteResult result = engine.route(TOKEN, "t1", "   ", null);

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).isEqualTo("Empty command");
    }

    @Test
    void agentTools_registryCanBeEdited() {
        assertThat(engine.getAgentTools()).containsKeys("claude-code", "gemini");
        assertThat(engine.getAgentTools().get("claude-code").getExecutable()).isEqualTo("claude");

        engine.addAgentTool("aider", AgentToolConfig.builder().executable("aider").build());
        assertThat(engine.getAgentTools().get("aider").getName()).isEqualTo("aider");
        assertThat(toolDetection.getTool("aider").getCategory()).isEqualTo(ToolCategory.AI);
        assertThat(engine.parse("aider --yes").isAgentTool()).isTrue();

        assertThat(engine.removeAgentTool("aider")).isTrue();
        assertThat(engine.removeAgentTool("aider")).isFalse();
        assertThat(engine.parse("aider --yes").isAgentTool()).isFalse();
    }

    private void awaitRunning(String terminalId) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (System.currentTimeMillis() < deadline) {
            boolean attached = engine.getActiveProcesses().stream()
                    .anyMatch(p -> p.getTerminalId().equals(terminalId) && p.getPid() > 0);
            if (attached) {
                return;
            }
            Thread.sleep(20);
        }
        throw new AssertionError("Command never started in " + terminalId);
    }

    private static class Recorder implements RoutingEventListener {
        final List<String> agentChunks = Collections.synchronizedList(new ArrayList<>());
        final List<String> routed = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void onAgentOutput(String token, String terminalId, String tool, String chunk, String stream) {
            agentChunks.add(tool + "|" + chunk + "|" + stream);
        }

        @Override
        public void onCommandRouted(String token, String terminalId, RouteResult result) {
            routed.add(terminalId);
        }
    }
}
