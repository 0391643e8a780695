package com.example.terminal_bridge.controller;

import com.example.terminal_bridge.dto.ExecuteCommandRequest;
import com.example.terminal_bridge.dto.ParseCommandRequest;
import com.example.terminal_bridge.exception.BridgeException;
import com.example.terminal_bridge.handler.BridgeWebSocketHandler;
import com.example.terminal_bridge.routing.ActiveProcessInfo;
import com.example.terminal_bridge.routing.AgentToolConfig;
import com.example.terminal_bridge.routing.CommandHistory;
import com.example.terminal_bridge.routing.CommandInfo;
import com.example.terminal_bridge.routing.CommandRoutingEngine;
import com.example.terminal_bridge.routing.HistoryStats;
import com.example.terminal_bridge.routing.RouteResult;
import com.example.terminal_bridge.store.SessionRecord;
import com.example.terminal_bridge.store.SessionStore;
import com.example.terminal_bridge.terminal.TerminalSessionManager;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Request/response surface over the routing engine, the terminal manager and
 * the session records.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class AdminController {

    private final CommandRoutingEngine routingEngine;
    private final TerminalSessionManager terminalManager;
    private final SessionStore sessionStore;
    private final BridgeWebSocketHandler bridgeHandler;
    private final Clock clock;

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("timestamp", clock.millis());
        body.put("connectedClients", bridgeHandler.getConnectedClients().size());
        body.put("activeProcesses", routingEngine.getActiveProcesses().size());
        body.put("resources", terminalManager.getResourceUsage());
        return body;
    }

    // ============= COMMANDS =============

    @PostMapping("/commands/parse")
    public CommandInfo parse(@Valid @RequestBody ParseCommandRequest request) {
        return routingEngine.parse(request.getCommand());
    }

    @PostMapping("/commands/execute")
    public RouteResult execute(@Valid @RequestBody ExecuteCommandRequest request) {
        log.info("⚙️ Executing routed command for {} in {}", request.getUuid(), request.getTerminalId());
        return routingEngine.route(request.getUuid(), request.getTerminalId(),
                request.getCommand(), request.getWorkingDirectory());
    }

    // ============= HISTORY =============

    @GetMapping("/history/{uuid}/terminals/{terminalId}")
    public CommandHistory terminalHistory(@PathVariable String uuid, @PathVariable String terminalId) {
        return routingEngine.getTerminalHistory(uuid, terminalId);
    }

    @GetMapping("/history/{uuid}/tools")
    public List<CommandHistory> toolHistories(@PathVariable String uuid) {
        return routingEngine.getUserToolHistories(uuid);
    }

    @GetMapping("/history/{uuid}/tools/{tool}")
    public Map<String, Object> toolHistory(@PathVariable String uuid, @PathVariable String tool,
                                           @RequestParam(required = false) Integer limit) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tool", tool);
        body.put("history", routingEngine.getToolHistory(uuid, tool));
        if (limit != null) {
            body.put("recent", routingEngine.getRecentCommands(uuid, tool, limit));
        }
        return body;
    }

    @GetMapping("/history/{uuid}/stats")
    public HistoryStats stats(@PathVariable String uuid) {
        return routingEngine.getHistoryStats(uuid);
    }

    @DeleteMapping("/history/{uuid}")
    public Map<String, Object> clearHistory(@PathVariable String uuid,
                                            @RequestParam(required = false) String tool) {
        if (tool != null) {
            if (!routingEngine.clearToolHistory(uuid, tool)) {
                throw BridgeException.notFound("No history for tool " + tool);
            }
        } else {
            routingEngine.clearUserHistory(uuid);
        }
        return Map.of("success", true);
    }

    // ============= PROCESSES =============

    @GetMapping("/processes")
    public List<ActiveProcessInfo> processes() {
        return routingEngine.getActiveProcesses();
    }

    @DeleteMapping("/processes/{terminalId}")
    public Map<String, Object> killProcess(@PathVariable String terminalId) {
        if (!routingEngine.killProcess(terminalId)) {
            throw BridgeException.notFound("No running command in terminal " + terminalId);
        }
        return Map.of("success", true, "terminalId", terminalId);
    }

    // ============= AGENT TOOLS =============

    @GetMapping("/agent-tools")
    public Map<String, AgentToolConfig> agentTools() {
        return routingEngine.getAgentTools();
    }

    @PutMapping("/agent-tools/{name}")
    public AgentToolConfig putAgentTool(@PathVariable String name, @Valid @RequestBody AgentToolConfig config) {
        routingEngine.addAgentTool(name, config);
        return config;
    }

    @DeleteMapping("/agent-tools/{name}")
    public Map<String, Object> removeAgentTool(@PathVariable String name) {
        if (!routingEngine.removeAgentTool(name)) {
            throw BridgeException.notFound("Unknown agent tool: " + name);
        }
        return Map.of("success", true);
    }

    // ============= SESSIONS =============

    @GetMapping("/sessions")
    public List<SessionRecord> sessions() {
        return sessionStore.findAll();
    }

    @DeleteMapping("/sessions/{uuid}")
    public Map<String, Object> deleteSession(@PathVariable String uuid) {
        boolean hadTerminals = terminalManager.terminate(uuid, null);
        int killed = routingEngine.killProcessesForToken(uuid);
        boolean deleted = sessionStore.delete(uuid);
        if (!deleted && !hadTerminals && killed == 0) {
            throw BridgeException.notFound("Session not found: " + uuid);
        }
        log.info("🗑️ Session {} removed (terminals={}, commands={})", uuid, hadTerminals, killed);
        return Map.of("success", true);
    }

    @PostMapping("/generate-uuid")
    public Map<String, String> generateUuid() {
        return Map.of("uuid", UUID.randomUUID().toString());
    }
}
