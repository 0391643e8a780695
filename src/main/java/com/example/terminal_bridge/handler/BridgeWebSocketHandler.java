package com.example.terminal_bridge.handler;

import com.example.terminal_bridge.config.BridgeProperties;
import com.example.terminal_bridge.dto.BridgeMessage;
import com.example.terminal_bridge.dto.TerminalInfo;
import com.example.terminal_bridge.exception.BridgeException;
import com.example.terminal_bridge.routing.CommandRoutingEngine;
import com.example.terminal_bridge.routing.RouteResult;
import com.example.terminal_bridge.routing.RoutingEventListener;
import com.example.terminal_bridge.store.SessionRecord;
import com.example.terminal_bridge.store.SessionStatus;
import com.example.terminal_bridge.store.SessionStore;
import com.example.terminal_bridge.terminal.TerminalEventListener;
import com.example.terminal_bridge.terminal.TerminalSession;
import com.example.terminal_bridge.terminal.TerminalSessionManager;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static com.example.terminal_bridge.dto.MessageType.*;

/**
 * Bridge socket protocol: authentication, terminal multiplexing, routed
 * commands, heartbeat and reclamation sweeps.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BridgeWebSocketHandler extends TextWebSocketHandler
        implements TerminalEventListener, RoutingEventListener {

    static final Pattern UUID_PATTERN = Pattern.compile(
            "^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}$", Pattern.CASE_INSENSITIVE);

    public static final String LOOPBACK_ATTRIBUTE = "loopback";

    private final TerminalSessionManager terminalManager;
    private final CommandRoutingEngine routingEngine;
    private final SessionStore sessionStore;
    private final BridgeProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    // ============= CONNECTIONS (by socket id, and by token once authenticated) =============
    private final Map<String, ConnectedClient> connections = new ConcurrentHashMap<>();
    private final Map<String, ConnectedClient> clientsByToken = new ConcurrentHashMap<>();

    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(2, daemonThreads("bridge-sweeper"));
    private final ExecutorService commandExecutor = Executors.newCachedThreadPool(daemonThreads("command-route"));

    @PostConstruct
    public void start() {
        terminalManager.addListener(this);
        routingEngine.addListener(this);

        BridgeProperties.Connection config = properties.getConnection();
        long heartbeat = config.getHeartbeatInterval().toMillis();
        long reclamation = config.getReclamationInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::runHeartbeatSweep, heartbeat, heartbeat, TimeUnit.MILLISECONDS);
        scheduler.scheduleAtFixedRate(this::runReclamationSweep, reclamation, reclamation, TimeUnit.MILLISECONDS);
        log.info("🔌 Bridge socket ready on {} (heartbeat {}ms, reclamation {}ms)", config.getPath(), heartbeat, reclamation);
    }

    // ============= WEBSOCKET LIFECYCLE =============

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        BridgeProperties.Connection config = properties.getConnection();
        WebSocketSession concurrent = new ConcurrentWebSocketSessionDecorator(
                session, config.getSendTimeLimitMs(), config.getSendBufferSizeLimit());
        ConnectedClient client = new ConnectedClient(concurrent, clock.instant());
        connections.put(session.getId(), client);
        log.info("🔌 WebSocket connected: {} from {}", session.getId(), session.getRemoteAddress());

        send(client, BridgeMessage.builder().type(PING).timestamp(clock.millis()).build());

        if (properties.getSecure().isAutoAuthenticate()
                && Boolean.TRUE.equals(session.getAttributes().get(LOOPBACK_ATTRIBUTE))) {
            String token = UUID.randomUUID().toString();
            client.setToken(token);
            clientsByToken.put(token, client);
            log.info("🔐 Auto-authenticating loopback client {} as {}", session.getId(), token);
            completeAuthentication(client, token);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        ConnectedClient client = connections.get(session.getId());
        if (client == null) {
            return;
        }

        BridgeMessage frame;
        try {
            frame = objectMapper.readValue(message.getPayload(), BridgeMessage.class);
        } catch (JsonProcessingException e) {
            log.warn("⚠️ Invalid frame from {}: {}", session.getId(), e.getOriginalMessage());
            sendError(client, "Invalid message format");
            return;
        }
        if (frame == null) {
            log.warn("⚠️ Empty frame from {}", session.getId());
            sendError(client, "Invalid message format");
            return;
        }

        String type = frame.getType();
        try {
            dispatch(client, frame);
        } catch (RuntimeException e) {
            log.error("❌ Failed to handle {} from {}: {}", type, session.getId(), e.getMessage(), e);
            sendError(client, "Failed to handle " + type + ": " + e.getMessage());
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.info("🔌 WebSocket disconnected: {} | Status: {}", session.getId(), status);
        release(session.getId());
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.error("🚨 Transport error for session {}: {}", session.getId(), exception.getMessage());
        release(session.getId());
    }

    // ============= DISPATCH =============

    private void dispatch(ConnectedClient client, BridgeMessage frame) {
        String type = StringUtils.defaultString(frame.getType());
        log.debug("⬅️ {} from {}", type, client.getConnectionId());

        switch (type) {
            case AUTH:
                handleAuth(client, frame);
                return;
            case PING:
                client.setLastHeartbeat(clock.instant());
                send(client, BridgeMessage.builder().type(PONG).timestamp(clock.millis()).build());
                return;
            case PONG:
                client.setLastHeartbeat(clock.instant());
                return;
            default:
                break;
        }

        if (!isKnown(type)) {
            log.warn("⚠️ Unknown message type from {}: {}", client.getConnectionId(), type);
            return;
        }
        if (!client.isAuthenticated()) {
            sendError(client, "Authentication required");
            return;
        }

        switch (type) {
            case TERMINAL_INPUT -> handleTerminalInput(client, frame);
            case TERMINAL_RESIZE -> handleTerminalResize(client, frame);
            case TERMINAL_CREATE -> handleTerminalCreate(client, frame);
            case TERMINAL_CLOSE -> handleTerminalClose(client, frame);
            case TERMINAL_LIST -> sendTerminalList(client);
            case TERMINAL_BROADCAST -> handleTerminalBroadcast(client, frame);
            case COMMAND_ROUTE -> handleCommandRoute(client, frame);
            case COMMAND_PARSE -> handleCommandParse(client, frame);
            case COMMAND_HISTORY -> handleCommandHistory(client, frame);
            case COMMAND_KILL -> handleCommandKill(client, frame);
            case TOOL_HISTORY -> handleToolHistory(client, frame);
            default -> log.warn("⚠️ Unhandled message type: {}", type);
        }
    }

    private static boolean isKnown(String type) {
        return List.of(TERMINAL_INPUT, TERMINAL_RESIZE, TERMINAL_CREATE, TERMINAL_CLOSE, TERMINAL_LIST,
                TERMINAL_BROADCAST, COMMAND_ROUTE, COMMAND_PARSE, COMMAND_HISTORY, COMMAND_KILL,
                TOOL_HISTORY).contains(type);
    }

    // ============= AUTH =============

    private void handleAuth(ConnectedClient client, BridgeMessage frame) {
        if (client.isAuthenticated()) {
            sendAuthError(client, "Already authenticated");
            return;
        }
        String token = frame.getUuid();
        if (StringUtils.isBlank(token)) {
            sendAuthError(client, "Invalid UUID");
            return;
        }
        if (!UUID_PATTERN.matcher(token).matches()) {
            sendAuthError(client, "Invalid UUID format");
            return;
        }
        // the token is set first so a concurrent release() always unbinds it
        client.setToken(token);
        if (clientsByToken.putIfAbsent(token, client) != null) {
            client.setToken(null);
            log.warn("⚠️ Token {} already bound to another connection", token);
            sendAuthError(client, "UUID already in use");
            return;
        }
        completeAuthentication(client, token);
    }

    private void completeAuthentication(ConnectedClient client, String token) {
        client.setAuthenticated(true);
        client.setLastHeartbeat(clock.instant());

        SessionRecord record = sessionStore.createOrActivate(token);

        if (connections.get(client.getConnectionId()) != client) {
            clientsByToken.remove(token, client);
            sessionStore.updateStatus(token, SessionStatus.INACTIVE);
            log.info("🔌 Connection {} closed during authentication, token {} released", client.getConnectionId(), token);
            return;
        }

        if (terminalManager.listByToken(token).isEmpty()) {
            try {
                terminalManager.create(token, null, "Terminal 1", "blue");
            } catch (BridgeException e) {
                log.warn("⚠️ Could not create default terminal for {}: {}", token, e.getMessage());
                sendError(client, payload("message", e.getMessage(), "code", e.getCode()));
            }
        }

        log.info("✅ Client authenticated: token={}, connection={}", token, client.getConnectionId());
        send(client, BridgeMessage.builder()
                .type(AUTH_SUCCESS)
                .uuid(token)
                .data(payload("uuid", token, "sessionId", record.getId(), "timestamp", clock.millis()))
                .build());

        scheduler.schedule(() -> sendTerminalList(client),
                properties.getConnection().getTerminalListDelay().toMillis(), TimeUnit.MILLISECONDS);
    }

    // ============= TERMINALS =============

    private void handleTerminalInput(ConnectedClient client, BridgeMessage frame) {
        String terminalId = frame.getTerminalId();
        if (StringUtils.isBlank(terminalId)) {
            sendError(client, "Terminal ID required for input");
            return;
        }
        if (!(frame.getData() instanceof String)) {
            sendError(client, "Terminal input must be a string");
            return;
        }
        if (terminalManager.write(client.getToken(), terminalId, (String) frame.getData())) {
            sessionStore.touch(client.getToken());
        } else {
            sendError(client, "Terminal " + terminalId + " is not running");
        }
    }

    private void handleTerminalResize(ConnectedClient client, BridgeMessage frame) {
        String terminalId = frame.getTerminalId();
        if (StringUtils.isBlank(terminalId)) {
            sendError(client, "Terminal ID required for resize");
            return;
        }
        Map<?, ?> data = asMap(frame.getData());
        Integer cols = asInt(data.get("cols"));
        Integer rows = asInt(data.get("rows"));
        if (cols == null || rows == null || cols <= 0 || rows <= 0) {
            sendError(client, "Resize requires positive numeric cols and rows");
            return;
        }
        if (!terminalManager.resize(client.getToken(), terminalId, cols, rows)) {
            sendError(client, "Terminal " + terminalId + " is not running");
        }
    }

    private void handleTerminalCreate(ConnectedClient client, BridgeMessage frame) {
        Map<?, ?> data = asMap(frame.getData());
        try {
            TerminalSession session = terminalManager.create(client.getToken(), frame.getTerminalId(),
                    asString(data.get("name")), asString(data.get("color")));
            send(client, BridgeMessage.builder()
                    .type(TERMINAL_CREATED)
                    .terminalId(session.getTerminalId())
                    .data(session.toInfo())
                    .build());
        } catch (BridgeException e) {
            log.warn("⚠️ Terminal creation failed for {}: {}", client.getToken(), e.getMessage());
            sendError(client, payload("message", e.getMessage(), "code", e.getCode(),
                    "terminalId", frame.getTerminalId()));
        }
    }

    private void handleTerminalClose(ConnectedClient client, BridgeMessage frame) {
        String terminalId = frame.getTerminalId();
        if (StringUtils.isBlank(terminalId)) {
            sendError(client, "Terminal ID required for close");
            return;
        }
        boolean success = terminalManager.terminate(client.getToken(), terminalId);
        send(client, BridgeMessage.builder()
                .type(TERMINAL_CLOSED)
                .terminalId(terminalId)
                .data(payload("success", success, "terminalId", terminalId))
                .build());
    }

    private void sendTerminalList(ConnectedClient client) {
        if (!client.isAuthenticated()) {
            return;
        }
        List<TerminalInfo> terminals = terminalManager.listByToken(client.getToken()).stream()
                .map(TerminalSession::toInfo)
                .collect(Collectors.toList());
        send(client, BridgeMessage.builder()
                .type(TERMINAL_LIST)
                .data(payload("terminals", terminals))
                .build());
    }

    private void handleTerminalBroadcast(ConnectedClient client, BridgeMessage frame) {
        String token = client.getToken();
        String source = frame.getTerminalId();
        if (StringUtils.isBlank(source)) {
            sendError(client, "Source terminal ID required for broadcast");
            return;
        }
        if (terminalManager.getSession(token, source) == null) {
            sendError(client, "Source terminal not found");
            return;
        }

        String target = frame.getTargetTerminalId();
        if (StringUtils.isNotBlank(target)) {
            if (terminalManager.getSession(token, target) == null) {
                sendError(client, "Target terminal not found");
                return;
            }
            sendTerminalMessage(client, source, target, frame.getData());
            return;
        }
        for (TerminalSession session : terminalManager.listByToken(token)) {
            if (!session.getTerminalId().equals(source)) {
                sendTerminalMessage(client, source, session.getTerminalId(), frame.getData());
            }
        }
    }

    private void sendTerminalMessage(ConnectedClient client, String source, String target, Object data) {
        send(client, BridgeMessage.builder()
                .type(TERMINAL_MESSAGE)
                .terminalId(target)
                .sourceTerminalId(source)
                .data(data)
                .build());
    }

    // ============= ROUTED COMMANDS =============

    private void handleCommandRoute(ConnectedClient client, BridgeMessage frame) {
        String terminalId = frame.getTerminalId();
        if (StringUtils.isBlank(terminalId) || StringUtils.isBlank(frame.getCommand())) {
            sendError(client, "Terminal ID and command are required for routing");
            return;
        }
        String token = client.getToken();
        commandExecutor.execute(() -> {
            RouteResult result = routingEngine.route(token, terminalId, frame.getCommand(), frame.getWorkingDirectory());
            send(client, BridgeMessage.builder()
                    .type(COMMAND_RESULT)
                    .terminalId(terminalId)
                    .data(result)
                    .build());
        });
    }

    private void handleCommandParse(ConnectedClient client, BridgeMessage frame) {
        if (StringUtils.isBlank(frame.getCommand())) {
            sendError(client, "Command is required for parsing");
            return;
        }
        send(client, BridgeMessage.builder()
                .type(COMMAND_PARSED)
                .data(payload("commandInfo", routingEngine.parse(frame.getCommand())))
                .build());
    }

    private void handleCommandHistory(ConnectedClient client, BridgeMessage frame) {
        String terminalId = frame.getTerminalId();
        if (StringUtils.isBlank(terminalId)) {
            sendError(client, "Terminal ID is required for command history");
            return;
        }
        send(client, BridgeMessage.builder()
                .type(COMMAND_HISTORY_RESULT)
                .terminalId(terminalId)
                .data(payload("history", routingEngine.getTerminalHistory(client.getToken(), terminalId)))
                .build());
    }

    private void handleToolHistory(ConnectedClient client, BridgeMessage frame) {
        String token = client.getToken();
        String tool = frame.getTool();
        if (StringUtils.isBlank(tool)) {
            send(client, BridgeMessage.builder()
                    .type(TOOL_HISTORIES_RESULT)
                    .data(payload("histories", routingEngine.getUserToolHistories(token)))
                    .build());
            return;
        }
        Map<String, Object> data = payload("tool", tool, "history", routingEngine.getToolHistory(token, tool));
        if (frame.getLimit() != null) {
            data.put("recent", routingEngine.getRecentCommands(token, tool, frame.getLimit()));
        }
        send(client, BridgeMessage.builder().type(TOOL_HISTORY_RESULT).data(data).build());
    }

    private void handleCommandKill(ConnectedClient client, BridgeMessage frame) {
        String terminalId = frame.getTerminalId();
        if (StringUtils.isBlank(terminalId)) {
            sendError(client, "Terminal ID is required to kill a command");
            return;
        }
        boolean success = routingEngine.killProcess(client.getToken(), terminalId);
        send(client, BridgeMessage.builder()
                .type(COMMAND_KILLED)
                .terminalId(terminalId)
                .data(payload("success", success, "terminalId", terminalId))
                .build());
    }

    // ============= EVENTS FROM TERMINALS AND ROUTING =============

    @Override
    public void onOutput(String token, String terminalId, String data) {
        ConnectedClient client = clientsByToken.get(token);
        if (client != null) {
            send(client, BridgeMessage.builder().type(TERMINAL_OUTPUT).terminalId(terminalId).data(data).build());
        }
    }

    @Override
    public void onExit(String token, String terminalId, int exitCode) {
        ConnectedClient client = clientsByToken.get(token);
        if (client != null) {
            send(client, BridgeMessage.builder()
                    .type(TERMINAL_EXIT)
                    .terminalId(terminalId)
                    .data(payload("exitCode", exitCode, "terminalId", terminalId))
                    .build());
        }
        boolean anyRunning = terminalManager.listByToken(token).stream().anyMatch(TerminalSession::isActive);
        if (!anyRunning) {
            sessionStore.updateStatus(token, SessionStatus.TERMINATED);
        }
    }

    @Override
    public void onReclaimed(TerminalSession session, String reason) {
        ConnectedClient client = clientsByToken.get(session.getToken());
        if (client != null) {
            send(client, BridgeMessage.builder()
                    .type(TERMINAL_CLOSED)
                    .terminalId(session.getTerminalId())
                    .data(payload("success", true, "terminalId", session.getTerminalId(), "reason", reason))
                    .build());
        }
    }

    @Override
    public void onAgentOutput(String token, String terminalId, String tool, String chunk, String stream) {
        ConnectedClient client = clientsByToken.get(token);
        if (client != null) {
            send(client, BridgeMessage.builder()
                    .type(AGENT_OUTPUT)
                    .terminalId(terminalId)
                    .data(payload("tool", tool, "chunk", chunk, "type", stream))
                    .build());
        }
    }

    @Override
    public void onCommandRouted(String token, String terminalId, RouteResult result) {
        ConnectedClient client = clientsByToken.get(token);
        if (client != null) {
            send(client, BridgeMessage.builder()
                    .type(COMMAND_ROUTED)
                    .terminalId(terminalId)
                    .data(payload("commandInfo", result.getCommandInfo(), "result", result,
                            "duration", result.getDurationMs()))
                    .build());
        }
    }

    // ============= SWEEPS =============

    /**
     * Evicts connections silent longer than the heartbeat timeout and pings the rest.
     */
    void runHeartbeatSweep() {
        try {
            Instant cutoff = clock.instant().minus(properties.getConnection().getHeartbeatTimeout());
            for (ConnectedClient client : new ArrayList<>(connections.values())) {
                if (client.getLastHeartbeat().isBefore(cutoff)) {
                    evict(client);
                } else if (client.isAuthenticated()) {
                    send(client, BridgeMessage.builder().type(PING).timestamp(clock.millis()).build());
                }
            }
        } catch (RuntimeException e) {
            log.error("❌ Heartbeat sweep failed: {}", e.getMessage(), e);
        }
    }

    void runReclamationSweep() {
        try {
            for (ConnectedClient client : new ArrayList<>(connections.values())) {
                if (!client.isOpen()) {
                    log.info("🧹 Cleaning up closed connection: {}", client.getConnectionId());
                    release(client.getConnectionId());
                    String token = client.getToken();
                    if (token != null) {
                        terminalManager.terminate(token, null);
                        routingEngine.killProcessesForToken(token);
                    }
                }
            }
            clientsByToken.forEach((token, client) -> {
                if (connections.get(client.getConnectionId()) != client && clientsByToken.remove(token, client)) {
                    log.warn("⚠️ Dropped stale binding for token {}", token);
                }
            });
            terminalManager.cleanupInactiveSessions();
            sessionStore.expireOlderThan(properties.getStore().getRetention());
        } catch (RuntimeException e) {
            log.error("❌ Reclamation sweep failed: {}", e.getMessage(), e);
        }
    }

    private void evict(ConnectedClient client) {
        log.info("🔌 Disconnecting unresponsive client: {} (token={})", client.getConnectionId(), client.getToken());
        release(client.getConnectionId());
        try {
            client.getSession().close(CloseStatus.SESSION_NOT_RELIABLE);
        } catch (IOException e) {
            log.debug("Error closing evicted session {}: {}", client.getConnectionId(), e.getMessage());
        }
    }

    private void release(String connectionId) {
        ConnectedClient client = connections.remove(connectionId);
        if (client == null) {
            return;
        }
        String token = client.getToken();
        if (token != null && clientsByToken.remove(token, client)) {
            sessionStore.updateStatus(token, SessionStatus.INACTIVE);
        }
    }

    public List<ConnectedClient> getConnectedClients() {
        return new ArrayList<>(connections.values());
    }

    public ConnectedClient getClientByToken(String token) {
        return clientsByToken.get(token);
    }

    // ============= SENDING =============

    private void send(ConnectedClient client, BridgeMessage message) {
        WebSocketSession session = client.getSession();
        if (!session.isOpen()) {
            return;
        }
        try {
            session.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
        } catch (IOException e) {
            log.warn("⚠️ Send to {} failed: {}", client.getConnectionId(), e.getMessage());
        } catch (SessionLimitExceededException e) {
            log.warn("⚠️ Client {} is not keeping up, closing: {}", client.getConnectionId(), e.getMessage());
            release(client.getConnectionId());
        }
    }

    private void sendError(ConnectedClient client, Object data) {
        send(client, BridgeMessage.builder().type(ERROR).data(data).build());
    }

    private void sendAuthError(ConnectedClient client, String reason) {
        log.warn("⚠️ Auth rejected for {}: {}", client.getConnectionId(), reason);
        send(client, BridgeMessage.builder().type(AUTH_ERROR).data(reason).build());
    }

    private static Map<String, Object> payload(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put((String) keyValues[i], keyValues[i + 1]);
        }
        return map;
    }

    private static Map<?, ?> asMap(Object data) {
        return data instanceof Map ? (Map<?, ?>) data : Map.of();
    }

    private static Integer asInt(Object value) {
        return value instanceof Number ? ((Number) value).intValue() : null;
    }

    private static String asString(Object value) {
        return value instanceof String ? (String) value : null;
    }

    private static java.util.concurrent.ThreadFactory daemonThreads(String prefix) {
        AtomicInteger count = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
        commandExecutor.shutdownNow();
        for (ConnectedClient client : new ArrayList<>(connections.values())) {
            try {
                client.getSession().close(CloseStatus.GOING_AWAY);
            } catch (IOException e) {
                log.debug("Error closing session {}: {}", client.getConnectionId(), e.getMessage());
            }
        }
        connections.clear();
        clientsByToken.clear();
    }
}
