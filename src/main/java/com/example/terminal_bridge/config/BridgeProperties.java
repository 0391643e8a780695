package com.example.terminal_bridge.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "bridge")
public class BridgeProperties {

    private Terminal terminal = new Terminal();
    private Connection connection = new Connection();
    private Routing routing = new Routing();
    private Secure secure = new Secure();
    private Store store = new Store();

    public enum ProcessMode {
        AUTO, PTY, PIPE
    }

    @Data
    public static class Terminal {
        private int maxSessionsPerToken = 8;
        private int maxSessionsGlobal = 50;
        private Duration idleTimeout = Duration.ofMinutes(30);
        private Duration aggressiveIdleTimeout = Duration.ofMinutes(30);
        private DataSize perSessionMemoryBudget = DataSize.ofMegabytes(50);
        private double memoryPressureRatio = 0.8;
        private Duration memoryCheckInterval = Duration.ofSeconds(30);
        // Blank means: resolve the platform default shell at startup
        private String shell;
        private List<String> shellArgs;
        private String workingDirectory;
        private int defaultCols = 80;
        private int defaultRows = 24;
        private Duration bannerDelay = Duration.ofMillis(100);
        private ProcessMode processMode = ProcessMode.AUTO;

        public long estimatedMemoryCeilingBytes() {
            return perSessionMemoryBudget.toBytes() * maxSessionsGlobal;
        }
    }

    @Data
    public static class Connection {
        private String path = "/ws";
        private List<String> allowedOriginPatterns = new ArrayList<>(List.of("*"));
        private Duration heartbeatInterval = Duration.ofSeconds(15);
        private Duration heartbeatTimeout = Duration.ofSeconds(30);
        private Duration reclamationInterval = Duration.ofMinutes(5);
        private Duration terminalListDelay = Duration.ofMillis(100);
        private int sendTimeLimitMs = 10_000;
        private int sendBufferSizeLimit = 512 * 1024;
    }

    @Data
    public static class Routing {
        private int maxHistorySize = 1000;
        private Duration commandTimeout = Duration.ofMinutes(10);
        private Duration detectionCacheTtl = Duration.ofMinutes(5);
        private Duration versionProbeTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Secure {
        private boolean enabled = false;
        private String certificateDir = System.getProperty("user.home") + "/.terminal-bridge/ssl";
        private String keystorePassword = "changeit";
        private String keyAlias = "terminal-bridge";
        private int fallbackPortOffset = 1;
        private boolean autoAuthenticate = false;
    }

    @Data
    public static class Store {
        private String path = System.getProperty("user.home") + "/.terminal-bridge/sessions.json";
        private Duration retention = Duration.ofHours(24);
    }
}
