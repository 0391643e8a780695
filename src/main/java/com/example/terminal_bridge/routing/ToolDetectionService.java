package com.example.terminal_bridge.routing;

import com.example.terminal_bridge.config.BridgeProperties;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.SystemUtils;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Registry of known tools with PATH lookup and version probing.
 * Detection results are cached for {@code bridge.routing.detection-cache-ttl}.
 */
@Service
@Slf4j
public class ToolDetectionService {

    private static final Pattern SEMVER = Pattern.compile("v?(\\d+\\.\\d+\\.\\d+)");
    private static final Pattern MAJOR_MINOR = Pattern.compile("v?(\\d+\\.\\d+)");

    private final BridgeProperties.Routing config;
    private final Clock clock;

    private final Map<String, ToolInfo> registry = new ConcurrentHashMap<>();
    private final Map<String, CachedDetection> detectionCache = new ConcurrentHashMap<>();

    private static class CachedDetection {
        final ToolInfo result;
        final Instant checkedAt;

        CachedDetection(ToolInfo result, Instant checkedAt) {
            this.result = result;
            this.checkedAt = checkedAt;
        }
    }

    public ToolDetectionService(BridgeProperties properties, Clock clock) {
        this.config = properties.getRouting();
        this.clock = clock;
        registerDefaults();
    }

    @PostConstruct
    public void warmUp() {
        CompletableFuture.runAsync(() -> {
            List<ToolInfo> detected = detectAllTools();
            long installed = detected.stream().filter(ToolInfo::isInstalled).count();
            log.info("🔍 Tool detection finished: {}/{} installed", installed, detected.size());
        });
    }

    // ============= REGISTRY =============

    private void registerDefaults() {
        register("claude-code", "Claude Code", ToolCategory.AI, "claude",
                "AI coding assistant CLI", List.of("claude", "--version"));
        register("gemini", "Gemini CLI", ToolCategory.AI, "gemini",
                "Gemini AI CLI tool", null);

        register("git", "Git", ToolCategory.DEVELOPMENT, "git", "Distributed version control system", null);
        register("node", "Node.js", ToolCategory.DEVELOPMENT, "node", "JavaScript runtime", null);
        register("python", "Python", ToolCategory.DEVELOPMENT, "python", "Python interpreter", null);
        register("cargo", "Rust Cargo", ToolCategory.DEVELOPMENT, "cargo", "Rust package manager and build system", null);

        register("docker", "Docker", ToolCategory.DEVOPS, "docker", "Container engine", null);
        register("kubectl", "Kubernetes CLI", ToolCategory.DEVOPS, "kubectl",
                "Kubernetes cluster client", List.of("kubectl", "version", "--client"));
        register("terraform", "Terraform", ToolCategory.DEVOPS, "terraform", "Infrastructure as Code tool", null);

        register("aws", "AWS CLI", ToolCategory.CLOUD, "aws", "Amazon Web Services CLI", null);
        register("gcloud", "Google Cloud CLI", ToolCategory.CLOUD, "gcloud", "Google Cloud Platform CLI", null);
        register("az", "Azure CLI", ToolCategory.CLOUD, "az", "Microsoft Azure CLI", null);

        register("mysql", "MySQL", ToolCategory.DATABASE, "mysql", "MySQL database client", null);
        register("psql", "PostgreSQL", ToolCategory.DATABASE, "psql", "PostgreSQL database client", null);
        register("redis-cli", "Redis CLI", ToolCategory.DATABASE, "redis-cli", "Redis command-line client", null);

        register("curl", "cURL", ToolCategory.SYSTEM, "curl", "HTTP client", null);
        register("wget", "wget", ToolCategory.SYSTEM, "wget", "File downloader", null);
        register("jq", "jq", ToolCategory.SYSTEM, "jq", "JSON processor", null);
    }

    private void register(String name, String displayName, ToolCategory category, String executable,
                          String description, List<String> versionCommand) {
        registerTool(ToolInfo.builder()
                .name(name)
                .displayName(displayName)
                .category(category)
                .executable(executable)
                .description(description)
                .versionCommand(versionCommand != null ? versionCommand : List.of(executable, "--version"))
                .build());
    }

    public void registerTool(ToolInfo tool) {
        if (StringUtils.isBlank(tool.getExecutable())) {
            tool.setExecutable(tool.getName());
        }
        if (tool.getVersionCommand() == null) {
            tool.setVersionCommand(List.of(tool.getExecutable(), "--version"));
        }
        registry.put(tool.getName(), tool);
        detectionCache.remove(tool.getName());
    }

    public boolean unregisterTool(String name) {
        detectionCache.remove(name);
        return registry.remove(name) != null;
    }

    public ToolInfo getTool(String name) {
        return name == null ? null : registry.get(name);
    }

    public boolean isRegistered(String name) {
        return name != null && registry.containsKey(name);
    }

    public List<ToolInfo> getRegistry() {
        return sorted(registry.values());
    }

    // ============= DETECTION =============

    public List<ToolInfo> detectAllTools() {
        List<ToolInfo> result = new ArrayList<>();
        for (String name : new ArrayList<>(registry.keySet())) {
            ToolInfo info = detectTool(name);
            if (info != null) {
                result.add(info);
            }
        }
        return sorted(result);
    }

    /**
     * @return the detection result, or null if the tool is not registered
     */
    public ToolInfo detectTool(String name) {
        ToolInfo base = getTool(name);
        if (base == null) {
            return null;
        }
        Instant now = clock.instant();
        CachedDetection cached = detectionCache.get(name);
        if (cached != null && cached.checkedAt.plus(config.getDetectionCacheTtl()).isAfter(now)) {
            return cached.result;
        }

        ToolInfo detected = base.toBuilder().lastChecked(now).build();
        File executable = findOnPath(base.getExecutable());
        if (executable != null) {
            detected.setPath(executable.getAbsolutePath());
            detected.setInstalled(true);
            detected.setAvailable(true);
            detected.setVersion(probeVersion(base.getVersionCommand()));
        }
        registry.computeIfPresent(name, (key, current) -> {
            current.setInstalled(detected.isInstalled());
            current.setAvailable(detected.isAvailable());
            current.setPath(detected.getPath());
            current.setVersion(detected.getVersion());
            current.setLastChecked(now);
            return current;
        });
        detectionCache.put(name, new CachedDetection(detected, now));
        log.debug("Detected {}: installed={}, version={}", name, detected.isInstalled(), detected.getVersion());
        return detected;
    }

    public void clearCache() {
        detectionCache.clear();
    }

    static File findOnPath(String executable) {
        if (StringUtils.isBlank(executable)) {
            return null;
        }
        if (executable.contains(File.separator)) {
            File direct = new File(executable);
            return direct.isFile() && direct.canExecute() ? direct : null;
        }
        String path = System.getenv("PATH");
        if (path == null) {
            return null;
        }
        List<String> suffixes = new ArrayList<>();
        suffixes.add("");
        if (SystemUtils.IS_OS_WINDOWS) {
            String pathExt = StringUtils.defaultIfBlank(System.getenv("PATHEXT"), ".EXE;.CMD;.BAT");
            for (String ext : pathExt.split(";")) {
                suffixes.add(ext.toLowerCase());
            }
        }
        for (String dir : path.split(File.pathSeparator)) {
            if (dir.isEmpty()) {
                continue;
            }
            for (String suffix : suffixes) {
                File candidate = new File(dir, executable + suffix);
                if (candidate.isFile() && candidate.canExecute()) {
                    return candidate;
                }
            }
        }
        return null;
    }

    private String probeVersion(List<String> command) {
        Process process = null;
        try {
            process = new ProcessBuilder(command).redirectErrorStream(true).start();
            process.getOutputStream().close();
            if (!process.waitFor(config.getVersionProbeTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("⚠️ Version probe timed out: {}", command);
                process.destroyForcibly();
                return null;
            }
            try (InputStream in = process.getInputStream()) {
                return parseVersion(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            log.debug("Version probe failed for {}: {}", command, e.getMessage());
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (process != null) {
                process.destroyForcibly();
            }
            return null;
        }
    }

    static String parseVersion(String output) {
        if (StringUtils.isBlank(output)) {
            return null;
        }
        for (Pattern pattern : List.of(SEMVER, MAJOR_MINOR)) {
            Matcher matcher = pattern.matcher(output);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return output.trim().split("\\R", 2)[0];
    }

    private static List<ToolInfo> sorted(Collection<ToolInfo> tools) {
        return tools.stream()
                .sorted(Comparator.comparing(ToolInfo::getName))
                .collect(Collectors.toList());
    }
}
