package com.example.terminal_bridge.routing;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Splits a command line and classifies its program against the tool registry.
 */
@Component
@RequiredArgsConstructor
public class CommandParser {

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("claude", "claude-code"),
            Map.entry("g", "git"),
            Map.entry("gitk", "git"),
            Map.entry("npm", "node"),
            Map.entry("npx", "node"),
            Map.entry("yarn", "node"),
            Map.entry("pnpm", "node"),
            Map.entry("pip", "python"),
            Map.entry("pip3", "python"),
            Map.entry("python3", "python"),
            Map.entry("py", "python"),
            Map.entry("docker-compose", "docker"),
            Map.entry("docker-machine", "docker"),
            Map.entry("mysql-client", "mysql"),
            Map.entry("postgresql", "psql"),
            Map.entry("pg", "psql"),
            Map.entry("redis", "redis-cli"),
            Map.entry("curl", "curl"),
            Map.entry("wget", "wget"),
            Map.entry("jq", "jq"));

    private static final Map<String, String> SYSTEM_COMMANDS = Map.ofEntries(
            Map.entry("code", "code"),
            Map.entry("vim", "vim"),
            Map.entry("nvim", "vim"),
            Map.entry("emacs", "emacs"),
            Map.entry("nano", "nano"),
            Map.entry("ssh", "ssh"),
            Map.entry("scp", "ssh"),
            Map.entry("rsync", "rsync"),
            Map.entry("grep", "grep"),
            Map.entry("sed", "sed"),
            Map.entry("awk", "awk"),
            Map.entry("find", "find"),
            Map.entry("ls", "ls"),
            Map.entry("cat", "cat"),
            Map.entry("less", "less"),
            Map.entry("more", "less"),
            Map.entry("tail", "tail"),
            Map.entry("head", "head"));

    static final List<String> DEFAULT_AGENT_TOOLS = List.of("claude-code", "gemini", "cursor", "codeium", "copilot");

    private final ToolDetectionService toolDetection;
    private final Clock clock;

    private final Set<String> agentTools = new CopyOnWriteArraySet<>(DEFAULT_AGENT_TOOLS);

    /**
     * Never throws; a blank line yields an empty command with {@code tool == null}.
     */
    public CommandInfo parse(String commandLine) {
        String trimmed = commandLine == null ? "" : commandLine.trim();
        if (trimmed.isEmpty()) {
            return build("", List.of(), null);
        }

        List<String> parts = tokenize(trimmed);
        if (parts.isEmpty()) {
            return build("", List.of(), null);
        }
        String command = parts.get(0);
        List<String> args = List.copyOf(parts.subList(1, parts.size()));

        if (toolDetection.isRegistered(command)) {
            return build(command, args, command);
        }

        String alias = ALIASES.get(command);
        if (toolDetection.isRegistered(alias)) {
            return build(command, args, alias);
        }

        String compound = compoundMatch(command, args);
        if (toolDetection.isRegistered(compound)) {
            return build(command, args, compound);
        }

        String system = SYSTEM_COMMANDS.get(command);
        if (toolDetection.isRegistered(system)) {
            return build(command, args, system);
        }

        return build(command, args, null);
    }

    /**
     * Whitespace split honouring single/double quotes and backslash escapes.
     */
    static List<String> tokenize(String line) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        char quote = 0;
        boolean escaped = false;
        boolean hasToken = false;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (escaped) {
                current.append(c);
                escaped = false;
                hasToken = true;
            } else if (c == '\\') {
                escaped = true;
            } else if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else {
                    current.append(c);
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
                hasToken = true;
            } else if (c == ' ' || c == '\t') {
                if (hasToken) {
                    parts.add(current.toString());
                    current.setLength(0);
                    hasToken = false;
                }
            } else {
                current.append(c);
                hasToken = true;
            }
        }
        if (hasToken) {
            parts.add(current.toString());
        }
        return parts;
    }

    private static String compoundMatch(String command, List<String> args) {
        if (args.isEmpty()) {
            return null;
        }
        if (command.equals("docker") && args.get(0).equals("compose")) {
            return "docker";
        }
        if (command.equals("git")) {
            return "git";
        }
        if (command.equals("npm") || command.equals("yarn") || command.equals("pnpm")) {
            return "node";
        }
        if (command.equals("pip") || command.equals("pip3")) {
            return "python";
        }
        return null;
    }

    private CommandInfo build(String command, List<String> args, String tool) {
        ToolInfo toolInfo = toolDetection.getTool(tool);
        return CommandInfo.builder()
                .command(command)
                .args(args)
                .tool(tool)
                .toolInfo(toolInfo)
                .agentTool(tool != null && agentTools.contains(tool))
                .category(toolInfo != null ? toolInfo.getCategory() : ToolCategory.UNKNOWN)
                .timestamp(clock.instant())
                .build();
    }

    // ============= AGENT TOOLS =============

    public boolean isAgentTool(String name) {
        return agentTools.contains(name);
    }

    public void addAgentTool(String name) {
        agentTools.add(name);
    }

    public void removeAgentTool(String name) {
        agentTools.remove(name);
    }

    public Set<String> getAgentTools() {
        return new TreeSet<>(agentTools);
    }
}
