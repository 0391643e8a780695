package com.example.terminal_bridge.routing;

import com.example.terminal_bridge.config.BridgeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Bounded command ledgers per (token, terminal) and per (token, tool).
 */
@Component
@Slf4j
public class CommandHistoryManager {

    static final String TERMINAL_LEDGER = "terminal";
    static final String ALL_TERMINALS = "all";

    private final int maxHistorySize;

    // token -> terminalId -> ledger
    private final Map<String, Map<String, Ledger>> terminalHistories = new ConcurrentHashMap<>();
    // token -> tool -> ledger
    private final Map<String, Map<String, Ledger>> toolHistories = new ConcurrentHashMap<>();

    public CommandHistoryManager(BridgeProperties properties) {
        this.maxHistorySize = properties.getRouting().getMaxHistorySize();
    }

    private static final class Ledger {
        private final String uuid;
        private final String terminalId;
        private final String tool;
        private final Deque<HistoryEntry> entries = new ArrayDeque<>();

        Ledger(String uuid, String terminalId, String tool) {
            this.uuid = uuid;
            this.terminalId = terminalId;
            this.tool = tool;
        }

        synchronized void append(HistoryEntry entry, int max) {
            entries.addLast(entry);
            while (entries.size() > max) {
                entries.removeFirst();
            }
        }

        synchronized List<HistoryEntry> snapshot() {
            return new ArrayList<>(entries);
        }

        synchronized int size() {
            return entries.size();
        }

        synchronized HistoryEntry last() {
            return entries.peekLast();
        }

        CommandHistory toHistory() {
            return CommandHistory.builder()
                    .uuid(uuid)
                    .terminalId(terminalId)
                    .tool(tool)
                    .commands(snapshot())
                    .build();
        }
    }

    public void addCommand(String uuid, String terminalId, CommandInfo info,
                           String output, String error, Integer exitCode, Long durationMs) {
        HistoryEntry entry = HistoryEntry.builder()
                .command(info.getCommand())
                .args(info.getArgs())
                .timestamp(info.getTimestamp())
                .exitCode(exitCode)
                .output(output)
                .error(error)
                .durationMs(durationMs)
                .build();

        terminalHistories.computeIfAbsent(uuid, k -> new ConcurrentHashMap<>())
                .computeIfAbsent(terminalId, k -> new Ledger(uuid, terminalId, TERMINAL_LEDGER))
                .append(entry, maxHistorySize);

        if (info.getTool() != null) {
            toolHistories.computeIfAbsent(uuid, k -> new ConcurrentHashMap<>())
                    .computeIfAbsent(info.getTool(), k -> new Ledger(uuid, ALL_TERMINALS, info.getTool()))
                    .append(entry, maxHistorySize);
        }
    }

    public CommandHistory getTerminalHistory(String uuid, String terminalId) {
        Ledger ledger = terminalHistories.getOrDefault(uuid, Map.of()).get(terminalId);
        return ledger == null ? null : ledger.toHistory();
    }

    public CommandHistory getToolHistory(String uuid, String tool) {
        Ledger ledger = toolHistories.getOrDefault(uuid, Map.of()).get(tool);
        return ledger == null ? null : ledger.toHistory();
    }

    public List<CommandHistory> getUserToolHistories(String uuid) {
        return toolHistories.getOrDefault(uuid, Map.of()).values().stream()
                .map(Ledger::toHistory)
                .sorted(Comparator.comparing(CommandHistory::getTool))
                .collect(Collectors.toList());
    }

    /**
     * Last {@code limit} commands for a tool, oldest first, without captured output.
     */
    public List<HistoryEntry> getRecentCommands(String uuid, String tool, int limit) {
        Ledger ledger = toolHistories.getOrDefault(uuid, Map.of()).get(tool);
        if (ledger == null || limit <= 0) {
            return List.of();
        }
        List<HistoryEntry> all = ledger.snapshot();
        return all.subList(Math.max(0, all.size() - limit), all.size()).stream()
                .map(e -> e.toBuilder().output(null).error(null).durationMs(null).build())
                .collect(Collectors.toList());
    }

    public HistoryStats getHistoryStats(String uuid) {
        Map<String, Integer> usage = new TreeMap<>();
        List<HistoryStats.ToolActivity> activity = new ArrayList<>();
        int total = 0;

        for (Ledger ledger : toolHistories.getOrDefault(uuid, Map.of()).values()) {
            int count = ledger.size();
            total += count;
            usage.put(ledger.tool, count);
            HistoryEntry last = ledger.last();
            if (last != null) {
                activity.add(new HistoryStats.ToolActivity(ledger.tool, count, last.getTimestamp()));
            }
        }
        activity.sort(Comparator.comparing(HistoryStats.ToolActivity::getLastUsed).reversed());

        return HistoryStats.builder()
                .totalCommands(total)
                .toolUsage(usage)
                .recentActivity(activity)
                .build();
    }

    public void clearUserHistory(String uuid) {
        terminalHistories.remove(uuid);
        toolHistories.remove(uuid);
        log.debug("History cleared for {}", uuid);
    }

    public boolean clearToolHistory(String uuid, String tool) {
        Map<String, Ledger> ledgers = toolHistories.get(uuid);
        return ledgers != null && ledgers.remove(tool) != null;
    }
}
