package com.example.terminal_bridge.routing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Snapshot of one ledger. Terminal ledgers carry {@code tool = "terminal"},
 * tool ledgers carry {@code terminalId = "all"}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommandHistory {
    private String uuid;
    private String terminalId;
    private String tool;
    private List<HistoryEntry> commands;
}
