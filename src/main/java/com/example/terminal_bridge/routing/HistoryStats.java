package com.example.terminal_bridge.routing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HistoryStats {
    private int totalCommands;
    private Map<String, Integer> toolUsage;
    // most recently used first
    private List<ToolActivity> recentActivity;

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class ToolActivity {
        private String tool;
        private int count;
        private Instant lastUsed;
    }
}
