package com.example.terminal_bridge.terminal;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResourceUsage {
    private int activeSessions;
    private int totalSessions;
    private int maxSessionsPerToken;
    private int maxSessionsGlobal;
    private long heapUsedBytes;
    private long heapCommittedBytes;
    private long heapMaxBytes;
    private long memoryCeilingBytes;
    private boolean underMemoryPressure;
}
