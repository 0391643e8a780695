package com.example.terminal_bridge.routing;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActiveProcessInfo {
    private String terminalId;
    private String uuid;
    private String tool;
    private String command;
    private long pid;
    private Instant startedAt;
}
