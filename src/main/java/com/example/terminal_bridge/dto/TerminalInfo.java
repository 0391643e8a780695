package com.example.terminal_bridge.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Wire view of one terminal slot; never carries the process handle.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TerminalInfo {
    private String id;
    private String terminalId;
    private String name;
    private String color;
    @JsonProperty("isActive")
    private boolean active;
    private Instant createdAt;
    private Instant lastActivity;
    private int cols;
    private int rows;
}
