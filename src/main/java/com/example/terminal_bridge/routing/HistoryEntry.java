package com.example.terminal_bridge.routing;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HistoryEntry {
    private String command;
    private List<String> args;
    private Instant timestamp;
    private Integer exitCode;
    private String output;
    private String error;
    private Long durationMs;
}
