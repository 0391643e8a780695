package com.example.terminal_bridge.routing;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommandInfo {
    private String command;
    private List<String> args;
    // null when the program matched nothing in the registry
    private String tool;
    private ToolInfo toolInfo;
    @JsonProperty("isAgentTool")
    private boolean agentTool;
    private ToolCategory category;
    private Instant timestamp;
}
