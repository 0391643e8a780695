package com.example.terminal_bridge.routing;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ToolCategory {
    @JsonProperty("ai") AI,
    @JsonProperty("development") DEVELOPMENT,
    @JsonProperty("devops") DEVOPS,
    @JsonProperty("system") SYSTEM,
    @JsonProperty("database") DATABASE,
    @JsonProperty("cloud") CLOUD,
    @JsonProperty("unknown") UNKNOWN
}
