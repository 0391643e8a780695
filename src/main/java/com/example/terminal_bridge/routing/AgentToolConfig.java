package com.example.terminal_bridge.routing;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Execution parameters for a program treated as an interactive agent tool.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentToolConfig {

    public enum InterceptMode {
        @JsonProperty("full") FULL,
        @JsonProperty("commands") COMMANDS,
        @JsonProperty("none") NONE
    }

    public enum ResponseFormat {
        @JsonProperty("streaming") STREAMING,
        @JsonProperty("batch") BATCH,
        @JsonProperty("json") JSON
    }

    private String name;
    @NotBlank
    private String executable;
    @Builder.Default
    private List<String> args = new ArrayList<>();
    @Builder.Default
    private InterceptMode interceptMode = InterceptMode.FULL;
    @Builder.Default
    private ResponseFormat responseFormat = ResponseFormat.STREAMING;
    @Positive
    @Builder.Default
    private long timeoutMs = 300_000;
}
