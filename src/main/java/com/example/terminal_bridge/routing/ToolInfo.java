package com.example.terminal_bridge.routing;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * A known command-line tool plus the result of its last detection probe.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolInfo {
    private String name;
    private String displayName;
    private ToolCategory category;
    private String description;
    // program looked up on PATH; differs from name for e.g. claude-code
    private String executable;
    @JsonIgnore
    private List<String> versionCommand;
    private String installUrl;
    private String installCommand;

    private String version;
    private String path;
    @JsonProperty("isInstalled")
    private boolean installed;
    @JsonProperty("isAvailable")
    private boolean available;
    private Instant lastChecked;
}
