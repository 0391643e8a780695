package com.example.terminal_bridge.routing;

import com.example.terminal_bridge.exception.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RouteResult {
    private boolean success;
    // false when the line fell through to the raw shell
    private boolean handled;
    private String output;
    private String error;
    private ErrorCode errorCode;
    private Integer exitCode;
    private long durationMs;
    private CommandInfo commandInfo;
}
