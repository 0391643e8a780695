package com.example.terminal_bridge.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One JSON frame on the bridge socket, in either direction.
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class BridgeMessage {
    private String type;
    private String uuid;
    private String terminalId;
    private String targetTerminalId;
    private String sourceTerminalId;
    // string for terminal I/O and errors, object for everything else
    private Object data;
    private Long timestamp;
    private String command;
    private String tool;
    private String workingDirectory;
    private Integer limit;
}
