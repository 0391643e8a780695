package com.example.terminal_bridge.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecuteCommandRequest {
    @NotBlank
    private String uuid;
    @NotBlank
    private String terminalId;
    @NotBlank
    private String command;
    private String workingDirectory;
}
