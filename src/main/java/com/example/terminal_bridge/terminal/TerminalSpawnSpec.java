package com.example.terminal_bridge.terminal;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class TerminalSpawnSpec {
    List<String> command;
    String workingDirectory;
    Map<String, String> environment;
    int cols;
    int rows;
}
