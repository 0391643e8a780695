package com.example.terminal_bridge.dto;

public final class MessageType {

    private MessageType() {
    }

    // inbound
    public static final String AUTH = "auth";
    public static final String TERMINAL_INPUT = "terminal_input";
    public static final String TERMINAL_RESIZE = "terminal_resize";
    public static final String TERMINAL_CREATE = "terminal_create";
    public static final String TERMINAL_CLOSE = "terminal_close";
    public static final String TERMINAL_LIST = "terminal_list";
    public static final String TERMINAL_BROADCAST = "terminal_broadcast";
    public static final String COMMAND_ROUTE = "command_route";
    public static final String COMMAND_PARSE = "command_parse";
    public static final String COMMAND_HISTORY = "command_history";
    public static final String COMMAND_KILL = "command_kill";
    public static final String TOOL_HISTORY = "tool_history";
    public static final String PING = "ping";
    public static final String PONG = "pong";

    // outbound
    public static final String AUTH_SUCCESS = "auth_success";
    public static final String AUTH_ERROR = "auth_error";
    public static final String TERMINAL_CREATED = "terminal_created";
    public static final String TERMINAL_CLOSED = "terminal_closed";
    public static final String TERMINAL_OUTPUT = "terminal_output";
    public static final String TERMINAL_EXIT = "terminal_exit";
    public static final String TERMINAL_MESSAGE = "terminal_message";
    public static final String COMMAND_RESULT = "command_result";
    public static final String COMMAND_ROUTED = "command_routed";
    public static final String COMMAND_PARSED = "command_parsed";
    public static final String COMMAND_HISTORY_RESULT = "command_history_result";
    public static final String COMMAND_KILLED = "command_killed";
    public static final String TOOL_HISTORY_RESULT = "tool_history_result";
    public static final String TOOL_HISTORIES_RESULT = "tool_histories_result";
    public static final String AGENT_OUTPUT = "agent_output";
    public static final String ERROR = "error";
}
