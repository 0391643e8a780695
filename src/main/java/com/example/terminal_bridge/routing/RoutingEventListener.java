package com.example.terminal_bridge.routing;

public interface RoutingEventListener {

    /**
     * A chunk produced by a running agent tool; {@code stream} is "stdout" or "stderr".
     */
    void onAgentOutput(String token, String terminalId, String tool, String chunk, String stream);

    void onCommandRouted(String token, String terminalId, RouteResult result);
}
