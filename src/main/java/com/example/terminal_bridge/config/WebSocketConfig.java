package com.example.terminal_bridge.config;

import com.example.terminal_bridge.handler.BridgeWebSocketHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.HandshakeInterceptor;

import java.net.InetSocketAddress;
import java.util.Map;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
@Slf4j
public class WebSocketConfig implements WebSocketConfigurer {

    private final BridgeWebSocketHandler bridgeHandler;
    private final BridgeProperties properties;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        BridgeProperties.Connection connection = properties.getConnection();
        registry.addHandler(bridgeHandler, connection.getPath())
                .addInterceptors(new LoopbackHandshakeInterceptor())
                .setAllowedOriginPatterns(connection.getAllowedOriginPatterns().toArray(new String[0]));
    }

    /**
     * Flags handshakes that originate from the local machine so the handler can
     * decide whether to skip the auth frame.
     */
    static class LoopbackHandshakeInterceptor implements HandshakeInterceptor {

        @Override
        public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                       WebSocketHandler wsHandler, Map<String, Object> attributes) {
            InetSocketAddress remote = request.getRemoteAddress();
            boolean loopback = remote != null && remote.getAddress() != null && remote.getAddress().isLoopbackAddress();
            attributes.put(BridgeWebSocketHandler.LOOPBACK_ATTRIBUTE, loopback);
            log.debug("🤝 Handshake from {} (loopback={})", remote, loopback);
            return true;
        }

        @Override
        public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Exception exception) {
            if (exception != null) {
                log.error("❌ Bridge WebSocket handshake failed", exception);
            }
        }
    }
}
