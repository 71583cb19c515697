package com.codereview.orchestrator.config;

import com.codereview.orchestrator.api.ProgressWebSocketHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Plain WebSocket (no STOMP) endpoint for live review progress.
 *
 * Allowed origins come from {@code codereview.websocket.allowed-origins},
 * a comma-separated list of origin patterns.
 */
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ProgressWebSocketHandler handler;
    private final String[]                 allowedOrigins;

    public WebSocketConfig(ProgressWebSocketHandler handler,
                           @Value("${codereview.websocket.allowed-origins:*}") String allowedOrigins) {
        this.handler        = handler;
        this.allowedOrigins = allowedOrigins.split(",");
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, "/ws/review/*")
                .setAllowedOriginPatterns(allowedOrigins);
    }
}
