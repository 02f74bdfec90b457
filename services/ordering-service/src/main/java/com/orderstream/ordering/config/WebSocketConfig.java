package com.orderstream.ordering.config;

import com.orderstream.ordering.infrastructure.websocket.ChangeStreamWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final ChangeStreamWebSocketHandler handler;
    private final SyncProperties syncProperties;

    public WebSocketConfig(ChangeStreamWebSocketHandler handler, SyncProperties syncProperties) {
        this.handler = handler;
        this.syncProperties = syncProperties;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, syncProperties.websocketPath())
                .setAllowedOriginPatterns(syncProperties.allowedOrigins().toArray(String[]::new));
    }
}
