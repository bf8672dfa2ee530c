package com.koni.tempmonitor.infrastructure.websocket;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

/**
 * Registers the temperature WebSocket endpoint. Upgrade requests on any other
 * path are not served.
 */
@Slf4j
@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final TemperatureWebSocketHandler temperatureWebSocketHandler;

    @Value("${monitor.websocket.path:/ws/temperature}")
    private String path;

    @Value("${monitor.websocket.allowed-origins:*}")
    private String[] allowedOrigins;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(temperatureWebSocketHandler, path)
                .setAllowedOriginPatterns(allowedOrigins);
        log.info("Temperature WebSocket endpoint registered at {}", path);
    }
}
