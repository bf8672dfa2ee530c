package com.koni.tempmonitor.infrastructure.websocket;

import com.koni.tempmonitor.application.ingestion.IngestionGateway;
import com.koni.tempmonitor.application.port.Connection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Binds WebSocket sessions on the temperature endpoint to the ingestion gateway.
 * Every session becomes a {@link WebSocketConnection}; text and binary frames are
 * both handed over as UTF-8 text.
 */
@Slf4j
@Component
public class TemperatureWebSocketHandler extends AbstractWebSocketHandler {

    static final String CONNECTION_ATTRIBUTE = "tempmonitor.connection";

    private final IngestionGateway gateway;
    private final Executor outboundExecutor;
    private final int maxPending;
    private final Duration sendTimeLimit;

    public TemperatureWebSocketHandler(
            IngestionGateway gateway,
            @Qualifier("outboundExecutor") Executor outboundExecutor,
            @Value("${monitor.websocket.outbound.max-pending:64}") int maxPending,
            @Value("${monitor.websocket.outbound.send-time-limit:PT10S}") Duration sendTimeLimit) {
        this.gateway = gateway;
        this.outboundExecutor = outboundExecutor;
        this.maxPending = maxPending;
        this.sendTimeLimit = sendTimeLimit;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketConnection connection = new WebSocketConnection(session, outboundExecutor, maxPending, sendTimeLimit);
        session.getAttributes().put(CONNECTION_ATTRIBUTE, connection);
        gateway.accept(connection);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Connection connection = connectionOf(session);
        if (connection != null) {
            gateway.onFrame(connection, message.getPayload());
        }
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        Connection connection = connectionOf(session);
        if (connection != null) {
            gateway.onFrame(connection, StandardCharsets.UTF_8.decode(message.getPayload()).toString());
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error: sessionId={}, error={}", session.getId(), exception.getMessage());
        Connection connection = connectionOf(session);
        if (connection != null) {
            gateway.onClose(connection);
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        log.debug("Session closed: sessionId={}, status={}", session.getId(), status);
        Connection connection = connectionOf(session);
        if (connection != null) {
            gateway.onClose(connection);
        }
    }

    private static Connection connectionOf(WebSocketSession session) {
        return (Connection) session.getAttributes().get(CONNECTION_ATTRIBUTE);
    }
}
