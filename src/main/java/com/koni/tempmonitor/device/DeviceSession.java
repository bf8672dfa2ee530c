package com.koni.tempmonitor.device;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Client side of one sensor device's connection to the ingestion gateway.
 *
 * Once started the session keeps itself connected:
 * - on connect it sends one handshake frame, then a temperature frame every interval
 * - any transport error or close moves it back to DISCONNECTED
 * - while running, a DISCONNECTED session reconnects after a fixed backoff
 *
 * The gateway does not require the handshake before telemetry, so a lost
 * handshake does not affect the readings that follow it.
 */
@Slf4j
public class DeviceSession {

    private final String deviceId;
    private final String deviceName;
    private final URI serverUri;
    private final WebSocketClient client;
    private final TemperatureSensor sensor;
    private final ScheduledExecutorService scheduler;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration interval;
    private final Duration reconnectBackoff;

    private final AtomicReference<DeviceSessionState> state = new AtomicReference<>(DeviceSessionState.DISCONNECTED);
    private final Object sendLock = new Object();
    private volatile boolean running;
    private volatile WebSocketSession session;
    private volatile ScheduledFuture<?> telemetryTask;

    public DeviceSession(
            String deviceId,
            String deviceName,
            URI serverUri,
            WebSocketClient client,
            TemperatureSensor sensor,
            ScheduledExecutorService scheduler,
            ObjectMapper objectMapper,
            Clock clock,
            Duration interval,
            Duration reconnectBackoff) {
        this.deviceId = deviceId;
        this.deviceName = deviceName;
        this.serverUri = serverUri;
        this.client = client;
        this.sensor = sensor;
        this.scheduler = scheduler;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.interval = interval;
        this.reconnectBackoff = reconnectBackoff;
    }

    /**
     * Starts connecting. Calling start on a running session has no effect.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        connect();
    }

    /**
     * Stops the session: no further readings and no reconnect.
     */
    public synchronized void stop() {
        running = false;
        cancelTelemetry();
        WebSocketSession current = session;
        session = null;
        state.set(DeviceSessionState.DISCONNECTED);
        if (current != null && current.isOpen()) {
            try {
                current.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                log.debug("Error closing device session: deviceId={}, error={}", deviceId, e.getMessage());
            }
        }
        log.info("Device session stopped: deviceId={}", deviceId);
    }

    public DeviceSessionState getState() {
        return state.get();
    }

    public String getDeviceId() {
        return deviceId;
    }

    private void connect() {
        if (!running || !state.compareAndSet(DeviceSessionState.DISCONNECTED, DeviceSessionState.CONNECTING)) {
            return;
        }
        log.info("Connecting device session: deviceId={}, uri={}", deviceId, serverUri);

        try {
            client.execute(new SessionHandler(), new WebSocketHttpHeaders(), serverUri)
                    .whenComplete((established, error) -> {
                        if (error != null) {
                            log.warn("Device connection failed: deviceId={}, error={}", deviceId, error.getMessage());
                            onDisconnected();
                        }
                    });
        } catch (RuntimeException e) {
            log.warn("Device connection could not be started: deviceId={}, error={}", deviceId, e.getMessage());
            onDisconnected();
        }
    }

    private void onConnected(WebSocketSession established) {
        if (!running) {
            try {
                established.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                log.debug("Error closing late device session: deviceId={}, error={}", deviceId, e.getMessage());
            }
            return;
        }
        session = established;
        state.set(DeviceSessionState.CONNECTED);
        log.info("Device session connected: deviceId={}, sessionId={}", deviceId, established.getId());

        ObjectNode handshake = objectMapper.createObjectNode()
                .put("type", "handshake")
                .put("deviceId", deviceId)
                .put("deviceName", deviceName);
        send(handshake);
        if (session != established) {
            return;
        }

        long periodMs = interval.toMillis();
        telemetryTask = scheduler.scheduleAtFixedRate(this::sendReading, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    private void onDisconnected() {
        DeviceSessionState previous = state.getAndSet(DeviceSessionState.DISCONNECTED);
        if (previous == DeviceSessionState.DISCONNECTED) {
            return;
        }
        cancelTelemetry();
        session = null;

        if (running) {
            log.info("Device session disconnected, reconnecting in {} ms: deviceId={}",
                    reconnectBackoff.toMillis(), deviceId);
            scheduler.schedule(this::connect, reconnectBackoff.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    private void sendReading() {
        SensorSample sample = sensor.read();
        ObjectNode frame = objectMapper.createObjectNode()
                .put("type", "temperature")
                .put("deviceId", deviceId)
                .put("ambientTemp", sample.getAmbientTemp())
                .put("objectTemp", sample.getObjectTemp())
                .put("timestamp", clock.millis());
        send(frame);
    }

    private void send(ObjectNode frame) {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            return;
        }
        try {
            String payload = objectMapper.writeValueAsString(frame);
            synchronized (sendLock) {
                current.sendMessage(new TextMessage(payload));
            }
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize device frame", e);
        } catch (IOException | RuntimeException e) {
            log.warn("Device send failed, closing session: deviceId={}, error={}", deviceId, e.getMessage());
            try {
                current.close(CloseStatus.SESSION_NOT_RELIABLE);
            } catch (IOException closeError) {
                log.debug("Error closing device session: deviceId={}, error={}", deviceId, closeError.getMessage());
            }
            onDisconnected();
        }
    }

    private void cancelTelemetry() {
        ScheduledFuture<?> task = telemetryTask;
        telemetryTask = null;
        if (task != null) {
            task.cancel(false);
        }
    }

    private final class SessionHandler extends TextWebSocketHandler {

        @Override
        public void afterConnectionEstablished(WebSocketSession established) {
            onConnected(established);
        }

        @Override
        protected void handleTextMessage(WebSocketSession ws, TextMessage message) {
            log.debug("Device received frame: deviceId={}, payload={}", deviceId, message.getPayload());
        }

        @Override
        public void handleTransportError(WebSocketSession ws, Throwable exception) {
            log.warn("Device transport error: deviceId={}, error={}", deviceId, exception.getMessage());
        }

        @Override
        public void afterConnectionClosed(WebSocketSession ws, CloseStatus status) {
            log.debug("Device connection closed: deviceId={}, status={}", deviceId, status);
            onDisconnected();
        }
    }
}
