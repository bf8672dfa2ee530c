package com.koni.tempmonitor.device;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Runs simulated sensor devices against the gateway, for demos and local
 * development without hardware.
 *
 * Enabled with {@code monitor.device-simulator.enabled=true}; sessions start once
 * the application is ready to accept connections.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "monitor.device-simulator.enabled", havingValue = "true")
public class DeviceSimulator {

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final URI serverUri;
    private final List<String> deviceIds;
    private final Duration interval;
    private final Duration reconnectBackoff;

    private final ScheduledExecutorService scheduler = Executors.newScheduledThreadPool(1);
    private final List<DeviceSession> sessions = new ArrayList<>();

    public DeviceSimulator(
            ObjectMapper objectMapper,
            Clock clock,
            @Value("${monitor.device-simulator.server-uri:ws://localhost:8080/ws/temperature}") URI serverUri,
            @Value("${monitor.device-simulator.device-ids:SIM-1}") List<String> deviceIds,
            @Value("${monitor.device-simulator.interval:PT2S}") Duration interval,
            @Value("${monitor.device-simulator.reconnect-backoff:PT5S}") Duration reconnectBackoff) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.serverUri = serverUri;
        this.deviceIds = deviceIds;
        this.interval = interval;
        this.reconnectBackoff = reconnectBackoff;
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        StandardWebSocketClient client = new StandardWebSocketClient();
        for (String deviceId : deviceIds) {
            DeviceSession session = new DeviceSession(
                    deviceId,
                    "Simulated sensor " + deviceId,
                    serverUri,
                    client,
                    SimulatedTemperatureSensor.withRandomBase(),
                    scheduler,
                    objectMapper,
                    clock,
                    interval,
                    reconnectBackoff
            );
            sessions.add(session);
            session.start();
        }
        log.info("Device simulator started {} sessions against {}", sessions.size(), serverUri);
    }

    public synchronized List<DeviceSession> getSessions() {
        return Collections.unmodifiableList(new ArrayList<>(sessions));
    }

    @PreDestroy
    public synchronized void stop() {
        sessions.forEach(DeviceSession::stop);
        sessions.clear();
        scheduler.shutdownNow();
        log.info("Device simulator stopped");
    }
}
