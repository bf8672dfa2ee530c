package com.koni.tempmonitor.application.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.tempmonitor.application.broadcast.BroadcastRouter;
import com.koni.tempmonitor.application.broadcast.SubscriberSet;
import com.koni.tempmonitor.application.port.Connection;
import com.koni.tempmonitor.application.port.EventPublisher;
import com.koni.tempmonitor.domain.event.TelemetryRecorded;
import com.koni.tempmonitor.domain.event.TelemetryUpdateEvent;
import com.koni.tempmonitor.domain.exception.MalformedFrameException;
import com.koni.tempmonitor.domain.model.DeviceReading;
import com.koni.tempmonitor.domain.repository.DeviceRegistry;
import com.koni.tempmonitor.infrastructure.observability.TelemetryMetrics;
import io.micrometer.observation.annotation.Observed;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;

/**
 * Single entry point for every transport connection.
 *
 * Responsibilities:
 * - Register accepted connections as subscribers
 * - Decode inbound frames and dispatch them by type
 * - Update the device registry and broadcast accepted readings
 * - Hand accepted readings to the history archive (fire-and-forget)
 * - Remove closed connections from the subscriber set
 *
 * Any failure caused by one frame stays inside that frame's handling: the
 * connection remains open and no other connection is affected.
 */
@Slf4j
@Service
public class IngestionGateway {

    private final SubscriberSet subscriberSet;
    private final DeviceRegistry deviceRegistry;
    private final BroadcastRouter broadcastRouter;
    private final EventPublisher eventPublisher;
    private final FrameDecoder frameDecoder;
    private final ObjectMapper objectMapper;
    private final TelemetryMetrics telemetryMetrics;
    private final Clock clock;
    private final String handshakeMessage;

    public IngestionGateway(
            SubscriberSet subscriberSet,
            DeviceRegistry deviceRegistry,
            BroadcastRouter broadcastRouter,
            EventPublisher eventPublisher,
            FrameDecoder frameDecoder,
            ObjectMapper objectMapper,
            TelemetryMetrics telemetryMetrics,
            Clock clock,
            @Value("${monitor.gateway.handshake-message:Welcome to Temperature Monitor}") String handshakeMessage) {
        this.subscriberSet = subscriberSet;
        this.deviceRegistry = deviceRegistry;
        this.broadcastRouter = broadcastRouter;
        this.eventPublisher = eventPublisher;
        this.frameDecoder = frameDecoder;
        this.objectMapper = objectMapper;
        this.telemetryMetrics = telemetryMetrics;
        this.clock = clock;
        this.handshakeMessage = handshakeMessage;
    }

    /**
     * Accepts a new connection. From now on it receives every broadcast.
     *
     * @param connection the connection that was just opened
     */
    public void accept(Connection connection) {
        subscriberSet.add(connection);
        log.info("Connection accepted: connectionId={}, subscribers={}",
                connection.getId(), subscriberSet.size());
    }

    /**
     * Handles one inbound frame from a connection.
     * Malformed frames are dropped and logged, unknown frame types are ignored.
     *
     * @param connection the connection the frame arrived on
     * @param payload the frame text, UTF-8 decoded
     */
    @Observed(name = "gateway.frame", contextualName = "handle-frame")
    public void onFrame(Connection connection, String payload) {
        long receivedAt = clock.millis();
        telemetryMetrics.recordFrameReceived();

        InboundFrame frame;
        try {
            frame = frameDecoder.decode(payload, receivedAt);
        } catch (MalformedFrameException e) {
            telemetryMetrics.recordMalformedFrame();
            log.warn("Dropping malformed frame: connectionId={}, reason={}", connection.getId(), e.getMessage());
            return;
        }

        switch (frame.getKind()) {
            case HANDSHAKE -> handleHandshake(connection, (HandshakeFrame) frame);
            case TEMPERATURE -> handleTemperature(connection, (TemperatureFrame) frame);
            default -> log.debug("Ignoring frame of unknown type: connectionId={}, type={}",
                    connection.getId(), ((UnknownFrame) frame).getType());
        }
    }

    /**
     * Removes a closed connection from the subscriber set. Calling it again for
     * the same connection has no further effect.
     *
     * @param connection the connection that closed
     */
    public void onClose(Connection connection) {
        if (subscriberSet.remove(connection)) {
            log.info("Connection closed: connectionId={}, subscribers={}",
                    connection.getId(), subscriberSet.size());
        } else {
            log.debug("Connection already removed: connectionId={}", connection.getId());
        }
    }

    private void handleHandshake(Connection connection, HandshakeFrame frame) {
        log.info("Handshake received: connectionId={}, deviceId={}, deviceName={}",
                connection.getId(), frame.getDeviceId(), frame.getDeviceName());

        HandshakeAck ack = new HandshakeAck(handshakeMessage, clock.millis());
        try {
            connection.send(objectMapper.writeValueAsString(ack));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize handshake acknowledgement", e);
        } catch (IOException e) {
            log.warn("Failed to send handshake acknowledgement: connectionId={}, error={}",
                    connection.getId(), e.getMessage());
        }
    }

    private void handleTemperature(Connection connection, TemperatureFrame frame) {
        DeviceReading reading = frame.toReading();

        telemetryMetrics.recordProcessingTime(() -> {
            deviceRegistry.update(reading);
            telemetryMetrics.recordReadingAccepted();
            log.debug("Reading accepted: connectionId={}, deviceId={}, ambientTemp={}, objectTemp={}",
                    connection.getId(), reading.getDeviceId(), reading.getAmbientTemp(), reading.getObjectTemp());

            broadcastRouter.publish(new TelemetryUpdateEvent(reading, clock.millis()));
            archive(reading);
        });
    }

    private void archive(DeviceReading reading) {
        try {
            eventPublisher.publish(TelemetryRecorded.of(reading, clock.instant()));
        } catch (RuntimeException e) {
            telemetryMetrics.recordArchiveFailure();
            log.error("Archive hand-off failed, reading kept in registry only: deviceId={}",
                    reading.getDeviceId(), e);
        }
    }
}
