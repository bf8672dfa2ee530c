package com.koni.tempmonitor.application.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.tempmonitor.application.port.Connection;
import com.koni.tempmonitor.domain.event.BroadcastEvent;
import com.koni.tempmonitor.domain.model.ConnectionState;
import com.koni.tempmonitor.infrastructure.observability.TelemetryMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

/**
 * Delivers broadcast events to every open member of the subscriber set.
 *
 * Delivery is best effort:
 * - the event is serialized once and the same payload goes to every subscriber
 * - connections that are not OPEN are skipped
 * - a failed send drops that subscriber and never fails the publish call
 * - subscribers joining after the snapshot is taken do not see the event
 *
 * Publishes are serialized so every subscriber sees events in the same order.
 * {@link Connection#send(String)} only queues the payload, so the lock is never
 * held across a network write.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BroadcastRouter {

    private final SubscriberSet subscriberSet;
    private final ObjectMapper objectMapper;
    private final TelemetryMetrics telemetryMetrics;

    private final Object publishLock = new Object();

    /**
     * Publishes an event to the subscribers connected at the time of the call.
     *
     * @param event the event to fan out
     * @return the number of subscribers the payload was handed to
     */
    public int publish(BroadcastEvent event) {
        String payload = serialize(event);

        int delivered = 0;
        int targetCount;
        synchronized (publishLock) {
            List<Connection> targets = subscriberSet.snapshot();
            targetCount = targets.size();
            for (Connection connection : targets) {
                if (connection.getState() != ConnectionState.OPEN) {
                    log.debug("Skipping subscriber not open: connectionId={}, state={}",
                            connection.getId(), connection.getState());
                    continue;
                }
                try {
                    connection.send(payload);
                    delivered++;
                } catch (IOException | RuntimeException e) {
                    dropSubscriber(connection, e);
                }
            }
        }

        telemetryMetrics.recordBroadcast(event.getType());
        log.debug("Published {} event to {} of {} subscribers", event.getType(), delivered, targetCount);
        return delivered;
    }

    private void dropSubscriber(Connection connection, Exception cause) {
        log.warn("Send failed, dropping subscriber: connectionId={}, error={}",
                connection.getId(), cause.getMessage());
        telemetryMetrics.recordSendFailure();
        subscriberSet.remove(connection);
        connection.close();
    }

    private String serialize(BroadcastEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize " + event.getType() + " event", e);
        }
    }
}
