package com.koni.tempmonitor.application.broadcast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.tempmonitor.domain.event.AlertEvent;
import com.koni.tempmonitor.domain.event.TelemetryUpdateEvent;
import com.koni.tempmonitor.domain.model.ConnectionState;
import com.koni.tempmonitor.domain.model.DeviceReading;
import com.koni.tempmonitor.infrastructure.observability.TelemetryMetrics;
import com.koni.tempmonitor.support.RecordingConnection;
import com.koni.tempmonitor.tags.UnitTest;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Unit tests for BroadcastRouter.
 * Tests fan-out completeness, late joiners, failing subscribers and state filtering.
 */
@UnitTest
class BroadcastRouterTest {

    private SubscriberSet subscriberSet;
    private SimpleMeterRegistry meterRegistry;
    private BroadcastRouter router;
    private final ObjectMapper objectMapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        subscriberSet = new SubscriberSet();
        meterRegistry = new SimpleMeterRegistry();
        router = new BroadcastRouter(subscriberSet, objectMapper, new TelemetryMetrics(meterRegistry));
    }

    @Test
    void shouldDeliverExactlyOneCopyToEveryOpenSubscriber() {
        // Given
        RecordingConnection first = new RecordingConnection("c1");
        RecordingConnection second = new RecordingConnection("c2");
        RecordingConnection third = new RecordingConnection("c3");
        subscriberSet.add(first);
        subscriberSet.add(second);
        subscriberSet.add(third);

        // When
        int delivered = router.publish(new AlertEvent("D1", "Fever detected", 1000L));

        // Then
        assertThat(delivered).isEqualTo(3);
        assertThat(first.getSent()).hasSize(1);
        assertThat(second.getSent()).containsExactlyElementsOf(first.getSent());
        assertThat(third.getSent()).containsExactlyElementsOf(first.getSent());
    }

    @Test
    void shouldReturnZeroWhenNobodyIsSubscribed() {
        int delivered = router.publish(new AlertEvent("D1", "Fever detected", 1000L));

        assertThat(delivered).isZero();
    }

    @Test
    void shouldSerializeTelemetryUpdateInWireFormat() throws Exception {
        // Given
        RecordingConnection subscriber = new RecordingConnection("c1");
        subscriberSet.add(subscriber);
        DeviceReading reading = new DeviceReading("D1", 24.5, 32.1, 1700000000000L);

        // When
        router.publish(new TelemetryUpdateEvent(reading, 1700000000500L));

        // Then
        JsonNode frame = objectMapper.readTree(subscriber.getSent().get(0));
        assertThat(frame.get("type").asText()).isEqualTo("temperature-update");
        assertThat(frame.get("timestamp").asLong()).isEqualTo(1700000000500L);
        assertThat(frame.get("data").get("deviceId").asText()).isEqualTo("D1");
        assertThat(frame.get("data").get("ambientTemp").asDouble()).isEqualTo(24.5);
        assertThat(frame.get("data").get("objectTemp").asDouble()).isEqualTo(32.1);
        assertThat(frame.get("data").get("timestamp").asLong()).isEqualTo(1700000000000L);
    }

    @Test
    void shouldSerializeAlertInWireFormat() throws Exception {
        RecordingConnection subscriber = new RecordingConnection("c1");
        subscriberSet.add(subscriber);

        router.publish(new AlertEvent("D7", "Sensor detached", 42L));

        JsonNode frame = objectMapper.readTree(subscriber.getSent().get(0));
        assertThat(frame.get("type").asText()).isEqualTo("alert");
        assertThat(frame.get("deviceId").asText()).isEqualTo("D7");
        assertThat(frame.get("message").asText()).isEqualTo("Sensor detached");
        assertThat(frame.get("timestamp").asLong()).isEqualTo(42L);
    }

    @Test
    void lateJoinerShouldOnlyReceiveEventsPublishedAfterJoining() {
        // Given
        RecordingConnection early = new RecordingConnection("early");
        subscriberSet.add(early);
        router.publish(new AlertEvent("D1", "first", 1L));

        // When
        RecordingConnection late = new RecordingConnection("late");
        subscriberSet.add(late);
        router.publish(new AlertEvent("D1", "second", 2L));
        router.publish(new AlertEvent("D1", "third", 3L));

        // Then
        assertThat(early.getSent()).hasSize(3);
        assertThat(late.getSent()).hasSize(2);
        assertThat(late.getSent().get(0)).contains("second");
        assertThat(late.getSent().get(1)).contains("third");
    }

    @Test
    void failingSubscriberShouldNotPreventDeliveryToOthers() {
        // Given
        RecordingConnection broken = new RecordingConnection("broken");
        RecordingConnection healthy = new RecordingConnection("healthy");
        broken.failSends();
        subscriberSet.add(broken);
        subscriberSet.add(healthy);

        // When
        int delivered = router.publish(new AlertEvent("D1", "Fever detected", 1000L));

        // Then
        assertThat(delivered).isEqualTo(1);
        assertThat(healthy.getSent()).hasSize(1);
        assertThat(subscriberSet.contains(broken)).isFalse();
        assertThat(subscriberSet.contains(healthy)).isTrue();
        assertThat(broken.getCloseCount()).isEqualTo(1);
        assertThat(meterRegistry.find("telemetry.broadcast.send_failures.total").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldSkipSubscribersThatAreNotOpen() {
        // Given
        RecordingConnection closing = new RecordingConnection("closing");
        closing.setState(ConnectionState.CLOSING);
        RecordingConnection closed = new RecordingConnection("closed");
        closed.setState(ConnectionState.CLOSED);
        RecordingConnection open = new RecordingConnection("open");
        subscriberSet.add(closing);
        subscriberSet.add(closed);
        subscriberSet.add(open);

        // When
        int delivered = router.publish(new AlertEvent("D1", "Fever detected", 1000L));

        // Then
        assertThat(delivered).isEqualTo(1);
        assertThat(closing.getSent()).isEmpty();
        assertThat(closed.getSent()).isEmpty();
        assertThat(open.getSent()).hasSize(1);
        assertThat(subscriberSet.size()).isEqualTo(3);
    }

    @Test
    void shouldDeliverEventsInPublishOrder() {
        RecordingConnection subscriber = new RecordingConnection("c1");
        subscriberSet.add(subscriber);

        for (int i = 0; i < 5; i++) {
            router.publish(new AlertEvent("D1", "alert-" + i, i));
        }

        assertThat(subscriber.getSent()).hasSize(5);
        for (int i = 0; i < 5; i++) {
            assertThat(subscriber.getSent().get(i)).contains("alert-" + i);
        }
    }

    @Test
    void concurrentPublishersShouldProduceTheSameOrderForEverySubscriber() throws Exception {
        // Given
        CountDownLatch firstSendStarted = new CountDownLatch(1);
        CountDownLatch resumeFirstSend = new CountDownLatch(1);
        AtomicBoolean paused = new AtomicBoolean();
        PausingConnection first = new PausingConnection("c1", paused, firstSendStarted, resumeFirstSend);
        PausingConnection second = new PausingConnection("c2", paused, firstSendStarted, resumeFirstSend);
        subscriberSet.add(first);
        subscriberSet.add(second);

        Thread earlier = new Thread(() -> router.publish(new AlertEvent("D1", "E1", 1L)));
        Thread later = new Thread(() -> router.publish(new AlertEvent("D1", "E2", 2L)));

        try {
            // When
            earlier.start();
            assertThat(firstSendStarted.await(2, TimeUnit.SECONDS)).isTrue();
            later.start();
            await().atMost(2, TimeUnit.SECONDS).until(() -> later.getState() == Thread.State.BLOCKED);
            resumeFirstSend.countDown();
            earlier.join(2000);
            later.join(2000);

            // Then
            assertThat(first.getSent()).hasSize(2);
            assertThat(first.getSent().get(0)).contains("E1");
            assertThat(first.getSent().get(1)).contains("E2");
            assertThat(second.getSent()).containsExactlyElementsOf(first.getSent());
        } finally {
            resumeFirstSend.countDown();
        }
    }

    @Test
    void shouldCountBroadcastsPerEventType() {
        router.publish(new AlertEvent("D1", "a", 1L));
        router.publish(new TelemetryUpdateEvent(new DeviceReading("D1", 20.0, 36.0, 1L), 2L));
        router.publish(new TelemetryUpdateEvent(new DeviceReading("D1", 20.0, 36.1, 3L), 4L));

        assertThat(meterRegistry.find("telemetry.broadcast.events.total").tag("type", "alert").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.find("telemetry.broadcast.events.total").tag("type", "temperature-update").counter().count())
                .isEqualTo(2.0);
    }

    /**
     * Holds the very first send across all instances sharing the flag until released.
     */
    private static final class PausingConnection extends RecordingConnection {

        private final AtomicBoolean paused;
        private final CountDownLatch started;
        private final CountDownLatch resume;

        PausingConnection(String id, AtomicBoolean paused, CountDownLatch started, CountDownLatch resume) {
            super(id);
            this.paused = paused;
            this.started = started;
            this.resume = resume;
        }

        @Override
        public void send(String payload) throws IOException {
            super.send(payload);
            if (paused.compareAndSet(false, true)) {
                started.countDown();
                try {
                    resume.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IOException("Interrupted while paused", e);
                }
            }
        }
    }
}
