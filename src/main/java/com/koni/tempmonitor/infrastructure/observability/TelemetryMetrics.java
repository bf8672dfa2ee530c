package com.koni.tempmonitor.infrastructure.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Component for tracking ingestion and fan-out metrics.
 * Provides counters and timers for monitoring system behavior.
 */
@Slf4j
@Component
public class TelemetryMetrics {

    private final MeterRegistry registry;
    private final Counter framesReceived;
    private final Counter framesMalformed;
    private final Counter readingsAccepted;
    private final Counter sendFailures;
    private final Counter archiveFailures;
    private final Timer processingTime;

    public TelemetryMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.framesReceived = Counter.builder("telemetry.frames.received.total")
                .description("Total inbound frames received on device connections")
                .register(registry);

        this.framesMalformed = Counter.builder("telemetry.frames.malformed.total")
                .description("Total inbound frames dropped as malformed")
                .register(registry);

        this.readingsAccepted = Counter.builder("telemetry.readings.accepted.total")
                .description("Total temperature readings accepted into the registry")
                .tag("type", "temperature")
                .register(registry);

        this.sendFailures = Counter.builder("telemetry.broadcast.send_failures.total")
                .description("Total subscribers dropped after a failed send")
                .register(registry);

        this.archiveFailures = Counter.builder("telemetry.archive.failures.total")
                .description("Total readings that could not be handed to the history archive")
                .register(registry);

        this.processingTime = Timer.builder("telemetry.processing.time")
                .description("Time to process an accepted reading")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordFrameReceived() {
        framesReceived.increment();
    }

    public void recordMalformedFrame() {
        framesMalformed.increment();
        log.debug("Malformed frame counter incremented");
    }

    public void recordReadingAccepted() {
        readingsAccepted.increment();
    }

    /**
     * Increment the broadcast counter for the given event type.
     *
     * @param eventType wire type of the published event
     */
    public void recordBroadcast(String eventType) {
        Counter.builder("telemetry.broadcast.events.total")
                .description("Total events published to subscribers")
                .tag("type", eventType)
                .register(registry)
                .increment();
    }

    public void recordSendFailure() {
        sendFailures.increment();
        log.debug("Send failure counter incremented");
    }

    public void recordArchiveFailure() {
        archiveFailures.increment();
        log.debug("Archive failure counter incremented");
    }

    /**
     * Record the processing time for a telemetry operation.
     *
     * @param operation The operation to time
     * @param <T> The return type of the operation
     * @return The result of the operation
     */
    public <T> T recordProcessingTime(Supplier<T> operation) {
        return processingTime.record(operation);
    }

    /**
     * Record the processing time for a void operation.
     *
     * @param operation The operation to time
     */
    public void recordProcessingTime(Runnable operation) {
        processingTime.record(operation);
    }
}
