package com.koni.tempmonitor.infrastructure.messaging;

import com.koni.tempmonitor.application.port.EventPublisher;
import com.koni.tempmonitor.domain.event.TelemetryRecorded;
import com.koni.tempmonitor.infrastructure.observability.TelemetryMetrics;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Kafka implementation of the EventPublisher port, protected by a circuit breaker.
 * Hands TelemetryRecorded events to the history storage collaborator.
 *
 * Features:
 * - Fire-and-forget: the send runs on the archive executor and the caller never waits
 * - Circuit Breaker protection so an unavailable broker fails fast
 * - Uses deviceId as partition key to maintain ordering per device
 * - Failures are logged and counted, never propagated to ingestion
 */
@Slf4j
@Service
public class KafkaArchivePublisher implements EventPublisher {

    private final KafkaTemplate<String, TelemetryRecorded> kafkaTemplate;
    private final CircuitBreaker circuitBreaker;
    private final Executor archiveExecutor;
    private final TelemetryMetrics telemetryMetrics;
    private final String topic;

    public KafkaArchivePublisher(
            KafkaTemplate<String, TelemetryRecorded> kafkaTemplate,
            CircuitBreaker archiveCircuitBreaker,
            @Qualifier("archiveExecutor") Executor archiveExecutor,
            TelemetryMetrics telemetryMetrics,
            @Value("${monitor.archive.kafka.topic}") String topic) {
        this.kafkaTemplate = kafkaTemplate;
        this.circuitBreaker = archiveCircuitBreaker;
        this.archiveExecutor = archiveExecutor;
        this.telemetryMetrics = telemetryMetrics;
        this.topic = topic;

        registerCircuitBreakerEventListeners();
    }

    /**
     * Starts publishing a TelemetryRecorded event and returns immediately.
     *
     * @param event the TelemetryRecorded event to publish
     * @throws IllegalArgumentException if event is null
     */
    @Override
    public void publish(TelemetryRecorded event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }

        log.debug("Archiving reading: deviceId={}, eventId={}", event.getDeviceId(), event.getEventId());

        Supplier<CompletionStage<SendResult<String, TelemetryRecorded>>> decoratedSend =
                CircuitBreaker.decorateCompletionStage(circuitBreaker, () -> sendAsync(event));

        decoratedSend.get().whenComplete((result, error) -> {
            if (error == null) {
                log.debug("Reading archived: topic={}, partition={}, offset={}, deviceId={}",
                        topic,
                        result.getRecordMetadata().partition(),
                        result.getRecordMetadata().offset(),
                        event.getDeviceId());
                return;
            }
            handleFailure(event, unwrap(error));
        });
    }

    private CompletionStage<SendResult<String, TelemetryRecorded>> sendAsync(TelemetryRecorded event) {
        return CompletableFuture
                .supplyAsync(() -> kafkaTemplate.send(topic, event.getDeviceId(), event), archiveExecutor)
                .thenCompose(future -> future);
    }

    private void handleFailure(TelemetryRecorded event, Throwable error) {
        telemetryMetrics.recordArchiveFailure();
        if (error instanceof CallNotPermittedException) {
            log.warn("Circuit breaker is OPEN, reading not archived: deviceId={}, eventId={}",
                    event.getDeviceId(), event.getEventId());
        } else {
            log.error("Failed to archive reading: deviceId={}, eventId={}",
                    event.getDeviceId(), event.getEventId(), error);
        }
    }

    private static Throwable unwrap(Throwable error) {
        if (error instanceof CompletionException && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    /**
     * Logs circuit breaker state transitions for observability.
     */
    private void registerCircuitBreakerEventListeners() {
        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.warn(
                        "Archive circuit breaker state transition: {} -> {} (failure rate: {}%)",
                        event.getStateTransition().getFromState(),
                        event.getStateTransition().getToState(),
                        circuitBreaker.getMetrics().getFailureRate()))
                .onCallNotPermitted(event -> log.debug("Archive circuit breaker call not permitted (circuit is OPEN)"));
    }
}
