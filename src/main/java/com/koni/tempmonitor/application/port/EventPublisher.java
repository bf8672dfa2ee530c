package com.koni.tempmonitor.application.port;

import com.koni.tempmonitor.domain.event.TelemetryRecorded;

/**
 * Port interface for handing accepted readings to the history storage collaborator.
 * This interface follows the Hexagonal Architecture pattern, defining an output port
 * that is implemented by an infrastructure adapter (the Kafka archive publisher).
 *
 * Publishing is fire-and-forget: implementations return without waiting for the
 * collaborator and report failures through logs and metrics only.
 */
public interface EventPublisher {

    /**
     * Publishes a TelemetryRecorded event to the archive.
     *
     * @param event the TelemetryRecorded event to publish
     * @throws IllegalArgumentException if event is null
     */
    void publish(TelemetryRecorded event);
}
