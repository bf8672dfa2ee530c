package com.koni.tempmonitor.domain.event;

/**
 * Event fanned out to every connected subscriber.
 * The set of events is closed: telemetry updates produced by the ingestion
 * gateway and alerts injected by the external alerting collaborator.
 * Instances are immutable and serialized once per publish.
 */
public abstract class BroadcastEvent {

    private final long timestamp;

    BroadcastEvent(long timestamp) {
        this.timestamp = timestamp;
    }

    /**
     * Wire discriminator of this event, e.g. {@code temperature-update}.
     */
    public abstract String getType();

    /**
     * Publish time in epoch milliseconds.
     */
    public long getTimestamp() {
        return timestamp;
    }
}
