package com.koni.tempmonitor.domain.event;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.koni.tempmonitor.domain.model.DeviceReading;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Broadcast when a device reading has been accepted into the registry.
 * Serialized as {@code {"type":"temperature-update","data":{...},"timestamp":...}}.
 */
@EqualsAndHashCode(callSuper = false)
@ToString
@JsonPropertyOrder({"type", "data", "timestamp"})
public final class TelemetryUpdateEvent extends BroadcastEvent {

    public static final String TYPE = "temperature-update";

    private final DeviceReading reading;

    public TelemetryUpdateEvent(DeviceReading reading, long timestamp) {
        super(timestamp);
        this.reading = reading;
    }

    @Override
    public String getType() {
        return TYPE;
    }

    @JsonProperty("data")
    public DeviceReading getReading() {
        return reading;
    }
}
