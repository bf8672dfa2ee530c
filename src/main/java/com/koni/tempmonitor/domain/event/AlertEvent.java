package com.koni.tempmonitor.domain.event;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Broadcast when the external alerting logic injects an alert for a device.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
@ToString
@JsonPropertyOrder({"type", "deviceId", "message", "timestamp"})
public final class AlertEvent extends BroadcastEvent {

    public static final String TYPE = "alert";

    private final String deviceId;
    private final String message;

    public AlertEvent(String deviceId, String message, long timestamp) {
        super(timestamp);
        this.deviceId = deviceId;
        this.message = message;
    }

    @Override
    public String getType() {
        return TYPE;
    }
}
