package com.koni.tempmonitor.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Latest temperature reading reported by a sensor device.
 * This is an immutable value object; the registry keeps exactly one per device
 * and replaces it whenever a newer frame is processed.
 *
 * Temperatures are in degrees Celsius, the timestamp in epoch milliseconds.
 */
@Getter
@EqualsAndHashCode
public final class DeviceReading {

    private final String deviceId;
    private final double ambientTemp;
    private final double objectTemp;
    private final long timestamp;

    /**
     * Creates a new DeviceReading.
     *
     * @param deviceId the identifier the device reports for itself
     * @param ambientTemp the ambient (room) temperature
     * @param objectTemp the object (patient) temperature
     * @param timestamp device clock time of the reading, or gateway receipt time
     */
    @JsonCreator
    public DeviceReading(
            @JsonProperty("deviceId") String deviceId,
            @JsonProperty("ambientTemp") double ambientTemp,
            @JsonProperty("objectTemp") double objectTemp,
            @JsonProperty("timestamp") long timestamp) {
        this.deviceId = deviceId;
        this.ambientTemp = ambientTemp;
        this.objectTemp = objectTemp;
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return "DeviceReading{" +
                "deviceId=" + deviceId +
                ", ambientTemp=" + ambientTemp +
                ", objectTemp=" + objectTemp +
                ", timestamp=" + timestamp +
                '}';
    }
}
