package com.koni.tempmonitor.domain.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.koni.tempmonitor.domain.model.DeviceReading;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.UUID;

/**
 * TelemetryRecorded archive event.
 * Handed to the history storage collaborator for every reading the gateway accepts.
 * The object temperature is also carried in Fahrenheit because the history
 * table keeps both scales.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class TelemetryRecorded {

    private final UUID eventId;
    private final String deviceId;
    private final double ambientTemp;
    private final double objectTemp;
    private final double objectTempF;
    private final long timestamp;
    private final Instant recordedAt;

    /**
     * Creates a new TelemetryRecorded event.
     * This constructor is used by Jackson for JSON deserialization.
     *
     * @param eventId the unique identifier of this event
     * @param deviceId the identifier of the device
     * @param ambientTemp ambient temperature in Celsius
     * @param objectTemp object temperature in Celsius
     * @param objectTempF object temperature in Fahrenheit
     * @param timestamp reading time in epoch milliseconds
     * @param recordedAt the time the gateway accepted the reading
     */
    @JsonCreator
    public TelemetryRecorded(
            @JsonProperty("eventId") UUID eventId,
            @JsonProperty("deviceId") String deviceId,
            @JsonProperty("ambientTemp") double ambientTemp,
            @JsonProperty("objectTemp") double objectTemp,
            @JsonProperty("objectTempF") double objectTempF,
            @JsonProperty("timestamp") long timestamp,
            @JsonProperty("recordedAt") Instant recordedAt) {
        this.eventId = eventId;
        this.deviceId = deviceId;
        this.ambientTemp = ambientTemp;
        this.objectTemp = objectTemp;
        this.objectTempF = objectTempF;
        this.timestamp = timestamp;
        this.recordedAt = recordedAt;
    }

    /**
     * Builds the archive event for an accepted reading.
     */
    public static TelemetryRecorded of(DeviceReading reading, Instant recordedAt) {
        return new TelemetryRecorded(
                UUID.randomUUID(),
                reading.getDeviceId(),
                reading.getAmbientTemp(),
                reading.getObjectTemp(),
                toFahrenheit(reading.getObjectTemp()),
                reading.getTimestamp(),
                recordedAt
        );
    }

    static double toFahrenheit(double celsius) {
        return Math.round((celsius * 9.0 / 5.0 + 32.0) * 10.0) / 10.0;
    }
}
