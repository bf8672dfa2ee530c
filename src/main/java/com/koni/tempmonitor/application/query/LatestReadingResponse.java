package com.koni.tempmonitor.application.query;

import com.koni.tempmonitor.domain.model.DeviceReading;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Data Transfer Object representing the latest reading of one device, as returned
 * by the pull-style read API.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class LatestReadingResponse {

    private String deviceId;
    private double ambientTemp;
    private double objectTemp;
    private long timestamp;

    static LatestReadingResponse from(DeviceReading reading) {
        return new LatestReadingResponse(
                reading.getDeviceId(),
                reading.getAmbientTemp(),
                reading.getObjectTemp(),
                reading.getTimestamp()
        );
    }
}
