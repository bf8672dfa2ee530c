package com.koni.tempmonitor.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Query for the latest readings held by the device registry.
 * With no device id it asks for every known device.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class GetLatestReadingsQuery {

    private String deviceId;

    public boolean isSingleDevice() {
        return deviceId != null && !deviceId.isBlank();
    }
}
