package com.koni.tempmonitor.domain.exception;

/**
 * Exception thrown when a pull-style read asks for a device that has never
 * reported a reading.
 */
public class DeviceNotFoundException extends RuntimeException {

    private final String deviceId;

    public DeviceNotFoundException(String deviceId) {
        super("Device not found: " + deviceId);
        this.deviceId = deviceId;
    }

    public String getDeviceId() {
        return deviceId;
    }
}
