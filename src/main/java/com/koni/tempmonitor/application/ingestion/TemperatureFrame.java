package com.koni.tempmonitor.application.ingestion;

import com.koni.tempmonitor.domain.model.DeviceReading;
import lombok.Getter;
import lombok.ToString;

/**
 * A validated telemetry frame. The timestamp is already resolved to the gateway
 * receipt time when the device did not send one.
 */
@Getter
@ToString
public final class TemperatureFrame extends InboundFrame {

    public static final String TYPE = "temperature";

    private final String deviceId;
    private final double ambientTemp;
    private final double objectTemp;
    private final long timestamp;

    public TemperatureFrame(String deviceId, double ambientTemp, double objectTemp, long timestamp) {
        this.deviceId = deviceId;
        this.ambientTemp = ambientTemp;
        this.objectTemp = objectTemp;
        this.timestamp = timestamp;
    }

    @Override
    public Kind getKind() {
        return Kind.TEMPERATURE;
    }

    public DeviceReading toReading() {
        return new DeviceReading(deviceId, ambientTemp, objectTemp, timestamp);
    }
}
