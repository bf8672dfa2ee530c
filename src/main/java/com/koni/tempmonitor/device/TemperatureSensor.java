package com.koni.tempmonitor.device;

/**
 * Source of temperature measurements for a device session.
 */
@FunctionalInterface
public interface TemperatureSensor {

    SensorSample read();
}
