package com.koni.tempmonitor.device;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * One measurement taken by a sensor, in degrees Celsius.
 */
@Getter
@ToString
@AllArgsConstructor
public class SensorSample {

    private final double ambientTemp;
    private final double objectTemp;
}
