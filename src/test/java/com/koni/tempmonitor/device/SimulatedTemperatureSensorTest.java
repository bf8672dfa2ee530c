package com.koni.tempmonitor.device;

import com.koni.tempmonitor.tags.UnitTest;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@UnitTest
class SimulatedTemperatureSensorTest {

    @Test
    void readingsShouldStayWithinPlausibleRange() {
        SimulatedTemperatureSensor sensor = new SimulatedTemperatureSensor(24.0, 36.8);

        for (int i = 0; i < 1_000; i++) {
            SensorSample sample = sensor.read();
            assertThat(sample.getAmbientTemp()).isBetween(15.0, 35.0);
            assertThat(sample.getObjectTemp()).isBetween(34.0, 41.0);
        }
    }

    @Test
    void readingsShouldBeRoundedToOneDecimal() {
        SimulatedTemperatureSensor sensor = new SimulatedTemperatureSensor(24.0, 36.8);

        SensorSample sample = sensor.read();

        assertThat(sample.getObjectTemp() * 10.0).isEqualTo(Math.rint(sample.getObjectTemp() * 10.0));
    }

    @Test
    void outOfRangeBaseShouldBeClamped() {
        SimulatedTemperatureSensor sensor = new SimulatedTemperatureSensor(80.0, 10.0);

        SensorSample sample = sensor.read();

        assertThat(sample.getAmbientTemp()).isLessThanOrEqualTo(35.0);
        assertThat(sample.getObjectTemp()).isGreaterThanOrEqualTo(34.0);
    }

    @RepeatedTest(5)
    void randomBaseShouldStartNearRoomAndBodyTemperature() {
        SensorSample sample = SimulatedTemperatureSensor.withRandomBase().read();

        assertThat(sample.getAmbientTemp()).isBetween(19.0, 29.0);
        assertThat(sample.getObjectTemp()).isBetween(35.5, 38.0);
    }
}
