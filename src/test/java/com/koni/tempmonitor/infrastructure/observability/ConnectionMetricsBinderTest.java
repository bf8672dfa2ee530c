package com.koni.tempmonitor.infrastructure.observability;

import com.koni.tempmonitor.application.broadcast.SubscriberSet;
import com.koni.tempmonitor.domain.model.DeviceReading;
import com.koni.tempmonitor.infrastructure.registry.InMemoryDeviceRegistry;
import com.koni.tempmonitor.support.RecordingConnection;
import com.koni.tempmonitor.tags.UnitTest;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@UnitTest
class ConnectionMetricsBinderTest {

    @Test
    void gaugesShouldFollowSubscriberAndDeviceCounts() {
        // Given
        SubscriberSet subscriberSet = new SubscriberSet();
        InMemoryDeviceRegistry deviceRegistry = new InMemoryDeviceRegistry();
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        new ConnectionMetricsBinder(subscriberSet, deviceRegistry).bindTo(meterRegistry);

        // When
        subscriberSet.add(new RecordingConnection("c1"));
        subscriberSet.add(new RecordingConnection("c2"));
        deviceRegistry.update(new DeviceReading("D1", 22.0, 36.6, 1L));

        // Then
        assertThat(meterRegistry.find("telemetry.subscribers.active").gauge().value()).isEqualTo(2.0);
        assertThat(meterRegistry.find("telemetry.devices.known").gauge().value()).isEqualTo(1.0);
    }
}
