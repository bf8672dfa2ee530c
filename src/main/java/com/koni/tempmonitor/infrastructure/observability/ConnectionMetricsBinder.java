package com.koni.tempmonitor.infrastructure.observability;

import com.koni.tempmonitor.application.broadcast.SubscriberSet;
import com.koni.tempmonitor.domain.repository.DeviceRegistry;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Exposes the size of the subscriber set and of the device registry as gauges.
 */
@Component
@RequiredArgsConstructor
public class ConnectionMetricsBinder implements MeterBinder {

    private final SubscriberSet subscriberSet;
    private final DeviceRegistry deviceRegistry;

    @Override
    public void bindTo(MeterRegistry registry) {
        Gauge.builder("telemetry.subscribers.active", subscriberSet, SubscriberSet::size)
                .description("Connections currently receiving broadcasts")
                .register(registry);

        Gauge.builder("telemetry.devices.known", deviceRegistry, DeviceRegistry::size)
                .description("Devices with a reading in the registry")
                .register(registry);
    }
}
