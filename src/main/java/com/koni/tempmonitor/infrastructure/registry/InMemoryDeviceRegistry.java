package com.koni.tempmonitor.infrastructure.registry;

import com.koni.tempmonitor.domain.model.DeviceReading;
import com.koni.tempmonitor.domain.repository.DeviceRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide in-memory implementation of the DeviceRegistry.
 * Each update is a single map write, so the reading processed last wins
 * regardless of the timestamps the devices report.
 */
@Slf4j
@Repository
public class InMemoryDeviceRegistry implements DeviceRegistry {

    private final Map<String, DeviceReading> latest = new ConcurrentHashMap<>();

    @Override
    public void update(DeviceReading reading) {
        if (reading == null || reading.getDeviceId() == null) {
            throw new IllegalArgumentException("Reading with a device id is required");
        }
        DeviceReading previous = latest.put(reading.getDeviceId(), reading);
        if (previous == null) {
            log.info("First reading from device: deviceId={}", reading.getDeviceId());
        }
    }

    @Override
    public Optional<DeviceReading> findLatest(String deviceId) {
        if (deviceId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(latest.get(deviceId));
    }

    @Override
    public List<DeviceReading> findAll() {
        return new ArrayList<>(latest.values());
    }

    @Override
    public int size() {
        return latest.size();
    }
}
