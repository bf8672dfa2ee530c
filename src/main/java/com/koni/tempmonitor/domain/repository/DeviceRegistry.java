package com.koni.tempmonitor.domain.repository;

import com.koni.tempmonitor.domain.model.DeviceReading;

import java.util.List;
import java.util.Optional;

/**
 * Registry of the most recent reading per device.
 * Implementations must allow concurrent updates for distinct devices without
 * blocking each other; updates for the same device resolve last-write-wins in
 * processing order.
 */
public interface DeviceRegistry {

    /**
     * Replaces any reading held for {@code reading.getDeviceId()}.
     *
     * @param reading the reading to store
     */
    void update(DeviceReading reading);

    /**
     * @param deviceId the device identifier
     * @return the latest reading, or empty if the device never reported
     */
    Optional<DeviceReading> findLatest(String deviceId);

    /**
     * @return a point-in-time snapshot of all latest readings, in no particular order
     */
    List<DeviceReading> findAll();

    /**
     * @return the number of devices that have reported at least once
     */
    int size();
}
