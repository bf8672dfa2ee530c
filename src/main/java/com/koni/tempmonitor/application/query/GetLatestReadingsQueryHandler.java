package com.koni.tempmonitor.application.query;

import com.koni.tempmonitor.domain.exception.DeviceNotFoundException;
import com.koni.tempmonitor.domain.repository.DeviceRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Query handler for pull-style reads of the device registry, used by dashboards
 * that do not hold a push connection.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GetLatestReadingsQueryHandler {

    private final DeviceRegistry deviceRegistry;

    /**
     * Returns the latest reading of every known device. An empty list is a valid result.
     *
     * @param query the query; its device id is ignored
     * @return one response per device, in no particular order
     */
    public List<LatestReadingResponse> handleAll(GetLatestReadingsQuery query) {
        List<LatestReadingResponse> readings = deviceRegistry.findAll().stream()
                .map(LatestReadingResponse::from)
                .collect(Collectors.toList());

        log.debug("Retrieved latest readings for {} devices", readings.size());
        return readings;
    }

    /**
     * Returns the latest reading of the device named in the query.
     *
     * @param query the query carrying the device id
     * @return the latest reading
     * @throws DeviceNotFoundException if the device never reported
     */
    public LatestReadingResponse handleOne(GetLatestReadingsQuery query) {
        return deviceRegistry.findLatest(query.getDeviceId())
                .map(LatestReadingResponse::from)
                .orElseThrow(() -> new DeviceNotFoundException(query.getDeviceId()));
    }
}
