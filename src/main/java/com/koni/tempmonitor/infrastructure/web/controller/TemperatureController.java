package com.koni.tempmonitor.infrastructure.web.controller;

import com.koni.tempmonitor.application.command.InjectAlertCommand;
import com.koni.tempmonitor.application.command.InjectAlertCommandHandler;
import com.koni.tempmonitor.application.query.GetLatestReadingsQuery;
import com.koni.tempmonitor.application.query.GetLatestReadingsQueryHandler;
import com.koni.tempmonitor.infrastructure.web.dto.AlertRequest;
import com.koni.tempmonitor.infrastructure.web.dto.AlertResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for dashboards and collaborators that do not hold a push connection.
 *
 * Endpoints:
 * - GET /api/temperature/latest: latest reading of every device, or of one device with ?deviceId=
 * - POST /api/temperature/alert: inject an alert into the broadcast fan-out
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class TemperatureController {

    private final GetLatestReadingsQueryHandler queryHandler;
    private final InjectAlertCommandHandler alertHandler;

    /**
     * Returns the latest readings held by the device registry.
     *
     * Example response for a single device:
     * {
     *   "deviceId": "ESP32-WARD-3",
     *   "ambientTemp": 24.5,
     *   "objectTemp": 36.9,
     *   "timestamp": 1738328400000
     * }
     *
     * @param deviceId optional device filter
     * @return 200 OK with one reading or a list of readings; 404 if the device is unknown
     */
    @GetMapping("/temperature/latest")
    public ResponseEntity<?> getLatest(@RequestParam(name = "deviceId", required = false) String deviceId) {
        GetLatestReadingsQuery query = new GetLatestReadingsQuery(deviceId);

        if (query.isSingleDevice()) {
            log.debug("Received request for latest reading: deviceId={}", deviceId);
            return ResponseEntity.ok(queryHandler.handleOne(query));
        }

        log.debug("Received request for latest readings of all devices");
        return ResponseEntity.ok(queryHandler.handleAll(query));
    }

    /**
     * Pushes an alert to every connected dashboard.
     *
     * Example request:
     * POST /api/temperature/alert
     * {
     *   "deviceId": "ESP32-WARD-3",
     *   "alertMessage": "Patient temperature above threshold"
     * }
     *
     * @param request the alert to broadcast
     * @return 200 OK once the alert has been handed to the subscribers
     */
    @PostMapping("/temperature/alert")
    public ResponseEntity<AlertResponse> injectAlert(@RequestBody @Valid AlertRequest request) {
        log.info("Received alert: deviceId={}", request.getDeviceId());

        int recipients = alertHandler.handle(new InjectAlertCommand(request.getDeviceId(), request.getAlertMessage()));

        return ResponseEntity.ok(new AlertResponse(true, "Alert sent", recipients));
    }
}
