package com.koni.tempmonitor.application.command;

import com.koni.tempmonitor.application.broadcast.BroadcastRouter;
import com.koni.tempmonitor.domain.event.AlertEvent;
import com.koni.tempmonitor.domain.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Command handler for alerts injected by the external alerting collaborator.
 * The alert travels the same fan-out path as telemetry updates.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class InjectAlertCommandHandler {

    private final BroadcastRouter broadcastRouter;
    private final Clock clock;

    /**
     * Validates the command and broadcasts an alert event.
     *
     * @param command the alert to inject
     * @return the number of subscribers the alert was handed to
     * @throws ValidationException if the device id or message is blank
     */
    public int handle(InjectAlertCommand command) {
        if (command.getDeviceId() == null || command.getDeviceId().isBlank()) {
            throw new ValidationException("deviceId is required");
        }
        if (command.getMessage() == null || command.getMessage().isBlank()) {
            throw new ValidationException("alertMessage is required");
        }

        AlertEvent event = new AlertEvent(command.getDeviceId(), command.getMessage(), clock.millis());
        int recipients = broadcastRouter.publish(event);

        log.info("Alert injected: deviceId={}, recipients={}", command.getDeviceId(), recipients);
        return recipients;
    }
}
