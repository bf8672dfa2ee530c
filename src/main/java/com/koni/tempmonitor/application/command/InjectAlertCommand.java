package com.koni.tempmonitor.application.command;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Command to push an externally raised alert through the broadcast fan-out.
 */
@Getter
@AllArgsConstructor
public class InjectAlertCommand {

    /**
     * The device the alert refers to.
     */
    private final String deviceId;

    /**
     * Human readable alert text shown on the dashboards.
     */
    private final String message;
}
