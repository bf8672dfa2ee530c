package com.koni.tempmonitor.infrastructure.web.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Acknowledgement returned once an alert has been handed to the subscribers.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class AlertResponse {

    private boolean success;
    private String message;
    private int recipients;
}
