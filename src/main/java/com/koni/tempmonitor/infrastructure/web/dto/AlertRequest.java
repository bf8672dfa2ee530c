package com.koni.tempmonitor.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Data Transfer Object for an alert injected by the external alerting logic.
 *
 * Contains:
 * - deviceId: the device the alert refers to
 * - alertMessage: the text to show on every dashboard ({@code message} is accepted as well)
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class AlertRequest {

    @NotBlank(message = "deviceId is required")
    private String deviceId;

    @NotBlank(message = "alertMessage is required")
    @JsonAlias("message")
    private String alertMessage;
}
