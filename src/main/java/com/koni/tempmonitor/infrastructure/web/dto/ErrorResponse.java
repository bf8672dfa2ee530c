package com.koni.tempmonitor.infrastructure.web.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.time.Instant;

/**
 * Body of every non-2xx REST answer: {@code {"status":404,"message":"Device not found","timestamp":"..."}}.
 */
@Getter
@AllArgsConstructor
public class ErrorResponse {

    private final int status;
    private final String message;
    private final Instant timestamp;

    public static ErrorResponse of(HttpStatus status, String message) {
        return new ErrorResponse(status.value(), message, Instant.now());
    }
}
