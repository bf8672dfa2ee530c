package com.koni.tempmonitor.domain.exception;

/**
 * Exception thrown when input submitted through the REST surface does not meet
 * the required shape (for example a blank device id on an alert).
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
