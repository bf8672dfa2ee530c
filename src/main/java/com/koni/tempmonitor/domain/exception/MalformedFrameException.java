package com.koni.tempmonitor.domain.exception;

/**
 * Exception thrown when an inbound frame cannot be decoded: invalid JSON, a
 * document that is not an object, or a telemetry frame with missing or wrongly
 * typed required fields.
 * It never escapes the connection that produced the frame.
 */
public class MalformedFrameException extends RuntimeException {

    public MalformedFrameException(String message) {
        super(message);
    }

    public MalformedFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
