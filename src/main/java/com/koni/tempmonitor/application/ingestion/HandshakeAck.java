package com.koni.tempmonitor.application.ingestion;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Reply sent to the originating connection only, in answer to a handshake.
 */
@Getter
@AllArgsConstructor
@JsonPropertyOrder({"type", "message", "timestamp"})
public class HandshakeAck {

    public static final String TYPE = "handshake-ack";

    private final String message;
    private final long timestamp;

    public String getType() {
        return TYPE;
    }
}
