package com.koni.tempmonitor.application.port;

import com.koni.tempmonitor.domain.model.ConnectionState;

import java.io.IOException;

/**
 * Port for a live, message-oriented transport connection.
 * A connection is not a device: it may report telemetry for any device id, or
 * never send anything and only receive broadcasts.
 *
 * Implementations are owned by the transport adapter (e.g. WebSocket) for the
 * lifetime of the underlying session.
 */
public interface Connection {

    /**
     * @return process-local unique identifier of this connection
     */
    String getId();

    /**
     * @return the current lifecycle state
     */
    ConnectionState getState();

    /**
     * Hands a serialized frame to the transport for delivery.
     * Must not block the caller on a slow peer.
     *
     * @param payload the serialized JSON frame
     * @throws IOException if the frame cannot be accepted for delivery
     */
    void send(String payload) throws IOException;

    /**
     * Closes the connection. Closing an already closed connection is a no-op.
     */
    void close();
}
