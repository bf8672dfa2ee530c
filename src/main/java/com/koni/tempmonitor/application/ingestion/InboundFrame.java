package com.koni.tempmonitor.application.ingestion;

/**
 * Decoded inbound frame. The set of frames is closed:
 * {@link HandshakeFrame}, {@link TemperatureFrame} and {@link UnknownFrame},
 * the last one standing for any type the gateway does not recognise.
 */
public abstract class InboundFrame {

    /**
     * Frame kind used for dispatch.
     */
    public enum Kind {
        HANDSHAKE,
        TEMPERATURE,
        UNKNOWN
    }

    InboundFrame() {
    }

    public abstract Kind getKind();
}
