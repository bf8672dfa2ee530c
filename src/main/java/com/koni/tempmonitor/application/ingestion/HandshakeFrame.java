package com.koni.tempmonitor.application.ingestion;

import lombok.Getter;
import lombok.ToString;

/**
 * Informational greeting sent by a device right after it connects.
 * Both fields are optional; a handshake never gates telemetry.
 */
@Getter
@ToString
public final class HandshakeFrame extends InboundFrame {

    public static final String TYPE = "handshake";

    private final String deviceId;
    private final String deviceName;

    public HandshakeFrame(String deviceId, String deviceName) {
        this.deviceId = deviceId;
        this.deviceName = deviceName;
    }

    @Override
    public Kind getKind() {
        return Kind.HANDSHAKE;
    }
}
