package com.koni.tempmonitor.device;

/**
 * Connection state of a device session.
 * DISCONNECTED -> CONNECTING -> CONNECTED -> DISCONNECTED, then a reconnect
 * after the fixed backoff.
 */
public enum DeviceSessionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
