package com.koni.tempmonitor.domain.model;

/**
 * Lifecycle state of a live transport connection.
 */
public enum ConnectionState {
    OPEN,
    CLOSING,
    CLOSED
}
