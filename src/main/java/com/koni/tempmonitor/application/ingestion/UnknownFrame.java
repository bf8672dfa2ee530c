package com.koni.tempmonitor.application.ingestion;

import lombok.Getter;
import lombok.ToString;

/**
 * A well-formed JSON object whose {@code type} is missing or not recognised.
 */
@Getter
@ToString
public final class UnknownFrame extends InboundFrame {

    private final String type;

    public UnknownFrame(String type) {
        this.type = type;
    }

    @Override
    public Kind getKind() {
        return Kind.UNKNOWN;
    }
}
