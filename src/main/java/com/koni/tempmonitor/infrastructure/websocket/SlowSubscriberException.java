package com.koni.tempmonitor.infrastructure.websocket;

import java.io.IOException;
import java.time.Duration;

/**
 * Thrown when a subscriber has not kept up with the broadcast rate: its outbound
 * lane is full, or its current write has exceeded the send time limit.
 */
public class SlowSubscriberException extends IOException {

    public SlowSubscriberException(String connectionId, int pending) {
        super("Subscriber " + connectionId + " has " + pending + " undelivered frames");
    }

    public SlowSubscriberException(String connectionId, Duration stalledFor) {
        super("Subscriber " + connectionId + " write stalled for " + stalledFor.toMillis() + " ms");
    }
}
