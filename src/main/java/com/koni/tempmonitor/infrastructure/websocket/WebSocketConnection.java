package com.koni.tempmonitor.infrastructure.websocket;

import com.koni.tempmonitor.application.port.Connection;
import com.koni.tempmonitor.domain.model.ConnectionState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * {@link Connection} backed by a Spring {@link WebSocketSession}.
 *
 * Outbound frames go through a bounded lane: {@link #send(String)} only queues
 * the frame and the lane is drained on the shared outbound executor, one frame
 * at a time and in queue order. A stalled peer therefore blocks only its own
 * lane. The send fails with {@link SlowSubscriberException} when the lane is full,
 * or when the write in progress has been stuck for longer than the send time
 * limit, in which case the session is closed as well. A failed write closes the
 * session.
 */
@Slf4j
public class WebSocketConnection implements Connection {

    private final WebSocketSession session;
    private final Executor outboundExecutor;
    private final int maxPending;
    private final long sendTimeLimitNanos;

    private final Object lock = new Object();
    private final Deque<String> pending = new ArrayDeque<>();
    private boolean draining;
    private volatile boolean closing;
    private volatile long writeStartedAt;

    public WebSocketConnection(
            WebSocketSession session, Executor outboundExecutor, int maxPending, Duration sendTimeLimit) {
        this.session = session;
        this.outboundExecutor = outboundExecutor;
        this.maxPending = maxPending;
        this.sendTimeLimitNanos = sendTimeLimit.toNanos();
    }

    @Override
    public String getId() {
        return session.getId();
    }

    @Override
    public ConnectionState getState() {
        if (!session.isOpen()) {
            return ConnectionState.CLOSED;
        }
        return closing ? ConnectionState.CLOSING : ConnectionState.OPEN;
    }

    @Override
    public void send(String payload) throws IOException {
        if (getState() != ConnectionState.OPEN) {
            throw new IOException("Connection " + getId() + " is not open");
        }
        checkSendTimeLimit();

        synchronized (lock) {
            if (pending.size() >= maxPending) {
                throw new SlowSubscriberException(getId(), pending.size());
            }
            pending.addLast(payload);
            if (draining) {
                return;
            }
            draining = true;
        }

        try {
            outboundExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            synchronized (lock) {
                pending.clear();
                draining = false;
            }
            throw new IOException("Outbound executor rejected delivery for " + getId(), e);
        }
    }

    @Override
    public void close() {
        close(CloseStatus.SESSION_NOT_RELIABLE);
    }

    /**
     * @return number of frames queued but not yet written
     */
    int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    private void checkSendTimeLimit() throws SlowSubscriberException {
        long startedAt = writeStartedAt;
        if (startedAt == 0L) {
            return;
        }
        long stalledNanos = System.nanoTime() - startedAt;
        if (stalledNanos > sendTimeLimitNanos) {
            Duration stalledFor = Duration.ofNanos(stalledNanos);
            log.warn("Write exceeded send time limit, closing connection: connectionId={}, stalledMs={}",
                    getId(), stalledFor.toMillis());
            close(CloseStatus.SESSION_NOT_RELIABLE);
            throw new SlowSubscriberException(getId(), stalledFor);
        }
    }

    private void drain() {
        while (true) {
            String next;
            synchronized (lock) {
                next = pending.pollFirst();
                if (next == null) {
                    draining = false;
                    return;
                }
            }

            writeStartedAt = System.nanoTime();
            try {
                session.sendMessage(new TextMessage(next));
            } catch (IOException | RuntimeException e) {
                writeStartedAt = 0L;
                log.warn("Write failed, closing connection: connectionId={}, error={}", getId(), e.getMessage());
                synchronized (lock) {
                    pending.clear();
                    draining = false;
                }
                close(CloseStatus.SESSION_NOT_RELIABLE);
                return;
            }
            writeStartedAt = 0L;
        }
    }

    private void close(CloseStatus status) {
        closing = true;
        if (!session.isOpen()) {
            return;
        }
        try {
            session.close(status);
        } catch (IOException e) {
            log.debug("Error while closing connection: connectionId={}, error={}", getId(), e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "WebSocketConnection{id=" + getId() + ", state=" + getState() + '}';
    }
}
