package com.koni.tempmonitor.application.broadcast;

import com.koni.tempmonitor.application.port.Connection;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Set of connections currently eligible to receive broadcasts.
 * Holds nothing per subscriber beyond the connection handle.
 */
@Component
public class SubscriberSet {

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();

    public void add(Connection connection) {
        connections.put(connection.getId(), connection);
    }

    /**
     * Removes the connection if it is still a member.
     *
     * @return true if this call removed it, false if it was already gone
     */
    public boolean remove(Connection connection) {
        return connections.remove(connection.getId(), connection);
    }

    public boolean contains(Connection connection) {
        return connections.get(connection.getId()) == connection;
    }

    /**
     * @return a point-in-time copy of the members; later joins and leaves do not affect it
     */
    public List<Connection> snapshot() {
        return new ArrayList<>(connections.values());
    }

    public int size() {
        return connections.size();
    }
}
