package com.example.collab.session.service;

import com.example.collab.session.model.CollabConnection;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connections owned by this instance. One registry per coordinator, never static.
 */
@Component
public class ConnectionRegistry {

    private final Map<String, CollabConnection> connections = new ConcurrentHashMap<>();

    public void register(CollabConnection connection) {
        connections.put(connection.getConnectionId(), connection);
    }

    public CollabConnection get(String connectionId) {
        return connectionId == null ? null : connections.get(connectionId);
    }

    public CollabConnection remove(String connectionId) {
        return connections.remove(connectionId);
    }

    public Collection<CollabConnection> all() {
        return new ArrayList<>(connections.values());
    }

    public Set<String> connectionIds() {
        return new HashSet<>(connections.keySet());
    }

    public int size() {
        return connections.size();
    }
}
