package com.example.collab.shared.service.directory;

import com.example.collab.shared.config.AppProperties;
import com.example.collab.shared.dto.cache.ConnectionInfo;
import com.example.collab.shared.util.Constants;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Service
@Profile(Constants.LOCAL_PROFILE)
public class InMemoryConnectionDirectory implements ConnectionDirectory {

    private final Map<String, Entry> connections = new ConcurrentHashMap<>();
    private final Map<String, Long> instanceHeartbeats = new ConcurrentHashMap<>();
    private final long connectionTtlMillis;
    private final Clock clock;

    @Autowired
    public InMemoryConnectionDirectory(AppProperties appProperties) {
        this(appProperties.getDirectory().getConnectionTtl(), Clock.systemUTC());
    }

    public InMemoryConnectionDirectory(long connectionTtlMillis, Clock clock) {
        this.connectionTtlMillis = connectionTtlMillis;
        this.clock = clock;
    }

    @Override
    public void registerConnection(ConnectionInfo connectionInfo) {
        connections.put(connectionInfo.getConnectionId(), new Entry(connectionInfo, clock.millis() + connectionTtlMillis));
    }

    @Override
    public void removeConnection(String connectionId, String instanceId) {
        connections.remove(connectionId);
    }

    @Override
    public void refreshConnections(String instanceId, Set<String> connectionIds) {
        long expiresAt = clock.millis() + connectionTtlMillis;
        for (String connectionId : connectionIds) {
            connections.computeIfPresent(connectionId, (id, entry) -> new Entry(entry.info(), expiresAt));
        }
    }

    @Override
    public boolean isActive(String connectionId) {
        return getConnection(connectionId).isPresent();
    }

    @Override
    public Optional<ConnectionInfo> getConnection(String connectionId) {
        Entry entry = connections.get(connectionId);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.expiresAt() <= clock.millis()) {
            connections.remove(connectionId, entry);
            return Optional.empty();
        }
        return Optional.of(entry.info());
    }

    @Override
    public void recordInstanceHeartbeat(String instanceId) {
        instanceHeartbeats.put(instanceId, clock.millis());
    }

    @Override
    public Set<String> findStaleInstances(long thresholdMillis) {
        return instanceHeartbeats.entrySet().stream()
                .filter(entry -> entry.getValue() < thresholdMillis)
                .map(Map.Entry::getKey)
                .collect(Collectors.toSet());
    }

    @Override
    public Set<String> removeInstance(String instanceId) {
        Set<String> removed = new HashSet<>();
        connections.forEach((connectionId, entry) -> {
            if (instanceId.equals(entry.info().getInstanceId()) && connections.remove(connectionId, entry)) {
                removed.add(connectionId);
            }
        });
        instanceHeartbeats.remove(instanceId);
        return removed;
    }

    private record Entry(ConnectionInfo info, long expiresAt) {
    }
}
