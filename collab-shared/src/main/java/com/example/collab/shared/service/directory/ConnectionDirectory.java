package com.example.collab.shared.service.directory;

import com.example.collab.shared.dto.cache.ConnectionInfo;

import java.util.Optional;
import java.util.Set;

/**
 * Cluster-wide record of which connections are alive and which instance owns them.
 * Entries expire unless refreshed, so a crashed instance's connections disappear on their own.
 */
public interface ConnectionDirectory {

    void registerConnection(ConnectionInfo connectionInfo);

    void removeConnection(String connectionId, String instanceId);

    void refreshConnections(String instanceId, Set<String> connectionIds);

    boolean isActive(String connectionId);

    Optional<ConnectionInfo> getConnection(String connectionId);

    void recordInstanceHeartbeat(String instanceId);

    /**
     * @return instances whose last heartbeat is older than {@code thresholdMillis} (epoch millis)
     */
    Set<String> findStaleInstances(long thresholdMillis);

    /**
     * Forgets an instance and every connection registered under it.
     * @return the ids of the removed connections
     */
    Set<String> removeInstance(String instanceId);
}
