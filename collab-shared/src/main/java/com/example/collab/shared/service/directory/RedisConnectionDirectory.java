package com.example.collab.shared.service.directory;

import com.example.collab.shared.config.AppProperties;
import com.example.collab.shared.dto.cache.ConnectionInfo;
import com.example.collab.shared.service.StoreHealthTracker;
import com.example.collab.shared.util.Constants;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@Profile("!" + Constants.LOCAL_PROFILE)
@Slf4j
@RequiredArgsConstructor
public class RedisConnectionDirectory implements ConnectionDirectory {

    private static final String CONNECTION_KEY_SEGMENT = ":conn-info:";
    private static final String INSTANCE_CONNECTIONS_KEY_SEGMENT = ":instance-conns:";
    private static final String INSTANCE_HEARTBEATS_KEY_SEGMENT = ":instance-heartbeats";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final AppProperties appProperties;
    private final StoreHealthTracker storeHealthTracker;

    @Override
    public void registerConnection(ConnectionInfo connectionInfo) {
        try {
            String json = objectMapper.writeValueAsString(connectionInfo);
            redisTemplate.opsForValue().set(connectionKey(connectionInfo.getConnectionId()), json, connectionTtl());
            redisTemplate.opsForSet().add(instanceConnectionsKey(connectionInfo.getInstanceId()), connectionInfo.getConnectionId());
            storeHealthTracker.recordSuccess();
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize connection info for {}", connectionInfo.getConnectionId(), e);
        } catch (RuntimeException e) {
            storeHealthTracker.recordFailure("directory-register", e);
            log.warn("Could not register connection {} in the directory: {}", connectionInfo.getConnectionId(), e.getMessage());
        }
    }

    @Override
    public void removeConnection(String connectionId, String instanceId) {
        try {
            redisTemplate.delete(connectionKey(connectionId));
            redisTemplate.opsForSet().remove(instanceConnectionsKey(instanceId), connectionId);
        } catch (RuntimeException e) {
            storeHealthTracker.recordFailure("directory-remove", e);
            log.warn("Could not remove connection {} from the directory. It will expire. Cause: {}", connectionId, e.getMessage());
        }
    }

    @Override
    public void refreshConnections(String instanceId, Set<String> connectionIds) {
        try {
            for (String connectionId : connectionIds) {
                redisTemplate.expire(connectionKey(connectionId), connectionTtl());
            }
            storeHealthTracker.recordSuccess();
        } catch (RuntimeException e) {
            storeHealthTracker.recordFailure("directory-refresh", e);
            log.warn("Could not refresh {} directory entries for instance {}: {}", connectionIds.size(), instanceId, e.getMessage());
        }
    }

    @Override
    public boolean isActive(String connectionId) {
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(connectionKey(connectionId)));
        } catch (RuntimeException e) {
            storeHealthTracker.recordFailure("directory-lookup", e);
            return false;
        }
    }

    @Override
    public Optional<ConnectionInfo> getConnection(String connectionId) {
        try {
            String json = redisTemplate.opsForValue().get(connectionKey(connectionId));
            return json == null ? Optional.empty() : Optional.of(objectMapper.readValue(json, ConnectionInfo.class));
        } catch (JsonProcessingException e) {
            log.error("Corrupt directory entry for connection {}", connectionId, e);
            return Optional.empty();
        } catch (RuntimeException e) {
            storeHealthTracker.recordFailure("directory-lookup", e);
            return Optional.empty();
        }
    }

    @Override
    public void recordInstanceHeartbeat(String instanceId) {
        redisTemplate.opsForHash().put(instanceHeartbeatsKey(), instanceId, String.valueOf(System.currentTimeMillis()));
    }

    @Override
    public Set<String> findStaleInstances(long thresholdMillis) {
        Map<Object, Object> heartbeats = redisTemplate.opsForHash().entries(instanceHeartbeatsKey());
        return heartbeats.entrySet().stream()
                .filter(entry -> Long.parseLong(entry.getValue().toString()) < thresholdMillis)
                .map(entry -> entry.getKey().toString())
                .collect(Collectors.toSet());
    }

    @Override
    public Set<String> removeInstance(String instanceId) {
        String instanceKey = instanceConnectionsKey(instanceId);
        Set<String> connectionIds = redisTemplate.opsForSet().members(instanceKey);
        Set<String> removed = connectionIds == null ? new HashSet<>() : new HashSet<>(connectionIds);
        if (!removed.isEmpty()) {
            redisTemplate.delete(removed.stream().map(this::connectionKey).collect(Collectors.toSet()));
        }
        redisTemplate.delete(instanceKey);
        redisTemplate.opsForHash().delete(instanceHeartbeatsKey(), instanceId);
        return removed;
    }

    private Duration connectionTtl() {
        return Duration.ofMillis(appProperties.getDirectory().getConnectionTtl());
    }

    private String connectionKey(String connectionId) {
        return prefix() + CONNECTION_KEY_SEGMENT + connectionId;
    }

    private String instanceConnectionsKey(String instanceId) {
        return prefix() + INSTANCE_CONNECTIONS_KEY_SEGMENT + instanceId;
    }

    private String instanceHeartbeatsKey() {
        return prefix() + INSTANCE_HEARTBEATS_KEY_SEGMENT;
    }

    private String prefix() {
        return Constants.CHANNEL_ROOT + ":" + appProperties.getClusterName();
    }
}
