package com.example.collab.shared.lock;

import com.example.collab.shared.aspect.Monitored;
import com.example.collab.shared.config.AppProperties;
import com.example.collab.shared.service.StoreHealthTracker;
import com.example.collab.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

@Service
@Profile("!" + Constants.LOCAL_PROFILE)
@Slf4j
@RequiredArgsConstructor
@Monitored("lock")
public class RedisEditLockManager implements EditLockManager {

    private static final String LOCK_SEGMENT = ":lock:";
    private static final String HOLDER_INDEX_SEGMENT = ":lock-holder:";

    // KEYS[1] lock key, KEYS[2] holder index; ARGV[1] holder, ARGV[2] ttl millis, ARGV[3] object id
    private static final RedisScript<Long> ACQUIRE_SCRIPT = new DefaultRedisScript<>(
            "local current = redis.call('GET', KEYS[1]) "
                    + "if current and current ~= ARGV[1] then return 0 end "
                    + "redis.call('SET', KEYS[1], ARGV[1], 'PX', ARGV[2]) "
                    + "redis.call('SADD', KEYS[2], ARGV[3]) "
                    + "redis.call('PEXPIRE', KEYS[2], ARGV[2]) "
                    + "return 1",
            Long.class);

    // KEYS[1] lock key, KEYS[2] holder index; ARGV[1] holder, ARGV[2] object id
    private static final RedisScript<Long> RELEASE_SCRIPT = new DefaultRedisScript<>(
            "redis.call('SREM', KEYS[2], ARGV[2]) "
                    + "if redis.call('GET', KEYS[1]) == ARGV[1] then "
                    + "redis.call('DEL', KEYS[1]) "
                    + "return 1 "
                    + "end "
                    + "return 0",
            Long.class);

    private final StringRedisTemplate redisTemplate;
    private final AppProperties appProperties;
    private final StoreHealthTracker storeHealthTracker;

    @Override
    public LockResult tryAcquire(String objectId, String holderId, Duration ttl) {
        Objects.requireNonNull(objectId, "objectId");
        Objects.requireNonNull(holderId, "holderId");
        try {
            Long result = redisTemplate.execute(ACQUIRE_SCRIPT,
                    List.of(lockKey(objectId), holderIndexKey(holderId)),
                    holderId, String.valueOf(ttl.toMillis()), objectId);
            storeHealthTracker.recordSuccess();
            return result != null && result == 1L ? LockResult.ACQUIRED : LockResult.BUSY;
        } catch (RuntimeException e) {
            // Any store failure, timeouts included, denies the lock.
            storeHealthTracker.recordFailure("lock-acquire", e);
            log.warn("Lock store unavailable while acquiring '{}' for '{}'. Denying.", objectId, holderId);
            return LockResult.UNAVAILABLE;
        }
    }

    @Override
    public boolean release(String objectId, String holderId) {
        try {
            Long result = redisTemplate.execute(RELEASE_SCRIPT,
                    List.of(lockKey(objectId), holderIndexKey(holderId)),
                    holderId, objectId);
            storeHealthTracker.recordSuccess();
            return result != null && result == 1L;
        } catch (RuntimeException e) {
            storeHealthTracker.recordFailure("lock-release", e);
            log.warn("Lock store unavailable while releasing '{}' for '{}'. The lock will expire on its own.", objectId, holderId);
            return false;
        }
    }

    @Override
    public List<String> releaseAllFor(String holderId) {
        List<String> released = new ArrayList<>();
        String indexKey = holderIndexKey(holderId);
        try {
            Set<String> objectIds = redisTemplate.opsForSet().members(indexKey);
            if (objectIds == null || objectIds.isEmpty()) {
                return released;
            }
            for (String objectId : objectIds) {
                if (release(objectId, holderId)) {
                    released.add(objectId);
                }
            }
            redisTemplate.delete(indexKey);
            log.debug("Released {} of {} indexed locks for holder '{}'", released.size(), objectIds.size(), holderId);
        } catch (RuntimeException e) {
            storeHealthTracker.recordFailure("lock-release-all", e);
            log.warn("Could not sweep locks for holder '{}': {}. Remaining locks expire by TTL.", holderId, e.getMessage());
        }
        return released;
    }

    @Override
    public boolean isHeldBy(String objectId, String holderId) {
        try {
            String current = redisTemplate.opsForValue().get(lockKey(objectId));
            storeHealthTracker.recordSuccess();
            return holderId.equals(current);
        } catch (RuntimeException e) {
            storeHealthTracker.recordFailure("lock-check", e);
            return false;
        }
    }

    private String lockKey(String objectId) {
        return Constants.CHANNEL_ROOT + ":" + appProperties.getClusterName() + LOCK_SEGMENT + objectId;
    }

    private String holderIndexKey(String holderId) {
        return Constants.CHANNEL_ROOT + ":" + appProperties.getClusterName() + HOLDER_INDEX_SEGMENT + holderId;
    }
}
