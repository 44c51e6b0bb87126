package com.example.collab.shared.lock;

import com.example.collab.shared.util.Constants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local lock table for the {@code local} profile. Shared by every instance built in
 * the same JVM, so it behaves like the store would for a single-node deployment.
 */
@Service
@Profile(Constants.LOCAL_PROFILE)
@Slf4j
public class InMemoryEditLockManager implements EditLockManager {

    private final Map<String, LockEntry> locks = new ConcurrentHashMap<>();
    private final Clock clock;

    @Autowired
    public InMemoryEditLockManager() {
        this(Clock.systemUTC());
    }

    public InMemoryEditLockManager(Clock clock) {
        this.clock = clock;
    }

    @Override
    public LockResult tryAcquire(String objectId, String holderId, Duration ttl) {
        long now = clock.millis();
        AtomicBoolean acquired = new AtomicBoolean(false);
        locks.compute(objectId, (key, current) -> {
            if (current == null || current.isExpired(now) || current.holderId().equals(holderId)) {
                acquired.set(true);
                return new LockEntry(holderId, now + ttl.toMillis());
            }
            return current;
        });
        return acquired.get() ? LockResult.ACQUIRED : LockResult.BUSY;
    }

    @Override
    public boolean release(String objectId, String holderId) {
        long now = clock.millis();
        AtomicBoolean released = new AtomicBoolean(false);
        locks.computeIfPresent(objectId, (key, current) -> {
            if (current.isExpired(now)) {
                return null;
            }
            if (current.holderId().equals(holderId)) {
                released.set(true);
                return null;
            }
            return current;
        });
        return released.get();
    }

    @Override
    public List<String> releaseAllFor(String holderId) {
        List<String> released = new ArrayList<>();
        for (Map.Entry<String, LockEntry> entry : Map.copyOf(locks).entrySet()) {
            if (entry.getValue().holderId().equals(holderId) && release(entry.getKey(), holderId)) {
                released.add(entry.getKey());
            }
        }
        return released;
    }

    @Override
    public boolean isHeldBy(String objectId, String holderId) {
        LockEntry entry = locks.get(objectId);
        return entry != null && !entry.isExpired(clock.millis()) && entry.holderId().equals(holderId);
    }

    private record LockEntry(String holderId, long expiresAt) {
        boolean isExpired(long now) {
            return expiresAt <= now;
        }
    }
}
