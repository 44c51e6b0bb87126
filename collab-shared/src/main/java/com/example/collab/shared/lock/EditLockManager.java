package com.example.collab.shared.lock;

import java.time.Duration;
import java.util.List;

/**
 * Cluster-wide, TTL-bounded edit locks on shared objects such as puzzle pieces.
 * Implementations must never report a lock as acquired when the store cannot confirm it.
 */
public interface EditLockManager {

    /**
     * Acquires the lock, or refreshes its TTL when {@code holderId} already holds it.
     * Never retried internally: a caller seeing {@link LockResult#UNAVAILABLE} must treat the object as busy.
     */
    LockResult tryAcquire(String objectId, String holderId, Duration ttl);

    /**
     * Deletes the lock only if {@code holderId} still holds it.
     * @return false if the lock expired, was never held, or belongs to someone else.
     */
    boolean release(String objectId, String holderId);

    /**
     * Best-effort sweep of every lock held by {@code holderId}.
     * @return the ids of the objects actually released.
     */
    List<String> releaseAllFor(String holderId);

    boolean isHeldBy(String objectId, String holderId);
}
