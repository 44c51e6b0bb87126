package com.example.collab.shared.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks whether the shared store is reachable. While degraded, room events only reach
 * local connections and every lock attempt is denied.
 */
@Service
@Slf4j
public class StoreHealthTracker {

    private final AtomicBoolean degraded = new AtomicBoolean(false);
    private final AtomicLong failureCount = new AtomicLong();
    private volatile long degradedSince;
    private volatile String lastFailure;

    public void recordSuccess() {
        if (degraded.compareAndSet(true, false)) {
            log.info("[STORE_RECOVERED] Shared store reachable again after {}ms. Cross-instance delivery resumed.",
                    System.currentTimeMillis() - degradedSince);
        }
    }

    public void recordFailure(String operation, Throwable cause) {
        failureCount.incrementAndGet();
        lastFailure = operation + ": " + cause.getMessage();
        if (degraded.compareAndSet(false, true)) {
            degradedSince = System.currentTimeMillis();
            log.warn("[STORE_DEGRADED] Shared store failed during '{}': {}. Falling back to local-only delivery and denying locks.",
                    operation, cause.getMessage());
        } else {
            log.debug("Shared store still unavailable during '{}': {}", operation, cause.getMessage());
        }
    }

    public boolean isDegraded() {
        return degraded.get();
    }

    public long getFailureCount() {
        return failureCount.get();
    }

    public long getDegradedSince() {
        return degradedSince;
    }

    public String getLastFailure() {
        return lastFailure;
    }
}
