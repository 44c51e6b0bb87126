package com.example.collab.session.health;

import com.example.collab.session.service.SessionCoordinator;
import com.example.collab.session.throttle.ThrottlingPipeline;
import com.example.collab.shared.service.StoreHealthTracker;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Reports UP while the shared store is reachable, DEGRADED while delivery is local-only and
 * OUT_OF_SERVICE once the instance drains.
 */
@Component
public class CollabHealthIndicator implements HealthIndicator {

    public static final String DEGRADED = "DEGRADED";

    private final SessionCoordinator sessionCoordinator;
    private final ThrottlingPipeline throttlingPipeline;
    private final StoreHealthTracker storeHealthTracker;

    public CollabHealthIndicator(SessionCoordinator sessionCoordinator,
                                 ThrottlingPipeline throttlingPipeline,
                                 StoreHealthTracker storeHealthTracker) {
        this.sessionCoordinator = sessionCoordinator;
        this.throttlingPipeline = throttlingPipeline;
        this.storeHealthTracker = storeHealthTracker;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        details.put("instanceId", sessionCoordinator.instanceId());
        details.put("connections", sessionCoordinator.getConnectionCount());
        details.put("rooms", sessionCoordinator.getRoomCount());
        details.put("throttledStreams", throttlingPipeline.activeStreamCount());
        details.put("storeFailures", storeHealthTracker.getFailureCount());

        boolean degraded = storeHealthTracker.isDegraded();
        details.put("storeStatus", degraded ? DEGRADED : "UP");
        if (degraded && storeHealthTracker.getLastFailure() != null) {
            details.put("storeError", storeHealthTracker.getLastFailure());
        }

        Health.Builder builder;
        if (sessionCoordinator.isDraining()) {
            builder = Health.outOfService();
        } else if (degraded) {
            builder = Health.status(DEGRADED);
        } else {
            builder = Health.up();
        }
        return builder.withDetails(details).build();
    }
}
