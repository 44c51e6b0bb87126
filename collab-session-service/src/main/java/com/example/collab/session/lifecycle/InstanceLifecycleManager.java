package com.example.collab.session.lifecycle;

import com.example.collab.session.service.SessionCoordinator;
import com.example.collab.shared.config.AppProperties;
import com.example.collab.shared.service.directory.ConnectionDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Set;

@Service
@Slf4j
@RequiredArgsConstructor
public class InstanceLifecycleManager {

    private final AppProperties appProperties;
    private final ConnectionDirectory connectionDirectory;
    private final SessionCoordinator sessionCoordinator;

    /**
     * Per-instance task: every instance stamps its own heartbeat in the shared store.
     */
    @Scheduled(fixedRateString = "${collab.directory.instance-heartbeat-interval:30000}")
    public void updateSelfHeartbeat() {
        if (sessionCoordinator.isDraining()) return;
        try {
            connectionDirectory.recordInstanceHeartbeat(appProperties.getInstanceId());
        } catch (Exception e) {
            log.warn("Could not update instance heartbeat: {}", e.getMessage());
        }
    }

    /**
     * Cluster-wide task: runs on one instance at a time. Instances whose heartbeat went stale
     * are removed from the directory and announced as departed so peers drop their presence.
     */
    @Scheduled(fixedRate = 60000)
    @SchedulerLock(name = "reapStaleInstances", lockAtLeastFor = "PT55S", lockAtMostFor = "PT59S")
    public void reapStaleInstances() {
        if (sessionCoordinator.isDraining()) return;
        log.debug("Running stale instance cleanup task...");
        try {
            long threshold = System.currentTimeMillis() - appProperties.getDirectory().getStaleInstanceThreshold();
            Set<String> staleInstances = connectionDirectory.findStaleInstances(threshold);
            for (String instanceId : staleInstances) {
                if (instanceId.equals(appProperties.getInstanceId())) {
                    continue;
                }
                Set<String> orphaned = connectionDirectory.removeInstance(instanceId);
                log.warn("[INSTANCE_REAPED] Instance {} missed its heartbeats. Removed {} orphaned connections.", instanceId, orphaned.size());
                sessionCoordinator.announceDeparture(instanceId);
                sessionCoordinator.forgetInstance(instanceId);
            }
        } catch (Exception e) {
            log.error("Error during stale instance reaping task: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedRate = 10000)
    public void evictIdleRooms() {
        try {
            sessionCoordinator.evictIdleRooms(System.currentTimeMillis());
        } catch (Exception e) {
            log.error("Error during room eviction task: {}", e.getMessage(), e);
        }
    }
}
