package com.example.collab.session.lifecycle;

import com.example.collab.session.model.CollabConnection;
import com.example.collab.session.service.SessionCoordinator;
import com.example.collab.shared.config.AppProperties;
import com.example.collab.shared.service.directory.ConnectionDirectory;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Set;

/**
 * Keeps connections alive: pings every client in its own protocol, refreshes the cluster
 * directory entries and drops connections that went silent.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ConnectionHeartbeatService {

    private final SessionCoordinator sessionCoordinator;
    private final ConnectionDirectory connectionDirectory;
    private final AppProperties appProperties;
    private Disposable heartbeatSubscription;

    @PostConstruct
    public void start() {
        Duration interval = Duration.ofMillis(appProperties.getKeepAlive().getHeartbeatInterval());
        heartbeatSubscription = Flux.interval(interval, Schedulers.parallel())
                .doOnNext(tick -> beat())
                .subscribe();
    }

    void beat() {
        try {
            sessionCoordinator.disconnectIdle(appProperties.getKeepAlive().getIdleTimeout(), System.currentTimeMillis());

            Set<String> connectionIds = sessionCoordinator.getLocalConnectionIds();
            if (connectionIds.isEmpty()) {
                return;
            }
            connectionDirectory.refreshConnections(sessionCoordinator.instanceId(), connectionIds);
            for (CollabConnection connection : sessionCoordinator.getConnections()) {
                connection.sendHeartbeat();
            }
        } catch (Exception e) {
            log.error("Error in connection heartbeat task: {}", e.getMessage());
        }
    }

    @PreDestroy
    public void stop() {
        if (heartbeatSubscription != null && !heartbeatSubscription.isDisposed()) {
            heartbeatSubscription.dispose();
        }
    }
}
