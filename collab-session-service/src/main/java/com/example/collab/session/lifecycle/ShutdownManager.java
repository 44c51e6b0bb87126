package com.example.collab.session.lifecycle;

import com.example.collab.session.backplane.BackplaneEventListener;
import com.example.collab.session.service.SessionCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Drains the instance when the application context starts closing, before any bean is destroyed,
 * so clients are told and cleanup still reaches the shared store.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ShutdownManager {

    private final SessionCoordinator sessionCoordinator;
    private final BackplaneEventListener backplaneEventListener;
    private final ConnectionHeartbeatService heartbeatService;

    @EventListener(ContextClosedEvent.class)
    public void onShutdown() {
        log.info("Initiating graceful shutdown...");
        heartbeatService.stop();
        try {
            int drained = sessionCoordinator.drain();
            log.info("Drained {} connections.", drained);
        } catch (Exception e) {
            log.error("Error while draining connections: {}", e.getMessage(), e);
        }
        backplaneEventListener.unsubscribeAll();
        log.info("Graceful shutdown completed.");
    }
}
