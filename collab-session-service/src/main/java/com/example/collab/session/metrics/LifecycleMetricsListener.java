package com.example.collab.session.metrics;

import com.example.collab.shared.config.MonitoringConfig;
import com.example.collab.shared.event.CollabLifecycleEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Counts connection and lock lifecycle transitions as {@code collab.lifecycle.events{type=...}}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LifecycleMetricsListener {

    public static final String METRIC_NAME = "collab.lifecycle.events";

    private final MonitoringConfig.CollabMetricsCollector metricsCollector;

    @EventListener
    public void onLifecycleEvent(CollabLifecycleEvent event) {
        metricsCollector.incrementCounter(METRIC_NAME, "type", event.getType().name().toLowerCase());
        log.trace("Lifecycle {} for connection {} ({})", event.getType(), event.getConnectionId(), event.getSubject());
    }
}
