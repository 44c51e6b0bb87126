package com.example.collab.session.metrics;

import com.example.collab.shared.config.MonitoringConfig;
import com.example.collab.shared.event.CollabLifecycleEvent;
import com.example.collab.shared.util.Constants;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LifecycleMetricsListenerTest {

    @Test
    void countsEventsByType() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        LifecycleMetricsListener listener = new LifecycleMetricsListener(new MonitoringConfig.CollabMetricsCollector(registry));

        listener.onLifecycleEvent(new CollabLifecycleEvent(this, Constants.LifecycleEventType.LOCK_DENIED, "c1", "alice", "p1"));
        listener.onLifecycleEvent(new CollabLifecycleEvent(this, Constants.LifecycleEventType.LOCK_DENIED, "c2", "bob", "p1"));
        listener.onLifecycleEvent(new CollabLifecycleEvent(this, Constants.LifecycleEventType.CONNECTION_OPENED, "c3", "carol", null));

        assertThat(registry.get(LifecycleMetricsListener.METRIC_NAME).tag("type", "lock_denied").counter().count()).isEqualTo(2.0);
        assertThat(registry.get(LifecycleMetricsListener.METRIC_NAME).tag("type", "connection_opened").counter().count()).isEqualTo(1.0);
    }
}
