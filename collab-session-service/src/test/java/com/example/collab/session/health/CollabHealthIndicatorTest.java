package com.example.collab.session.health;

import com.example.collab.session.support.RecordingOutboundChannel;
import com.example.collab.session.support.TestCluster;
import com.example.collab.session.support.TestInstance;
import com.example.collab.shared.service.StoreHealthTracker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;

class CollabHealthIndicatorTest {

    private TestCluster cluster;
    private TestInstance instance;
    private StoreHealthTracker storeHealthTracker;
    private CollabHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        cluster = new TestCluster();
        instance = cluster.addInstance("instance-1");
        storeHealthTracker = new StoreHealthTracker();
        indicator = new CollabHealthIndicator(instance.coordinator(), instance.throttlingPipeline(), storeHealthTracker);
    }

    @AfterEach
    void tearDown() {
        cluster.shutdown();
    }

    @Test
    void upWithConnectionDetails() {
        instance.connect("alice", new RecordingOutboundChannel());

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("instanceId", "instance-1")
                .containsEntry("connections", 1)
                .containsEntry("storeStatus", "UP");
    }

    @Test
    void degradedWhileStoreIsDown() {
        storeHealthTracker.recordFailure("lock-acquire", new IllegalStateException("timeout"));

        Health health = indicator.health();

        assertThat(health.getStatus().getCode()).isEqualTo(CollabHealthIndicator.DEGRADED);
        assertThat(health.getDetails()).containsEntry("storeError", "lock-acquire: timeout");
    }

    @Test
    void outOfServiceOnceDraining() {
        instance.coordinator().drain();

        assertThat(indicator.health().getStatus()).isEqualTo(Status.OUT_OF_SERVICE);
    }
}
