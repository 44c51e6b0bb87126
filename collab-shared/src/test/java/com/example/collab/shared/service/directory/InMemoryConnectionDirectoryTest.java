package com.example.collab.shared.service.directory;

import com.example.collab.shared.dto.cache.ConnectionInfo;
import com.example.collab.shared.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryConnectionDirectoryTest {

    private MutableClock clock;
    private InMemoryConnectionDirectory directory;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        directory = new InMemoryConnectionDirectory(10_000L, clock);
    }

    @Test
    void registeredConnectionIsActiveUntilTtlLapses() {
        directory.registerConnection(info("c1", "i1"));

        assertThat(directory.isActive("c1")).isTrue();
        assertThat(directory.getConnection("c1")).get().extracting(ConnectionInfo::getUserId).isEqualTo("user-c1");

        clock.advance(Duration.ofSeconds(10));

        assertThat(directory.isActive("c1")).isFalse();
    }

    @Test
    void refreshExtendsTtl() {
        directory.registerConnection(info("c1", "i1"));
        clock.advance(Duration.ofSeconds(8));
        directory.refreshConnections("i1", Set.of("c1", "unknown"));
        clock.advance(Duration.ofSeconds(8));

        assertThat(directory.isActive("c1")).isTrue();
        assertThat(directory.isActive("unknown")).isFalse();
    }

    @Test
    void removeConnectionForgetsIt() {
        directory.registerConnection(info("c1", "i1"));
        directory.removeConnection("c1", "i1");

        assertThat(directory.getConnection("c1")).isEmpty();
    }

    @Test
    void staleInstancesAreThoseWithOldHeartbeats() {
        directory.recordInstanceHeartbeat("i1");
        clock.advance(Duration.ofSeconds(60));
        directory.recordInstanceHeartbeat("i2");

        assertThat(directory.findStaleInstances(clock.millis() - 30_000L)).containsExactly("i1");
        assertThat(directory.findStaleInstances(clock.millis())).containsExactly("i1");
    }

    @Test
    void removeInstanceDropsOnlyItsConnections() {
        directory.registerConnection(info("c1", "i1"));
        directory.registerConnection(info("c2", "i1"));
        directory.registerConnection(info("c3", "i2"));
        directory.recordInstanceHeartbeat("i1");

        assertThat(directory.removeInstance("i1")).containsExactlyInAnyOrder("c1", "c2");
        assertThat(directory.isActive("c3")).isTrue();
        assertThat(directory.findStaleInstances(Long.MAX_VALUE)).doesNotContain("i1");
    }

    private ConnectionInfo info(String connectionId, String instanceId) {
        return ConnectionInfo.builder()
                .connectionId(connectionId)
                .userId("user-" + connectionId)
                .instanceId(instanceId)
                .protocol("NATIVE")
                .connectedAt(clock.millis())
                .lastActivityAt(clock.millis())
                .build();
    }
}
