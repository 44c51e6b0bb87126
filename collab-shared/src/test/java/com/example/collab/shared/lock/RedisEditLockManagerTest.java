package com.example.collab.shared.lock;

import com.example.collab.shared.config.AppProperties;
import com.example.collab.shared.service.StoreHealthTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.core.SetOperations;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Duration;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedisEditLockManagerTest {

    @Mock
    private StringRedisTemplate redisTemplate;
    @Mock
    private SetOperations<String, String> setOperations;

    private StoreHealthTracker storeHealthTracker;
    private RedisEditLockManager lockManager;

    @BeforeEach
    void setUp() {
        AppProperties appProperties = new AppProperties();
        appProperties.setClusterName("test");
        appProperties.setInstanceId("instance-1");
        storeHealthTracker = new StoreHealthTracker();
        lockManager = new RedisEditLockManager(redisTemplate, appProperties, storeHealthTracker);
    }

    @Test
    @SuppressWarnings("unchecked")
    void acquireRunsScriptAgainstNamespacedKeys() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(), any(), any())).thenReturn(1L);

        assertThat(lockManager.tryAcquire("p1", "conn-a", Duration.ofSeconds(30))).isEqualTo(LockResult.ACQUIRED);
        verify(redisTemplate).execute(any(RedisScript.class),
                eq(List.of("collab:test:lock:p1", "collab:test:lock-holder:conn-a")),
                eq("conn-a"), eq("30000"), eq("p1"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void scriptReturningZeroMeansBusy() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(), any(), any())).thenReturn(0L);

        assertThat(lockManager.tryAcquire("p1", "conn-b", Duration.ofSeconds(30))).isEqualTo(LockResult.BUSY);
        assertThat(storeHealthTracker.isDegraded()).isFalse();
    }

    @Test
    @SuppressWarnings("unchecked")
    void storeTimeoutFailsClosed() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(), any(), any()))
                .thenThrow(new QueryTimeoutException("Redis command timed out"));

        assertThat(lockManager.tryAcquire("p1", "conn-a", Duration.ofSeconds(30))).isEqualTo(LockResult.UNAVAILABLE);
        assertThat(storeHealthTracker.isDegraded()).isTrue();
        assertThat(storeHealthTracker.getFailureCount()).isEqualTo(1);
    }

    @Test
    @SuppressWarnings("unchecked")
    void releaseFailureReturnsFalse() {
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(), any()))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThat(lockManager.release("p1", "conn-a")).isFalse();
        assertThat(storeHealthTracker.isDegraded()).isTrue();
    }

    @Test
    void releaseAllForReturnsEmptyWhenStoreIsDown() {
        when(redisTemplate.opsForSet()).thenReturn(setOperations);
        when(setOperations.members("collab:test:lock-holder:conn-a"))
                .thenThrow(new RedisConnectionFailureException("connection refused"));

        assertThat(lockManager.releaseAllFor("conn-a")).isEmpty();
        assertThat(storeHealthTracker.isDegraded()).isTrue();
    }

    @Test
    @SuppressWarnings("unchecked")
    void releaseAllForReleasesIndexedObjects() {
        when(redisTemplate.opsForSet()).thenReturn(setOperations);
        when(setOperations.members("collab:test:lock-holder:conn-a")).thenReturn(Set.of("p1", "p2"));
        when(redisTemplate.execute(any(RedisScript.class), anyList(), eq("conn-a"), eq("p1"))).thenReturn(1L);
        when(redisTemplate.execute(any(RedisScript.class), anyList(), eq("conn-a"), eq("p2"))).thenReturn(0L);

        assertThat(lockManager.releaseAllFor("conn-a")).containsExactly("p1");
        verify(redisTemplate).delete("collab:test:lock-holder:conn-a");
    }

    @Test
    @SuppressWarnings("unchecked")
    void successfulCallClearsDegradedMode() {
        storeHealthTracker.recordFailure("earlier", new RuntimeException("down"));
        when(redisTemplate.execute(any(RedisScript.class), anyList(), any(), any(), any())).thenReturn(1L);

        lockManager.tryAcquire("p1", "conn-a", Duration.ofSeconds(30));

        assertThat(storeHealthTracker.isDegraded()).isFalse();
    }
}
