package com.example.collab.shared.lock;

import com.example.collab.shared.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryEditLockManagerTest {

    private static final Duration TTL = Duration.ofSeconds(30);

    private MutableClock clock;
    private InMemoryEditLockManager lockManager;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        lockManager = new InMemoryEditLockManager(clock);
    }

    @Test
    void exactlyOneOfManyConcurrentAcquirersWins() throws Exception {
        int contenders = 50;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<LockResult>> results = new ArrayList<>();
        try {
            for (int i = 0; i < contenders; i++) {
                String holder = "conn-" + i;
                Callable<LockResult> attempt = () -> {
                    start.await();
                    return lockManager.tryAcquire("piece-1", holder, TTL);
                };
                results.add(pool.submit(attempt));
            }
            start.countDown();

            int acquired = 0;
            for (Future<LockResult> result : results) {
                if (result.get(5, TimeUnit.SECONDS) == LockResult.ACQUIRED) {
                    acquired++;
                }
            }
            assertThat(acquired).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void reacquireBySameHolderRefreshesTtl() {
        assertThat(lockManager.tryAcquire("p1", "a", TTL)).isEqualTo(LockResult.ACQUIRED);
        clock.advance(Duration.ofSeconds(20));
        assertThat(lockManager.tryAcquire("p1", "a", TTL)).isEqualTo(LockResult.ACQUIRED);
        clock.advance(Duration.ofSeconds(20));

        assertThat(lockManager.isHeldBy("p1", "a")).isTrue();
        assertThat(lockManager.tryAcquire("p1", "b", TTL)).isEqualTo(LockResult.BUSY);
    }

    @Test
    void expiredLockCanBeTakenByAnotherHolder() {
        lockManager.tryAcquire("p1", "a", TTL);
        clock.advance(TTL);

        assertThat(lockManager.isHeldBy("p1", "a")).isFalse();
        assertThat(lockManager.tryAcquire("p1", "b", TTL)).isEqualTo(LockResult.ACQUIRED);
    }

    @Test
    void releaseAfterExpiryReturnsFalseAndKeepsNewHolder() {
        lockManager.tryAcquire("p1", "a", TTL);
        clock.advance(TTL.plusSeconds(1));
        lockManager.tryAcquire("p1", "b", TTL);

        assertThat(lockManager.release("p1", "a")).isFalse();
        assertThat(lockManager.isHeldBy("p1", "b")).isTrue();
    }

    @Test
    void releaseByNonHolderIsRejected() {
        lockManager.tryAcquire("p1", "a", TTL);

        assertThat(lockManager.release("p1", "b")).isFalse();
        assertThat(lockManager.isHeldBy("p1", "a")).isTrue();
        assertThat(lockManager.release("p1", "a")).isTrue();
        assertThat(lockManager.release("p1", "a")).isFalse();
    }

    @Test
    void releaseAllForSweepsOnlyTheHoldersLocks() {
        lockManager.tryAcquire("p1", "a", TTL);
        lockManager.tryAcquire("p2", "a", TTL);
        lockManager.tryAcquire("p3", "b", TTL);

        assertThat(lockManager.releaseAllFor("a")).containsExactlyInAnyOrder("p1", "p2");
        assertThat(lockManager.isHeldBy("p3", "b")).isTrue();
        assertThat(lockManager.releaseAllFor("a")).isEmpty();
    }
}
