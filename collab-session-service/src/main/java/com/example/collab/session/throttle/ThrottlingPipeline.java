package com.example.collab.session.throttle;

import com.example.collab.shared.config.AppProperties;
import com.example.collab.shared.dto.CollabEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;

/**
 * Last-value-wins coalescing of high-frequency streams. Each (connection, stream key) gets one
 * periodic task that flushes at most one event per tick and nothing when no update arrived.
 */
@Service
@Slf4j
public class ThrottlingPipeline {

    private final Map<StreamKey, CoalescingStream> streams = new ConcurrentHashMap<>();
    private final Scheduler scheduler;
    private final Duration tick;

    @Autowired
    public ThrottlingPipeline(@Qualifier("throttleScheduler") Scheduler scheduler, AppProperties appProperties) {
        this(scheduler, Duration.ofMillis(appProperties.getThrottle().getTick()));
    }

    public ThrottlingPipeline(Scheduler scheduler, Duration tick) {
        this.scheduler = scheduler;
        this.tick = tick;
    }

    /**
     * Replaces whatever value is pending for the stream. The stream is opened on first use
     * with {@code flushAction}; later calls keep the original action. A flush returning false
     * means the stream's owner is gone and closes the stream.
     */
    public void submit(String connectionId, String streamKey, CollabEvent event, Predicate<CollabEvent> flushAction) {
        StreamKey key = new StreamKey(connectionId, streamKey);
        streams.computeIfAbsent(key, k -> open(k, flushAction)).offer(event);
    }

    /**
     * Stops and discards every stream of the connection, including values not yet flushed.
     * @return the number of streams closed
     */
    public int closeAll(String connectionId) {
        List<StreamKey> owned = new ArrayList<>();
        for (StreamKey key : streams.keySet()) {
            if (key.connectionId().equals(connectionId)) {
                owned.add(key);
            }
        }
        int closed = 0;
        for (StreamKey key : owned) {
            CoalescingStream stream = streams.remove(key);
            if (stream != null) {
                stream.close();
                closed++;
            }
        }
        if (closed > 0) {
            log.debug("Closed {} throttled streams for connection {}", closed, connectionId);
        }
        return closed;
    }

    public int activeStreamCount() {
        return streams.size();
    }

    public int activeStreamCount(String connectionId) {
        return (int) streams.keySet().stream().filter(key -> key.connectionId().equals(connectionId)).count();
    }

    private CoalescingStream open(StreamKey key, Predicate<CollabEvent> flushAction) {
        CoalescingStream stream = new CoalescingStream(key, flushAction);
        stream.start(Flux.interval(tick, tick, scheduler));
        log.debug("Opened throttled stream '{}' for connection {} (tick {}ms)", key.streamKey(), key.connectionId(), tick.toMillis());
        return stream;
    }

    private record StreamKey(String connectionId, String streamKey) {
    }

    private final class CoalescingStream {
        private final StreamKey key;
        private final Predicate<CollabEvent> flushAction;
        private final AtomicReference<CollabEvent> latest = new AtomicReference<>();
        private volatile Disposable task;

        private CoalescingStream(StreamKey key, Predicate<CollabEvent> flushAction) {
            this.key = key;
            this.flushAction = flushAction;
        }

        void start(Flux<Long> ticks) {
            task = ticks.subscribe(tick -> flush());
        }

        void offer(CollabEvent event) {
            latest.set(event);
        }

        private void flush() {
            CollabEvent value = latest.getAndSet(null);
            if (value == null) {
                return;
            }
            boolean ownerPresent;
            try {
                ownerPresent = flushAction.test(value);
            } catch (Exception e) {
                log.warn("Failed to flush throttled stream '{}' for connection {}: {}", key.streamKey(), key.connectionId(), e.getMessage());
                return;
            }
            if (!ownerPresent && streams.remove(key, this)) {
                close();
                log.debug("Closed orphaned throttled stream '{}' for connection {}", key.streamKey(), key.connectionId());
            }
        }

        void close() {
            Disposable current = task;
            if (current != null) {
                current.dispose();
            }
            latest.set(null);
        }
    }
}
