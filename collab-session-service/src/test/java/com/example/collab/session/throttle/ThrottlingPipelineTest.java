package com.example.collab.session.throttle;

import com.example.collab.shared.dto.CollabEvent;
import com.example.collab.shared.util.Constants;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ThrottlingPipelineTest {

    private static final Duration TICK = Duration.ofMillis(100);

    private VirtualTimeScheduler scheduler;
    private ThrottlingPipeline pipeline;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        pipeline = new ThrottlingPipeline(scheduler, TICK);
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    @Test
    void burstWithinOneTickFlushesOnlyTheLastValue() {
        List<CollabEvent> flushed = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            pipeline.submit("c1", "cursor", cursor(i), flushed::add);
        }

        scheduler.advanceTimeBy(TICK);

        assertThat(flushed).hasSize(1);
        assertThat(flushed.get(0).getPayload().path("x").asInt()).isEqualTo(99);
    }

    @Test
    void quietTicksFlushNothing() {
        List<CollabEvent> flushed = new ArrayList<>();
        pipeline.submit("c1", "cursor", cursor(1), flushed::add);

        scheduler.advanceTimeBy(TICK.multipliedBy(5));

        assertThat(flushed).hasSize(1);
        assertThat(pipeline.activeStreamCount("c1")).isEqualTo(1);
    }

    @Test
    void eachTickCarriesItsOwnLatestValue() {
        List<CollabEvent> flushed = new ArrayList<>();
        pipeline.submit("c1", "cursor", cursor(1), flushed::add);
        pipeline.submit("c1", "cursor", cursor(2), flushed::add);
        scheduler.advanceTimeBy(TICK);
        pipeline.submit("c1", "cursor", cursor(3), flushed::add);
        scheduler.advanceTimeBy(TICK);

        assertThat(flushed).extracting(event -> event.getPayload().path("x").asInt()).containsExactly(2, 3);
    }

    @Test
    void nothingIsFlushedBeforeTheFirstTick() {
        List<CollabEvent> flushed = new ArrayList<>();
        pipeline.submit("c1", "cursor", cursor(1), flushed::add);

        scheduler.advanceTimeBy(TICK.minusMillis(1));

        assertThat(flushed).isEmpty();
    }

    @Test
    void streamsAreIndependentPerConnectionAndKey() {
        List<CollabEvent> first = new ArrayList<>();
        List<CollabEvent> second = new ArrayList<>();
        List<CollabEvent> other = new ArrayList<>();
        pipeline.submit("c1", "cursor", cursor(1), first::add);
        pipeline.submit("c2", "cursor", cursor(2), second::add);
        pipeline.submit("c1", "selection", cursor(3), other::add);

        scheduler.advanceTimeBy(TICK);

        assertThat(first).hasSize(1);
        assertThat(second).hasSize(1);
        assertThat(other).hasSize(1);
        assertThat(pipeline.activeStreamCount()).isEqualTo(3);
        assertThat(pipeline.activeStreamCount("c1")).isEqualTo(2);
    }

    @Test
    void closeAllDiscardsPendingValues() {
        List<CollabEvent> flushed = new ArrayList<>();
        pipeline.submit("c1", "cursor", cursor(1), flushed::add);
        pipeline.submit("c2", "cursor", cursor(2), flushed::add);

        assertThat(pipeline.closeAll("c1")).isEqualTo(1);
        scheduler.advanceTimeBy(TICK.multipliedBy(3));

        assertThat(flushed).extracting(event -> event.getPayload().path("x").asInt()).containsExactly(2);
        assertThat(pipeline.activeStreamCount("c1")).isZero();
        assertThat(pipeline.closeAll("c1")).isZero();
    }

    @Test
    void failingFlushKeepsTheStreamAlive() {
        List<CollabEvent> flushed = new ArrayList<>();
        pipeline.submit("c1", "cursor", cursor(1), event -> {
            if (event.getPayload().path("x").asInt() == 1) {
                throw new IllegalStateException("boom");
            }
            return flushed.add(event);
        });
        scheduler.advanceTimeBy(TICK);
        pipeline.submit("c1", "cursor", cursor(2), event -> true);
        scheduler.advanceTimeBy(TICK);

        assertThat(flushed).extracting(event -> event.getPayload().path("x").asInt()).containsExactly(2);
        assertThat(pipeline.activeStreamCount("c1")).isEqualTo(1);
    }

    @Test
    void streamWhoseOwnerIsGoneClosesItselfOnFlush() {
        AtomicInteger attempts = new AtomicInteger();
        pipeline.submit("c1", "cursor", cursor(1), event -> {
            attempts.incrementAndGet();
            return false;
        });

        scheduler.advanceTimeBy(TICK);
        assertThat(pipeline.activeStreamCount("c1")).isZero();

        pipeline.submit("c1", "cursor", cursor(2), event -> {
            attempts.incrementAndGet();
            return true;
        });
        scheduler.advanceTimeBy(TICK.multipliedBy(3));

        assertThat(attempts).hasValue(2);
        assertThat(pipeline.activeStreamCount("c1")).isEqualTo(1);
    }

    private CollabEvent cursor(int x) {
        return CollabEvent.builder()
                .type(Constants.EventType.CURSOR_UPDATE)
                .roomId("room-1")
                .payload(JsonNodeFactory.instance.objectNode().put("x", x).put("y", 0))
                .build();
    }
}
