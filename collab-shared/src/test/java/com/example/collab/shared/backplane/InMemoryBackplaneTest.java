package com.example.collab.shared.backplane;

import com.example.collab.shared.dto.BackplaneEnvelope;
import com.example.collab.shared.dto.CollabEvent;
import com.example.collab.shared.util.Constants;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryBackplaneTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private InMemoryBackplane backplane;

    @BeforeEach
    void setUp() {
        backplane = new InMemoryBackplane(objectMapper);
    }

    @Test
    void prefixPatternReceivesEveryMatchingChannel() {
        List<String> channels = new ArrayList<>();
        backplane.subscribe("collab:test:room:*", (channel, envelope) -> channels.add(channel));

        backplane.publish("collab:test:room:r1", envelope("i1", "r1"));
        backplane.publish("collab:test:room:r2", envelope("i1", "r2"));
        backplane.publish("collab:test:conn:c1", envelope("i1", null));
        backplane.publish("collab:other:room:r1", envelope("i1", "r1"));

        assertThat(channels).containsExactly("collab:test:room:r1", "collab:test:room:r2");
    }

    @Test
    void exactChannelSubscriptionIgnoresSiblings() {
        List<String> channels = new ArrayList<>();
        backplane.subscribe("collab:test:control", (channel, envelope) -> channels.add(channel));

        backplane.publish("collab:test:control", envelope("i1", null));
        backplane.publish("collab:test:controlled", envelope("i1", null));

        assertThat(channels).containsExactly("collab:test:control");
    }

    @Test
    void everySubscriberGetsItsOwnCopy() {
        List<BackplaneEnvelope> first = new ArrayList<>();
        List<BackplaneEnvelope> second = new ArrayList<>();
        backplane.subscribe("collab:test:room:*", (channel, envelope) -> {
            envelope.getExcludeConnectionIds().add("mutated");
            first.add(envelope);
        });
        backplane.subscribe("collab:test:room:*", (channel, envelope) -> second.add(envelope));

        BackplaneEnvelope published = envelope("i1", "r1");
        backplane.publish("collab:test:room:r1", published);

        assertThat(first).hasSize(1);
        assertThat(second).hasSize(1);
        assertThat(second.get(0)).isNotSameAs(published);
        assertThat(second.get(0).getExcludeConnectionIds()).containsExactly("c-excluded");
        assertThat(second.get(0).getEvent().getRoomId()).isEqualTo("r1");
        assertThat(published.getExcludeConnectionIds()).containsExactly("c-excluded");
    }

    @Test
    void failingHandlerDoesNotStopOtherSubscribers() {
        List<String> delivered = new ArrayList<>();
        backplane.subscribe("collab:test:room:*", (channel, envelope) -> {
            throw new IllegalStateException("boom");
        });
        backplane.subscribe("collab:test:room:*", (channel, envelope) -> delivered.add(channel));

        backplane.publish("collab:test:room:r1", envelope("i1", "r1"));

        assertThat(delivered).containsExactly("collab:test:room:r1");
    }

    @Test
    void unsubscribeStopsDelivery() {
        List<String> channels = new ArrayList<>();
        BackplaneSubscription subscription = backplane.subscribe("collab:test:room:*", (channel, envelope) -> channels.add(channel));

        subscription.unsubscribe();
        backplane.publish("collab:test:room:r1", envelope("i1", "r1"));

        assertThat(channels).isEmpty();
        assertThat(backplane.getSubscriptionCount()).isZero();
    }

    private BackplaneEnvelope envelope(String origin, String roomId) {
        CollabEvent event = CollabEvent.builder()
                .type(Constants.EventType.CHAT_MESSAGE)
                .roomId(roomId)
                .originInstance(origin)
                .timestamp(1L)
                .payload(objectMapper.createObjectNode().put("message", "hi"))
                .build();
        return BackplaneEnvelope.builder()
                .originInstance(origin)
                .event(event)
                .excludeConnectionIds(new java.util.HashSet<>(Set.of("c-excluded")))
                .build();
    }
}
