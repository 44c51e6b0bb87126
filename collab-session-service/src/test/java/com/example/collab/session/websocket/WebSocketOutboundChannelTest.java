package com.example.collab.session.websocket;

import com.example.collab.session.protocol.OutboundFrame;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class WebSocketOutboundChannelTest {

    @Test
    void framesFlowUntilClosed() {
        WebSocketOutboundChannel channel = new WebSocketOutboundChannel();

        StepVerifier.create(channel.asFlux().map(OutboundFrame::getText))
                .then(() -> {
                    assertThat(channel.send(OutboundFrame.text("one"))).isTrue();
                    assertThat(channel.send(OutboundFrame.text("two"))).isTrue();
                    channel.close("client-close");
                })
                .expectNext("one", "two")
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertThat(channel.getCloseReason()).isEqualTo("client-close");
        assertThat(channel.send(OutboundFrame.text("late"))).isFalse();
    }
}
