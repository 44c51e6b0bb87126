package com.example.collab.session.websocket;

import com.example.collab.session.protocol.OutboundChannel;
import com.example.collab.session.protocol.OutboundFrame;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * Buffers frames for one WebSocket session until the transport writes them.
 * Emission is serialized because room fanout, throttle ticks and the inbound pipeline all write here.
 */
@Slf4j
public class WebSocketOutboundChannel implements OutboundChannel {

    private final Sinks.Many<OutboundFrame> sink = Sinks.many().multicast().onBackpressureBuffer();
    private volatile String closeReason;

    @Override
    public synchronized boolean send(OutboundFrame frame) {
        Sinks.EmitResult result = sink.tryEmitNext(frame);
        if (result.isFailure()) {
            log.debug("Failed to emit outbound frame. Result: {}", result);
            return false;
        }
        return true;
    }

    @Override
    public synchronized void close(String reason) {
        this.closeReason = reason;
        sink.tryEmitComplete();
    }

    public Flux<OutboundFrame> asFlux() {
        return sink.asFlux();
    }

    public String getCloseReason() {
        return closeReason;
    }
}
