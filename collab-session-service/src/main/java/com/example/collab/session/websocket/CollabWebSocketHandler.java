package com.example.collab.session.websocket;

import com.example.collab.session.command.ClientCommand;
import com.example.collab.session.command.CommandDispatcher;
import com.example.collab.session.command.CommandReply;
import com.example.collab.session.model.CollabConnection;
import com.example.collab.session.protocol.InboundFrame;
import com.example.collab.session.protocol.OutboundFrame;
import com.example.collab.session.protocol.ProtocolCodec;
import com.example.collab.session.protocol.ProtocolException;
import com.example.collab.session.service.SessionCoordinator;
import com.example.collab.session.service.UserIdentityResolver;
import com.example.collab.shared.exception.CollabException;
import com.example.collab.shared.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;

/**
 * Binds one WebSocket endpoint to a codec. Inbound frames of a connection are processed one at a
 * time off the event loop; outbound frames flow from the connection's channel.
 */
@Slf4j
public class CollabWebSocketHandler implements WebSocketHandler {

    private final ProtocolCodec codec;
    private final SessionCoordinator sessionCoordinator;
    private final CommandDispatcher commandDispatcher;
    private final UserIdentityResolver identityResolver;
    private final Scheduler inboundScheduler;

    public CollabWebSocketHandler(ProtocolCodec codec,
                                  SessionCoordinator sessionCoordinator,
                                  CommandDispatcher commandDispatcher,
                                  UserIdentityResolver identityResolver,
                                  Scheduler inboundScheduler) {
        this.codec = codec;
        this.sessionCoordinator = sessionCoordinator;
        this.commandDispatcher = commandDispatcher;
        this.identityResolver = identityResolver;
        this.inboundScheduler = inboundScheduler;
    }

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        WebSocketOutboundChannel channel = new WebSocketOutboundChannel();
        CollabConnection connection;
        try {
            String userId = identityResolver.resolve(session.getHandshakeInfo()).orElse(null);
            connection = sessionCoordinator.connect(userId, codec, channel);
        } catch (CollabException e) {
            log.warn("Rejected {} connection from {}: {}", codec.protocol(), session.getHandshakeInfo().getRemoteAddress(), e.getMessage());
            OutboundFrame error = codec.encodeError(e.getErrorCode(), e.getMessage(), null);
            return session.send(Mono.just(toMessage(session, error)))
                    .then(session.close(CloseStatus.GOING_AWAY));
        }

        String connectionId = connection.getConnectionId();
        codec.handshake(connectionId).forEach(connection::send);

        Mono<Void> input = session.receive()
                .filter(message -> message.getType() == WebSocketMessage.Type.TEXT || message.getType() == WebSocketMessage.Type.BINARY)
                .map(this::toInbound)
                .publishOn(inboundScheduler)
                .concatMap(frame -> Mono.fromRunnable(() -> process(connection, frame)))
                .doOnError(e -> log.warn("Inbound stream of connection {} failed: {}", connectionId, e.getMessage()))
                .onErrorResume(e -> Mono.empty())
                .then()
                .doFinally(signal -> sessionCoordinator.disconnect(connectionId, "transport-closed"));

        Mono<Void> output = session.send(channel.asFlux().map(frame -> toMessage(session, frame)))
                .then(Mono.defer(session::close));

        return Mono.when(input, output);
    }

    void process(CollabConnection connection, InboundFrame frame) {
        sessionCoordinator.touch(connection.getConnectionId());
        List<ClientCommand> commands;
        try {
            commands = codec.decode(frame);
        } catch (ProtocolException e) {
            log.debug("Malformed {} frame on connection {}: {}", codec.protocol(), connection.getConnectionId(), e.getMessage());
            connection.send(codec.encodeError(e.getErrorCode(), e.getMessage(), e.getPartialCommand()));
            return;
        } catch (Exception e) {
            log.warn("Failed to decode {} frame on connection {}: {}", codec.protocol(), connection.getConnectionId(), e.getMessage());
            connection.send(codec.encodeError(ErrorCode.PROTOCOL_ERROR, ErrorCode.PROTOCOL_ERROR.getDefaultMessage(), null));
            return;
        }
        for (ClientCommand command : commands) {
            if (!connection.isActive()) {
                return;
            }
            CommandReply reply = commandDispatcher.dispatch(connection, command);
            codec.encodeReply(reply).ifPresent(connection::send);
        }
    }

    private InboundFrame toInbound(WebSocketMessage message) {
        if (message.getType() == WebSocketMessage.Type.TEXT) {
            return InboundFrame.text(message.getPayloadAsText());
        }
        DataBuffer payload = message.getPayload();
        byte[] bytes = new byte[payload.readableByteCount()];
        payload.read(bytes);
        return InboundFrame.binary(bytes);
    }

    private WebSocketMessage toMessage(WebSocketSession session, OutboundFrame frame) {
        if (frame.isText()) {
            return session.textMessage(frame.getText());
        }
        return session.binaryMessage(factory -> factory.wrap(frame.getBinary()));
    }
}
