package com.example.collab.session.command;

import com.example.collab.session.model.CollabConnection;
import com.example.collab.session.model.JoinResult;
import com.example.collab.session.service.SessionCoordinator;
import com.example.collab.session.signaling.RelayResult;
import com.example.collab.session.signaling.SignalingRelay;
import com.example.collab.session.throttle.ThrottlingPipeline;
import com.example.collab.shared.config.AppProperties;
import com.example.collab.shared.dto.CollabEvent;
import com.example.collab.shared.event.CollabLifecycleEvent;
import com.example.collab.shared.exception.CollabException;
import com.example.collab.shared.exception.ErrorCode;
import com.example.collab.shared.lock.EditLockManager;
import com.example.collab.shared.lock.LockResult;
import com.example.collab.shared.util.Constants;
import com.example.collab.shared.util.Constants.EventType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.nio.ByteBuffer;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Collections;
import java.util.Set;
import java.util.UUID;

/**
 * Executes decoded commands on behalf of one connection. Every outcome is a {@link CommandReply};
 * nothing thrown here reaches the transport.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CommandDispatcher {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final SessionCoordinator sessionCoordinator;
    private final EditLockManager lockManager;
    private final ThrottlingPipeline throttlingPipeline;
    private final SignalingRelay signalingRelay;
    private final ApplicationEventPublisher eventPublisher;
    private final AppProperties appProperties;
    private final ObjectMapper objectMapper;

    public CommandReply dispatch(CollabConnection connection, ClientCommand command) {
        try {
            return execute(connection, command);
        } catch (CollabException e) {
            log.debug("Command {} from connection {} rejected: {} ({})", command.getType(), connection.getConnectionId(),
                    e.getErrorCode().getCode(), e.getMessage());
            return CommandReply.error(command, e.getErrorCode(), e.getMessage());
        } catch (Exception e) {
            log.error("Failed to process command {} from connection {}: {}", command.getType(), connection.getConnectionId(), e.getMessage(), e);
            return CommandReply.error(command, ErrorCode.INTERNAL_ERROR, ErrorCode.INTERNAL_ERROR.getDefaultMessage());
        }
    }

    private CommandReply execute(CollabConnection connection, ClientCommand command) {
        if (command.getType() == null) {
            throw new CollabException(ErrorCode.UNKNOWN_COMMAND);
        }
        switch (command.getType()) {
            case HANDSHAKE:
                return CommandReply.handshake(command, object().put("connectionId", connection.getConnectionId()));
            case CONNECT:
                return CommandReply.handshake(command, object().put("sid", connection.getConnectionId()));
            case PING:
                return CommandReply.pong(command, object().put("timestamp", System.currentTimeMillis()));
            case PONG:
                return CommandReply.none(command);
            case ECHO:
                return CommandReply.echo(command, command.getPayload());
            case BINARY_REQUEST:
                return CommandReply.binary(command, binaryResponse());
            case BINARY_DATA:
                return CommandReply.binary(command, command.getBinary() == null ? new byte[0] : command.getBinary());
            case CLIENT_ERROR:
                log.warn("Client on connection {} reported an error: {}", connection.getConnectionId(),
                        command.getText() != null ? command.getText() : command.getPayload());
                return CommandReply.none(command);
            case JOIN_ROOM:
                return join(connection, command);
            case LEAVE_ROOM:
                return leave(connection, command);
            case LOCK_PIECE:
                return lock(connection, command);
            case UNLOCK_PIECE:
                return unlock(connection, command);
            case MOVE_PIECE:
                return move(connection, command);
            case CHAT_MESSAGE:
                return chat(connection, command);
            case CURSOR_UPDATE:
                return cursor(connection, command);
            case CUSTOM_EVENT:
                return customEvent(connection, command);
            case SIGNAL:
                return signal(connection, command);
            case CLOSE:
                sessionCoordinator.disconnect(connection.getConnectionId(), "client-close");
                return CommandReply.none(command);
            default:
                throw new CollabException(ErrorCode.UNKNOWN_COMMAND);
        }
    }

    private CommandReply join(CollabConnection connection, ClientCommand command) {
        JoinResult result = sessionCoordinator.joinRoom(connection.getConnectionId(), command.getRoomId());
        return CommandReply.result(command, objectMapper.valueToTree(result));
    }

    private CommandReply leave(CollabConnection connection, ClientCommand command) {
        String roomId = connection.getRoomId();
        sessionCoordinator.leaveRoom(connection.getConnectionId());
        ObjectNode body = object().put("success", true);
        body.put("roomId", roomId);
        return CommandReply.result(command, body);
    }

    private CommandReply lock(CollabConnection connection, ClientCommand command) {
        String roomId = requireRoom(connection);
        String pieceId = requireObjectId(command);
        Duration ttl = Duration.ofMillis(appProperties.getLock().getTtl());
        LockResult result = lockManager.tryAcquire(pieceId, connection.getConnectionId(), ttl);

        if (result.isAcquired()) {
            long expiry = System.currentTimeMillis() + ttl.toMillis();
            ObjectNode payload = object();
            payload.put("pieceId", pieceId);
            payload.put("lockedBy", connection.getUserId());
            payload.put("lockedByConnection", connection.getConnectionId());
            payload.put("lockExpiry", expiry);
            sessionCoordinator.broadcast(roomId, sessionCoordinator.roomEvent(EventType.PIECE_LOCKED, connection, roomId, payload), Collections.emptySet());
            publishLifecycle(Constants.LifecycleEventType.LOCK_ACQUIRED, connection, pieceId);

            ObjectNode body = object().put("success", true);
            body.put("pieceId", pieceId);
            body.put("lockExpiry", expiry);
            return CommandReply.result(command, body);
        }

        publishLifecycle(Constants.LifecycleEventType.LOCK_DENIED, connection, pieceId);
        ErrorCode code = result == LockResult.BUSY ? ErrorCode.LOCK_BUSY : ErrorCode.LOCK_UNAVAILABLE;
        log.debug("Lock on {} denied to connection {}: {}", pieceId, connection.getConnectionId(), result);
        return CommandReply.error(command, code, code.getDefaultMessage());
    }

    private CommandReply unlock(CollabConnection connection, ClientCommand command) {
        String roomId = requireRoom(connection);
        String pieceId = requireObjectId(command);
        if (!lockManager.release(pieceId, connection.getConnectionId())) {
            throw new CollabException(ErrorCode.NOT_LOCK_HOLDER);
        }
        ObjectNode payload = object();
        payload.put("pieceId", pieceId);
        payload.put("unlockedBy", connection.getUserId());
        sessionCoordinator.broadcast(roomId, sessionCoordinator.roomEvent(EventType.PIECE_UNLOCKED, connection, roomId, payload), Collections.emptySet());

        ObjectNode body = object().put("success", true);
        body.put("pieceId", pieceId);
        return CommandReply.result(command, body);
    }

    private CommandReply move(CollabConnection connection, ClientCommand command) {
        String roomId = requireRoom(connection);
        String pieceId = requireObjectId(command);
        JsonNode position = command.getPayload();
        if (position == null || !position.path("x").isNumber() || !position.path("y").isNumber()) {
            throw new CollabException(ErrorCode.INVALID_ARGUMENT, "x and y must be numbers");
        }
        if (!lockManager.isHeldBy(pieceId, connection.getConnectionId())) {
            throw new CollabException(ErrorCode.NOT_LOCK_HOLDER);
        }
        ObjectNode payload = object();
        payload.put("pieceId", pieceId);
        payload.put("x", position.path("x").asDouble());
        payload.put("y", position.path("y").asDouble());
        payload.put("rotation", position.path("rotation").asDouble(0));
        payload.put("movedBy", connection.getUserId());
        sessionCoordinator.broadcast(roomId, sessionCoordinator.roomEvent(EventType.PIECE_MOVED, connection, roomId, payload),
                Set.of(connection.getConnectionId()));

        ObjectNode body = payload.deepCopy();
        body.put("success", true);
        return CommandReply.result(command, body);
    }

    private CommandReply chat(CollabConnection connection, ClientCommand command) {
        String roomId = requireRoom(connection);
        String message = command.getText();
        if (!StringUtils.hasText(message)) {
            throw new CollabException(ErrorCode.INVALID_ARGUMENT, "Message must not be empty");
        }
        int maxLength = appProperties.getChat().getMaxLength();
        if (message.length() > maxLength) {
            throw new CollabException(ErrorCode.INVALID_ARGUMENT, "Message exceeds " + maxLength + " characters");
        }
        long now = System.currentTimeMillis();
        String messageId = UUID.randomUUID().toString();
        ObjectNode payload = object();
        payload.put("messageId", messageId);
        payload.put("userId", connection.getUserId());
        payload.put("message", message);
        payload.put("timestamp", now);
        sessionCoordinator.broadcast(roomId, sessionCoordinator.roomEvent(EventType.CHAT_MESSAGE, connection, roomId, payload), Collections.emptySet());

        ObjectNode body = object().put("success", true);
        body.put("messageId", messageId);
        body.put("timestamp", now);
        return CommandReply.result(command, body);
    }

    private CommandReply cursor(CollabConnection connection, ClientCommand command) {
        String roomId = connection.getRoomId();
        if (roomId == null || !connection.isInRoom(roomId)) {
            // high-frequency stream: updates outside a room are dropped without a reply
            return CommandReply.none(command);
        }
        JsonNode position = command.getPayload();
        if (position == null || !position.path("x").isNumber() || !position.path("y").isNumber()) {
            throw new CollabException(ErrorCode.INVALID_ARGUMENT, "x and y must be numbers");
        }
        ObjectNode payload = object();
        payload.put("connectionId", connection.getConnectionId());
        payload.put("userId", connection.getUserId());
        payload.put("x", position.path("x").asDouble());
        payload.put("y", position.path("y").asDouble());
        payload.put("timestamp", System.currentTimeMillis());
        CollabEvent event = sessionCoordinator.roomEvent(EventType.CURSOR_UPDATE, connection, roomId, payload);

        String connectionId = connection.getConnectionId();
        throttlingPipeline.submit(connectionId, Constants.CURSOR_STREAM_KEY, event, latest -> {
            if (!connection.isInRoom(latest.getRoomId())) {
                return false;
            }
            sessionCoordinator.broadcast(latest.getRoomId(), latest, Set.of(connectionId));
            return true;
        });
        return CommandReply.none(command);
    }

    private CommandReply customEvent(CollabConnection connection, ClientCommand command) {
        String roomId = requireRoom(connection);
        if (!StringUtils.hasText(command.getEventName())) {
            throw new CollabException(ErrorCode.INVALID_ARGUMENT, "Event name is required");
        }
        CollabEvent event = sessionCoordinator.roomEvent(EventType.CUSTOM, connection, roomId, command.getPayload())
                .toBuilder()
                .name(command.getEventName())
                .build();
        sessionCoordinator.broadcast(roomId, event, Set.of(connection.getConnectionId()));
        return CommandReply.none(command);
    }

    private CommandReply signal(CollabConnection connection, ClientCommand command) {
        if (command.getSignalKind() == null) {
            throw new CollabException(ErrorCode.INVALID_ARGUMENT, "Signal kind is required");
        }
        if (!StringUtils.hasText(command.getTargetConnectionId())) {
            throw new CollabException(ErrorCode.INVALID_ARGUMENT, "Target connection is required");
        }
        RelayResult result = signalingRelay.relayToPeer(connection.getConnectionId(), command.getTargetConnectionId(),
                command.getSignalKind(), command.getPayload());
        if (!result.isDelivered()) {
            throw new CollabException(ErrorCode.PEER_UNAVAILABLE);
        }
        ObjectNode body = object().put("success", true);
        body.put("target", command.getTargetConnectionId());
        body.put("kind", command.getSignalKind().getWireName());
        return CommandReply.result(command, body);
    }

    private String requireRoom(CollabConnection connection) {
        String roomId = connection.getRoomId();
        if (connection.getState() != Constants.ConnectionState.JOINED || roomId == null) {
            throw new CollabException(ErrorCode.NOT_IN_ROOM);
        }
        return roomId;
    }

    private String requireObjectId(ClientCommand command) {
        if (!StringUtils.hasText(command.getObjectId())) {
            throw new CollabException(ErrorCode.INVALID_ARGUMENT, "pieceId is required");
        }
        return command.getObjectId();
    }

    private byte[] binaryResponse() {
        byte[] body = new byte[appProperties.getBinary().getResponseBodyBytes()];
        RANDOM.nextBytes(body);
        return ByteBuffer.allocate(Long.BYTES + body.length)
                .putLong(System.currentTimeMillis())
                .put(body)
                .array();
    }

    private ObjectNode object() {
        return objectMapper.createObjectNode();
    }

    private void publishLifecycle(Constants.LifecycleEventType type, CollabConnection connection, String objectId) {
        eventPublisher.publishEvent(new CollabLifecycleEvent(this, type, connection.getConnectionId(), connection.getUserId(), objectId));
    }
}
