package com.example.collab.session.service;

import com.example.collab.session.model.CollabConnection;
import com.example.collab.session.model.JoinResult;
import com.example.collab.session.model.Room;
import com.example.collab.session.protocol.OutboundChannel;
import com.example.collab.session.protocol.ProtocolCodec;
import com.example.collab.session.throttle.ThrottlingPipeline;
import com.example.collab.shared.aspect.Monitored;
import com.example.collab.shared.backplane.Backplane;
import com.example.collab.shared.backplane.BackplaneChannels;
import com.example.collab.shared.config.AppProperties;
import com.example.collab.shared.dto.BackplaneEnvelope;
import com.example.collab.shared.dto.CollabEvent;
import com.example.collab.shared.dto.IceServer;
import com.example.collab.shared.dto.MemberInfo;
import com.example.collab.shared.dto.cache.ConnectionInfo;
import com.example.collab.shared.event.CollabLifecycleEvent;
import com.example.collab.shared.exception.CollabException;
import com.example.collab.shared.exception.ErrorCode;
import com.example.collab.shared.lock.EditLockManager;
import com.example.collab.shared.service.directory.ConnectionDirectory;
import com.example.collab.shared.util.Constants;
import com.example.collab.shared.util.Constants.EventType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns this instance's connections and its view of room membership.
 * It is the single source of truth for in-memory session state on this instance:
 * - registering connections locally and in the cluster-wide directory,
 * - joining and leaving rooms, including the lock and throttle cleanup a leave implies,
 * - delivering room events locally and fanning them out over the backplane,
 * - applying presence announcements from other instances.
 */
@Service
@Slf4j
@Monitored("session")
public class SessionCoordinator {

    private static final int MAX_FAILED_EMITS = 3;

    private final ConnectionRegistry connectionRegistry;
    private final RoomRegistry roomRegistry;
    private final Backplane backplane;
    private final BackplaneChannels channels;
    private final EditLockManager lockManager;
    private final ConnectionDirectory connectionDirectory;
    private final RoomAccessPolicy roomAccessPolicy;
    private final ThrottlingPipeline throttlingPipeline;
    private final ApplicationEventPublisher eventPublisher;
    private final AppProperties appProperties;
    private final ObjectMapper objectMapper;

    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final Map<String, Integer> failedEmitCounts = new ConcurrentHashMap<>();

    public SessionCoordinator(ConnectionRegistry connectionRegistry,
                              RoomRegistry roomRegistry,
                              Backplane backplane,
                              BackplaneChannels channels,
                              EditLockManager lockManager,
                              ConnectionDirectory connectionDirectory,
                              RoomAccessPolicy roomAccessPolicy,
                              ThrottlingPipeline throttlingPipeline,
                              ApplicationEventPublisher eventPublisher,
                              AppProperties appProperties,
                              ObjectMapper objectMapper) {
        this.connectionRegistry = connectionRegistry;
        this.roomRegistry = roomRegistry;
        this.backplane = backplane;
        this.channels = channels;
        this.lockManager = lockManager;
        this.connectionDirectory = connectionDirectory;
        this.roomAccessPolicy = roomAccessPolicy;
        this.throttlingPipeline = throttlingPipeline;
        this.eventPublisher = eventPublisher;
        this.appProperties = appProperties;
        this.objectMapper = objectMapper;
    }

    /**
     * Registers a freshly accepted transport.
     *
     * @param userId  the resolved user, or null to use the connection id as the user id
     * @param codec   the wire adapter the transport speaks
     * @param channel where frames for this connection are written
     * @return the new connection in state CONNECTING
     * @throws CollabException with {@link ErrorCode#SERVER_DRAINING} while the instance shuts down
     */
    public CollabConnection connect(String userId, ProtocolCodec codec, OutboundChannel channel) {
        if (draining.get()) {
            throw new CollabException(ErrorCode.SERVER_DRAINING);
        }
        String connectionId = UUID.randomUUID().toString();
        String resolvedUserId = StringUtils.hasText(userId) ? userId : connectionId;
        long now = System.currentTimeMillis();
        CollabConnection connection = new CollabConnection(connectionId, resolvedUserId, codec, channel, now);
        connectionRegistry.register(connection);

        connectionDirectory.registerConnection(ConnectionInfo.builder()
                .connectionId(connectionId)
                .userId(resolvedUserId)
                .instanceId(instanceId())
                .protocol(codec.protocol().name())
                .connectedAt(now)
                .lastActivityAt(now)
                .build());

        publishLifecycle(Constants.LifecycleEventType.CONNECTION_OPENED, connection, null);
        log.info("[CONNECT] connection={} user={} protocol={} instance={}", connectionId, resolvedUserId, codec.protocol(), instanceId());
        return connection;
    }

    /**
     * Moves the connection into {@code roomId}, then leaves its current room. A rejected join
     * leaves the connection where it was. Joining the room the connection is already in changes
     * nothing and returns the current members again.
     */
    public JoinResult joinRoom(String connectionId, String roomId) {
        CollabConnection connection = requireActive(connectionId);
        if (!StringUtils.hasText(roomId)) {
            throw new CollabException(ErrorCode.INVALID_ARGUMENT, "roomId is required");
        }
        if (!roomAccessPolicy.isOpen(roomId, connection.getUserId())) {
            throw new CollabException(ErrorCode.ROOM_UNAVAILABLE);
        }

        MemberInfo member;
        boolean created;
        synchronized (connection) {
            if (connection.isInRoom(roomId)) {
                return buildJoinResult(connection, roomId);
            }
            if (!connection.isActive()) {
                throw new CollabException(ErrorCode.CONNECTION_CLOSED);
            }
            long now = System.currentTimeMillis();
            member = MemberInfo.builder()
                    .connectionId(connectionId)
                    .userId(connection.getUserId())
                    .instanceId(instanceId())
                    .joinedAt(now)
                    .build();
            RoomRegistry.JoinOutcome outcome = roomRegistry.join(roomId, member, now, appProperties.getRoom().getMaxMembers());
            if (!outcome.admitted()) {
                throw new CollabException(ErrorCode.ROOM_FULL);
            }
            created = outcome.created();
            // the current room is only left once the new one has admitted the connection
            if (connection.getState() == Constants.ConnectionState.JOINED) {
                leaveRoomInternal(connection, false);
            }
            connection.markJoined(roomId);
        }

        if (created) {
            backplane.publish(channels.roomChannel(roomId), envelope(internalEvent(EventType.PRESENCE_QUERY, roomId, null), Collections.emptySet()));
        }
        broadcast(roomId, roomEvent(EventType.USER_JOINED, connection, roomId, memberPayload(member, roomId)), Set.of(connectionId));
        log.info("[JOIN] connection={} user={} room={}", connectionId, connection.getUserId(), roomId);
        return buildJoinResult(connection, roomId);
    }

    /**
     * @return true if the connection was in a room
     */
    public boolean leaveRoom(String connectionId) {
        CollabConnection connection = connectionRegistry.get(connectionId);
        if (connection == null) {
            return false;
        }
        synchronized (connection) {
            return leaveRoomInternal(connection, false) != null;
        }
    }

    /**
     * Delivers to this instance's members of the room, then publishes for every other instance.
     */
    public void broadcast(String roomId, CollabEvent event, Set<String> excludeConnectionIds) {
        CollabEvent stamped = stamp(event, roomId);
        Set<String> excluded = excludeConnectionIds == null ? Collections.emptySet() : excludeConnectionIds;
        deliverLocal(roomId, stamped, excluded);
        backplane.publish(channels.roomChannel(roomId), envelope(stamped, excluded));
        roomRegistry.find(roomId).ifPresent(room -> room.touch(stamped.getTimestamp()));
    }

    /**
     * Local-only delivery. Never publishes, so events received from the backplane stop here.
     *
     * @return the number of connections the event was handed to
     */
    public int deliverLocal(String roomId, CollabEvent event, Set<String> excludeConnectionIds) {
        if (event == null || event.getType() == null || event.getType().isInternal()) {
            return 0;
        }
        Optional<Room> room = roomRegistry.find(roomId);
        if (room.isEmpty()) {
            return 0;
        }
        int delivered = 0;
        for (String memberId : room.get().getLocalConnectionIds()) {
            if (excludeConnectionIds != null && excludeConnectionIds.contains(memberId)) {
                continue;
            }
            CollabConnection member = connectionRegistry.get(memberId);
            if (member != null && member.isInRoom(roomId) && deliverTo(member, event)) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * Point-to-point delivery to a connection owned by this instance.
     */
    public boolean sendTo(String connectionId, CollabEvent event) {
        CollabConnection connection = connectionRegistry.get(connectionId);
        if (connection == null || !connection.isActive()) {
            return false;
        }
        return deliverTo(connection, event);
    }

    /**
     * Leaves the room, deregisters everywhere and closes the transport. Safe to call repeatedly.
     */
    public void disconnect(String connectionId, String reason) {
        CollabConnection connection = connectionRegistry.remove(connectionId);
        if (connection == null) {
            return;
        }
        synchronized (connection) {
            leaveRoomInternal(connection, true);
            connection.markDisconnected();
        }
        throttlingPipeline.closeAll(connectionId);
        failedEmitCounts.remove(connectionId);
        connectionDirectory.removeConnection(connectionId, instanceId());
        connection.closeTransport(reason);
        publishLifecycle(Constants.LifecycleEventType.CONNECTION_CLOSED, connection, reason);
        log.info("[DISCONNECT] connection={} user={} reason={}", connectionId, connection.getUserId(), reason);
    }

    public void touch(String connectionId) {
        CollabConnection connection = connectionRegistry.get(connectionId);
        if (connection != null) {
            connection.touch(System.currentTimeMillis());
        }
    }

    /**
     * @return ids of the connections disconnected for being silent longer than {@code idleTimeoutMillis}
     */
    public List<String> disconnectIdle(long idleTimeoutMillis, long now) {
        List<String> idle = new ArrayList<>();
        for (CollabConnection connection : connectionRegistry.all()) {
            if (now - connection.getLastInboundAt() > idleTimeoutMillis) {
                idle.add(connection.getConnectionId());
            }
        }
        for (String connectionId : idle) {
            log.warn("Connection {} idle for more than {}ms. Disconnecting.", connectionId, idleTimeoutMillis);
            disconnect(connectionId, "idle-timeout");
        }
        return idle;
    }

    public List<String> evictIdleRooms(long now) {
        List<String> evicted = roomRegistry.evictEmpty(now, appProperties.getRoom().getGracePeriod());
        if (!evicted.isEmpty()) {
            log.debug("Evicted {} empty rooms: {}", evicted.size(), evicted);
        }
        return evicted;
    }

    /**
     * Handles an envelope another instance published on a room or control channel.
     */
    public void onBackplaneEvent(BackplaneEnvelope envelope) {
        if (envelope == null || envelope.getEvent() == null || envelope.getEvent().getType() == null) {
            return;
        }
        if (instanceId().equals(envelope.getOriginInstance())) {
            return;
        }
        CollabEvent event = envelope.getEvent();
        switch (event.getType()) {
            case PRESENCE_QUERY:
                answerPresenceQuery(event.getRoomId());
                break;
            case PRESENCE_SNAPSHOT:
                applyPresenceSnapshot(event);
                break;
            case INSTANCE_DEPARTED:
                forgetInstance(event.getPayload() != null ? event.getPayload().path("instanceId").asText(null) : null);
                break;
            case USER_JOINED:
                memberFromPayload(event.getPayload()).ifPresent(member ->
                        roomRegistry.find(event.getRoomId()).ifPresent(room -> room.putRemoteMember(member)));
                deliverLocal(event.getRoomId(), event, envelope.getExcludeConnectionIds());
                break;
            case USER_LEFT:
                String leftConnection = event.getPayload() != null ? event.getPayload().path("connectionId").asText(null) : null;
                if (leftConnection != null) {
                    roomRegistry.find(event.getRoomId()).ifPresent(room -> room.removeRemoteMember(leftConnection));
                }
                deliverLocal(event.getRoomId(), event, envelope.getExcludeConnectionIds());
                break;
            default:
                deliverLocal(event.getRoomId(), event, envelope.getExcludeConnectionIds());
        }
    }

    /**
     * Drops the remote presence of an instance that is gone.
     */
    public int forgetInstance(String departedInstanceId) {
        if (!StringUtils.hasText(departedInstanceId) || instanceId().equals(departedInstanceId)) {
            return 0;
        }
        int removed = roomRegistry.forgetInstance(departedInstanceId);
        if (removed > 0) {
            log.info("Forgot {} remote members of departed instance {}", removed, departedInstanceId);
        }
        return removed;
    }

    /**
     * Refuses new connections, tells every client the server is going away, disconnects them all
     * with full cleanup and announces the departure to the rest of the cluster.
     */
    public int drain() {
        if (!draining.compareAndSet(false, true)) {
            return 0;
        }
        Collection<CollabConnection> connections = connectionRegistry.all();
        log.info("[DRAIN] Draining {} connections on instance {}", connections.size(), instanceId());
        long now = System.currentTimeMillis();
        for (CollabConnection connection : connections) {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("message", "Server is shutting down");
            payload.put("timestamp", now);
            connection.deliver(CollabEvent.builder()
                    .type(EventType.SERVER_SHUTDOWN)
                    .targetConnectionId(connection.getConnectionId())
                    .originInstance(instanceId())
                    .timestamp(now)
                    .payload(payload)
                    .build());
        }
        for (CollabConnection connection : connections) {
            disconnect(connection.getConnectionId(), "server-shutdown");
        }
        announceDeparture(instanceId());
        return connections.size();
    }

    /**
     * Publishes {@code INSTANCE_DEPARTED} for an instance on the control channel.
     */
    public void announceDeparture(String departedInstanceId) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("instanceId", departedInstanceId);
        backplane.publish(channels.controlChannel(), envelope(internalEvent(EventType.INSTANCE_DEPARTED, null, payload), Collections.emptySet()));
    }

    public boolean isDraining() {
        return draining.get();
    }

    public CollabConnection getConnection(String connectionId) {
        return connectionRegistry.get(connectionId);
    }

    public int getConnectionCount() {
        return connectionRegistry.size();
    }

    public int getRoomCount() {
        return roomRegistry.size();
    }

    public Set<String> getLocalConnectionIds() {
        return connectionRegistry.connectionIds();
    }

    public Collection<CollabConnection> getConnections() {
        return connectionRegistry.all();
    }

    public String instanceId() {
        return appProperties.getInstanceId();
    }

    /**
     * Builds a room event originated by {@code connection}. Callers stamp the id and time through {@link #broadcast}.
     */
    public CollabEvent roomEvent(EventType type, CollabConnection connection, String roomId, JsonNode payload) {
        return CollabEvent.builder()
                .type(type)
                .roomId(roomId)
                .originConnectionId(connection.getConnectionId())
                .originUserId(connection.getUserId())
                .payload(payload)
                .build();
    }

    /**
     * Must be called while holding the connection's monitor.
     *
     * @return the room that was left, or null if the connection was not in one
     */
    private String leaveRoomInternal(CollabConnection connection, boolean disconnecting) {
        String roomId = connection.beginLeave();
        if (roomId == null) {
            return null;
        }
        String connectionId = connection.getConnectionId();
        long now = System.currentTimeMillis();
        throttlingPipeline.closeAll(connectionId);
        roomRegistry.leave(roomId, connectionId, now);

        for (String objectId : lockManager.releaseAllFor(connectionId)) {
            ObjectNode payload = objectMapper.createObjectNode();
            payload.put("pieceId", objectId);
            payload.put("unlockedBy", connection.getUserId());
            payload.put("reason", disconnecting ? "disconnect" : "leave");
            broadcast(roomId, roomEvent(EventType.PIECE_UNLOCKED, connection, roomId, payload), Collections.emptySet());
        }

        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("userId", connection.getUserId());
        payload.put("connectionId", connectionId);
        payload.put("roomId", roomId);
        payload.put("instanceId", instanceId());
        payload.put("timestamp", now);
        broadcast(roomId, roomEvent(EventType.USER_LEFT, connection, roomId, payload), Set.of(connectionId));

        if (!disconnecting) {
            connection.completeLeave();
        }
        log.info("[LEAVE] connection={} user={} room={}", connectionId, connection.getUserId(), roomId);
        return roomId;
    }

    private JoinResult buildJoinResult(CollabConnection connection, String roomId) {
        List<MemberInfo> others = roomRegistry.find(roomId)
                .map(Room::getKnownMembers)
                .orElseGet(ArrayList::new);
        others.removeIf(member -> connection.getConnectionId().equals(member.getConnectionId()));
        List<IceServer> iceServers = appProperties.getWebrtc().getIceServers();
        return JoinResult.builder()
                .success(true)
                .roomId(roomId)
                .connectionId(connection.getConnectionId())
                .userId(connection.getUserId())
                .members(others)
                .iceServers(iceServers == null || iceServers.isEmpty() ? null : iceServers)
                .build();
    }

    private void answerPresenceQuery(String roomId) {
        Optional<Room> room = roomRegistry.find(roomId);
        if (room.isEmpty() || room.get().isEmpty()) {
            return;
        }
        ObjectNode payload = objectMapper.createObjectNode();
        ArrayNode members = payload.putArray("members");
        room.get().getLocalMembers().forEach(member -> members.add(objectMapper.valueToTree(member)));
        backplane.publish(channels.roomChannel(roomId), envelope(internalEvent(EventType.PRESENCE_SNAPSHOT, roomId, payload), Collections.emptySet()));
        log.debug("Answered presence query for room {} with {} members", roomId, members.size());
    }

    private void applyPresenceSnapshot(CollabEvent event) {
        Optional<Room> room = roomRegistry.find(event.getRoomId());
        if (room.isEmpty() || event.getPayload() == null) {
            return;
        }
        for (JsonNode node : event.getPayload().path("members")) {
            memberFromPayload(node).ifPresent(member -> {
                if (!instanceId().equals(member.getInstanceId())) {
                    room.get().putRemoteMember(member);
                }
            });
        }
    }

    private Optional<MemberInfo> memberFromPayload(JsonNode node) {
        if (node == null || !node.hasNonNull("connectionId")) {
            return Optional.empty();
        }
        return Optional.of(MemberInfo.builder()
                .connectionId(node.path("connectionId").asText())
                .userId(node.path("userId").asText(null))
                .instanceId(node.path("instanceId").asText(null))
                .joinedAt(node.path("joinedAt").asLong())
                .build());
    }

    private ObjectNode memberPayload(MemberInfo member, String roomId) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("userId", member.getUserId());
        payload.put("connectionId", member.getConnectionId());
        payload.put("roomId", roomId);
        payload.put("instanceId", member.getInstanceId());
        payload.put("joinedAt", member.getJoinedAt());
        payload.put("timestamp", member.getJoinedAt());
        return payload;
    }

    private boolean deliverTo(CollabConnection connection, CollabEvent event) {
        String connectionId = connection.getConnectionId();
        if (connection.deliver(event)) {
            failedEmitCounts.remove(connectionId);
            return true;
        }
        if (connection.isActive()) {
            int failures = failedEmitCounts.merge(connectionId, 1, Integer::sum);
            if (failures >= MAX_FAILED_EMITS) {
                failedEmitCounts.remove(connectionId);
                log.warn("Failed to emit {} consecutive events to connection {}. Proactively disconnecting.", failures, connectionId);
                Schedulers.boundedElastic().schedule(() -> disconnect(connectionId, "emit-failure"));
            }
        }
        return false;
    }

    private CollabEvent stamp(CollabEvent event, String roomId) {
        return event.toBuilder()
                .roomId(roomId)
                .originInstance(instanceId())
                .timestamp(event.getTimestamp() > 0 ? event.getTimestamp() : System.currentTimeMillis())
                .build();
    }

    private CollabEvent internalEvent(EventType type, String roomId, JsonNode payload) {
        return CollabEvent.builder()
                .type(type)
                .roomId(roomId)
                .originInstance(instanceId())
                .timestamp(System.currentTimeMillis())
                .payload(payload)
                .build();
    }

    private BackplaneEnvelope envelope(CollabEvent event, Set<String> excludeConnectionIds) {
        return BackplaneEnvelope.builder()
                .originInstance(instanceId())
                .event(event)
                .excludeConnectionIds(new HashSet<>(excludeConnectionIds))
                .build();
    }

    private CollabConnection requireActive(String connectionId) {
        CollabConnection connection = connectionRegistry.get(connectionId);
        if (connection == null || !connection.isActive()) {
            throw new CollabException(ErrorCode.CONNECTION_CLOSED);
        }
        return connection;
    }

    private void publishLifecycle(Constants.LifecycleEventType type, CollabConnection connection, String subject) {
        eventPublisher.publishEvent(new CollabLifecycleEvent(this, type, connection.getConnectionId(), connection.getUserId(), subject));
    }
}
