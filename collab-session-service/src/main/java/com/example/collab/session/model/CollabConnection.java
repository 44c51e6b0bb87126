package com.example.collab.session.model;

import com.example.collab.session.protocol.OutboundChannel;
import com.example.collab.session.protocol.OutboundFrame;
import com.example.collab.session.protocol.ProtocolCodec;
import com.example.collab.shared.dto.CollabEvent;
import com.example.collab.shared.util.Constants.ConnectionState;
import com.example.collab.shared.util.Constants.WireProtocol;
import lombok.Getter;

import java.util.concurrent.atomic.AtomicLong;

/**
 * One live transport session and its state machine:
 * CONNECTING -> JOINED -> LEAVING -> DISCONNECTED, or CONNECTING -> DISCONNECTED.
 * A leave that is not part of a disconnect returns the connection to CONNECTING.
 * <p>
 * Transitions synchronize on the connection; reads are lock-free so delivering to one
 * connection never waits on another.
 */
public class CollabConnection {

    @Getter
    private final String connectionId;
    @Getter
    private final String userId;
    @Getter
    private final long connectedAt;
    @Getter
    private final ProtocolCodec codec;
    private final OutboundChannel channel;
    private final AtomicLong lastInboundAt;

    private volatile ConnectionState state = ConnectionState.CONNECTING;
    private volatile String roomId;

    public CollabConnection(String connectionId, String userId, ProtocolCodec codec, OutboundChannel channel, long connectedAt) {
        this.connectionId = connectionId;
        this.userId = userId;
        this.codec = codec;
        this.channel = channel;
        this.connectedAt = connectedAt;
        this.lastInboundAt = new AtomicLong(connectedAt);
    }

    public WireProtocol getProtocol() {
        return codec.protocol();
    }

    public ConnectionState getState() {
        return state;
    }

    public String getRoomId() {
        return roomId;
    }

    public boolean isActive() {
        return state != ConnectionState.DISCONNECTED;
    }

    public boolean isInRoom(String candidate) {
        return state == ConnectionState.JOINED && candidate != null && candidate.equals(roomId);
    }

    public synchronized void markJoined(String newRoomId) {
        if (state != ConnectionState.CONNECTING && state != ConnectionState.JOINED) {
            throw new IllegalStateException("Connection " + connectionId + " cannot join from state " + state);
        }
        this.roomId = newRoomId;
        this.state = ConnectionState.JOINED;
    }

    /**
     * @return the room being left, or null if the connection was not in one
     */
    public synchronized String beginLeave() {
        if (state != ConnectionState.JOINED) {
            return null;
        }
        state = ConnectionState.LEAVING;
        return roomId;
    }

    public synchronized void completeLeave() {
        if (state == ConnectionState.LEAVING) {
            roomId = null;
            state = ConnectionState.CONNECTING;
        }
    }

    /**
     * @return false if the connection was already disconnected
     */
    public synchronized boolean markDisconnected() {
        if (state == ConnectionState.DISCONNECTED) {
            return false;
        }
        roomId = null;
        state = ConnectionState.DISCONNECTED;
        return true;
    }

    public void touch(long now) {
        lastInboundAt.accumulateAndGet(now, Math::max);
    }

    public long getLastInboundAt() {
        return lastInboundAt.get();
    }

    public boolean deliver(CollabEvent event) {
        return isActive() && channel.send(codec.encodeEvent(event));
    }

    public boolean send(OutboundFrame frame) {
        return isActive() && channel.send(frame);
    }

    public void sendHeartbeat() {
        codec.heartbeat().ifPresent(this::send);
    }

    public void closeTransport(String reason) {
        channel.close(reason);
    }
}
