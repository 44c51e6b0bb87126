package com.example.collab.shared.util;

public final class Constants {

    // Private constructor to prevent instantiation
    private Constants() {}

    public static final String LOCAL_PROFILE = "local";
    public static final String CURSOR_STREAM_KEY = "cursor";
    public static final String CHANNEL_ROOT = "collab";

    public enum WireProtocol {
        NATIVE,
        BINARY_FRAMED,
        LEGACY_TEXT
    }

    public enum ConnectionState {
        CONNECTING,
        JOINED,
        LEAVING,
        DISCONNECTED
    }

    public enum EventScope {
        ROOM,
        PEER,
        INTERNAL
    }

    /**
     * The closed set of events that travel between instances and out to clients.
     * Each kind knows its kebab-case wire name and the target name used by the hub protocol.
     */
    public enum EventType {
        USER_JOINED("user-joined", "UserJoined", EventScope.ROOM),
        USER_LEFT("user-left", "UserLeft", EventScope.ROOM),
        PIECE_MOVED("piece-moved", "PieceMoved", EventScope.ROOM),
        PIECE_LOCKED("piece-locked", "PieceLocked", EventScope.ROOM),
        PIECE_UNLOCKED("piece-unlocked", "PieceUnlocked", EventScope.ROOM),
        CHAT_MESSAGE("chat-message", "ChatMessage", EventScope.ROOM),
        CURSOR_UPDATE("cursor-update", "CursorUpdate", EventScope.ROOM),
        CUSTOM("custom", "CustomEvent", EventScope.ROOM),
        CALL_REQUEST("call-request", "IncomingCall", EventScope.PEER),
        CALL_RESPONSE("call-response", "CallResponse", EventScope.PEER),
        SDP_OFFER("offer", "ReceiveOffer", EventScope.PEER),
        SDP_ANSWER("answer", "ReceiveAnswer", EventScope.PEER),
        ICE_CANDIDATE("ice-candidate", "ReceiveIceCandidate", EventScope.PEER),
        CALL_ENDED("call-ended", "CallEnded", EventScope.PEER),
        SERVER_SHUTDOWN("server-shutdown", "ServerShutdown", EventScope.PEER),
        PRESENCE_QUERY("presence-query", null, EventScope.INTERNAL),
        PRESENCE_SNAPSHOT("presence-snapshot", null, EventScope.INTERNAL),
        INSTANCE_DEPARTED("instance-departed", null, EventScope.INTERNAL);

        private final String eventName;
        private final String hubTarget;
        private final EventScope scope;

        EventType(String eventName, String hubTarget, EventScope scope) {
            this.eventName = eventName;
            this.hubTarget = hubTarget;
            this.scope = scope;
        }

        public String getEventName() {
            return eventName;
        }

        public String getHubTarget() {
            return hubTarget;
        }

        public EventScope getScope() {
            return scope;
        }

        public boolean isInternal() {
            return scope == EventScope.INTERNAL;
        }
    }

    public enum LifecycleEventType {
        CONNECTION_OPENED,
        CONNECTION_CLOSED,
        LOCK_ACQUIRED,
        LOCK_DENIED
    }
}
