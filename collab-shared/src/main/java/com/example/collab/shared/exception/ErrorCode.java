package com.example.collab.shared.exception;

public enum ErrorCode {
    PROTOCOL_ERROR("protocol-error", "Malformed frame"),
    UNKNOWN_COMMAND("unknown-command", "Unknown message type"),
    INVALID_ARGUMENT("invalid-argument", "Invalid argument"),
    NOT_IN_ROOM("not-in-room", "Not connected to a room"),
    ROOM_UNAVAILABLE("room-unavailable", "Room is not available"),
    ROOM_FULL("room-full", "Room is full"),
    LOCK_BUSY("busy", "Piece is locked by another user"),
    LOCK_UNAVAILABLE("unavailable", "Locking is temporarily unavailable"),
    NOT_LOCK_HOLDER("not-lock-holder", "You do not hold the lock on this piece"),
    PEER_UNAVAILABLE("peer-unavailable", "Target connection is not active"),
    CONNECTION_CLOSED("connection-closed", "Connection is no longer active"),
    SERVER_DRAINING("server-draining", "Server is shutting down"),
    INTERNAL_ERROR("internal-error", "Failed to process message");

    private final String code;
    private final String defaultMessage;

    ErrorCode(String code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
