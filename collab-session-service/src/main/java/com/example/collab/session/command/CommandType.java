package com.example.collab.session.command;

/**
 * Canonical client commands every wire adapter decodes into.
 */
public enum CommandType {
    HANDSHAKE("handshake", null),
    CONNECT("connect", null),
    PING("ping", "pong-test"),
    PONG("pong", null),
    ECHO("echo", null),
    BINARY_REQUEST("binary-request", null),
    BINARY_DATA("binary", null),
    CLIENT_ERROR("error", null),
    JOIN_ROOM("join", "joined"),
    LEAVE_ROOM("leave", "left"),
    MOVE_PIECE("move", "piece-move-confirmed"),
    LOCK_PIECE("lock", "lock-result"),
    UNLOCK_PIECE("unlock", "unlock-result"),
    CHAT_MESSAGE("chat", "message-sent"),
    CURSOR_UPDATE("cursor", null),
    CUSTOM_EVENT("broadcast", null),
    SIGNAL("signal", "signal-sent"),
    CLOSE("close", null);

    private final String wireName;
    private final String resultName;

    CommandType(String wireName, String resultName) {
        this.wireName = wireName;
        this.resultName = resultName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Event name used to report the outcome to clients that did not ask for an acknowledgement,
     * or null when such commands get no reply.
     */
    public String getResultName() {
        return resultName;
    }
}
