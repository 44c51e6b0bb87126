package com.example.collab.session.command;

import com.example.collab.shared.exception.ErrorCode;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * The direct answer to one command, addressed to the requesting connection only.
 * Codecs decide how (and whether) each reply type appears on their wire.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CommandReply {

    public enum ReplyType {
        NONE,
        OK,
        RESULT,
        ERROR,
        PONG,
        ECHO,
        BINARY,
        HANDSHAKE
    }

    private final ReplyType type;
    private final ClientCommand command;
    private final JsonNode body;
    private final byte[] binary;
    private final ErrorCode errorCode;
    private final String errorMessage;

    public static CommandReply none(ClientCommand command) {
        return new CommandReply(ReplyType.NONE, command, null, null, null, null);
    }

    public static CommandReply ok(ClientCommand command, JsonNode body) {
        return new CommandReply(ReplyType.OK, command, body, null, null, null);
    }

    public static CommandReply result(ClientCommand command, JsonNode body) {
        return new CommandReply(ReplyType.RESULT, command, body, null, null, null);
    }

    public static CommandReply error(ClientCommand command, ErrorCode errorCode, String message) {
        return new CommandReply(ReplyType.ERROR, command, null, null, errorCode, message);
    }

    public static CommandReply pong(ClientCommand command, JsonNode body) {
        return new CommandReply(ReplyType.PONG, command, body, null, null, null);
    }

    public static CommandReply echo(ClientCommand command, JsonNode body) {
        return new CommandReply(ReplyType.ECHO, command, body, null, null, null);
    }

    public static CommandReply binary(ClientCommand command, byte[] binary) {
        return new CommandReply(ReplyType.BINARY, command, null, binary, null, null);
    }

    public static CommandReply handshake(ClientCommand command, JsonNode body) {
        return new CommandReply(ReplyType.HANDSHAKE, command, body, null, null, null);
    }

    public String getReplyId() {
        return command != null ? command.getReplyId() : null;
    }

    public String getNamespace() {
        return command != null ? command.getNamespace() : null;
    }
}
