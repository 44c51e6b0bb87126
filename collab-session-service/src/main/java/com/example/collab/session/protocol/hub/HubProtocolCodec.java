package com.example.collab.session.protocol.hub;

import com.example.collab.session.command.ClientCommand;
import com.example.collab.session.command.CommandReply;
import com.example.collab.session.command.CommandType;
import com.example.collab.session.protocol.InboundFrame;
import com.example.collab.session.protocol.JsonCodecSupport;
import com.example.collab.session.protocol.OutboundFrame;
import com.example.collab.session.protocol.ProtocolException;
import com.example.collab.session.signaling.SignalKind;
import com.example.collab.shared.dto.CollabEvent;
import com.example.collab.shared.exception.ErrorCode;
import com.example.collab.shared.util.Constants;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * JSON hub protocol spoken on {@code /hub}. Every record is a JSON object terminated by the
 * ASCII record separator, and one WebSocket message may carry several records.
 */
@Component
public class HubProtocolCodec extends JsonCodecSupport {

    public static final char RECORD_SEPARATOR = '\u001e';

    static final int INVOCATION = 1;
    static final int COMPLETION = 3;
    static final int PING = 6;
    static final int CLOSE = 7;

    public HubProtocolCodec(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public Constants.WireProtocol protocol() {
        return Constants.WireProtocol.NATIVE;
    }

    @Override
    public List<ClientCommand> decode(InboundFrame frame) {
        if (!frame.isText()) {
            throw new ProtocolException("Binary messages are not supported by the JSON hub protocol");
        }
        List<ClientCommand> commands = new ArrayList<>();
        for (String record : frame.getText().split(String.valueOf(RECORD_SEPARATOR))) {
            if (!record.isBlank()) {
                commands.add(decodeRecord(parse(record)));
            }
        }
        if (commands.isEmpty()) {
            throw new ProtocolException("Frame contains no hub records");
        }
        return commands;
    }

    private ClientCommand decodeRecord(JsonNode record) {
        if (record.has("protocol")) {
            String protocol = record.path("protocol").asText();
            if (!"json".equals(protocol)) {
                throw new ProtocolException("Unsupported hub protocol '" + protocol + "'");
            }
            return ClientCommand.of(CommandType.HANDSHAKE);
        }
        int type = record.path("type").asInt(-1);
        switch (type) {
            case INVOCATION:
                return decodeInvocation(record);
            case PING:
                return ClientCommand.of(CommandType.PONG);
            case CLOSE:
                return ClientCommand.of(CommandType.CLOSE);
            default:
                throw new ProtocolException(ErrorCode.UNKNOWN_COMMAND, "Unsupported hub message type " + type, null);
        }
    }

    private ClientCommand decodeInvocation(JsonNode record) {
        String target = record.path("target").asText("");
        JsonNode args = record.path("arguments");
        ClientCommand partial = ClientCommand.builder()
                .replyId(optionalText(record, "invocationId"))
                .build();

        switch (target) {
            case "JoinRoom":
            case "JoinPuzzleSession":
                return partial.toBuilder().type(CommandType.JOIN_ROOM).roomId(argText(args, 0, "roomId", partial)).build();
            case "LeaveRoom":
            case "LeavePuzzleSession":
                return partial.toBuilder().type(CommandType.LEAVE_ROOM).build();
            case "MovePiece": {
                ObjectNode position = object();
                position.set("x", args.path(1));
                position.set("y", args.path(2));
                if (args.size() > 3) {
                    position.set("rotation", args.path(3));
                }
                return partial.toBuilder()
                        .type(CommandType.MOVE_PIECE)
                        .objectId(argText(args, 0, "pieceId", partial))
                        .payload(position(position, partial))
                        .build();
            }
            case "LockPiece":
                return partial.toBuilder().type(CommandType.LOCK_PIECE).objectId(argText(args, 0, "pieceId", partial)).build();
            case "UnlockPiece":
                return partial.toBuilder().type(CommandType.UNLOCK_PIECE).objectId(argText(args, 0, "pieceId", partial)).build();
            case "SendChatMessage":
                return partial.toBuilder().type(CommandType.CHAT_MESSAGE).text(args.path(0).asText(null)).build();
            case "UpdateCursor": {
                ObjectNode position = object();
                position.set("x", args.path(0));
                position.set("y", args.path(1));
                return partial.toBuilder().type(CommandType.CURSOR_UPDATE).payload(position(position, partial)).build();
            }
            case "SendOffer":
                return signal(partial, SignalKind.OFFER, args);
            case "SendAnswer":
                return signal(partial, SignalKind.ANSWER, args);
            case "SendIceCandidate":
                return signal(partial, SignalKind.ICE_CANDIDATE, args);
            case "RequestCall":
                return signal(partial, SignalKind.CALL_REQUEST, args);
            case "RespondToCall":
                return signal(partial, SignalKind.CALL_RESPONSE, args);
            case "EndCall":
                return signal(partial, SignalKind.CALL_ENDED, args);
            case "Emit":
                return partial.toBuilder()
                        .type(CommandType.CUSTOM_EVENT)
                        .eventName(argText(args, 0, "name", partial))
                        .payload(args.has(1) ? args.get(1) : null)
                        .build();
            default:
                throw new ProtocolException(ErrorCode.UNKNOWN_COMMAND, "Unknown hub method '" + target + "'", partial);
        }
    }

    private ClientCommand signal(ClientCommand partial, SignalKind kind, JsonNode args) {
        return partial.toBuilder()
                .type(CommandType.SIGNAL)
                .signalKind(kind)
                .targetConnectionId(argText(args, 0, "targetConnectionId", partial))
                .payload(args.has(1) ? args.get(1) : null)
                .build();
    }

    private String argText(JsonNode args, int index, String name, ClientCommand partial) {
        JsonNode value = args.path(index);
        if (value.isMissingNode() || value.isNull() || value.isContainerNode() || value.asText().isBlank()) {
            throw new ProtocolException(ErrorCode.INVALID_ARGUMENT, "Argument '" + name + "' is required", partial);
        }
        return value.asText();
    }

    @Override
    public OutboundFrame encodeEvent(CollabEvent event) {
        String target = event.getType() == Constants.EventType.CUSTOM ? event.resolveName() : event.getType().getHubTarget();
        return record(invocation(target, event.getPayload()));
    }

    @Override
    public Optional<OutboundFrame> encodeReply(CommandReply reply) {
        String invocationId = reply.getReplyId();
        switch (reply.getType()) {
            case HANDSHAKE: {
                ObjectNode connected = object();
                connected.put("connectionId", reply.getBody().path("connectionId").asText());
                connected.put("timestamp", System.currentTimeMillis());
                return Optional.of(OutboundFrame.text(write(object()) + RECORD_SEPARATOR
                        + write(invocation("Connected", connected)) + RECORD_SEPARATOR));
            }
            case ERROR:
                return Optional.of(encodeError(reply.getErrorCode(), reply.getErrorMessage(), reply.getCommand()));
            case BINARY:
                return Optional.empty();
            case NONE:
            case PONG:
                return invocationId == null ? Optional.empty() : Optional.of(record(completion(invocationId, null)));
            default:
                if (invocationId != null) {
                    return Optional.of(record(completion(invocationId, reply.getBody())));
                }
                String resultName = reply.getCommand() != null && reply.getCommand().getType() != null
                        ? reply.getCommand().getType().getResultName() : null;
                if (resultName == null) {
                    return Optional.empty();
                }
                return Optional.of(record(invocation(pascalCase(resultName), reply.getBody())));
        }
    }

    @Override
    public OutboundFrame encodeError(ErrorCode errorCode, String message, ClientCommand command) {
        String text = message != null ? message : errorCode.getDefaultMessage();
        if (command != null && command.getReplyId() != null) {
            ObjectNode completion = object();
            completion.put("type", COMPLETION);
            completion.put("invocationId", command.getReplyId());
            completion.put("error", text);
            return record(completion);
        }
        ObjectNode error = object();
        error.put("type", INVOCATION);
        error.put("target", "Error");
        ArrayNode arguments = error.putArray("arguments");
        arguments.add(text);
        arguments.add(errorCode.getCode());
        return record(error);
    }

    /**
     * The hub client opens with its own handshake record, so nothing is sent before it.
     */
    @Override
    public List<OutboundFrame> handshake(String connectionId) {
        return Collections.emptyList();
    }

    @Override
    public Optional<OutboundFrame> heartbeat() {
        ObjectNode ping = object();
        ping.put("type", PING);
        return Optional.of(record(ping));
    }

    private ObjectNode invocation(String target, JsonNode argument) {
        ObjectNode invocation = object();
        invocation.put("type", INVOCATION);
        invocation.put("target", target);
        ArrayNode arguments = invocation.putArray("arguments");
        arguments.add(argument == null ? objectMapper.nullNode() : argument);
        return invocation;
    }

    private ObjectNode completion(String invocationId, JsonNode result) {
        ObjectNode completion = object();
        completion.put("type", COMPLETION);
        completion.put("invocationId", invocationId);
        if (result != null) {
            completion.set("result", result);
        }
        return completion;
    }

    private OutboundFrame record(JsonNode node) {
        return OutboundFrame.text(write(node) + RECORD_SEPARATOR);
    }

    static String pascalCase(String kebab) {
        StringBuilder result = new StringBuilder(kebab.length());
        for (String part : kebab.split("-")) {
            if (!part.isEmpty()) {
                result.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
            }
        }
        return result.toString();
    }
}
