package com.example.collab.session.protocol.binary;

import com.example.collab.session.command.ClientCommand;
import com.example.collab.session.command.CommandReply;
import com.example.collab.session.command.CommandType;
import com.example.collab.session.protocol.InboundFrame;
import com.example.collab.session.protocol.JsonCodecSupport;
import com.example.collab.session.protocol.OutboundFrame;
import com.example.collab.session.protocol.ProtocolException;
import com.example.collab.session.signaling.SignalKind;
import com.example.collab.shared.config.AppProperties;
import com.example.collab.shared.dto.CollabEvent;
import com.example.collab.shared.exception.ErrorCode;
import com.example.collab.shared.util.Constants;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Length-prefixed framing on {@code /ws/binary}.
 * <pre>
 * frame   = length:int32-LE payload
 * payload = tag:uint8 body      (length counts tag + body)
 * tag     = 0x01 UTF-8 JSON | 0x02 raw bytes
 * </pre>
 * A WebSocket message may hold several frames. Text messages are read as a bare JSON body.
 */
@Component
public class BinaryFrameCodec extends JsonCodecSupport {

    public static final byte TAG_JSON = 0x01;
    public static final byte TAG_BINARY = 0x02;
    static final int LENGTH_PREFIX_BYTES = 4;

    private final int maxFrameBytes;

    @Autowired
    public BinaryFrameCodec(ObjectMapper objectMapper, AppProperties appProperties) {
        this(objectMapper, appProperties.getBinary().getMaxFrameBytes());
    }

    public BinaryFrameCodec(ObjectMapper objectMapper, int maxFrameBytes) {
        super(objectMapper);
        this.maxFrameBytes = maxFrameBytes;
    }

    @Override
    public Constants.WireProtocol protocol() {
        return Constants.WireProtocol.BINARY_FRAMED;
    }

    @Override
    public List<ClientCommand> decode(InboundFrame frame) {
        if (frame.isText()) {
            return List.of(fromJson(parse(frame.getText())));
        }
        ByteBuffer buffer = ByteBuffer.wrap(frame.getBinary()).order(ByteOrder.LITTLE_ENDIAN);
        List<ClientCommand> commands = new ArrayList<>();
        while (buffer.hasRemaining()) {
            if (buffer.remaining() < LENGTH_PREFIX_BYTES) {
                throw new ProtocolException("Truncated length prefix");
            }
            int length = buffer.getInt();
            if (length < 1 || length > maxFrameBytes) {
                throw new ProtocolException("Frame length " + length + " outside 1.." + maxFrameBytes);
            }
            if (buffer.remaining() < length) {
                throw new ProtocolException("Frame declares " + length + " bytes but only " + buffer.remaining() + " remain");
            }
            byte tag = buffer.get();
            byte[] body = new byte[length - 1];
            buffer.get(body);
            if (tag == TAG_JSON) {
                commands.add(fromJson(parse(new String(body, StandardCharsets.UTF_8))));
            } else if (tag == TAG_BINARY) {
                commands.add(ClientCommand.builder().type(CommandType.BINARY_DATA).binary(body).build());
            } else {
                throw new ProtocolException(String.format("Unknown payload tag 0x%02x", tag));
            }
        }
        if (commands.isEmpty()) {
            throw new ProtocolException("Empty message");
        }
        return commands;
    }

    private ClientCommand fromJson(JsonNode json) {
        if (!json.isObject()) {
            throw new ProtocolException("JSON body must be an object");
        }
        String type = json.path("type").asText("");
        ClientCommand partial = ClientCommand.builder().replyId(optionalText(json, "requestId")).build();
        switch (type) {
            case "ping":
                return partial.toBuilder().type(CommandType.PING).build();
            case "pong":
                return partial.toBuilder().type(CommandType.PONG).build();
            case "echo":
                return partial.toBuilder().type(CommandType.ECHO).payload(json.get("data")).build();
            case "binary-request":
                return partial.toBuilder().type(CommandType.BINARY_REQUEST).build();
            case "error":
                return partial.toBuilder().type(CommandType.CLIENT_ERROR).text(optionalText(json, "message")).payload(json).build();
            case "broadcast":
                String name = optionalText(json, "event");
                return partial.toBuilder()
                        .type(CommandType.CUSTOM_EVENT)
                        .eventName(name != null ? name : optionalText(json, "name"))
                        .payload(json.get("data"))
                        .build();
            case "join":
                String roomId = optionalText(json, "roomId");
                return partial.toBuilder()
                        .type(CommandType.JOIN_ROOM)
                        .roomId(roomId != null ? roomId : requireText(json, "room", partial))
                        .build();
            case "leave":
                return partial.toBuilder().type(CommandType.LEAVE_ROOM).build();
            case "move":
                return partial.toBuilder()
                        .type(CommandType.MOVE_PIECE)
                        .objectId(requireText(json, "pieceId", partial))
                        .payload(position(json, partial))
                        .build();
            case "lock":
                return partial.toBuilder().type(CommandType.LOCK_PIECE).objectId(requireText(json, "pieceId", partial)).build();
            case "unlock":
                return partial.toBuilder().type(CommandType.UNLOCK_PIECE).objectId(requireText(json, "pieceId", partial)).build();
            case "chat":
                return partial.toBuilder().type(CommandType.CHAT_MESSAGE).text(optionalText(json, "message")).build();
            case "cursor":
                return partial.toBuilder().type(CommandType.CURSOR_UPDATE).payload(position(json, partial)).build();
            case "signal":
                String kind = requireText(json, "kind", partial);
                return partial.toBuilder()
                        .type(CommandType.SIGNAL)
                        .signalKind(SignalKind.fromWireName(kind).orElseThrow(() ->
                                new ProtocolException(ErrorCode.INVALID_ARGUMENT, "Unknown signal kind '" + kind + "'", partial)))
                        .targetConnectionId(requireText(json, "target", partial))
                        .payload(json.get("data"))
                        .build();
            case "close":
                return partial.toBuilder().type(CommandType.CLOSE).build();
            default:
                throw new ProtocolException(ErrorCode.UNKNOWN_COMMAND, "Unknown message type '" + type + "'", partial);
        }
    }

    @Override
    public OutboundFrame encodeEvent(CollabEvent event) {
        ObjectNode message = object();
        message.put("type", "broadcast");
        message.put("event", event.resolveName());
        message.set("data", event.getPayload());
        message.put("from", event.getOriginConnectionId());
        message.put("timestamp", event.getTimestamp());
        return json(message);
    }

    @Override
    public Optional<OutboundFrame> encodeReply(CommandReply reply) {
        switch (reply.getType()) {
            case NONE:
                return Optional.empty();
            case BINARY:
                return Optional.of(frame(TAG_BINARY, reply.getBinary()));
            case ERROR:
                return Optional.of(encodeError(reply.getErrorCode(), reply.getErrorMessage(), reply.getCommand()));
            case HANDSHAKE:
                return Optional.of(welcome(reply.getBody().path("connectionId").asText()));
            case PONG: {
                ObjectNode pong = object();
                pong.put("type", "pong");
                pong.put("timestamp", reply.getBody().path("timestamp").asLong());
                return Optional.of(json(withRequestId(pong, reply.getReplyId())));
            }
            case ECHO: {
                ObjectNode echo = object();
                echo.put("type", "echo");
                echo.set("data", reply.getBody());
                return Optional.of(json(withRequestId(echo, reply.getReplyId())));
            }
            default: {
                ObjectNode result = object();
                result.put("type", "result");
                result.put("request", reply.getCommand().getType().getWireName());
                withRequestId(result, reply.getReplyId());
                JsonNode body = reply.getBody();
                if (body != null && body.isObject()) {
                    Iterator<Map.Entry<String, JsonNode>> fields = body.fields();
                    while (fields.hasNext()) {
                        Map.Entry<String, JsonNode> field = fields.next();
                        result.set(field.getKey(), field.getValue());
                    }
                } else if (body != null) {
                    result.set("data", body);
                }
                return Optional.of(json(result));
            }
        }
    }

    @Override
    public OutboundFrame encodeError(ErrorCode errorCode, String message, ClientCommand command) {
        ObjectNode error = object();
        error.put("type", "error");
        error.put("code", errorCode.getCode());
        error.put("message", message != null ? message : errorCode.getDefaultMessage());
        return json(withRequestId(error, command != null ? command.getReplyId() : null));
    }

    @Override
    public List<OutboundFrame> handshake(String connectionId) {
        return List.of(welcome(connectionId));
    }

    @Override
    public Optional<OutboundFrame> heartbeat() {
        ObjectNode ping = object();
        ping.put("type", "ping");
        ping.put("timestamp", System.currentTimeMillis());
        return Optional.of(json(ping));
    }

    /**
     * Wraps a body in a length-prefixed frame.
     */
    public static OutboundFrame frame(byte tag, byte[] body) {
        ByteBuffer buffer = ByteBuffer.allocate(LENGTH_PREFIX_BYTES + 1 + body.length).order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(body.length + 1);
        buffer.put(tag);
        buffer.put(body);
        return OutboundFrame.binary(buffer.array());
    }

    private OutboundFrame welcome(String connectionId) {
        ObjectNode welcome = object();
        welcome.put("type", "welcome");
        welcome.put("connectionId", connectionId);
        welcome.put("timestamp", System.currentTimeMillis());
        welcome.putArray("protocols").add("json").add("binary");
        return json(welcome);
    }

    private ObjectNode withRequestId(ObjectNode node, String requestId) {
        if (requestId != null) {
            node.put("requestId", requestId);
        }
        return node;
    }

    private OutboundFrame json(JsonNode node) {
        return frame(TAG_JSON, write(node).getBytes(StandardCharsets.UTF_8));
    }
}
