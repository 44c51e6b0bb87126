package com.example.collab.session.protocol.legacy;

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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Socket.IO-style text protocol on {@code /socket.io/}: Engine.IO packets
 * ({@code 0} open, {@code 1} close, {@code 2} ping, {@code 3} pong, {@code 4} message)
 * where a message wraps a Socket.IO packet {@code <type>[/namespace,][ackId][json]}.
 */
@Component
public class LegacyTextCodec extends JsonCodecSupport {

    static final char ENGINE_OPEN = '0';
    static final char ENGINE_CLOSE = '1';
    static final char ENGINE_PING = '2';
    static final char ENGINE_PONG = '3';
    static final char ENGINE_MESSAGE = '4';

    static final char PACKET_CONNECT = '0';
    static final char PACKET_DISCONNECT = '1';
    static final char PACKET_EVENT = '2';
    static final char PACKET_ACK = '3';
    static final char PACKET_ERROR = '4';

    static final String PING_TEST_EVENT = "ping-test";

    private final AppProperties.Legacy settings;

    public LegacyTextCodec(ObjectMapper objectMapper, AppProperties appProperties) {
        super(objectMapper);
        this.settings = appProperties.getLegacy();
    }

    @Override
    public Constants.WireProtocol protocol() {
        return Constants.WireProtocol.LEGACY_TEXT;
    }

    @Override
    public List<ClientCommand> decode(InboundFrame frame) {
        if (!frame.isText()) {
            throw new ProtocolException("Binary attachments are not supported");
        }
        String text = frame.getText();
        if (text.isEmpty()) {
            throw new ProtocolException("Empty packet");
        }
        String rest = text.substring(1);
        switch (text.charAt(0)) {
            case ENGINE_CLOSE:
                return List.of(ClientCommand.of(CommandType.CLOSE));
            case ENGINE_PING:
                return List.of(ClientCommand.builder().type(CommandType.PING).text(rest).build());
            case ENGINE_PONG:
            case '5':
            case '6':
                return List.of(ClientCommand.of(CommandType.PONG));
            case ENGINE_MESSAGE:
                return List.of(decodePacket(rest));
            default:
                throw new ProtocolException("Unknown Engine.IO packet type '" + text.charAt(0) + "'");
        }
    }

    private ClientCommand decodePacket(String packet) {
        if (packet.isEmpty()) {
            throw new ProtocolException("Empty Socket.IO packet");
        }
        char type = packet.charAt(0);
        int index = 1;
        String namespace = null;
        if (index < packet.length() && packet.charAt(index) == '/') {
            int comma = packet.indexOf(',', index);
            int end = comma < 0 ? packet.length() : comma;
            namespace = packet.substring(index, end);
            index = comma < 0 ? end : comma + 1;
        }
        int ackStart = index;
        while (index < packet.length() && Character.isDigit(packet.charAt(index))) {
            index++;
        }
        String ackId = index > ackStart ? packet.substring(ackStart, index) : null;
        String payload = packet.substring(index);
        ClientCommand partial = ClientCommand.builder().replyId(ackId).namespace(namespace).build();

        switch (type) {
            case PACKET_CONNECT:
                return partial.toBuilder().type(CommandType.CONNECT).build();
            case PACKET_DISCONNECT:
                return partial.toBuilder().type(CommandType.CLOSE).build();
            case PACKET_EVENT:
                return decodeEvent(payload, partial);
            case PACKET_ACK:
                // Acks for server events carry nothing the server waits on.
                return partial.toBuilder().type(CommandType.PONG).build();
            case PACKET_ERROR:
                return partial.toBuilder().type(CommandType.CLIENT_ERROR).text(payload).build();
            default:
                throw new ProtocolException(ErrorCode.UNKNOWN_COMMAND, "Unknown Socket.IO packet type '" + type + "'", partial);
        }
    }

    private ClientCommand decodeEvent(String payload, ClientCommand partial) {
        JsonNode array = parse(payload);
        if (!array.isArray() || array.isEmpty() || !array.get(0).isTextual()) {
            throw new ProtocolException(ErrorCode.PROTOCOL_ERROR, "Event payload must be [\"name\", data]", partial);
        }
        String name = array.get(0).asText();
        JsonNode data = array.has(1) ? array.get(1) : null;

        switch (name) {
            case "join":
                return partial.toBuilder().type(CommandType.JOIN_ROOM).roomId(roomOf(data, partial)).build();
            case "leave":
                return partial.toBuilder().type(CommandType.LEAVE_ROOM).build();
            case "message":
                return partial.toBuilder()
                        .type(CommandType.CHAT_MESSAGE)
                        .text(data != null && data.isTextual() ? data.asText() : optionalText(data, "message"))
                        .build();
            case "move-piece":
                return partial.toBuilder()
                        .type(CommandType.MOVE_PIECE)
                        .objectId(requireText(data, "pieceId", partial))
                        .payload(position(data, partial))
                        .build();
            case "lock-piece":
                return partial.toBuilder().type(CommandType.LOCK_PIECE).objectId(pieceOf(data, partial)).build();
            case "unlock-piece":
                return partial.toBuilder().type(CommandType.UNLOCK_PIECE).objectId(pieceOf(data, partial)).build();
            case "cursor-update":
                return partial.toBuilder().type(CommandType.CURSOR_UPDATE).payload(position(data, partial)).build();
            case PING_TEST_EVENT:
                return partial.toBuilder().type(CommandType.PING).eventName(PING_TEST_EVENT).build();
            default:
                Optional<SignalKind> kind = SignalKind.fromWireName(name);
                if (kind.isPresent()) {
                    String target = optionalText(data, "target");
                    return partial.toBuilder()
                            .type(CommandType.SIGNAL)
                            .signalKind(kind.get())
                            .targetConnectionId(target != null ? target : requireText(data, "to", partial))
                            .payload(signalPayload(data))
                            .build();
                }
                return partial.toBuilder().type(CommandType.CUSTOM_EVENT).eventName(name).payload(data).build();
        }
    }

    private String roomOf(JsonNode data, ClientCommand partial) {
        if (data != null && data.isTextual() && !data.asText().isBlank()) {
            return data.asText();
        }
        String room = optionalText(data, "room");
        return room != null ? room : requireText(data, "roomId", partial);
    }

    private String pieceOf(JsonNode data, ClientCommand partial) {
        if (data != null && (data.isTextual() || data.isNumber())) {
            return data.asText();
        }
        return requireText(data, "pieceId", partial);
    }

    @Override
    public OutboundFrame encodeEvent(CollabEvent event) {
        ArrayNode array = objectMapper.createArrayNode();
        array.add(event.resolveName());
        array.add(event.getPayload() == null ? objectMapper.nullNode() : event.getPayload());
        return OutboundFrame.text("" + ENGINE_MESSAGE + PACKET_EVENT + write(array));
    }

    @Override
    public Optional<OutboundFrame> encodeReply(CommandReply reply) {
        ClientCommand command = reply.getCommand();
        switch (reply.getType()) {
            case HANDSHAKE: {
                ObjectNode connect = object();
                connect.put("sid", reply.getBody().path("sid").asText());
                return Optional.of(packet(PACKET_CONNECT, reply.getNamespace(), null, write(connect)));
            }
            case ERROR:
                return Optional.of(encodeError(reply.getErrorCode(), reply.getErrorMessage(), command));
            case BINARY:
                return Optional.empty();
            case PONG:
                if (command == null || command.getEventName() == null) {
                    String probe = command != null && command.getText() != null ? command.getText() : "";
                    return Optional.of(OutboundFrame.text(ENGINE_PONG + probe));
                }
                return Optional.of(answer(reply, command.getType().getResultName()));
            case NONE:
                if (reply.getReplyId() == null) {
                    return Optional.empty();
                }
                return Optional.of(packet(PACKET_ACK, reply.getNamespace(), reply.getReplyId(), "[]"));
            case ECHO:
                return Optional.of(answer(reply, "echo"));
            default: {
                String resultName = command != null && command.getType() != null ? command.getType().getResultName() : null;
                if (reply.getReplyId() == null && resultName == null) {
                    return Optional.empty();
                }
                return Optional.of(answer(reply, resultName));
            }
        }
    }

    /**
     * Acknowledges when the client asked for it, otherwise emits {@code eventName}.
     */
    private OutboundFrame answer(CommandReply reply, String eventName) {
        JsonNode body = reply.getBody() == null ? objectMapper.nullNode() : reply.getBody();
        ArrayNode array = objectMapper.createArrayNode();
        if (reply.getReplyId() != null) {
            array.add(body);
            return packet(PACKET_ACK, reply.getNamespace(), reply.getReplyId(), write(array));
        }
        array.add(eventName);
        array.add(body);
        return packet(PACKET_EVENT, reply.getNamespace(), null, write(array));
    }

    @Override
    public OutboundFrame encodeError(ErrorCode errorCode, String message, ClientCommand command) {
        String text = message != null ? message : errorCode.getDefaultMessage();
        String namespace = command != null ? command.getNamespace() : null;
        if (command != null && command.getReplyId() != null) {
            ObjectNode failure = object();
            failure.put("success", false);
            failure.put("error", text);
            failure.put("code", errorCode.getCode());
            return packet(PACKET_ACK, namespace, command.getReplyId(), write(objectMapper.createArrayNode().add(failure)));
        }
        ObjectNode error = object();
        error.put("message", text);
        error.put("code", errorCode.getCode());
        return packet(PACKET_ERROR, namespace, null, write(error));
    }

    @Override
    public List<OutboundFrame> handshake(String connectionId) {
        ObjectNode open = object();
        open.put("sid", connectionId);
        open.putArray("upgrades");
        open.put("pingInterval", settings.getPingInterval());
        open.put("pingTimeout", settings.getPingTimeout());
        open.put("maxPayload", settings.getMaxPayload());
        return List.of(OutboundFrame.text(ENGINE_OPEN + write(open)));
    }

    @Override
    public Optional<OutboundFrame> heartbeat() {
        return Optional.of(OutboundFrame.text(String.valueOf(ENGINE_PING)));
    }

    private OutboundFrame packet(char type, String namespace, String ackId, String json) {
        StringBuilder packet = new StringBuilder().append(ENGINE_MESSAGE).append(type);
        if (namespace != null && !"/".equals(namespace)) {
            packet.append(namespace).append(',');
        }
        if (ackId != null) {
            packet.append(ackId);
        }
        return OutboundFrame.text(packet.append(json).toString());
    }
}
