package com.example.collab.session.protocol.legacy;

import com.example.collab.session.command.ClientCommand;
import com.example.collab.session.command.CommandReply;
import com.example.collab.session.command.CommandType;
import com.example.collab.session.protocol.InboundFrame;
import com.example.collab.session.protocol.ProtocolException;
import com.example.collab.session.signaling.SignalKind;
import com.example.collab.shared.config.AppProperties;
import com.example.collab.shared.dto.CollabEvent;
import com.example.collab.shared.exception.ErrorCode;
import com.example.collab.shared.util.Constants;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static com.example.collab.session.support.HubFrames.parse;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LegacyTextCodecTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final LegacyTextCodec codec = new LegacyTextCodec(objectMapper, new AppProperties());

    @Test
    void openPacketAdvertisesTimings() {
        String open = codec.handshake("conn-1").get(0).getText();

        assertThat(open).startsWith("0");
        JsonNode body = parse(open.substring(1));
        assertThat(body.path("sid").asText()).isEqualTo("conn-1");
        assertThat(body.path("upgrades").isArray()).isTrue();
        assertThat(body.path("pingInterval").asLong()).isEqualTo(25000L);
        assertThat(body.path("pingTimeout").asLong()).isEqualTo(20000L);
    }

    @Test
    void engineProbeIsAnsweredWithTheSameProbe() {
        ClientCommand ping = decode("2probe");

        assertThat(ping.getType()).isEqualTo(CommandType.PING);
        assertThat(codec.encodeReply(CommandReply.pong(ping, objectMapper.createObjectNode())).orElseThrow().getText())
                .isEqualTo("3probe");
        assertThat(codec.heartbeat().orElseThrow().getText()).isEqualTo("2");
        assertThat(decode("3").getType()).isEqualTo(CommandType.PONG);
        assertThat(decode("1").getType()).isEqualTo(CommandType.CLOSE);
    }

    @Test
    void namespaceConnectIsAcknowledgedInTheSameNamespace() {
        ClientCommand connect = decode("40/puzzle,");

        assertThat(connect.getType()).isEqualTo(CommandType.CONNECT);
        assertThat(connect.getNamespace()).isEqualTo("/puzzle");
        String ack = codec.encodeReply(CommandReply.handshake(connect, objectMapper.createObjectNode().put("sid", "conn-1")))
                .orElseThrow().getText();
        assertThat(ack).isEqualTo("40/puzzle,{\"sid\":\"conn-1\"}");

        assertThat(codec.encodeReply(CommandReply.handshake(decode("40"), objectMapper.createObjectNode().put("sid", "conn-1")))
                .orElseThrow().getText()).isEqualTo("40{\"sid\":\"conn-1\"}");
    }

    @Test
    void joinAcceptsEveryRoomShape() {
        assertThat(decode("42[\"join\",\"room-1\"]").getRoomId()).isEqualTo("room-1");
        assertThat(decode("42[\"join\",{\"room\":\"room-2\"}]").getRoomId()).isEqualTo("room-2");

        ClientCommand withAck = decode("4212[\"join\",{\"roomId\":\"room-3\"}]");
        assertThat(withAck.getType()).isEqualTo(CommandType.JOIN_ROOM);
        assertThat(withAck.getRoomId()).isEqualTo("room-3");
        assertThat(withAck.getReplyId()).isEqualTo("12");
    }

    @Test
    void pieceEventsAcceptBareIds() {
        assertThat(decode("42[\"lock-piece\",17]").getObjectId()).isEqualTo("17");
        assertThat(decode("42[\"unlock-piece\",{\"pieceId\":\"p2\"}]").getObjectId()).isEqualTo("p2");

        ClientCommand move = decode("42[\"move-piece\",{\"pieceId\":\"p2\",\"x\":3,\"y\":4}]");
        assertThat(move.getType()).isEqualTo(CommandType.MOVE_PIECE);
        assertThat(move.getPayload().path("y").asDouble()).isEqualTo(4.0);
    }

    @Test
    void pingTestIsAnsweredWithPongTest() {
        ClientCommand ping = decode("42[\"ping-test\"]");
        assertThat(ping.getType()).isEqualTo(CommandType.PING);

        String reply = codec.encodeReply(CommandReply.pong(ping, objectMapper.createObjectNode().put("timestamp", 5L)))
                .orElseThrow().getText();

        assertThat(reply).startsWith("42");
        JsonNode array = parse(reply.substring(2));
        assertThat(array.path(0).asText()).isEqualTo("pong-test");
        assertThat(array.path(1).path("timestamp").asLong()).isEqualTo(5L);
    }

    @Test
    void signalingEventsKeepTheirPayload() {
        ClientCommand offer = decode("42[\"offer\",{\"target\":\"conn-2\",\"type\":\"offer\",\"sdp\":\"v=0\"}]");

        assertThat(offer.getType()).isEqualTo(CommandType.SIGNAL);
        assertThat(offer.getSignalKind()).isEqualTo(SignalKind.OFFER);
        assertThat(offer.getTargetConnectionId()).isEqualTo("conn-2");
        assertThat(offer.getPayload().has("target")).isFalse();
        assertThat(offer.getPayload().path("type").asText()).isEqualTo("offer");
        assertThat(offer.getPayload().path("sdp").asText()).isEqualTo("v=0");

        assertThat(decode("42[\"end-call\",{\"to\":\"conn-3\"}]").getTargetConnectionId()).isEqualTo("conn-3");
    }

    @Test
    void unknownEventNameIsACustomEvent() {
        ClientCommand command = decode("42[\"wave\",{\"hand\":\"left\"}]");

        assertThat(command.getType()).isEqualTo(CommandType.CUSTOM_EVENT);
        assertThat(command.getEventName()).isEqualTo("wave");
        assertThat(command.getPayload().path("hand").asText()).isEqualTo("left");
    }

    @Test
    void malformedPacketsAreRejected() {
        assertThatThrownBy(() -> decode("")).isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> decode("4")).isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> decode("9")).isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> decode("42{\"join\":1}")).isInstanceOf(ProtocolException.class);
        assertThatThrownBy(() -> decode("42[\"join\""))
                .isInstanceOfSatisfying(ProtocolException.class,
                        e -> assertThat(e.getErrorCode()).isEqualTo(ErrorCode.PROTOCOL_ERROR));
        assertThatThrownBy(() -> codec.decode(InboundFrame.binary(new byte[]{1})))
                .isInstanceOf(ProtocolException.class);
    }

    @Test
    void eventsAreSocketIoEvents() {
        CollabEvent event = CollabEvent.builder()
                .type(Constants.EventType.USER_JOINED)
                .payload(objectMapper.createObjectNode().put("userId", "bob"))
                .build();

        String text = codec.encodeEvent(event).getText();

        assertThat(text).isEqualTo("42[\"user-joined\",{\"userId\":\"bob\"}]");
    }

    @Test
    void resultsAreAckedWhenAskedAndEmittedOtherwise() {
        JsonNode body = objectMapper.createObjectNode().put("success", true);

        ClientCommand acked = decode("425[\"message\",\"hi\"]");
        assertThat(codec.encodeReply(CommandReply.result(acked, body)).orElseThrow().getText())
                .isEqualTo("435[{\"success\":true}]");

        ClientCommand plain = decode("42[\"message\",{\"message\":\"hi\"}]");
        assertThat(plain.getText()).isEqualTo("hi");
        assertThat(codec.encodeReply(CommandReply.result(plain, body)).orElseThrow().getText())
                .isEqualTo("42[\"message-sent\",{\"success\":true}]");

        assertThat(codec.encodeReply(CommandReply.none(decode("42[\"wave\"]")))).isEmpty();
        assertThat(codec.encodeReply(CommandReply.none(decode("426[\"wave\"]"))).orElseThrow().getText()).isEqualTo("436[]");
    }

    @Test
    void errorsAreAckedOrSentAsErrorPackets() {
        String plain = codec.encodeError(ErrorCode.NOT_IN_ROOM, null, decode("42[\"message\",\"hi\"]")).getText();
        assertThat(plain).startsWith("44");
        assertThat(parse(plain.substring(2)).path("code").asText()).isEqualTo("not-in-room");

        String acked = codec.encodeError(ErrorCode.LOCK_BUSY, null, decode("427[\"lock-piece\",\"p1\"]")).getText();
        assertThat(acked).startsWith("437");
        JsonNode failure = parse(acked.substring(3)).path(0);
        assertThat(failure.path("success").asBoolean()).isFalse();
        assertThat(failure.path("code").asText()).isEqualTo("busy");
    }

    private ClientCommand decode(String text) {
        return codec.decode(InboundFrame.text(text)).get(0);
    }
}
