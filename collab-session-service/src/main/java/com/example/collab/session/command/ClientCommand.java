package com.example.collab.session.command;

import com.example.collab.session.signaling.SignalKind;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ClientCommand {
    private CommandType type;
    private String roomId;
    private String objectId;
    private String targetConnectionId;
    private SignalKind signalKind;
    /** Custom event name, or the legacy event a ping arrived as. */
    private String eventName;
    private String text;
    private JsonNode payload;
    private byte[] binary;
    /** Invocation id, ack id or request id the client wants echoed back with the result. */
    private String replyId;
    private String namespace;

    public static ClientCommand of(CommandType type) {
        return ClientCommand.builder().type(type).build();
    }
}
