package com.example.collab.session.protocol;

import com.example.collab.session.command.ClientCommand;
import com.example.collab.session.command.CommandReply;
import com.example.collab.shared.dto.CollabEvent;
import com.example.collab.shared.exception.ErrorCode;
import com.example.collab.shared.util.Constants;

import java.util.List;
import java.util.Optional;

/**
 * A stateless translator between one wire format and the canonical command/event model.
 * Session state always lives in the coordinator, keyed by connection id.
 */
public interface ProtocolCodec {

    Constants.WireProtocol protocol();

    /**
     * @throws ProtocolException if the frame is malformed or names an unknown operation
     */
    List<ClientCommand> decode(InboundFrame frame);

    OutboundFrame encodeEvent(CollabEvent event);

    Optional<OutboundFrame> encodeReply(CommandReply reply);

    /**
     * @param command the command that failed, or null when the frame never decoded
     */
    OutboundFrame encodeError(ErrorCode errorCode, String message, ClientCommand command);

    /**
     * Frames sent as soon as the transport is accepted.
     */
    List<OutboundFrame> handshake(String connectionId);

    Optional<OutboundFrame> heartbeat();
}
