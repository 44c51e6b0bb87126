package com.example.collab.session.protocol;

import com.example.collab.session.command.ClientCommand;
import com.example.collab.shared.exception.CollabException;
import com.example.collab.shared.exception.ErrorCode;
import lombok.Getter;

/**
 * A frame that could not be translated. Reported to the sender only; the connection stays open.
 */
@Getter
public class ProtocolException extends CollabException {

    /** Whatever was decoded before the failure, so the error can carry the client's reply id. */
    private final ClientCommand partialCommand;

    public ProtocolException(String message) {
        this(ErrorCode.PROTOCOL_ERROR, message, null);
    }

    public ProtocolException(String message, Throwable cause) {
        super(ErrorCode.PROTOCOL_ERROR, message, cause);
        this.partialCommand = null;
    }

    public ProtocolException(ErrorCode errorCode, String message, ClientCommand partialCommand) {
        super(errorCode, message);
        this.partialCommand = partialCommand;
    }
}
