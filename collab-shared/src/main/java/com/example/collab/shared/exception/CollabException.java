package com.example.collab.shared.exception;

import lombok.Getter;

/**
 * A failure that is reported back to the requesting connection as a structured error
 * instead of tearing the connection down.
 */
@Getter
public class CollabException extends RuntimeException {

    private final ErrorCode errorCode;

    public CollabException(ErrorCode errorCode) {
        this(errorCode, errorCode.getDefaultMessage());
    }

    public CollabException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CollabException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
