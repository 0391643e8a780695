package com.example.terminal_bridge.exception;

import lombok.Getter;

/**
 * Request-time failure with a user-displayable reason.
 */
@Getter
public class BridgeException extends RuntimeException {

    private final ErrorCode code;

    public BridgeException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public BridgeException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public static BridgeException slotAlreadyExists(String token, String terminalId) {
        return new BridgeException(ErrorCode.SLOT_ALREADY_EXISTS,
            "Terminal " + terminalId + " already exists for session " + token);
    }

    public static BridgeException capacityExceeded(String message) {
        return new BridgeException(ErrorCode.CAPACITY_EXCEEDED, message);
    }

    public static BridgeException notFound(String message) {
        return new BridgeException(ErrorCode.NOT_FOUND, message);
    }
}
