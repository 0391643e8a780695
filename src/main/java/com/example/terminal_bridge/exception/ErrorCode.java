package com.example.terminal_bridge.exception;

import com.fasterxml.jackson.annotation.JsonValue;
import org.springframework.http.HttpStatus;

public enum ErrorCode {
    INVALID_TOKEN("invalid_token", HttpStatus.BAD_REQUEST),
    TOKEN_IN_USE("token_in_use", HttpStatus.CONFLICT),
    SLOT_ALREADY_EXISTS("slot_already_exists", HttpStatus.CONFLICT),
    CAPACITY_EXCEEDED("capacity_exceeded", HttpStatus.TOO_MANY_REQUESTS),
    NOT_FOUND("not_found", HttpStatus.NOT_FOUND),
    SPAWN_FAILURE("spawn_failure", HttpStatus.INTERNAL_SERVER_ERROR),
    TIMEOUT("timeout", HttpStatus.GATEWAY_TIMEOUT),
    MALFORMED_FRAME("malformed_frame", HttpStatus.BAD_REQUEST);

    private final String wireName;
    private final HttpStatus status;

    ErrorCode(String wireName, HttpStatus status) {
        this.wireName = wireName;
        this.status = status;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
