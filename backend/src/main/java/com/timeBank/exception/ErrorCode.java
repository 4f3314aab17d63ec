package com.timeBank.exception;

import org.springframework.http.HttpStatus;

public enum ErrorCode {
    UNAUTHENTICATED(HttpStatus.UNAUTHORIZED),
    PROFILE_NOT_FOUND(HttpStatus.NOT_FOUND),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    FORBIDDEN(HttpStatus.FORBIDDEN),

    INVALID_DURATION(HttpStatus.BAD_REQUEST),
    INSUFFICIENT_CREDITS(HttpStatus.BAD_REQUEST),
    NO_FIELDS(HttpStatus.BAD_REQUEST),
    NOT_AVAILABLE(HttpStatus.BAD_REQUEST),
    SELF_ASSIGNMENT(HttpStatus.BAD_REQUEST),
    MISSING_EVIDENCE(HttpStatus.BAD_REQUEST),
    WRONG_STATUS(HttpStatus.BAD_REQUEST),

    UPSTREAM_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus status;

    ErrorCode(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
