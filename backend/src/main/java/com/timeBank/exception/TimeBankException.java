package com.timeBank.exception;

/**
 * Base for every error the API reports with a specific {@link ErrorCode}.
 * Rendered by {@link GlobalExceptionHandler}.
 */
public class TimeBankException extends RuntimeException {

    private final ErrorCode errorCode;

    public TimeBankException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public TimeBankException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }
}
