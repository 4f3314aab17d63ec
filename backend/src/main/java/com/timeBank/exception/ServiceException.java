package com.timeBank.exception;

/**
 * Failure of the hosted data store or identity provider. The underlying message
 * is appended so callers see what the upstream service reported.
 */
public class ServiceException extends TimeBankException {

    public ServiceException(String message, Throwable cause) {
        super(ErrorCode.UPSTREAM_FAILURE, withCause(message, cause), cause);
    }

    private static String withCause(String message, Throwable cause) {
        if (cause == null || cause.getMessage() == null)
            return message;
        return message + ": " + cause.getMessage();
    }
}
