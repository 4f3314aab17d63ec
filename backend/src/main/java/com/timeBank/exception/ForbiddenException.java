package com.timeBank.exception;

public class ForbiddenException extends TimeBankException {

    public ForbiddenException(String message) {
        super(ErrorCode.FORBIDDEN, message);
    }
}
