package com.timeBank.exception;

public class UnauthenticatedException extends TimeBankException {

    public UnauthenticatedException(String message) {
        super(ErrorCode.UNAUTHENTICATED, message);
    }
}
