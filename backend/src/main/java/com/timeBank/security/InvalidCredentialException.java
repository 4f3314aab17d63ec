package com.timeBank.security;

public class InvalidCredentialException extends Exception {

    public InvalidCredentialException(String message, Throwable cause) {
        super(message, cause);
    }
}
