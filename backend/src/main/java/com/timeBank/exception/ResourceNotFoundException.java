package com.timeBank.exception;

public class ResourceNotFoundException extends TimeBankException {

    public ResourceNotFoundException(String resource, String id) {
        super(ErrorCode.NOT_FOUND, resource + " not found: " + id);
    }
}
