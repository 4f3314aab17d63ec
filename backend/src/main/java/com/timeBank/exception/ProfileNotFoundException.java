package com.timeBank.exception;

/** Credential verified, but no application profile exists for the identity. */
public class ProfileNotFoundException extends TimeBankException {

    public ProfileNotFoundException(String userId) {
        super(ErrorCode.PROFILE_NOT_FOUND, "User profile not found: " + userId);
    }
}
