package com.timeBank.security;

/**
 * Verifies a bearer credential against the external identity service.
 */
public interface IdentityProvider {

    /**
     * @param credential raw bearer token, without the "Bearer " prefix
     * @return the provider-confirmed subject id
     * @throws InvalidCredentialException if the token is forged, expired or revoked
     */
    String verify(String credential) throws InvalidCredentialException;
}
