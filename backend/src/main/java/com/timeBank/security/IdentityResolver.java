package com.timeBank.security;

import com.timeBank.exception.ProfileNotFoundException;
import com.timeBank.exception.UnauthenticatedException;
import com.timeBank.model.User;
import com.timeBank.repository.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns a bearer credential into the caller's application profile. Read only.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdentityResolver {

    private final IdentityProvider identityProvider;
    private final UserRepository userRepository;

    /**
     * @throws UnauthenticatedException if the credential is absent or rejected by the provider
     * @throws ProfileNotFoundException if the identity is valid but has no profile row
     */
    public User resolve(String credential) {
        if (credential == null || credential.isBlank()) {
            throw new UnauthenticatedException("Missing authentication credentials");
        }

        String userId;
        try {
            userId = identityProvider.verify(credential);
        } catch (InvalidCredentialException e) {
            log.warn("Auth error: {}", e.getMessage());
            throw new UnauthenticatedException("Could not validate credentials");
        }

        return userRepository.findById(userId)
                .orElseThrow(() -> new ProfileNotFoundException(userId));
    }
}
