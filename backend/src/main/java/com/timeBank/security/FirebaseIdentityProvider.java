package com.timeBank.security;

import com.google.firebase.auth.FirebaseAuth;
import com.google.firebase.auth.FirebaseAuthException;
import com.google.firebase.auth.FirebaseToken;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Firebase Authentication ID tokens. The token's uid is the id of the user's
 * profile document.
 */
@Component
@RequiredArgsConstructor
public class FirebaseIdentityProvider implements IdentityProvider {

    private final FirebaseAuth firebaseAuth;

    @Override
    public String verify(String credential) throws InvalidCredentialException {
        try {
            FirebaseToken decodedToken = firebaseAuth.verifyIdToken(credential);
            return decodedToken.getUid();
        } catch (FirebaseAuthException e) {
            throw new InvalidCredentialException(e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            // empty or malformed token string
            throw new InvalidCredentialException(e.getMessage(), e);
        }
    }
}
