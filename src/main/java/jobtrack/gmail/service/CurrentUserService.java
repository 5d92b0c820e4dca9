package jobtrack.gmail.service;

import jobtrack.gmail.exception.UnauthenticatedException;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Service;

/**
 * Resolves the caller's user id. With Google sign-in this is the OAuth2 principal name (the Google subject id).
 */
@Service
public class CurrentUserService {

    public String requireUserId(Authentication authentication) {
        if (authentication == null || !authentication.isAuthenticated()
                || authentication instanceof AnonymousAuthenticationToken) {
            throw new UnauthenticatedException("Authentication required");
        }
        String userId = authentication.getName();
        if (userId == null || userId.isBlank()) {
            throw new UnauthenticatedException("Authenticated principal has no id");
        }
        return userId;
    }
}
