package jobtrack.gmail.service;

import jobtrack.gmail.config.GmailProperties;
import jobtrack.gmail.dto.AccessToken;
import jobtrack.gmail.dto.TokenResponse;
import jobtrack.gmail.entity.GmailConnection;
import jobtrack.gmail.entity.OAuthToken;
import jobtrack.gmail.exception.AuthExpiredException;
import jobtrack.gmail.repository.GmailConnectionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Keeps a connection's access token usable.
 * <p>
 * Not {@code @Transactional}: when the refresh token is rejected the connection is marked inactive
 * and that write has to survive the {@link AuthExpiredException} thrown afterwards.
 * Only the changed columns are written, so a connection removed during a run stays removed.
 */
@Slf4j
@Service
public class TokenRefreshService {
    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final GmailConnectionRepository connectionRepository;
    private final GoogleOAuthClient oauthClient;
    private final GmailProperties properties;
    private final Clock clock;

    public TokenRefreshService(GmailConnectionRepository connectionRepository, GoogleOAuthClient oauthClient,
                               GmailProperties properties, Clock clock) {
        this.connectionRepository = connectionRepository;
        this.oauthClient = oauthClient;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Returns the stored access token while it is outside the safety margin, otherwise refreshes it
     * and persists the new token and expiry on the connection.
     *
     * @throws AuthExpiredException if the refresh token is missing or rejected; the connection is marked inactive
     * @throws jobtrack.gmail.exception.ProviderUnavailableException on transient token endpoint failures
     */
    public AccessToken ensureFreshToken(GmailConnection connection) {
        OAuthToken token = requireToken(connection);
        Instant now = clock.instant();

        // A missing expiry is treated as expired
        boolean needsRefresh = token.getAccessToken() == null
                || token.getExpiry() == null
                || !now.isBefore(token.getExpiry().minus(properties.getTokenSafetyMargin()));

        if (!needsRefresh) {
            return new AccessToken(token.getAccessToken(), token.getExpiry());
        }
        return refresh(connection, "expired or about to expire");
    }

    /**
     * Refreshes regardless of the stored expiry. Used after Gmail answered 401 to a token we believed valid.
     */
    public AccessToken forceRefresh(GmailConnection connection) {
        requireToken(connection);
        return refresh(connection, "rejected by Gmail");
    }

    /**
     * Deactivates the connection so the user is asked to reconnect it.
     */
    public void markAuthExpired(GmailConnection connection, String reason) {
        connection.setActive(false);
        if (connectionRepository.deactivate(connection.getId(), clock.instant()) == 0) {
            log.info("Connection {} no longer exists, nothing to deactivate ({})", connection.getId(), reason);
            return;
        }
        log.warn("Connection {} ({}) marked inactive: {}", connection.getId(), connection.getEmailAddress(), reason);
    }

    private OAuthToken requireToken(GmailConnection connection) {
        if (connection.getToken() == null) {
            markAuthExpired(connection, "no stored credentials");
            throw new AuthExpiredException("No credentials stored for connection: " + connection.getEmailAddress());
        }
        return connection.getToken();
    }

    private AccessToken refresh(GmailConnection connection, String reason) {
        OAuthToken token = connection.getToken();
        if (token.getRefreshToken() == null || token.getRefreshToken().isEmpty()) {
            markAuthExpired(connection, "no refresh token");
            throw new AuthExpiredException("Access token expired and no refresh token available for connection: "
                    + connection.getEmailAddress() + ". Please reconnect Gmail.");
        }

        log.info("Refreshing access token for connection {} ({})", connection.getId(), reason);
        TokenResponse response;
        try {
            response = oauthClient.refresh(token.getRefreshToken());
        } catch (AuthExpiredException e) {
            markAuthExpired(connection, e.getMessage());
            throw e;
        }

        long expiresIn = response.getExpiresIn() != null ? response.getExpiresIn() : DEFAULT_EXPIRES_IN_SECONDS;
        Instant expiry = clock.instant().plusSeconds(expiresIn);
        String usedRefreshToken = token.getRefreshToken();

        token.setAccessToken(response.getAccessToken());
        token.setExpiry(expiry);
        // Google usually keeps the refresh token but may rotate it
        if (response.getRefreshToken() != null && !response.getRefreshToken().isEmpty()) {
            token.setRefreshToken(response.getRefreshToken());
        }
        if (response.getScope() != null) {
            token.setScope(response.getScope());
        }
        connection.setToken(token);

        int updated = connectionRepository.updateToken(connection.getId(), usedRefreshToken, token.getAccessToken(),
                token.getRefreshToken(), expiry, token.getScope(), clock.instant());
        if (updated == 0) {
            // disconnected or reconnected meanwhile; the stored row is newer than this token
            log.info("Connection {} changed during refresh, refreshed token kept for this run only", connection.getId());
            return new AccessToken(token.getAccessToken(), expiry);
        }
        log.info("Access token refreshed for connection {}, expires at {}", connection.getId(), expiry);
        return new AccessToken(token.getAccessToken(), expiry);
    }
}
