package jobtrack.gmail.service;

import jobtrack.gmail.config.GmailProperties;
import jobtrack.gmail.dto.ConnectionStatusResponse;
import jobtrack.gmail.dto.ConnectionSummary;
import jobtrack.gmail.dto.TokenResponse;
import jobtrack.gmail.entity.GmailConnection;
import jobtrack.gmail.entity.OAuthToken;
import jobtrack.gmail.exception.ConnectionNotFoundException;
import jobtrack.gmail.exception.GmailSyncException;
import jobtrack.gmail.exception.OAuthExchangeException;
import jobtrack.gmail.exception.RevokeFailedException;
import jobtrack.gmail.exception.SyncErrorCode;
import jobtrack.gmail.repository.GmailConnectionRepository;
import jobtrack.gmail.repository.SyncRunRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Connect, callback and disconnect of Gmail mailboxes.
 */
@Slf4j
@Service
public class ConnectionService {
    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final GmailConnectionRepository connectionRepository;
    private final SyncRunRepository syncRunRepository;
    private final GoogleOAuthClient oauthClient;
    private final GmailMailClient mailClient;
    private final OAuthStateService stateService;
    private final GmailProperties properties;
    private final Clock clock;

    public ConnectionService(
            GmailConnectionRepository connectionRepository,
            SyncRunRepository syncRunRepository,
            GoogleOAuthClient oauthClient,
            GmailMailClient mailClient,
            OAuthStateService stateService,
            GmailProperties properties,
            Clock clock) {
        this.connectionRepository = connectionRepository;
        this.syncRunRepository = syncRunRepository;
        this.oauthClient = oauthClient;
        this.mailClient = mailClient;
        this.stateService = stateService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Authorization URL carrying a signed state bound to {@code userId}.
     */
    public String connect(String userId) {
        String authUrl = oauthClient.buildAuthorizationUrl(stateService.issue(userId));
        log.info("Issued Gmail authorization URL for user {}", userId);
        return authUrl;
    }

    /**
     * Completes the OAuth flow. Nothing is stored unless Google granted a refresh token.
     *
     * @return the created or updated connection
     */
    public GmailConnection handleCallback(String userId, String code, String state) {
        stateService.verify(state, userId);
        if (code == null || code.isBlank()) {
            throw new OAuthExchangeException(SyncErrorCode.OAUTH_EXCHANGE_FAILED, "Missing authorization code");
        }

        TokenResponse tokens = oauthClient.exchangeCode(code);
        if (tokens.getRefreshToken() == null || tokens.getRefreshToken().isEmpty()) {
            log.warn("Google granted no refresh token to user {}, rejecting the connection", userId);
            throw new OAuthExchangeException(SyncErrorCode.NO_REFRESH_TOKEN,
                    "No refresh token received. Remove the app's access in your Google account and connect again.");
        }

        String emailAddress = mailClient.getProfileEmail(tokens.getAccessToken());
        if (emailAddress == null || emailAddress.isBlank()) {
            throw new OAuthExchangeException(SyncErrorCode.OAUTH_EXCHANGE_FAILED, "Gmail profile has no email address");
        }
        emailAddress = emailAddress.toLowerCase(Locale.ROOT);

        OAuthToken token = new OAuthToken();
        token.setAccessToken(tokens.getAccessToken());
        token.setRefreshToken(tokens.getRefreshToken());
        token.setScope(tokens.getScope());
        long expiresIn = tokens.getExpiresIn() != null ? tokens.getExpiresIn() : DEFAULT_EXPIRES_IN_SECONDS;
        token.setExpiry(clock.instant().plusSeconds(expiresIn));

        try {
            return upsert(userId, emailAddress, token);
        } catch (DataIntegrityViolationException | ObjectOptimisticLockingFailureException e) {
            // a parallel callback inserted the mailbox first, or a running sync touched the row
            log.info("Concurrent write on connection for {}, updating it again", emailAddress);
            return upsert(userId, emailAddress, token);
        }
    }

    private GmailConnection upsert(String userId, String emailAddress, OAuthToken token) {
        GmailConnection connection = connectionRepository.findByUserIdAndEmailAddress(userId, emailAddress)
                .orElseGet(GmailConnection::new);
        boolean reconnect = connection.getId() != null;

        connection.setUserId(userId);
        connection.setEmailAddress(emailAddress);
        connection.setToken(token);
        connection.setActive(true);
        GmailConnection saved = connectionRepository.saveAndFlush(connection);

        log.info("{} Gmail connection {} ({}) for user {}", reconnect ? "Updated" : "Created",
                saved.getId(), emailAddress, userId);
        return saved;
    }

    /**
     * Revokes the token at Google and deletes the connection. The local row is removed even when revocation fails.
     */
    public void disconnect(String userId, String connectionId) {
        if (connectionId == null || connectionId.isBlank()) {
            throw new IllegalArgumentException("connectionId is required");
        }
        GmailConnection connection = connectionRepository.findByIdAndUserId(connectionId, userId)
                .orElseThrow(() -> new ConnectionNotFoundException("Gmail connection not found: " + connectionId));

        String tokenToRevoke = revocableToken(connection.getToken());
        if (tokenToRevoke != null) {
            try {
                mailClient.revoke(tokenToRevoke);
            } catch (RevokeFailedException e) {
                log.warn("Could not revoke Gmail token for connection {}, deleting it anyway: {}",
                        connectionId, e.getMessage());
            }
        }

        connectionRepository.delete(connection);
        log.info("Disconnected Gmail connection {} ({}) for user {}", connectionId, connection.getEmailAddress(), userId);
    }

    public ConnectionStatusResponse status(String userId) {
        if (!properties.isConfigured()) {
            throw new GmailSyncException(SyncErrorCode.NOT_CONFIGURED, "Gmail integration is not configured");
        }
        List<ConnectionSummary> connections = connectionRepository.findByUserIdAndActiveTrueOrderByCreatedAtDesc(userId)
                .stream()
                .map(connection -> ConnectionSummary.of(connection,
                        syncRunRepository.findFirstByConnectionIdOrderByStartedAtDesc(connection.getId()).orElse(null)))
                .collect(Collectors.toList());
        return new ConnectionStatusResponse(!connections.isEmpty(), connections);
    }

    // revoking the refresh token also invalidates the access tokens issued from it
    private String revocableToken(OAuthToken token) {
        if (token == null) {
            return null;
        }
        if (token.getRefreshToken() != null && !token.getRefreshToken().isEmpty()) {
            return token.getRefreshToken();
        }
        return token.getAccessToken();
    }
}
