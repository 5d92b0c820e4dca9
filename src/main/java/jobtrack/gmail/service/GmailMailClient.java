package jobtrack.gmail.service;

import com.google.api.client.googleapis.json.GoogleJsonError;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.HttpResponseException;
import jobtrack.gmail.dto.AccessToken;
import jobtrack.gmail.dto.MailMessage;
import jobtrack.gmail.dto.MessagePage;
import jobtrack.gmail.entity.GmailConnection;
import jobtrack.gmail.exception.AuthExpiredException;
import jobtrack.gmail.exception.GmailApiException;
import jobtrack.gmail.exception.OAuthExchangeException;
import jobtrack.gmail.exception.ProviderUnavailableException;
import jobtrack.gmail.exception.SyncErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Instant;
import java.util.Set;

/**
 * Authenticated mailbox operations for a connection.
 * <p>
 * Every call obtains its token from {@link TokenRefreshService}. A 401 from Gmail triggers exactly one
 * forced refresh and one retry; a second 401 fails with {@link AuthExpiredException}. Transient failures
 * are retried according to the injected {@link RetryPolicy}.
 */
@Slf4j
@Service
public class GmailMailClient {
    private static final Set<String> RATE_LIMIT_REASONS = Set.of("rateLimitExceeded", "userRateLimitExceeded");

    private final GmailApiService gmailApiService;
    private final TokenRefreshService tokenRefreshService;
    private final GmailMessageParser messageParser;
    private final GoogleOAuthClient oauthClient;
    private final RetryPolicy retryPolicy;

    @FunctionalInterface
    interface GmailCall<T> {
        T call(String accessToken) throws IOException;
    }

    public GmailMailClient(GmailApiService gmailApiService, TokenRefreshService tokenRefreshService,
                           GmailMessageParser messageParser, GoogleOAuthClient oauthClient, RetryPolicy gmailRetryPolicy) {
        this.gmailApiService = gmailApiService;
        this.tokenRefreshService = tokenRefreshService;
        this.messageParser = messageParser;
        this.oauthClient = oauthClient;
        this.retryPolicy = gmailRetryPolicy;
    }

    /**
     * Gmail search query for messages received after {@code since}.
     */
    public static String receivedAfterQuery(Instant since) {
        return "after:" + since.getEpochSecond();
    }

    public MessagePage listMessages(GmailConnection connection, String query, String pageToken, int maxResults) {
        return execute(connection, "listMessages",
                accessToken -> gmailApiService.listMessages(accessToken, query, pageToken, maxResults));
    }

    public MailMessage getMessage(GmailConnection connection, String messageId) {
        return execute(connection, "getMessage " + messageId,
                accessToken -> messageParser.parse(gmailApiService.getMessage(accessToken, messageId)));
    }

    /**
     * Reads the mailbox address for a token that is not stored yet (OAuth callback).
     */
    public String getProfileEmail(String accessToken) {
        return retryPolicy.execute("getProfile", () -> {
            try {
                return gmailApiService.getProfileEmail(accessToken);
            } catch (IOException e) {
                RuntimeException translated = translate(e, "getProfile");
                if (translated instanceof GmailApiException) {
                    throw new OAuthExchangeException(SyncErrorCode.OAUTH_EXCHANGE_FAILED,
                            "Could not read the Gmail profile: " + e.getMessage(), e);
                }
                throw translated;
            }
        });
    }

    public void revoke(String accessToken) {
        oauthClient.revoke(accessToken);
    }

    private <T> T execute(GmailConnection connection, String operation, GmailCall<T> call) {
        return retryPolicy.execute(operation, () -> executeOnce(connection, operation, call));
    }

    private <T> T executeOnce(GmailConnection connection, String operation, GmailCall<T> call) {
        AccessToken token = tokenRefreshService.ensureFreshToken(connection);
        try {
            return call.call(token.getValue());
        } catch (IOException e) {
            if (!isUnauthorized(e)) {
                throw translate(e, operation);
            }
        }

        log.info("Gmail returned 401 for {} on connection {}, refreshing token and retrying once",
                operation, connection.getId());
        AccessToken refreshed = tokenRefreshService.forceRefresh(connection);
        try {
            return call.call(refreshed.getValue());
        } catch (IOException e) {
            if (isUnauthorized(e)) {
                tokenRefreshService.markAuthExpired(connection, "401 after a fresh token");
                throw new AuthExpiredException("Gmail rejected a freshly refreshed token for " + connection.getEmailAddress(), e);
            }
            throw translate(e, operation);
        }
    }

    private boolean isUnauthorized(IOException e) {
        return e instanceof HttpResponseException && ((HttpResponseException) e).getStatusCode() == 401;
    }

    RuntimeException translate(IOException e, String operation) {
        if (e instanceof HttpResponseException) {
            int status = ((HttpResponseException) e).getStatusCode();
            if (status == 429 || status >= 500 || isRateLimited(e)) {
                return new ProviderUnavailableException("Gmail " + operation + " failed with " + status, e);
            }
            return new GmailApiException(status, "Gmail " + operation + " failed with " + status, e);
        }
        return new ProviderUnavailableException("Gmail " + operation + " failed: " + e.getMessage(), e);
    }

    // Gmail reports per-user quota exhaustion as 403 with a rate limit reason
    private boolean isRateLimited(IOException e) {
        if (!(e instanceof GoogleJsonResponseException)) {
            return false;
        }
        GoogleJsonError details = ((GoogleJsonResponseException) e).getDetails();
        if (details == null || details.getErrors() == null) {
            return false;
        }
        return details.getErrors().stream()
                .anyMatch(info -> RATE_LIMIT_REASONS.contains(info.getReason()));
    }
}
