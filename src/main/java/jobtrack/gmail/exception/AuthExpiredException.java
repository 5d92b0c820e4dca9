package jobtrack.gmail.exception;

/**
 * The refresh token was rejected by Google. Never retried; the user has to reconnect the mailbox.
 */
public class AuthExpiredException extends GmailSyncException {
    public AuthExpiredException(String message) {
        super(SyncErrorCode.AUTH_EXPIRED, message);
    }

    public AuthExpiredException(String message, Throwable cause) {
        super(SyncErrorCode.AUTH_EXPIRED, message, cause);
    }
}
