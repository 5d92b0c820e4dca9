package jobtrack.gmail.exception;

/**
 * The OAuth state value was malformed, tampered with, expired, or issued to another user.
 */
public class InvalidOAuthStateException extends GmailSyncException {
    public InvalidOAuthStateException(String message) {
        super(SyncErrorCode.INVALID_STATE, message);
    }

    public InvalidOAuthStateException(String message, Throwable cause) {
        super(SyncErrorCode.INVALID_STATE, message, cause);
    }
}
