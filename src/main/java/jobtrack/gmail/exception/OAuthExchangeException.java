package jobtrack.gmail.exception;

/**
 * The authorization code could not be turned into a usable credential.
 */
public class OAuthExchangeException extends GmailSyncException {
    public OAuthExchangeException(SyncErrorCode code, String message) {
        super(code, message);
    }

    public OAuthExchangeException(SyncErrorCode code, String message, Throwable cause) {
        super(code, message, cause);
    }
}
