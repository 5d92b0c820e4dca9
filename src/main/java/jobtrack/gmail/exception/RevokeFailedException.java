package jobtrack.gmail.exception;

/**
 * Google did not confirm token revocation. Disconnect treats this as best effort.
 */
public class RevokeFailedException extends GmailSyncException {
    public RevokeFailedException(String message) {
        super(SyncErrorCode.REVOKE_FAILED, message);
    }

    public RevokeFailedException(String message, Throwable cause) {
        super(SyncErrorCode.REVOKE_FAILED, message, cause);
    }
}
