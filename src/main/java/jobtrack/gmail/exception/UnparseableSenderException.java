package jobtrack.gmail.exception;

/**
 * No usable email address could be read from the message headers.
 */
public class UnparseableSenderException extends GmailSyncException {
    public UnparseableSenderException(String message) {
        super(SyncErrorCode.UNPARSEABLE_SENDER, message);
    }

    public UnparseableSenderException(String message, Throwable cause) {
        super(SyncErrorCode.UNPARSEABLE_SENDER, message, cause);
    }
}
