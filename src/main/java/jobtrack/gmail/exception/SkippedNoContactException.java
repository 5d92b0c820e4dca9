package jobtrack.gmail.exception;

/**
 * The message has no counterpart worth a contact record (automated sender, own address).
 */
public class SkippedNoContactException extends GmailSyncException {
    public SkippedNoContactException(String message) {
        super(SyncErrorCode.SKIPPED_NO_CONTACT, message);
    }

    public SkippedNoContactException(String message, Throwable cause) {
        super(SyncErrorCode.SKIPPED_NO_CONTACT, message, cause);
    }
}
