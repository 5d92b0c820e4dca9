package jobtrack.gmail.exception;

import lombok.Getter;

/**
 * Base type for every failure the sync engine reports by code.
 */
@Getter
public class GmailSyncException extends RuntimeException {
    private final SyncErrorCode code;

    public GmailSyncException(SyncErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public GmailSyncException(SyncErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
