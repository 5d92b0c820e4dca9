package jobtrack.gmail.exception;

import lombok.Getter;

/**
 * Another sync run already holds the claim for this connection. Callers should poll the status instead.
 */
@Getter
public class SyncAlreadyRunningException extends GmailSyncException {
    private final String connectionId;

    public SyncAlreadyRunningException(String connectionId) {
        super(SyncErrorCode.SYNC_ALREADY_RUNNING, "Sync already in progress for connection " + connectionId);
        this.connectionId = connectionId;
    }

    public SyncAlreadyRunningException(String connectionId, Throwable cause) {
        super(SyncErrorCode.SYNC_ALREADY_RUNNING, "Sync already in progress for connection " + connectionId, cause);
        this.connectionId = connectionId;
    }
}
