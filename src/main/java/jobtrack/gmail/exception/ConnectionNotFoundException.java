package jobtrack.gmail.exception;

public class ConnectionNotFoundException extends GmailSyncException {
    public ConnectionNotFoundException(String message) {
        super(SyncErrorCode.CONNECTION_NOT_FOUND, message);
    }

    public ConnectionNotFoundException(String message, Throwable cause) {
        super(SyncErrorCode.CONNECTION_NOT_FOUND, message, cause);
    }
}
