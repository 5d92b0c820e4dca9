package jobtrack.gmail.exception;

public class UnauthenticatedException extends GmailSyncException {
    public UnauthenticatedException(String message) {
        super(SyncErrorCode.UNAUTHENTICATED, message);
    }

    public UnauthenticatedException(String message, Throwable cause) {
        super(SyncErrorCode.UNAUTHENTICATED, message, cause);
    }
}
