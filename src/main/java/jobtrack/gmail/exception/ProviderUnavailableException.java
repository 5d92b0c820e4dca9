package jobtrack.gmail.exception;

/**
 * Transient network or 5xx/429 failure talking to Google. Safe to retry with backoff.
 */
public class ProviderUnavailableException extends GmailSyncException {
    public ProviderUnavailableException(String message) {
        super(SyncErrorCode.PROVIDER_UNAVAILABLE, message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super(SyncErrorCode.PROVIDER_UNAVAILABLE, message, cause);
    }
}
