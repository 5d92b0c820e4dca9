package jobtrack.gmail.exception;

/**
 * Stable machine-readable codes for sync and connection failures.
 * These are persisted on sync runs and returned to API callers.
 */
public enum SyncErrorCode {
    AUTH_EXPIRED,
    PROVIDER_UNAVAILABLE,
    PROVIDER_ERROR,
    SYNC_ALREADY_RUNNING,
    UNPARSEABLE_SENDER,
    SKIPPED_NO_CONTACT,
    REVOKE_FAILED,
    CONNECTION_NOT_FOUND,
    INVALID_STATE,
    OAUTH_EXCHANGE_FAILED,
    NO_REFRESH_TOKEN,
    UNAUTHENTICATED,
    NOT_CONFIGURED,
    ABANDONED,
    INTERNAL_ERROR
}
