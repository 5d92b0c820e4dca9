package jobtrack.gmail.exception;

import lombok.Getter;

/**
 * Non-retryable client error returned by the Gmail API (for example a message deleted between list and get).
 */
@Getter
public class GmailApiException extends GmailSyncException {
    private final int statusCode;

    public GmailApiException(int statusCode, String message, Throwable cause) {
        super(SyncErrorCode.PROVIDER_ERROR, message, cause);
        this.statusCode = statusCode;
    }
}
