package jobtrack.gmail.controller;

import jobtrack.gmail.dto.ApiError;
import jobtrack.gmail.exception.GmailSyncException;
import jobtrack.gmail.exception.SyncErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Locale;

/**
 * Maps engine failures to HTTP statuses with a {@code {error, message}} body.
 */
@Slf4j
@RestControllerAdvice(basePackages = "jobtrack.gmail.controller")
public class ApiExceptionHandler {

    @ExceptionHandler(GmailSyncException.class)
    public ResponseEntity<ApiError> gmailSync(GmailSyncException e) {
        HttpStatus status = statusFor(e.getCode());
        if (status.is5xxServerError()) {
            log.error("Request failed with {}", e.getCode(), e);
        } else {
            log.debug("Request rejected with {}: {}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(new ApiError(e.getCode().name().toLowerCase(Locale.ROOT), e.getMessage()));
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ApiError> badRequest(Exception e) {
        return ResponseEntity.badRequest().body(new ApiError("bad_request", e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> internal(Exception e) {
        log.error("Unhandled API failure", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError("internal_error", "Request failed"));
    }

    static HttpStatus statusFor(SyncErrorCode code) {
        switch (code) {
            case UNAUTHENTICATED:
            case AUTH_EXPIRED:
                return HttpStatus.UNAUTHORIZED;
            case CONNECTION_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case SYNC_ALREADY_RUNNING:
                return HttpStatus.CONFLICT;
            case INVALID_STATE:
            case OAUTH_EXCHANGE_FAILED:
            case NO_REFRESH_TOKEN:
            case UNPARSEABLE_SENDER:
            case SKIPPED_NO_CONTACT:
                return HttpStatus.BAD_REQUEST;
            case PROVIDER_UNAVAILABLE:
            case PROVIDER_ERROR:
            case REVOKE_FAILED:
                return HttpStatus.BAD_GATEWAY;
            case NOT_CONFIGURED:
                return HttpStatus.SERVICE_UNAVAILABLE;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }
}
