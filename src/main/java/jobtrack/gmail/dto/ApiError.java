package jobtrack.gmail.dto;

import lombok.Value;

/**
 * Error body of the JSON API. {@code error} is a lower-case {@link jobtrack.gmail.exception.SyncErrorCode} name.
 */
@Value
public class ApiError {
    String error;
    String message;
}
