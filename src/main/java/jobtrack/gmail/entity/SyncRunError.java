package jobtrack.gmail.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jobtrack.gmail.exception.SyncErrorCode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A message that failed, or was skipped, during a run.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SyncRunError {
    private String messageRef;

    @Enumerated(EnumType.STRING)
    private SyncErrorCode code;

    @Column(length = 1000)
    private String detail;
}
