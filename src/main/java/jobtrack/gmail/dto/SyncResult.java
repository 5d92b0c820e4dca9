package jobtrack.gmail.dto;

import jobtrack.gmail.entity.SyncRun;
import jobtrack.gmail.entity.SyncRunError;
import jobtrack.gmail.entity.SyncRunStatus;
import jobtrack.gmail.exception.SyncErrorCode;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SyncResult {
    boolean success;
    String runId;
    SyncRunStatus status;
    int emailsProcessed;
    int emailsSkipped;
    int companiesCreated;
    int contactsCreated;
    int interactionsCreated;
    int errorCount;
    List<SyncRunError> errors;
    SyncErrorCode failureReason;
    String failureMessage;

    public static SyncResult from(SyncRun run) {
        return SyncResult.builder()
                .success(run.getStatus() == SyncRunStatus.COMPLETED)
                .runId(run.getId())
                .status(run.getStatus())
                .emailsProcessed(run.getEmailsProcessed())
                .emailsSkipped(run.getEmailsSkipped())
                .companiesCreated(run.getCompaniesCreated())
                .contactsCreated(run.getContactsCreated())
                .interactionsCreated(run.getInteractionsCreated())
                .errorCount(run.getErrorCount())
                .errors(List.copyOf(run.getErrors()))
                .failureReason(run.getFailureReason())
                .failureMessage(run.getFailureMessage())
                .build();
    }
}
