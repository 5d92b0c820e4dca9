package jobtrack.gmail.service;

import jobtrack.gmail.dto.ResolutionOutcome;
import jobtrack.gmail.entity.SyncRun;
import jobtrack.gmail.entity.SyncRunError;
import jobtrack.gmail.exception.SyncErrorCode;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * Running totals of one sync run. Not thread-safe; a run feeds it from a single worker.
 * <p>
 * Every per-message failure is recorded in {@code errors}. Skipped messages are recorded there too,
 * but only the first {@code maxRecordedSkips} of them.
 */
@Getter
public class SyncAggregates {
    private static final int MAX_DETAIL_LENGTH = 1000;

    private final int maxRecordedSkips;
    private int emailsProcessed;
    private int emailsSkipped;
    private int companiesCreated;
    private int contactsCreated;
    private int interactionsCreated;
    private int errorCount;
    private int recordedSkips;
    private final List<SyncRunError> errors = new ArrayList<>();

    public SyncAggregates(int maxRecordedSkips) {
        this.maxRecordedSkips = maxRecordedSkips;
    }

    public void messageProcessed() {
        emailsProcessed++;
    }

    public void recordOutcome(ResolutionOutcome outcome) {
        if (outcome.isCompanyCreated()) {
            companiesCreated++;
        }
        if (outcome.isContactCreated()) {
            contactsCreated++;
        }
        if (outcome.isInteractionCreated()) {
            interactionsCreated++;
        } else {
            // nothing new for this message: it was ingested by an earlier run
            emailsSkipped++;
        }
    }

    public void recordSkip(String messageRef, String detail) {
        emailsSkipped++;
        if (recordedSkips < maxRecordedSkips) {
            recordedSkips++;
            errors.add(new SyncRunError(messageRef, SyncErrorCode.SKIPPED_NO_CONTACT, truncate(detail)));
        }
    }

    public void recordError(String messageRef, SyncErrorCode code, String detail) {
        errorCount++;
        errors.add(new SyncRunError(messageRef, code, truncate(detail)));
    }

    void applyTo(SyncRun run) {
        run.setEmailsProcessed(emailsProcessed);
        run.setEmailsSkipped(emailsSkipped);
        run.setCompaniesCreated(companiesCreated);
        run.setContactsCreated(contactsCreated);
        run.setInteractionsCreated(interactionsCreated);
        run.setErrorCount(errorCount);
        run.setErrors(new ArrayList<>(errors));
    }

    private static String truncate(String detail) {
        return detail != null && detail.length() > MAX_DETAIL_LENGTH ? detail.substring(0, MAX_DETAIL_LENGTH) : detail;
    }
}
