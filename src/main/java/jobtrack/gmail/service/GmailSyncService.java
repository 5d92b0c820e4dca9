package jobtrack.gmail.service;

import jobtrack.gmail.config.GmailProperties;
import jobtrack.gmail.dto.MailMessage;
import jobtrack.gmail.dto.MessagePage;
import jobtrack.gmail.dto.MessageRef;
import jobtrack.gmail.dto.ResolutionOutcome;
import jobtrack.gmail.dto.SyncRequest;
import jobtrack.gmail.dto.SyncResult;
import jobtrack.gmail.dto.SyncStatusResponse;
import jobtrack.gmail.entity.GmailConnection;
import jobtrack.gmail.entity.SyncRun;
import jobtrack.gmail.entity.SyncRunStatus;
import jobtrack.gmail.entity.SyncType;
import jobtrack.gmail.exception.AuthExpiredException;
import jobtrack.gmail.exception.ConnectionNotFoundException;
import jobtrack.gmail.exception.GmailApiException;
import jobtrack.gmail.exception.ProviderUnavailableException;
import jobtrack.gmail.exception.SkippedNoContactException;
import jobtrack.gmail.exception.SyncErrorCode;
import jobtrack.gmail.exception.UnparseableSenderException;
import jobtrack.gmail.repository.GmailConnectionRepository;
import jobtrack.gmail.repository.SyncRunRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Drives one ingestion pass over a Gmail connection.
 * <p>
 * A run is claimed first, so a second request for the same connection fails with
 * {@link jobtrack.gmail.exception.SyncAlreadyRunningException} before anything is read or written.
 * The claimed run then pages through the mailbox until {@code maxEmails}, the end of the listing or
 * the wall-clock deadline, whichever comes first. Problems with a single message are recorded on the
 * run and processing moves on; only an expired credential or a provider that stays unavailable past
 * the retry budget fails the run. Every claimed run ends in exactly one terminal state.
 */
@Slf4j
@Service
public class GmailSyncService {
    private final GmailConnectionRepository connectionRepository;
    private final SyncRunRepository syncRunRepository;
    private final SyncClaimService syncClaimService;
    private final GmailMailClient mailClient;
    private final ContactResolutionService contactResolutionService;
    private final GmailProperties properties;
    private final TaskExecutor syncExecutor;
    private final Clock clock;

    public GmailSyncService(
            GmailConnectionRepository connectionRepository,
            SyncRunRepository syncRunRepository,
            SyncClaimService syncClaimService,
            GmailMailClient mailClient,
            ContactResolutionService contactResolutionService,
            GmailProperties properties,
            @Qualifier("gmailSyncExecutor") TaskExecutor syncExecutor,
            Clock clock) {
        this.connectionRepository = connectionRepository;
        this.syncRunRepository = syncRunRepository;
        this.syncClaimService = syncClaimService;
        this.mailClient = mailClient;
        this.contactResolutionService = contactResolutionService;
        this.properties = properties;
        this.syncExecutor = syncExecutor;
        this.clock = clock;
    }

    /**
     * Runs a sync to completion on the calling thread.
     *
     * @throws IllegalArgumentException if {@code daysSince} is negative or {@code maxEmails} is not positive
     * @throws ConnectionNotFoundException if the connection does not exist, is inactive or belongs to someone else
     * @throws jobtrack.gmail.exception.SyncAlreadyRunningException if a run is already in progress
     */
    public SyncResult sync(String userId, SyncRequest request) {
        SyncBudget budget = budgetFor(request);
        GmailConnection connection = loadActiveConnection(userId, request.getConnectionId());
        SyncRun run = syncClaimService.claim(connection, syncTypeOf(request));
        return SyncResult.from(runClaimed(connection, run, budget));
    }

    /**
     * Claims on the calling thread and continues the run on the sync executor.
     * The returned run is still in progress; callers poll {@link #status}.
     */
    public SyncRun startAsync(String userId, SyncRequest request) {
        SyncBudget budget = budgetFor(request);
        GmailConnection connection = loadActiveConnection(userId, request.getConnectionId());
        SyncRun run = syncClaimService.claim(connection, syncTypeOf(request));

        try {
            syncExecutor.execute(() -> runClaimed(connection, run, budget));
        } catch (TaskRejectedException e) {
            log.error("Sync executor rejected run {} for connection {}", run.getId(), connection.getId(), e);
            return syncClaimService.fail(run, SyncErrorCode.INTERNAL_ERROR,
                    "Sync could not be scheduled: " + e.getMessage(), null);
        }
        return run;
    }

    public SyncStatusResponse status(String userId, String connectionId) {
        connectionRepository.findByIdAndUserId(connectionId, userId)
                .orElseThrow(() -> new ConnectionNotFoundException("Gmail connection not found: " + connectionId));

        boolean inProgress = syncRunRepository.existsByConnectionIdAndStatus(connectionId, SyncRunStatus.IN_PROGRESS);
        List<SyncRun> recentRuns = syncRunRepository.findByConnectionIdAndUserIdOrderByStartedAtDesc(
                connectionId, userId, PageRequest.of(0, properties.getSync().getRecentRunsLimit()));
        return new SyncStatusResponse(inProgress, recentRuns);
    }

    SyncRun runClaimed(GmailConnection connection, SyncRun run, SyncBudget budget) {
        SyncAggregates aggregates = new SyncAggregates(properties.getSync().getMaxRecordedSkips());
        SyncRun finished;
        try {
            pullMessages(connection, budget, aggregates);
            finished = syncClaimService.complete(run, aggregates);
        } catch (AuthExpiredException e) {
            log.warn("Sync run {} failed: credentials for {} are no longer valid", run.getId(), connection.getEmailAddress());
            finished = syncClaimService.fail(run, SyncErrorCode.AUTH_EXPIRED, e.getMessage(), aggregates);
        } catch (ProviderUnavailableException e) {
            log.warn("Sync run {} failed: Gmail unavailable after retries: {}", run.getId(), e.getMessage());
            finished = syncClaimService.fail(run, SyncErrorCode.PROVIDER_UNAVAILABLE, e.getMessage(), aggregates);
        } catch (GmailApiException e) {
            log.error("Sync run {} failed: Gmail rejected the message listing with {}", run.getId(), e.getStatusCode(), e);
            finished = syncClaimService.fail(run, SyncErrorCode.PROVIDER_ERROR, e.getMessage(), aggregates);
        } catch (RuntimeException e) {
            log.error("Sync run {} failed unexpectedly", run.getId(), e);
            finished = syncClaimService.fail(run, SyncErrorCode.INTERNAL_ERROR, e.getMessage(), aggregates);
        }

        stampLastSync(connection);
        log.info("Sync run {} for {}: {} processed, {} skipped, {} companies, {} contacts, {} interactions, {} errors",
                finished.getId(), connection.getEmailAddress(), finished.getEmailsProcessed(), finished.getEmailsSkipped(),
                finished.getCompaniesCreated(), finished.getContactsCreated(), finished.getInteractionsCreated(),
                finished.getErrorCount());
        return finished;
    }

    private void pullMessages(GmailConnection connection, SyncBudget budget, SyncAggregates aggregates) {
        Instant now = clock.instant();
        Instant deadline = now.plus(properties.getSync().getRunTimeout());
        String query = GmailMailClient.receivedAfterQuery(windowStart(now, budget.daysSince));
        int pageSize = properties.getSync().getPageSize();

        int remaining = budget.maxEmails;
        String pageToken = null;
        do {
            if (deadlineReached(deadline)) {
                log.warn("Sync deadline reached for {}, completing with partial results", connection.getEmailAddress());
                return;
            }
            MessagePage page = mailClient.listMessages(connection, query, pageToken, Math.min(pageSize, remaining));
            for (MessageRef ref : page.getMessages()) {
                if (remaining == 0) {
                    return;
                }
                if (deadlineReached(deadline)) {
                    log.warn("Sync deadline reached for {}, completing with partial results", connection.getEmailAddress());
                    return;
                }
                processMessage(connection, ref, aggregates);
                remaining--;
            }
            pageToken = page.hasNextPage() ? page.getNextPageToken() : null;
        } while (remaining > 0 && pageToken != null);
    }

    /**
     * Feeds one message to the resolver. Run-level failures propagate, everything else is recorded.
     */
    private void processMessage(GmailConnection connection, MessageRef ref, SyncAggregates aggregates) {
        aggregates.messageProcessed();
        try {
            MailMessage message = mailClient.getMessage(connection, ref.getId());
            aggregates.recordOutcome(resolve(connection, message));
        } catch (SkippedNoContactException e) {
            log.debug("Skipping message {}: {}", ref.getId(), e.getMessage());
            aggregates.recordSkip(ref.getId(), e.getMessage());
        } catch (UnparseableSenderException e) {
            log.warn("Message {}: {}", ref.getId(), e.getMessage());
            aggregates.recordError(ref.getId(), SyncErrorCode.UNPARSEABLE_SENDER, e.getMessage());
        } catch (GmailApiException e) {
            log.warn("Message {} could not be fetched: {}", ref.getId(), e.getMessage());
            aggregates.recordError(ref.getId(), SyncErrorCode.PROVIDER_ERROR, e.getMessage());
        } catch (AuthExpiredException | ProviderUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Error processing message {}", ref.getId(), e);
            aggregates.recordError(ref.getId(), SyncErrorCode.INTERNAL_ERROR, e.getMessage());
        }
    }

    private ResolutionOutcome resolve(GmailConnection connection, MailMessage message) {
        try {
            return contactResolutionService.resolve(connection.getUserId(), connection.getEmailAddress(), message);
        } catch (DataIntegrityViolationException e) {
            // a concurrent writer created the same company, contact or interaction first
            log.info("Lost a uniqueness race on message {}, resolving again", message.getMessageId());
            return contactResolutionService.resolve(connection.getUserId(), connection.getEmailAddress(), message);
        }
    }

    private void stampLastSync(GmailConnection connection) {
        Instant syncedAt = clock.instant();
        try {
            if (connectionRepository.updateLastSyncAt(connection.getId(), syncedAt) == 0) {
                log.info("Connection {} was removed during the run, last sync time not recorded", connection.getId());
                return;
            }
            connection.setLastSyncAt(syncedAt);
        } catch (RuntimeException e) {
            // the run itself is already finalized
            log.warn("Could not record last sync time on connection {}", connection.getId(), e);
        }
    }

    /**
     * Start of the query window, never before the epoch: Gmail rejects a negative {@code after:}.
     */
    static Instant windowStart(Instant now, int daysSince) {
        Instant start = now.minus(Duration.ofDays(daysSince));
        return start.isBefore(Instant.EPOCH) ? Instant.EPOCH : start;
    }

    private boolean deadlineReached(Instant deadline) {
        return !clock.instant().isBefore(deadline);
    }

    private GmailConnection loadActiveConnection(String userId, String connectionId) {
        if (connectionId == null || connectionId.isBlank()) {
            throw new IllegalArgumentException("connectionId is required");
        }
        return connectionRepository.findByIdAndUserIdAndActiveTrue(connectionId, userId)
                .orElseThrow(() -> new ConnectionNotFoundException("Gmail connection not found or inactive: " + connectionId));
    }

    private SyncBudget budgetFor(SyncRequest request) {
        int daysSince = request.getDaysSince() != null
                ? request.getDaysSince() : properties.getSync().getDefaultDaysSince();
        int maxEmails = request.getMaxEmails() != null
                ? request.getMaxEmails() : properties.getSync().getDefaultMaxEmails();
        if (daysSince < 0) {
            throw new IllegalArgumentException("daysSince must be >= 0, was " + daysSince);
        }
        if (maxEmails <= 0) {
            throw new IllegalArgumentException("maxEmails must be > 0, was " + maxEmails);
        }
        return new SyncBudget(daysSince, maxEmails);
    }

    private SyncType syncTypeOf(SyncRequest request) {
        return request.getSyncType() != null ? request.getSyncType() : SyncType.MANUAL;
    }

    static final class SyncBudget {
        final int daysSince;
        final int maxEmails;

        SyncBudget(int daysSince, int maxEmails) {
            this.daysSince = daysSince;
            this.maxEmails = maxEmails;
        }
    }
}
