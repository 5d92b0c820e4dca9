package jobtrack.gmail.service;

import jobtrack.gmail.config.GmailProperties;
import jobtrack.gmail.entity.GmailConnection;
import jobtrack.gmail.entity.SyncRun;
import jobtrack.gmail.entity.SyncRunStatus;
import jobtrack.gmail.entity.SyncType;
import jobtrack.gmail.exception.SyncAlreadyRunningException;
import jobtrack.gmail.exception.SyncErrorCode;
import jobtrack.gmail.repository.SyncRunRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Single-flight guard for sync runs.
 * <p>
 * Claiming inserts a new {@link SyncRun} whose {@code activeClaimKey} is the connection id. The column is
 * unique, so when two requests race the store accepts exactly one insert and the other request gets
 * {@link SyncAlreadyRunningException} without having changed anything. Finishing a run clears the key.
 */
@Slf4j
@Service
public class SyncClaimService {
    private static final int MAX_MESSAGE_LENGTH = 2000;

    private final SyncRunRepository syncRunRepository;
    private final GmailProperties properties;
    private final Clock clock;

    public SyncClaimService(SyncRunRepository syncRunRepository, GmailProperties properties, Clock clock) {
        this.syncRunRepository = syncRunRepository;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Atomically creates the in-progress run for {@code connection}.
     *
     * @throws SyncAlreadyRunningException if another run holds the claim
     */
    public SyncRun claim(GmailConnection connection, SyncType syncType) {
        reclaimIfStale(connection.getId());

        SyncRun run = new SyncRun();
        run.setConnectionId(connection.getId());
        run.setUserId(connection.getUserId());
        run.setActiveClaimKey(connection.getId());
        run.setSyncType(syncType != null ? syncType : SyncType.MANUAL);
        run.setStatus(SyncRunStatus.IN_PROGRESS);
        run.setStartedAt(clock.instant());

        try {
            SyncRun claimed = syncRunRepository.saveAndFlush(run);
            log.info("Claimed sync run {} for connection {}", claimed.getId(), connection.getId());
            return claimed;
        } catch (DataIntegrityViolationException e) {
            log.info("Sync already in progress for connection {}", connection.getId());
            throw new SyncAlreadyRunningException(connection.getId(), e);
        }
    }

    public SyncRun complete(SyncRun run, SyncAggregates aggregates) {
        return finish(run, SyncRunStatus.COMPLETED, null, null, aggregates);
    }

    public SyncRun fail(SyncRun run, SyncErrorCode reason, String message, SyncAggregates aggregates) {
        return finish(run, SyncRunStatus.FAILED, reason, message, aggregates);
    }

    /**
     * A run whose worker died keeps its claim forever; once it is older than the stale horizon
     * it is finalized as failed so the connection can be synced again.
     */
    private void reclaimIfStale(String connectionId) {
        Duration staleAfter = properties.getSync().getStaleClaimAfter();
        Instant horizon = clock.instant().minus(staleAfter);
        syncRunRepository.findByActiveClaimKey(connectionId)
                .filter(existing -> existing.getStartedAt().isBefore(horizon))
                .ifPresent(stale -> {
                    log.warn("Reclaiming abandoned sync run {} for connection {} (started {})",
                            stale.getId(), connectionId, stale.getStartedAt());
                    finish(stale, SyncRunStatus.FAILED, SyncErrorCode.ABANDONED,
                            "Run did not finish within " + staleAfter, null);
                });
    }

    private SyncRun finish(SyncRun run, SyncRunStatus status, SyncErrorCode reason, String message,
                           SyncAggregates aggregates) {
        if (run.getStatus().isTerminal()) {
            log.warn("Sync run {} is already {}, ignoring transition to {}", run.getId(), run.getStatus(), status);
            return run;
        }

        run.setStatus(status);
        run.setCompletedAt(clock.instant());
        run.setActiveClaimKey(null);
        run.setFailureReason(reason);
        run.setFailureMessage(message != null && message.length() > MAX_MESSAGE_LENGTH
                ? message.substring(0, MAX_MESSAGE_LENGTH) : message);
        if (aggregates != null) {
            aggregates.applyTo(run);
        }

        try {
            SyncRun saved = syncRunRepository.saveAndFlush(run);
            log.info("Sync run {} for connection {} finished as {}{}", saved.getId(), saved.getConnectionId(), status,
                    reason != null ? " (" + reason + ")" : "");
            return saved;
        } catch (ObjectOptimisticLockingFailureException e) {
            // the stale-claim reaper or another worker got there first; the stored state stands
            log.warn("Sync run {} was finalized concurrently, keeping the stored terminal state", run.getId());
            return syncRunRepository.findById(run.getId()).orElse(run);
        }
    }
}
