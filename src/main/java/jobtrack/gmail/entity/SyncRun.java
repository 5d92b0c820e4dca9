package jobtrack.gmail.entity;

import jakarta.persistence.*;
import jobtrack.gmail.exception.SyncErrorCode;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Sync log entry: one bounded ingestion attempt against a connection.
 * <p>
 * While the run is {@link SyncRunStatus#IN_PROGRESS}, {@code activeClaimKey} holds the connection id.
 * The unique constraint on that column is what keeps a second run from being claimed for the same
 * connection. The key is cleared on the terminal transition.
 */
@Entity
@Table(name = "gmail_sync_runs",
        indexes = @Index(name = "idx_sync_run_connection_started", columnList = "connection_id, started_at"))
@Data
public class SyncRun {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Version
    private Long version;

    @Column(name = "connection_id", nullable = false)
    private String connectionId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "active_claim_key", unique = true)
    private String activeClaimKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SyncType syncType = SyncType.MANUAL;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SyncRunStatus status;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    private Instant completedAt;

    private int emailsProcessed;
    private int emailsSkipped;
    private int companiesCreated;
    private int contactsCreated;
    private int interactionsCreated;

    /** Per-message failures. All of them are in {@code errors}, next to a bounded number of skips. */
    private int errorCount;

    @Enumerated(EnumType.STRING)
    private SyncErrorCode failureReason;

    @Column(length = 2000)
    private String failureMessage;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "gmail_sync_run_errors", joinColumns = @JoinColumn(name = "sync_run_id"))
    @OrderColumn(name = "error_order")
    private List<SyncRunError> errors = new ArrayList<>();

    public boolean isInProgress() {
        return status == SyncRunStatus.IN_PROGRESS;
    }
}
