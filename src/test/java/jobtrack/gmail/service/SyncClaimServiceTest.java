package jobtrack.gmail.service;

import jobtrack.gmail.config.GmailProperties;
import jobtrack.gmail.dto.ResolutionOutcome;
import jobtrack.gmail.entity.GmailConnection;
import jobtrack.gmail.entity.SyncRun;
import jobtrack.gmail.entity.SyncRunStatus;
import jobtrack.gmail.entity.SyncType;
import jobtrack.gmail.exception.SyncAlreadyRunningException;
import jobtrack.gmail.exception.SyncErrorCode;
import jobtrack.gmail.repository.SyncRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SyncClaimServiceTest {
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private SyncRunRepository syncRunRepository;

    private SyncClaimService syncClaimService;
    private GmailConnection testConnection;

    @BeforeEach
    void setUp() {
        syncClaimService = new SyncClaimService(syncRunRepository, new GmailProperties(), Clock.fixed(NOW, ZoneOffset.UTC));

        testConnection = new GmailConnection();
        testConnection.setId("conn123");
        testConnection.setUserId("user123");
        testConnection.setEmailAddress("jane@example.com");
    }

    @Test
    void claim_WithNoActiveRun_ShouldInsertInProgressRunHoldingTheKey() {
        // Given
        when(syncRunRepository.findByActiveClaimKey("conn123")).thenReturn(Optional.empty());
        when(syncRunRepository.saveAndFlush(any(SyncRun.class))).thenAnswer(invocation -> {
            SyncRun run = invocation.getArgument(0);
            run.setId("run-1");
            return run;
        });

        // When
        SyncRun run = syncClaimService.claim(testConnection, SyncType.INITIAL);

        // Then
        assertEquals("run-1", run.getId());
        assertEquals(SyncRunStatus.IN_PROGRESS, run.getStatus());
        assertEquals("conn123", run.getActiveClaimKey());
        assertEquals("conn123", run.getConnectionId());
        assertEquals("user123", run.getUserId());
        assertEquals(SyncType.INITIAL, run.getSyncType());
        assertEquals(NOW, run.getStartedAt());
    }

    @Test
    void claim_WhenStoreRejectsSecondInsert_ShouldThrowSyncAlreadyRunning() {
        // Given
        SyncRun active = inProgressRun("run-1", NOW.minus(Duration.ofMinutes(2)));
        when(syncRunRepository.findByActiveClaimKey("conn123")).thenReturn(Optional.of(active));
        when(syncRunRepository.saveAndFlush(any(SyncRun.class)))
                .thenThrow(new DataIntegrityViolationException("uk_sync_run_active_claim"));

        // When & Then
        SyncAlreadyRunningException exception = assertThrows(SyncAlreadyRunningException.class, () ->
                syncClaimService.claim(testConnection, SyncType.MANUAL));

        assertEquals("conn123", exception.getConnectionId());
        assertEquals(SyncRunStatus.IN_PROGRESS, active.getStatus());
        assertEquals("conn123", active.getActiveClaimKey());
        verify(syncRunRepository, times(1)).saveAndFlush(any());
    }

    @Test
    void claim_WithAbandonedRun_ShouldFailItThenClaim() {
        // Given
        SyncRun abandoned = inProgressRun("run-old", NOW.minus(Duration.ofMinutes(45)));
        when(syncRunRepository.findByActiveClaimKey("conn123")).thenReturn(Optional.of(abandoned));
        when(syncRunRepository.saveAndFlush(any(SyncRun.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        SyncRun run = syncClaimService.claim(testConnection, SyncType.MANUAL);

        // Then
        assertEquals(SyncRunStatus.FAILED, abandoned.getStatus());
        assertEquals(SyncErrorCode.ABANDONED, abandoned.getFailureReason());
        assertNull(abandoned.getActiveClaimKey());
        assertEquals(NOW, abandoned.getCompletedAt());
        assertEquals(SyncRunStatus.IN_PROGRESS, run.getStatus());

        ArgumentCaptor<SyncRun> captor = ArgumentCaptor.forClass(SyncRun.class);
        verify(syncRunRepository, times(2)).saveAndFlush(captor.capture());
        assertSame(abandoned, captor.getAllValues().get(0));
    }

    @Test
    void complete_ShouldReleaseClaimAndApplyAggregates() {
        // Given
        SyncRun run = inProgressRun("run-1", NOW.minusSeconds(30));
        when(syncRunRepository.saveAndFlush(run)).thenReturn(run);
        SyncAggregates aggregates = new SyncAggregates(50);
        aggregates.messageProcessed();
        aggregates.messageProcessed();
        aggregates.recordOutcome(new ResolutionOutcome(true, true, true));
        aggregates.recordError("m2", SyncErrorCode.UNPARSEABLE_SENDER, "No valid sender");

        // When
        SyncRun completed = syncClaimService.complete(run, aggregates);

        // Then
        assertEquals(SyncRunStatus.COMPLETED, completed.getStatus());
        assertNull(completed.getActiveClaimKey());
        assertNull(completed.getFailureReason());
        assertEquals(NOW, completed.getCompletedAt());
        assertEquals(2, completed.getEmailsProcessed());
        assertEquals(1, completed.getCompaniesCreated());
        assertEquals(1, completed.getContactsCreated());
        assertEquals(1, completed.getInteractionsCreated());
        assertEquals(1, completed.getErrorCount());
        assertEquals("m2", completed.getErrors().get(0).getMessageRef());
    }

    @Test
    void complete_OnTerminalRun_ShouldNotWriteAgain() {
        // Given
        SyncRun run = inProgressRun("run-1", NOW.minusSeconds(30));
        run.setStatus(SyncRunStatus.FAILED);

        // When
        SyncRun result = syncClaimService.complete(run, new SyncAggregates(50));

        // Then
        assertEquals(SyncRunStatus.FAILED, result.getStatus());
        verifyNoInteractions(syncRunRepository);
    }

    @Test
    void fail_WhenFinalizedConcurrently_ShouldReturnStoredState() {
        // Given
        SyncRun run = inProgressRun("run-1", NOW.minusSeconds(30));
        SyncRun stored = inProgressRun("run-1", NOW.minusSeconds(30));
        stored.setStatus(SyncRunStatus.FAILED);
        stored.setFailureReason(SyncErrorCode.ABANDONED);
        when(syncRunRepository.saveAndFlush(run)).thenThrow(new ObjectOptimisticLockingFailureException(SyncRun.class, "run-1"));
        when(syncRunRepository.findById("run-1")).thenReturn(Optional.of(stored));

        // When
        SyncRun result = syncClaimService.fail(run, SyncErrorCode.AUTH_EXPIRED, "revoked", null);

        // Then
        assertSame(stored, result);
        assertEquals(SyncErrorCode.ABANDONED, result.getFailureReason());
    }

    @Test
    void fail_WithLongMessage_ShouldTruncate() {
        // Given
        SyncRun run = inProgressRun("run-1", NOW.minusSeconds(30));
        when(syncRunRepository.saveAndFlush(run)).thenReturn(run);

        // When
        SyncRun failed = syncClaimService.fail(run, SyncErrorCode.INTERNAL_ERROR, "x".repeat(5000), null);

        // Then
        assertEquals(2000, failed.getFailureMessage().length());
        assertEquals(SyncErrorCode.INTERNAL_ERROR, failed.getFailureReason());
    }

    private SyncRun inProgressRun(String id, Instant startedAt) {
        SyncRun run = new SyncRun();
        run.setId(id);
        run.setConnectionId("conn123");
        run.setUserId("user123");
        run.setActiveClaimKey("conn123");
        run.setStatus(SyncRunStatus.IN_PROGRESS);
        run.setStartedAt(startedAt);
        return run;
    }
}
