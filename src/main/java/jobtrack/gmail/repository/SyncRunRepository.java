package jobtrack.gmail.repository;

import jobtrack.gmail.entity.SyncRun;
import jobtrack.gmail.entity.SyncRunStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SyncRunRepository extends JpaRepository<SyncRun, String> {
    Optional<SyncRun> findByActiveClaimKey(String activeClaimKey);
    boolean existsByConnectionIdAndStatus(String connectionId, SyncRunStatus status);
    List<SyncRun> findByConnectionIdAndUserIdOrderByStartedAtDesc(String connectionId, String userId, Pageable pageable);
    Optional<SyncRun> findFirstByConnectionIdOrderByStartedAtDesc(String connectionId);
}
