package jobtrack.gmail.repository;

import jobtrack.gmail.entity.GmailConnection;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Sync and token refresh write single columns through the update queries below, never the whole row:
 * a connection deleted or reconnected meanwhile must not be re-created or overwritten.
 * Each returns the number of rows changed, 0 when the connection is gone.
 */
@Repository
public interface GmailConnectionRepository extends JpaRepository<GmailConnection, String> {
    Optional<GmailConnection> findByIdAndUserId(String id, String userId);
    Optional<GmailConnection> findByIdAndUserIdAndActiveTrue(String id, String userId);
    Optional<GmailConnection> findByUserIdAndEmailAddress(String userId, String emailAddress);
    List<GmailConnection> findByUserIdAndActiveTrueOrderByCreatedAtDesc(String userId);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update GmailConnection c set c.lastSyncAt = :syncedAt, c.updatedAt = :syncedAt, "
            + "c.version = c.version + 1 where c.id = :id")
    int updateLastSyncAt(@Param("id") String id, @Param("syncedAt") Instant syncedAt);

    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update GmailConnection c set c.active = false, c.updatedAt = :now, "
            + "c.version = c.version + 1 where c.id = :id")
    int deactivate(@Param("id") String id, @Param("now") Instant now);

    /**
     * Stores a refreshed token, only while the row still holds the refresh token it was obtained with.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update GmailConnection c set c.token.accessToken = :accessToken, c.token.refreshToken = :refreshToken, "
            + "c.token.expiry = :expiry, c.token.scope = :scope, c.updatedAt = :now, c.version = c.version + 1 "
            + "where c.id = :id and c.token.refreshToken = :usedRefreshToken")
    int updateToken(@Param("id") String id,
                    @Param("usedRefreshToken") String usedRefreshToken,
                    @Param("accessToken") String accessToken,
                    @Param("refreshToken") String refreshToken,
                    @Param("expiry") Instant expiry,
                    @Param("scope") String scope,
                    @Param("now") Instant now);
}
