package jobtrack.gmail.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One authorized mailbox of a user. Reconnecting the same address updates this row in place.
 */
@Entity
@Table(name = "gmail_connections",
        uniqueConstraints = @UniqueConstraint(name = "uk_gmail_connection_user_address",
                columnNames = {"user_id", "email_address"}))
@Getter
@Setter
@ToString(exclude = "token")
@EqualsAndHashCode(of = "id")
public class GmailConnection {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Version
    private Long version;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "email_address", nullable = false)
    private String emailAddress;

    @Embedded
    private OAuthToken token;

    private boolean active;

    private Instant lastSyncAt;

    private Instant createdAt;

    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
