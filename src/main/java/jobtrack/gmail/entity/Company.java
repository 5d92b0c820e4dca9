package jobtrack.gmail.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * Company owned by a user. {@code dedupKey} is the normalized domain, or the normalized name
 * for companies entered without one.
 */
@Entity
@Table(name = "companies",
        uniqueConstraints = @UniqueConstraint(name = "uk_company_user_dedup_key",
                columnNames = {"user_id", "dedup_key"}))
@Data
public class Company {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(nullable = false)
    private String name;

    private String domain;

    private String website;

    @Column(name = "dedup_key", nullable = false)
    private String dedupKey;

    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }
}
