package jobtrack.gmail.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "contacts",
        uniqueConstraints = @UniqueConstraint(name = "uk_contact_user_email",
                columnNames = {"user_id", "email"}))
@Data
public class Contact {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    // null for contacts on public webmail domains
    @Column(name = "company_id")
    private String companyId;

    @Column(nullable = false)
    private String name;

    /** Always stored lower-cased. */
    @Column(nullable = false)
    private String email;

    private String role;

    @Enumerated(EnumType.STRING)
    private ContactStatus status;

    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
    }
}
