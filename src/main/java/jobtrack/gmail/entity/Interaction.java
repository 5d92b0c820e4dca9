package jobtrack.gmail.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * A touchpoint with a contact. Interactions created from Gmail carry the message id, and
 * {@code (contact_id, gmail_message_id)} is unique so re-syncing a window never duplicates them.
 */
@Entity
@Table(name = "interactions",
        uniqueConstraints = @UniqueConstraint(name = "uk_interaction_contact_message",
                columnNames = {"contact_id", "gmail_message_id"}))
@Data
public class Interaction {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "contact_id", nullable = false)
    private String contactId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private InteractionType type;

    @Column(nullable = false)
    private Instant occurredAt;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "gmail_message_id")
    private String gmailMessageId;

    private String gmailThreadId;

    @Column(length = 1000)
    private String emailSubject;

    @Column(length = 1000)
    private String emailSnippet;

    @Enumerated(EnumType.STRING)
    private EmailDirection direction;

    private boolean gmailSynced;
}
