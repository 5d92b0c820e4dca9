package jobtrack.gmail.repository;

import jobtrack.gmail.entity.Interaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface InteractionRepository extends JpaRepository<Interaction, String> {
    boolean existsByContactIdAndGmailMessageId(String contactId, String gmailMessageId);
    List<Interaction> findByContactIdOrderByOccurredAtDesc(String contactId);
}
