package jobtrack.gmail.repository;

import jobtrack.gmail.entity.Contact;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ContactRepository extends JpaRepository<Contact, String> {
    Optional<Contact> findByUserIdAndEmail(String userId, String email);
}
