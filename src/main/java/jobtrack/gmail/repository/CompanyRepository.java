package jobtrack.gmail.repository;

import jobtrack.gmail.entity.Company;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CompanyRepository extends JpaRepository<Company, String> {
    Optional<Company> findByUserIdAndDedupKey(String userId, String dedupKey);
}
