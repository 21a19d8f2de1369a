package io.leadline.pipeline.company;

import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CompanyRepository extends JpaRepository<Company, UUID> {

  Optional<Company> findFirstByNameNormalizedOrderByCreatedAtAsc(String nameNormalized);
}
