package io.leadline.pipeline.contact;

import io.leadline.pipeline.prospect.Population;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ContactMethodRepository extends JpaRepository<ContactMethod, UUID> {

  List<ContactMethod> findByProspectIdOrderByPrimaryDescCreatedAtAsc(UUID prospectId);

  List<ContactMethod> findByTypeAndNormalizedValueOrderByCreatedAtAsc(
      ContactMethodType type, String normalizedValue);

  @Query(
      "SELECT DISTINCT cm.prospectId FROM ContactMethod cm, Prospect p"
          + " WHERE p.id = cm.prospectId AND p.population = :population"
          + " AND cm.type = :type AND cm.normalizedValue = :value")
  List<UUID> findProspectIdsByContactInPopulation(
      @Param("type") ContactMethodType type,
      @Param("value") String normalizedValue,
      @Param("population") Population population);
}
