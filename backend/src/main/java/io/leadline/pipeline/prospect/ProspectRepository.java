package io.leadline.pipeline.prospect;

import jakarta.persistence.LockModeType;
import jakarta.persistence.QueryHint;
import java.time.Instant;
import java.time.YearMonth;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.jpa.repository.QueryHints;
import org.springframework.data.repository.query.Param;

public interface ProspectRepository extends JpaRepository<Prospect, UUID> {

  /** Loads a prospect with a row lock held until the surrounding transaction ends. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @QueryHints(@QueryHint(name = "jakarta.persistence.lock.timeout", value = "5000"))
  @Query("SELECT p FROM Prospect p WHERE p.id = :id")
  Optional<Prospect> findByIdForUpdate(@Param("id") UUID id);

  List<Prospect> findByCompanyIdOrderByCreatedAtAsc(UUID companyId, Pageable pageable);

  List<Prospect> findByPopulation(Population population);

  @Query(
      "SELECT p FROM Prospect p WHERE p.followUpDate IS NOT NULL AND p.followUpDate < :asOf"
          + " AND p.population NOT IN :excluded ORDER BY p.followUpDate ASC")
  List<Prospect> findOverdue(
      @Param("asOf") Instant asOf, @Param("excluded") Collection<Population> excluded);

  @Query(
      "SELECT p FROM Prospect p WHERE p.followUpDate >= :from AND p.followUpDate < :to"
          + " AND p.population NOT IN :excluded ORDER BY p.followUpDate ASC")
  List<Prospect> findFollowUpsBetween(
      @Param("from") Instant from,
      @Param("to") Instant to,
      @Param("excluded") Collection<Population> excluded);

  @Query(
      "SELECT p FROM Prospect p WHERE p.population = :population AND p.followUpDate IS NULL"
          + " ORDER BY p.updatedAt ASC")
  List<Prospect> findByPopulationWithoutFollowUp(@Param("population") Population population);

  @Query(
      "SELECT p.id FROM Prospect p WHERE p.population = :population AND p.parkedMonth <= :month"
          + " ORDER BY p.parkedMonth ASC")
  List<UUID> findIdsByPopulationAndParkedMonthUpTo(
      @Param("population") Population population, @Param("month") YearMonth month);
}
