package io.leadline.pipeline.activity;

import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ActivityRepository extends JpaRepository<Activity, UUID> {

  Page<Activity> findByProspectIdOrderByCreatedAtDesc(UUID prospectId, Pageable pageable);

  List<Activity> findByProspectIdOrderByCreatedAtAsc(UUID prospectId);

  long countByProspectIdAndActivityType(UUID prospectId, ActivityType activityType);
}
