package io.leadline.pipeline.activity;

import io.leadline.pipeline.exception.ResourceNotFoundException;
import io.leadline.pipeline.prospect.ProspectRepository;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/** Appends to and reads from the per-prospect activity log. */
@Service
public class ActivityService {

  private final ActivityRepository activityRepository;
  private final ProspectRepository prospectRepository;

  public ActivityService(
      ActivityRepository activityRepository, ProspectRepository prospectRepository) {
    this.activityRepository = activityRepository;
    this.prospectRepository = prospectRepository;
  }

  /** Appends an activity in the caller's transaction, next to the state change it records. */
  @Transactional(propagation = Propagation.MANDATORY)
  public Activity append(Activity activity) {
    return activityRepository.save(activity);
  }

  @Transactional(readOnly = true)
  public Page<Activity> getHistory(UUID prospectId, Pageable pageable) {
    if (!prospectRepository.existsById(prospectId)) {
      throw new ResourceNotFoundException("Prospect", prospectId);
    }
    return activityRepository.findByProspectIdOrderByCreatedAtDesc(prospectId, pageable);
  }
}
