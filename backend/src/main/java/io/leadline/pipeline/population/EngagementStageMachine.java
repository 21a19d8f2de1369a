package io.leadline.pipeline.population;

import io.leadline.pipeline.activity.ActivityBuilder;
import io.leadline.pipeline.activity.ActivityService;
import io.leadline.pipeline.activity.ActivityType;
import io.leadline.pipeline.exception.InvalidTransitionException;
import io.leadline.pipeline.prospect.EngagementStage;
import io.leadline.pipeline.prospect.Population;
import io.leadline.pipeline.prospect.Prospect;
import io.leadline.pipeline.prospect.ProspectInvariantValidator;
import io.leadline.pipeline.prospect.ProspectService;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Moves an ENGAGED prospect one stage forward. */
@Service
public class EngagementStageMachine {

  private static final Logger log = LoggerFactory.getLogger(EngagementStageMachine.class);

  private final ProspectService prospectService;
  private final ProspectInvariantValidator invariantValidator;
  private final ActivityService activityService;

  public EngagementStageMachine(
      ProspectService prospectService,
      ProspectInvariantValidator invariantValidator,
      ActivityService activityService) {
    this.prospectService = prospectService;
    this.invariantValidator = invariantValidator;
    this.activityService = activityService;
  }

  public boolean canTransitionStage(EngagementStage from, EngagementStage to) {
    return from != null && from.canAdvanceTo(to);
  }

  @Transactional
  public Prospect transitionStage(
      UUID prospectId, EngagementStage target, String reason, String actor) {
    var prospect = prospectService.lockProspect(prospectId);
    invariantValidator.requireNotDnc(prospect, "stage transition to " + target);

    if (prospect.getPopulation() != Population.ENGAGED) {
      throw new InvalidTransitionException(
          "Invalid stage transition",
          "Prospect "
              + prospectId
              + " is "
              + prospect.getPopulation()
              + "; engagement stages apply only while ENGAGED");
    }
    EngagementStage from = prospect.getEngagementStage();
    if (!canTransitionStage(from, target)) {
      throw new InvalidTransitionException(
          "Invalid stage transition",
          "Cannot move prospect "
              + prospectId
              + " from stage "
              + from
              + " to "
              + target
              + "; stages advance one step at a time");
    }

    var candidate = prospect.state().withEngagementStage(target);
    invariantValidator.requireValid(prospectId, candidate);
    prospect.applyState(candidate);
    prospect = prospectService.save(prospect);

    activityService.append(
        ActivityBuilder.builder()
            .prospectId(prospectId)
            .activityType(ActivityType.STATUS_CHANGE)
            .population(Population.ENGAGED, Population.ENGAGED)
            .stage(from, target)
            .notes(
                reason != null && !reason.isBlank() ? reason : "Stage: " + from + " -> " + target)
            .createdBy(actor)
            .build());

    log.info("Prospect {} advanced from stage {} to {}", prospectId, from, target);
    return prospect;
  }
}
