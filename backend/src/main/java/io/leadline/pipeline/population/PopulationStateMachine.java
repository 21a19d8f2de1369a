package io.leadline.pipeline.population;

import io.leadline.pipeline.activity.ActivityBuilder;
import io.leadline.pipeline.activity.ActivityService;
import io.leadline.pipeline.activity.ActivityType;
import io.leadline.pipeline.cadence.CadenceEngine;
import io.leadline.pipeline.exception.InvalidTransitionException;
import io.leadline.pipeline.prospect.EngagementStage;
import io.leadline.pipeline.prospect.Population;
import io.leadline.pipeline.prospect.Prospect;
import io.leadline.pipeline.prospect.ProspectInvariantValidator;
import io.leadline.pipeline.prospect.ProspectService;
import io.leadline.pipeline.prospect.ProspectState;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * The only writer of a prospect's population. Every change is validated against the transition
 * table and the structural invariants, applied under a row lock, and recorded as exactly one
 * activity in the same transaction.
 */
@Service
public class PopulationStateMachine {

  private static final Logger log = LoggerFactory.getLogger(PopulationStateMachine.class);

  private final ProspectService prospectService;
  private final ProspectInvariantValidator invariantValidator;
  private final ActivityService activityService;
  private final CadenceEngine cadenceEngine;
  private final Clock clock;

  public PopulationStateMachine(
      ProspectService prospectService,
      ProspectInvariantValidator invariantValidator,
      ActivityService activityService,
      CadenceEngine cadenceEngine,
      Clock clock) {
    this.prospectService = prospectService;
    this.invariantValidator = invariantValidator;
    this.activityService = activityService;
    this.cadenceEngine = cadenceEngine;
    this.clock = clock;
  }

  public boolean canTransition(Population from, Population to) {
    return from != null && to != null && from.canTransitionTo(to);
  }

  public List<Population> availableTransitions(Population from) {
    return from.availableTransitions();
  }

  @Transactional(readOnly = true)
  public List<Population> availableTransitions(UUID prospectId) {
    return availableTransitions(prospectService.getProspect(prospectId).getPopulation());
  }

  /**
   * Moves a prospect to another population.
   *
   * @throws io.leadline.pipeline.exception.DncViolationException if the prospect is DEAD_DNC
   * @throws InvalidTransitionException if the target is not reachable from the current population
   * @throws io.leadline.pipeline.exception.ProspectValidationException if the resulting state would
   *     violate an invariant, e.g. ENGAGED without a follow-up date
   */
  @Transactional
  public Prospect transition(UUID prospectId, TransitionCommand command) {
    var prospect = prospectService.lockProspect(prospectId);
    invariantValidator.requireNotDnc(prospect, "transition to " + command.target());

    Population from = prospect.getPopulation();
    Population target = command.target();
    if (!canTransition(from, target)) {
      throw new InvalidTransitionException(
          "Invalid population transition",
          "Cannot transition prospect "
              + prospectId
              + " from "
              + from
              + " to "
              + target
              + "; allowed targets: "
              + from.availableTransitions());
    }

    var candidate = candidateState(target, command);
    invariantValidator.requireValid(prospectId, candidate);

    EngagementStage stageBefore = prospect.getEngagementStage();
    prospect.applyState(candidate);
    LocalDate today = LocalDate.now(clock);
    if (target == Population.LOST) {
      prospect.markLost(command.lostReason(), today);
    } else if (target == Population.DEAD_DNC) {
      prospect.markDoNotContact(today);
    }
    prospect = prospectService.save(prospect);

    activityService.append(
        ActivityBuilder.builder()
            .prospectId(prospectId)
            .activityType(ActivityType.STATUS_CHANGE)
            .population(from, target)
            .stage(stageBefore, candidate.engagementStage())
            .followUpSet(candidate.followUpDate())
            .notes(
                command.reason() != null && !command.reason().isBlank()
                    ? command.reason()
                    : "Transition: " + from + " -> " + target)
            .createdBy(command.actor())
            .build());

    log.info("Prospect {} transitioned from {} to {}", prospectId, from, target);
    return prospect;
  }

  /**
   * Gives a newly created prospect its first population and records its provenance as an IMPORT
   * activity. Runs in the caller's transaction so the prospect and its activity commit together.
   */
  @Transactional(propagation = Propagation.MANDATORY)
  public Prospect admit(Prospect prospect, Population initial, String notes, String actor) {
    if (prospect.getPopulation() != null) {
      throw new InvalidTransitionException(
          "Prospect already admitted",
          "Prospect " + prospect.getId() + " is already " + prospect.getPopulation());
    }
    if (initial != Population.UNENGAGED && initial != Population.BROKEN) {
      throw new InvalidTransitionException(
          "Invalid initial population",
          "New prospects start as UNENGAGED or BROKEN, not " + initial);
    }
    var candidate =
        new ProspectState(initial, null, cadenceEngine.initialSystemFollowUp(), null);
    invariantValidator.requireValid(prospect.getId(), candidate);
    prospect.applyState(candidate);
    prospect = prospectService.save(prospect);

    activityService.append(
        ActivityBuilder.builder()
            .prospectId(prospect.getId())
            .activityType(ActivityType.IMPORT)
            .population(null, initial)
            .followUpSet(candidate.followUpDate())
            .notes(notes)
            .createdBy(actor)
            .build());

    log.info("Prospect {} admitted as {}", prospect.getId(), initial);
    return prospect;
  }

  private ProspectState candidateState(Population target, TransitionCommand command) {
    return switch (target) {
      case ENGAGED -> new ProspectState(
          target,
          command.stage() != null ? command.stage() : EngagementStage.PRE_DEMO,
          command.followUpDate(),
          null);
      case PARKED -> new ProspectState(target, null, null, command.parkedMonth());
      case UNENGAGED, BROKEN -> new ProspectState(
          target,
          null,
          command.followUpDate() != null
              ? command.followUpDate()
              : cadenceEngine.initialSystemFollowUp(),
          null);
      case LOST, CLOSED_WON, PARTNERSHIP, DEAD_DNC -> new ProspectState(target, null, null, null);
    };
  }
}
