package io.leadline.pipeline.cadence;

import io.leadline.pipeline.activity.ActivityBuilder;
import io.leadline.pipeline.activity.ActivityOutcome;
import io.leadline.pipeline.activity.ActivityService;
import io.leadline.pipeline.activity.ActivityType;
import io.leadline.pipeline.exception.ProspectValidationException;
import io.leadline.pipeline.prospect.Population;
import io.leadline.pipeline.prospect.Prospect;
import io.leadline.pipeline.prospect.ProspectInvariantValidator;
import io.leadline.pipeline.prospect.ProspectRepository;
import io.leadline.pipeline.prospect.ProspectService;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Decides when a prospect must next be touched.
 *
 * <p>Two disjoint modes, selected by {@link CadenceMode#forPopulation}: system-paced populations
 * are scheduled from the configured interval table, prospect-paced (ENGAGED) follow-ups are
 * explicit dates that the engine stores but never recomputes.
 */
@Service
public class CadenceEngine {

  private static final Logger log = LoggerFactory.getLogger(CadenceEngine.class);

  /**
   * Populations that never appear on a follow-up list: the terminal ones. LOST is not terminal, so
   * an explicit win-back follow-up on a lost prospect is listed when due.
   */
  static final Set<Population> NO_FOLLOW_UP =
      EnumSet.of(Population.DEAD_DNC, Population.CLOSED_WON, Population.PARTNERSHIP);

  private final CadenceProperties cadenceProperties;
  private final ProspectRepository prospectRepository;
  private final ProspectService prospectService;
  private final ProspectInvariantValidator invariantValidator;
  private final ActivityService activityService;
  private final Clock clock;

  public CadenceEngine(
      CadenceProperties cadenceProperties,
      ProspectRepository prospectRepository,
      ProspectService prospectService,
      ProspectInvariantValidator invariantValidator,
      ActivityService activityService,
      Clock clock) {
    this.cadenceProperties = cadenceProperties;
    this.prospectRepository = prospectRepository;
    this.prospectService = prospectService;
    this.invariantValidator = invariantValidator;
    this.activityService = activityService;
    this.clock = clock;
  }

  /**
   * Computes the next system-paced contact date. With no prior attempt the first interval is
   * counted from today; otherwise the interval for {@code attemptCount} is counted from the last
   * attempt. Only business days are counted and the minimum of the interval is used.
   */
  public LocalDate calculateNextContact(int attemptCount, LocalDate lastAttemptDate) {
    if (attemptCount < 0) {
      throw new IllegalArgumentException("attemptCount must be >= 0, got " + attemptCount);
    }
    if (attemptCount == 0 || lastAttemptDate == null) {
      return BusinessDays.add(today(), cadenceProperties.firstInterval().minDays());
    }
    return BusinessDays.add(
        lastAttemptDate, cadenceProperties.intervalFor(attemptCount).minDays());
  }

  /** Suggested channel for the given attempt number. */
  public ContactChannel channelFor(int attemptNumber) {
    return cadenceProperties.intervalFor(attemptNumber).channel();
  }

  /** Follow-up for a prospect entering a system-paced population: a fresh start from today. */
  public Instant initialSystemFollowUp() {
    return startOfDay(calculateNextContact(0, null));
  }

  public Instant startOfDay(LocalDate date) {
    return date.atStartOfDay(clock.getZone()).toInstant();
  }

  /**
   * Stores an explicit follow-up date and records it in the activity log. This is the only way an
   * ENGAGED prospect gets a follow-up after its transition into ENGAGED.
   *
   * @throws ProspectValidationException if {@code when} is null
   */
  @Transactional
  public Prospect setFollowUp(UUID prospectId, Instant when, String reason, String actor) {
    if (when == null) {
      throw new ProspectValidationException(
          "Follow-up date required",
          "A follow-up date is required to schedule prospect " + prospectId);
    }
    var prospect = prospectService.lockProspect(prospectId);
    invariantValidator.requireNotDnc(prospect, "follow-up scheduling");
    var candidate = prospect.state().withFollowUpDate(when);
    invariantValidator.requireValid(prospectId, candidate);

    prospect.applyState(candidate);
    prospect = prospectService.save(prospect);

    activityService.append(
        ActivityBuilder.builder()
            .prospectId(prospectId)
            .activityType(ActivityType.REMINDER)
            .followUpSet(when)
            .notes(reason != null && !reason.isBlank() ? reason : "Follow-up set for " + when)
            .createdBy(actor)
            .build());

    log.info("Follow-up for prospect {} set to {}", prospectId, when);
    return prospect;
  }

  /**
   * Records an outreach attempt. System-paced prospects get their next follow-up computed from
   * the new attempt count; a prospect-paced follow-up is left untouched.
   */
  @Transactional
  public Prospect recordAttempt(
      UUID prospectId,
      ActivityType activityType,
      ActivityOutcome outcome,
      String notes,
      String actor) {
    if (activityType == null || !activityType.isAttempt()) {
      throw new ProspectValidationException(
          "Invalid attempt type",
          "Activity type " + activityType + " is not an outreach attempt (CALL, VOICEMAIL,"
              + " EMAIL_SENT)");
    }
    var prospect = prospectService.lockProspect(prospectId);
    invariantValidator.requireNotDnc(prospect, "contact attempt");

    LocalDate today = today();
    prospect.recordAttempt(today);
    Instant followUp = null;
    if (CadenceMode.forPopulation(prospect.getPopulation()) == CadenceMode.SYSTEM_PACED) {
      followUp = startOfDay(calculateNextContact(prospect.getAttemptCount(), today));
      prospect.setFollowUpDate(followUp);
    }
    invariantValidator.requireValid(prospectId, prospect.state());
    prospect = prospectService.save(prospect);

    activityService.append(
        ActivityBuilder.builder()
            .prospectId(prospectId)
            .activityType(activityType)
            .outcome(outcome)
            .followUpSet(followUp)
            .notes(notes)
            .createdBy(actor)
            .build());

    log.info(
        "Attempt {} ({}) recorded for prospect {}, next follow-up {}",
        prospect.getAttemptCount(),
        activityType,
        prospectId,
        prospect.getFollowUpDate());
    return prospect;
  }

  /** Prospects with a follow-up strictly before {@code asOf}, most overdue first. */
  @Transactional(readOnly = true)
  public List<Prospect> getOverdue(Instant asOf) {
    return prospectRepository.findOverdue(asOf, NO_FOLLOW_UP);
  }

  @Transactional(readOnly = true)
  public List<Prospect> getOverdue() {
    return getOverdue(startOfDay(today()));
  }

  /** Prospects whose follow-up falls on the given calendar day in the configured zone. */
  @Transactional(readOnly = true)
  public List<Prospect> getTodaysFollowUps(LocalDate date) {
    return prospectRepository.findFollowUpsBetween(
        startOfDay(date), startOfDay(date.plusDays(1)), NO_FOLLOW_UP);
  }

  /**
   * ENGAGED prospects without a follow-up. Should always be empty; anything returned was written
   * around the state machine and needs attention.
   */
  @Transactional(readOnly = true)
  public List<Prospect> getOrphanedEngaged() {
    var orphans = prospectRepository.findByPopulationWithoutFollowUp(Population.ENGAGED);
    if (!orphans.isEmpty()) {
      log.warn(
          "Found {} orphaned engaged prospects: {}",
          orphans.size(),
          orphans.stream().map(Prospect::getId).toList());
    }
    return orphans;
  }

  private LocalDate today() {
    return LocalDate.now(clock);
  }
}
