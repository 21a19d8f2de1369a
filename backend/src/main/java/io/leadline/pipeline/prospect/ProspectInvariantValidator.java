package io.leadline.pipeline.prospect;

import io.leadline.pipeline.exception.DncViolationException;
import io.leadline.pipeline.exception.ProspectValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Stateless checks of the structural prospect invariants. Shared by the population state machine,
 * the cadence engine and the intake funnel so every writer enforces the same rules.
 *
 * <ul>
 *   <li>DEAD_DNC is terminal: nothing may transition, merge into or reschedule it
 *   <li>ENGAGED requires a follow-up date (no orphan engaged)
 *   <li>PARKED requires a parked month
 *   <li>an engagement stage exists exactly while ENGAGED
 * </ul>
 */
@Service
public class ProspectInvariantValidator {

  private static final Logger log = LoggerFactory.getLogger(ProspectInvariantValidator.class);

  /**
   * Rejects any write to a Do-Not-Contact prospect. Logged at error level because reaching this
   * point means a caller tried to act on a compliance-protected record.
   *
   * @throws DncViolationException if the prospect is DEAD_DNC
   */
  public void requireNotDnc(Prospect prospect, String attemptedAction) {
    if (prospect.getPopulation() == Population.DEAD_DNC) {
      log.error(
          "DNC violation: {} attempted on Do-Not-Contact prospect {}",
          attemptedAction,
          prospect.getId());
      throw new DncViolationException(prospect.getId(), attemptedAction);
    }
  }

  /**
   * Validates a candidate state before it is applied.
   *
   * @throws ProspectValidationException listing every violated invariant
   */
  public void requireValid(UUID prospectId, ProspectState candidate) {
    var violations = violations(candidate);
    if (!violations.isEmpty()) {
      throw new ProspectValidationException(
          "Invalid prospect state",
          "Prospect " + prospectId + ": " + String.join("; ", violations));
    }
  }

  /** Returns a description of every invariant the state violates; empty when valid. */
  public List<String> violations(ProspectState state) {
    var violations = new ArrayList<String>();
    Population population = state.population();
    if (population == null) {
      violations.add("population is required");
      return violations;
    }
    if (population == Population.ENGAGED) {
      if (state.followUpDate() == null) {
        violations.add("orphan engaged: an ENGAGED prospect requires a follow-up date");
      }
      if (state.engagementStage() == null) {
        violations.add("an ENGAGED prospect requires an engagement stage");
      }
    } else if (state.engagementStage() != null) {
      violations.add(
          "engagement stage "
              + state.engagementStage()
              + " is only valid while ENGAGED, not "
              + population);
    }
    if (population == Population.PARKED && state.parkedMonth() == null) {
      violations.add("parked without month: a PARKED prospect requires a parked month");
    }
    if (population == Population.DEAD_DNC
        && (state.followUpDate() != null || state.parkedMonth() != null)) {
      violations.add("a DEAD_DNC prospect carries no follow-up date or parked month");
    }
    return violations;
  }
}
