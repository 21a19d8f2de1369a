package io.leadline.pipeline.population;

import io.leadline.pipeline.prospect.EngagementStage;
import io.leadline.pipeline.prospect.LostReason;
import io.leadline.pipeline.prospect.Population;
import java.time.Instant;
import java.time.YearMonth;
import java.util.Objects;

/**
 * A requested population change and the data the target population needs.
 *
 * @param target the population to move to
 * @param reason free-text reason recorded on the activity
 * @param followUpDate required when entering ENGAGED; optional override when entering a
 *     system-paced population
 * @param parkedMonth required when entering PARKED
 * @param stage initial engagement stage; defaults to PRE_DEMO when entering ENGAGED
 * @param lostReason optional classification when entering LOST
 * @param actor who requested the change; defaults to "user"
 */
public record TransitionCommand(
    Population target,
    String reason,
    Instant followUpDate,
    YearMonth parkedMonth,
    EngagementStage stage,
    LostReason lostReason,
    String actor) {

  public TransitionCommand {
    Objects.requireNonNull(target, "target is required");
  }

  public static TransitionCommand to(Population target, String reason) {
    return new TransitionCommand(target, reason, null, null, null, null, null);
  }

  public static TransitionCommand engage(Instant followUpDate, String reason) {
    return new TransitionCommand(
        Population.ENGAGED, reason, followUpDate, null, null, null, null);
  }

  public static TransitionCommand park(YearMonth parkedMonth, String reason) {
    return new TransitionCommand(Population.PARKED, reason, null, parkedMonth, null, null, null);
  }

  public static TransitionCommand lose(LostReason lostReason, String reason) {
    return new TransitionCommand(Population.LOST, reason, null, null, null, lostReason, null);
  }

  public TransitionCommand byActor(String actor) {
    return new TransitionCommand(
        target, reason, followUpDate, parkedMonth, stage, lostReason, actor);
  }
}
