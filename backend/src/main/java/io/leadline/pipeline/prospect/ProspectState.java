package io.leadline.pipeline.prospect;

import java.time.Instant;
import java.time.YearMonth;

/**
 * The scheduling-relevant slice of a prospect. Transitions build a candidate state, validate it,
 * and only then apply it to the entity, so an invalid candidate never reaches storage.
 */
public record ProspectState(
    Population population,
    EngagementStage engagementStage,
    Instant followUpDate,
    YearMonth parkedMonth) {

  public ProspectState withPopulation(Population population) {
    return new ProspectState(population, engagementStage, followUpDate, parkedMonth);
  }

  public ProspectState withEngagementStage(EngagementStage engagementStage) {
    return new ProspectState(population, engagementStage, followUpDate, parkedMonth);
  }

  public ProspectState withFollowUpDate(Instant followUpDate) {
    return new ProspectState(population, engagementStage, followUpDate, parkedMonth);
  }

  public ProspectState withParkedMonth(YearMonth parkedMonth) {
    return new ProspectState(population, engagementStage, followUpDate, parkedMonth);
  }
}
