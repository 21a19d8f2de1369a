package io.leadline.pipeline.activity;

import io.leadline.pipeline.prospect.EngagementStage;
import io.leadline.pipeline.prospect.Population;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Builder that constructs an {@link Activity}.
 *
 * <p>Required fields: {@code prospectId}, {@code activityType}. {@code createdBy} defaults to
 * {@value #USER}.
 *
 * <pre>{@code
 * Activity activity = ActivityBuilder.builder()
 *     .prospectId(prospect.getId())
 *     .activityType(ActivityType.STATUS_CHANGE)
 *     .population(Population.UNENGAGED, Population.ENGAGED)
 *     .notes("Showed interest")
 *     .build();
 * }</pre>
 */
public class ActivityBuilder {

  public static final String USER = "user";
  public static final String SYSTEM = "system";

  private UUID prospectId;
  private ActivityType activityType;
  private ActivityOutcome outcome;
  private Population populationBefore;
  private Population populationAfter;
  private EngagementStage stageBefore;
  private EngagementStage stageAfter;
  private Instant followUpSet;
  private String notes;
  private String createdBy = USER;

  private ActivityBuilder() {}

  public static ActivityBuilder builder() {
    return new ActivityBuilder();
  }

  public ActivityBuilder prospectId(UUID prospectId) {
    this.prospectId = prospectId;
    return this;
  }

  public ActivityBuilder activityType(ActivityType activityType) {
    this.activityType = activityType;
    return this;
  }

  public ActivityBuilder outcome(ActivityOutcome outcome) {
    this.outcome = outcome;
    return this;
  }

  public ActivityBuilder population(Population before, Population after) {
    this.populationBefore = before;
    this.populationAfter = after;
    return this;
  }

  public ActivityBuilder stage(EngagementStage before, EngagementStage after) {
    this.stageBefore = before;
    this.stageAfter = after;
    return this;
  }

  public ActivityBuilder followUpSet(Instant followUpSet) {
    this.followUpSet = followUpSet;
    return this;
  }

  public ActivityBuilder notes(String notes) {
    this.notes = notes;
    return this;
  }

  public ActivityBuilder createdBy(String createdBy) {
    this.createdBy = createdBy;
    return this;
  }

  public Activity build() {
    Objects.requireNonNull(prospectId, "prospectId is required");
    Objects.requireNonNull(activityType, "activityType is required");
    return new Activity(
        prospectId,
        activityType,
        outcome,
        populationBefore,
        populationAfter,
        stageBefore,
        stageAfter,
        followUpSet,
        notes,
        createdBy != null ? createdBy : USER);
  }
}
