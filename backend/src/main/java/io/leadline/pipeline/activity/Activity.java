package io.leadline.pipeline.activity;

import io.leadline.pipeline.prospect.EngagementStage;
import io.leadline.pipeline.prospect.Population;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;
import org.hibernate.annotations.Immutable;

/**
 * Append-only audit event on a prospect. Rows are never updated or deleted; the activity log is the
 * only historical record of population and stage changes.
 */
@Entity
@Immutable
@Table(name = "activities")
public class Activity {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "prospect_id", nullable = false, updatable = false)
  private UUID prospectId;

  @Enumerated(EnumType.STRING)
  @Column(name = "activity_type", nullable = false, updatable = false, length = 20)
  private ActivityType activityType;

  @Enumerated(EnumType.STRING)
  @Column(name = "outcome", updatable = false, length = 20)
  private ActivityOutcome outcome;

  @Column(name = "population_before", updatable = false, length = 20)
  private Population populationBefore;

  @Column(name = "population_after", updatable = false, length = 20)
  private Population populationAfter;

  @Column(name = "stage_before", updatable = false, length = 20)
  private EngagementStage stageBefore;

  @Column(name = "stage_after", updatable = false, length = 20)
  private EngagementStage stageAfter;

  @Column(name = "follow_up_set", updatable = false)
  private Instant followUpSet;

  @Column(name = "notes", updatable = false, columnDefinition = "TEXT")
  private String notes;

  @Column(name = "created_by", nullable = false, updatable = false, length = 50)
  private String createdBy;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Activity() {}

  Activity(
      UUID prospectId,
      ActivityType activityType,
      ActivityOutcome outcome,
      Population populationBefore,
      Population populationAfter,
      EngagementStage stageBefore,
      EngagementStage stageAfter,
      Instant followUpSet,
      String notes,
      String createdBy) {
    this.prospectId = prospectId;
    this.activityType = activityType;
    this.outcome = outcome;
    this.populationBefore = populationBefore;
    this.populationAfter = populationAfter;
    this.stageBefore = stageBefore;
    this.stageAfter = stageAfter;
    this.followUpSet = followUpSet;
    this.notes = notes;
    this.createdBy = createdBy;
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public UUID getProspectId() {
    return prospectId;
  }

  public ActivityType getActivityType() {
    return activityType;
  }

  public ActivityOutcome getOutcome() {
    return outcome;
  }

  public Population getPopulationBefore() {
    return populationBefore;
  }

  public Population getPopulationAfter() {
    return populationAfter;
  }

  public EngagementStage getStageBefore() {
    return stageBefore;
  }

  public EngagementStage getStageAfter() {
    return stageAfter;
  }

  public Instant getFollowUpSet() {
    return followUpSet;
  }

  public String getNotes() {
    return notes;
  }

  public String getCreatedBy() {
    return createdBy;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
