package io.leadline.pipeline.prospect;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.UUID;

@Entity
@Table(name = "prospects")
public class Prospect {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "company_id", nullable = false)
  private UUID companyId;

  @Column(name = "first_name", nullable = false, length = 100)
  private String firstName;

  @Column(name = "last_name", nullable = false, length = 100)
  private String lastName;

  @Column(name = "title", length = 200)
  private String title;

  @Column(name = "population", nullable = false, length = 20)
  private Population population;

  @Column(name = "engagement_stage", length = 20)
  private EngagementStage engagementStage;

  @Column(name = "follow_up_date")
  private Instant followUpDate;

  @Column(name = "last_contact_date")
  private LocalDate lastContactDate;

  @Column(name = "parked_month", length = 7)
  private YearMonth parkedMonth;

  @Column(name = "attempt_count", nullable = false)
  private int attemptCount;

  @Column(name = "source", length = 200)
  private String source;

  @Column(name = "notes", columnDefinition = "TEXT")
  private String notes;

  @Column(name = "referred_by_prospect_id")
  private UUID referredByProspectId;

  @Column(name = "dead_reason", length = 50)
  private String deadReason;

  @Column(name = "dead_date")
  private LocalDate deadDate;

  @Enumerated(EnumType.STRING)
  @Column(name = "lost_reason", length = 30)
  private LostReason lostReason;

  @Column(name = "lost_date")
  private LocalDate lostDate;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  @Version
  @Column(name = "version", nullable = false)
  private long version;

  protected Prospect() {}

  /**
   * Creates a prospect that has not yet been admitted into a population. Callers must admit it
   * through the population state machine before it is saved.
   */
  public Prospect(
      UUID companyId,
      String firstName,
      String lastName,
      String title,
      String source,
      String notes) {
    this.companyId = companyId;
    this.firstName = firstName != null ? firstName : "";
    this.lastName = lastName != null ? lastName : "";
    this.title = title;
    this.source = source;
    this.notes = notes;
    this.attemptCount = 0;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public String getFullName() {
    return (firstName + " " + lastName).trim();
  }

  public ProspectState state() {
    return new ProspectState(population, engagementStage, followUpDate, parkedMonth);
  }

  /**
   * Replaces the scheduling-relevant fields with an already validated candidate state. Population
   * and stage changes must go through the population state machine, which also writes the
   * matching activity.
   */
  public void applyState(ProspectState state) {
    this.population = state.population();
    this.engagementStage = state.engagementStage();
    this.followUpDate = state.followUpDate();
    this.parkedMonth = state.parkedMonth();
    this.updatedAt = Instant.now();
  }

  public void markDoNotContact(LocalDate date) {
    this.deadReason = "dnc";
    this.deadDate = date;
    this.updatedAt = Instant.now();
  }

  public void markLost(LostReason reason, LocalDate date) {
    this.lostReason = reason;
    this.lostDate = date;
    this.updatedAt = Instant.now();
  }

  public void recordAttempt(LocalDate contactDate) {
    this.attemptCount++;
    this.lastContactDate = contactDate;
    this.updatedAt = Instant.now();
  }

  /**
   * Fills profile fields that are currently blank. Existing values are never replaced, so a merge
   * can only add information.
   *
   * @return true if any field changed
   */
  public boolean fillBlankProfileFields(String title, String notes, String source) {
    boolean changed = false;
    if (isBlank(this.title) && !isBlank(title)) {
      this.title = title;
      changed = true;
    }
    if (isBlank(this.notes) && !isBlank(notes)) {
      this.notes = notes;
      changed = true;
    }
    if (isBlank(this.source) && !isBlank(source)) {
      this.source = source;
      changed = true;
    }
    if (changed) {
      this.updatedAt = Instant.now();
    }
    return changed;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  public UUID getId() {
    return id;
  }

  public UUID getCompanyId() {
    return companyId;
  }

  public String getFirstName() {
    return firstName;
  }

  public String getLastName() {
    return lastName;
  }

  public String getTitle() {
    return title;
  }

  public Population getPopulation() {
    return population;
  }

  public EngagementStage getEngagementStage() {
    return engagementStage;
  }

  public Instant getFollowUpDate() {
    return followUpDate;
  }

  public void setFollowUpDate(Instant followUpDate) {
    this.followUpDate = followUpDate;
    this.updatedAt = Instant.now();
  }

  public LocalDate getLastContactDate() {
    return lastContactDate;
  }

  public YearMonth getParkedMonth() {
    return parkedMonth;
  }

  public int getAttemptCount() {
    return attemptCount;
  }

  public String getSource() {
    return source;
  }

  public String getNotes() {
    return notes;
  }

  public UUID getReferredByProspectId() {
    return referredByProspectId;
  }

  public void setReferredByProspectId(UUID referredByProspectId) {
    this.referredByProspectId = referredByProspectId;
    this.updatedAt = Instant.now();
  }

  public String getDeadReason() {
    return deadReason;
  }

  public LocalDate getDeadDate() {
    return deadDate;
  }

  public LostReason getLostReason() {
    return lostReason;
  }

  public LocalDate getLostDate() {
    return lostDate;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public long getVersion() {
    return version;
  }
}
