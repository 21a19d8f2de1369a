package io.leadline.pipeline.contact;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Entity
@Table(name = "contact_methods")
public class ContactMethod {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "prospect_id", nullable = false)
  private UUID prospectId;

  @Enumerated(EnumType.STRING)
  @Column(name = "method_type", nullable = false, length = 10)
  private ContactMethodType type;

  @Column(name = "method_value", nullable = false, length = 255)
  private String value;

  @Column(name = "normalized_value", nullable = false, length = 255)
  private String normalizedValue;

  @Column(name = "label", length = 20)
  private String label;

  @Column(name = "is_primary", nullable = false)
  private boolean primary;

  @Column(name = "is_verified", nullable = false)
  private boolean verified;

  @Column(name = "verified_date")
  private LocalDate verifiedDate;

  @Column(name = "confidence_score", nullable = false)
  private int confidenceScore;

  @Column(name = "is_suspect", nullable = false)
  private boolean suspect;

  @Column(name = "source", length = 200)
  private String source;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected ContactMethod() {}

  public ContactMethod(
      UUID prospectId, ContactMethodType type, String value, boolean primary, String source) {
    this.prospectId = prospectId;
    this.type = type;
    this.value = value.strip();
    this.normalizedValue = ContactValues.normalize(type, value);
    this.primary = primary;
    this.source = source;
    this.createdAt = Instant.now();
  }

  /** Marks the value as possibly wrong. Suspect values are kept, never deleted. */
  public void flagSuspect() {
    this.suspect = true;
    this.verified = false;
  }

  /** Clears the suspect flag and records a verification. */
  public void reactivate(LocalDate verifiedOn) {
    this.suspect = false;
    this.verified = true;
    this.verifiedDate = verifiedOn;
  }

  public UUID getId() {
    return id;
  }

  public UUID getProspectId() {
    return prospectId;
  }

  public ContactMethodType getType() {
    return type;
  }

  public String getValue() {
    return value;
  }

  public String getNormalizedValue() {
    return normalizedValue;
  }

  public String getLabel() {
    return label;
  }

  public boolean isPrimary() {
    return primary;
  }

  public boolean isVerified() {
    return verified;
  }

  public LocalDate getVerifiedDate() {
    return verifiedDate;
  }

  public int getConfidenceScore() {
    return confidenceScore;
  }

  public boolean isSuspect() {
    return suspect;
  }

  public String getSource() {
    return source;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
