package io.leadline.pipeline.company;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "companies")
public class Company {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "name_normalized", nullable = false, length = 255)
  private String nameNormalized;

  @Column(name = "domain", length = 255)
  private String domain;

  @Column(name = "state", length = 2)
  private String state;

  @Column(name = "timezone", nullable = false, length = 20)
  private String timezone;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Company() {}

  public Company(String name, String domain, String state) {
    this.name = name;
    this.nameNormalized = CompanyNames.normalize(name);
    this.domain = domain;
    this.state = StateTimezones.normalizeState(state);
    this.timezone = StateTimezones.forState(state);
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getNameNormalized() {
    return nameNormalized;
  }

  public String getDomain() {
    return domain;
  }

  public String getState() {
    return state;
  }

  public String getTimezone() {
    return timezone;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
