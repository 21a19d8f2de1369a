package io.leadline.pipeline.intake;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.UUID;

/** One committed import batch and its counts. */
@Entity
@Table(name = "import_sources")
public class ImportSource {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "source_name", nullable = false, length = 200)
  private String sourceName;

  @Column(name = "filename", length = 500)
  private String filename;

  @Column(name = "total_records", nullable = false)
  private int totalRecords;

  @Column(name = "imported_records", nullable = false)
  private int importedRecords;

  @Column(name = "duplicate_records", nullable = false)
  private int duplicateRecords;

  @Column(name = "broken_records", nullable = false)
  private int brokenRecords;

  @Column(name = "dnc_blocked_records", nullable = false)
  private int dncBlockedRecords;

  @Column(name = "skipped_records", nullable = false)
  private int skippedRecords;

  @Column(name = "failed_records", nullable = false)
  private int failedRecords;

  @Column(name = "import_date", nullable = false, updatable = false)
  private Instant importDate;

  protected ImportSource() {}

  public ImportSource(
      String sourceName,
      String filename,
      int totalRecords,
      int importedRecords,
      int duplicateRecords,
      int brokenRecords,
      int dncBlockedRecords,
      int skippedRecords,
      int failedRecords,
      Instant importDate) {
    this.sourceName = sourceName != null ? sourceName : "";
    this.filename = filename;
    this.totalRecords = totalRecords;
    this.importedRecords = importedRecords;
    this.duplicateRecords = duplicateRecords;
    this.brokenRecords = brokenRecords;
    this.dncBlockedRecords = dncBlockedRecords;
    this.skippedRecords = skippedRecords;
    this.failedRecords = failedRecords;
    this.importDate = importDate;
  }

  public UUID getId() {
    return id;
  }

  public String getSourceName() {
    return sourceName;
  }

  public String getFilename() {
    return filename;
  }

  public int getTotalRecords() {
    return totalRecords;
  }

  public int getImportedRecords() {
    return importedRecords;
  }

  public int getDuplicateRecords() {
    return duplicateRecords;
  }

  public int getBrokenRecords() {
    return brokenRecords;
  }

  public int getDncBlockedRecords() {
    return dncBlockedRecords;
  }

  public int getSkippedRecords() {
    return skippedRecords;
  }

  public int getFailedRecords() {
    return failedRecords;
  }

  public Instant getImportDate() {
    return importDate;
  }
}
