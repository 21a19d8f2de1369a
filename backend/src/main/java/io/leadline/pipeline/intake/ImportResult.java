package io.leadline.pipeline.intake;

import io.leadline.pipeline.batch.BatchFailure;
import java.util.List;
import java.util.UUID;

/**
 * Counts of a committed import. {@code importedCount} includes the rows created as BROKEN, which
 * are also counted in {@code brokenCount}.
 */
public record ImportResult(
    int totalRecords,
    int importedCount,
    int mergedCount,
    int brokenCount,
    int skippedCount,
    int dncBlockedCount,
    UUID sourceId,
    List<BatchFailure<AnalysisResult>> failures) {

  public ImportResult {
    failures = List.copyOf(failures);
  }
}
