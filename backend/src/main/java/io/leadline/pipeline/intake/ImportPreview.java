package io.leadline.pipeline.intake;

import java.util.List;

/**
 * Categorized result of {@link IntakeFunnel#analyze}. Nothing has been written when a preview
 * exists; a reviewer may edit classifications before handing it to {@link IntakeFunnel#commit}.
 */
public record ImportPreview(String sourceName, String filename, List<AnalysisResult> results) {

  public ImportPreview {
    results = results != null ? List.copyOf(results) : List.of();
  }

  public List<AnalysisResult> newRecords() {
    return withStatus(MatchStatus.NEW);
  }

  public List<AnalysisResult> mergeRecords() {
    return withStatus(MatchStatus.MERGE);
  }

  public List<AnalysisResult> needsReview() {
    return withStatus(MatchStatus.NEEDS_REVIEW);
  }

  public List<AnalysisResult> blockedDnc() {
    return withStatus(MatchStatus.BLOCKED_DNC);
  }

  public List<AnalysisResult> incomplete() {
    return withStatus(MatchStatus.INCOMPLETE);
  }

  public int totalRecords() {
    return results.size();
  }

  public boolean canImport() {
    return results.stream()
        .anyMatch(
            r ->
                r.status() == MatchStatus.NEW
                    || r.status() == MatchStatus.MERGE
                    || r.status() == MatchStatus.INCOMPLETE);
  }

  /** Label used in activity notes: the source name, or the filename when no name was given. */
  public String label() {
    if (sourceName != null && !sourceName.isBlank()) {
      return sourceName;
    }
    return filename != null && !filename.isBlank() ? filename : "import";
  }

  private List<AnalysisResult> withStatus(MatchStatus status) {
    return results.stream().filter(r -> r.status() == status).toList();
  }
}
