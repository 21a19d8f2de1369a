package io.leadline.pipeline.intake;

import java.util.UUID;

/**
 * Classification of one import row.
 *
 * @param rowNumber 1-based position of the row in the analyzed batch
 * @param record the row as received
 * @param status the classification
 * @param matchedProspectId the existing prospect the row matched, if any
 * @param matchReason which pass produced the match
 * @param matchConfidence 1.0 for exact matches, the name similarity for fuzzy matches
 */
public record AnalysisResult(
    int rowNumber,
    ImportRecord record,
    MatchStatus status,
    UUID matchedProspectId,
    MatchReason matchReason,
    Double matchConfidence) {

  public static AnalysisResult of(int rowNumber, ImportRecord record, MatchStatus status) {
    return new AnalysisResult(rowNumber, record, status, null, null, null);
  }

  public static AnalysisResult matched(
      int rowNumber,
      ImportRecord record,
      MatchStatus status,
      UUID prospectId,
      MatchReason reason,
      Double confidence) {
    return new AnalysisResult(rowNumber, record, status, prospectId, reason, confidence);
  }

  /** Reclassifies the row, e.g. after a reviewer rejected a phone match. */
  public AnalysisResult withStatus(MatchStatus newStatus) {
    return new AnalysisResult(
        rowNumber, record, newStatus, matchedProspectId, matchReason, matchConfidence);
  }

  /** Confirms the row as a merge into the given prospect, e.g. after review of a phone match. */
  public AnalysisResult asMergeInto(UUID prospectId) {
    return new AnalysisResult(
        rowNumber,
        record,
        MatchStatus.MERGE,
        prospectId,
        matchReason != null ? matchReason : MatchReason.PHONE,
        matchConfidence);
  }
}
