package io.leadline.pipeline.intake;

public enum MatchStatus {
  NEW,
  MERGE,
  NEEDS_REVIEW,
  BLOCKED_DNC,
  INCOMPLETE
}
