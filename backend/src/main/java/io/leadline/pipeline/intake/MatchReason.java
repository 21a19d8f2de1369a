package io.leadline.pipeline.intake;

/** Which dedup pass matched a record to an existing prospect. */
public enum MatchReason {
  DNC_EMAIL,
  DNC_PHONE,
  DNC_NAME,
  EMAIL,
  FUZZY_NAME,
  PHONE
}
