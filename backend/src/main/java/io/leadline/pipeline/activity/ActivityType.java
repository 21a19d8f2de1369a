package io.leadline.pipeline.activity;

public enum ActivityType {
  CALL,
  VOICEMAIL,
  EMAIL_SENT,
  EMAIL_RECEIVED,
  DEMO,
  NOTE,
  STATUS_CHANGE,
  IMPORT,
  ENRICHMENT,
  REMINDER;

  /** Activity types that count as an outreach attempt for cadence purposes. */
  public boolean isAttempt() {
    return this == CALL || this == VOICEMAIL || this == EMAIL_SENT;
  }
}
