package io.leadline.pipeline.cadence;

/** Suggested outreach channel for a system-paced attempt. */
public enum ContactChannel {
  CALL,
  EMAIL,
  COMBO
}
