package io.leadline.pipeline.activity;

public enum ActivityOutcome {
  NO_ANSWER,
  LEFT_VM,
  SPOKE_WITH,
  INTERESTED,
  NOT_INTERESTED,
  NOT_NOW,
  DEMO_SET,
  DEMO_COMPLETED,
  CLOSED_WON,
  CLOSED_LOST,
  BOUNCED,
  REPLIED,
  OOO,
  REFERRAL
}
