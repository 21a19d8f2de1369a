package io.leadline.pipeline.prospect;

import java.util.Map;

/**
 * Sub-state of an ENGAGED prospect. Stages only move one step forward; there is no skipping and no
 * regression. Re-entering ENGAGED resets the stage.
 */
public enum EngagementStage {
  PRE_DEMO,
  DEMO_SCHEDULED,
  POST_DEMO,
  CLOSING;

  private static final Map<EngagementStage, EngagementStage> NEXT_STAGE =
      Map.of(
          PRE_DEMO, DEMO_SCHEDULED,
          DEMO_SCHEDULED, POST_DEMO,
          POST_DEMO, CLOSING);

  public boolean canAdvanceTo(EngagementStage target) {
    return target != null && target == NEXT_STAGE.get(this);
  }

  public String storageValue() {
    return switch (this) {
      case PRE_DEMO -> "pre_demo";
      case DEMO_SCHEDULED -> "demo_scheduled";
      case POST_DEMO -> "post_demo";
      case CLOSING -> "closing";
    };
  }

  public static EngagementStage fromStorage(String value) {
    for (EngagementStage stage : values()) {
      if (stage.storageValue().equals(value)) {
        return stage;
      }
    }
    throw new IllegalStateException("Unknown stored engagement stage: '" + value + "'");
  }
}
