package io.leadline.pipeline.prospect;

public enum LostReason {
  LOST_TO_COMPETITOR,
  NOT_BUYING,
  TIMING,
  BUDGET,
  OUT_OF_BUSINESS
}
