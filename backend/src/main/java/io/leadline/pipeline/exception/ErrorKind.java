package io.leadline.pipeline.exception;

/** Documented failure kinds of the pipeline operations. */
public enum ErrorKind {
  DNC_VIOLATION,
  INVALID_TRANSITION,
  VALIDATION_ERROR,
  STORAGE_BUSY,
  NOT_FOUND,
  MALFORMED_RECORD;

  /** Whether a caller may retry the same operation unchanged. */
  public boolean isRetryable() {
    return this == STORAGE_BUSY;
  }
}
