package io.leadline.pipeline.batch;

import io.leadline.pipeline.exception.ErrorKind;
import io.leadline.pipeline.exception.PipelineException;

/**
 * One rejected item of a batch operation.
 *
 * @param record the input item that failed (a prospect id, an import row, ...)
 * @param kind the documented failure kind
 * @param message the specific reason
 */
public record BatchFailure<R>(R record, ErrorKind kind, String message) {

  public static <R> BatchFailure<R> of(R record, PipelineException ex) {
    return new BatchFailure<>(record, ex.getKind(), ex.getDetail());
  }
}
