package io.leadline.pipeline.batch;

import io.leadline.pipeline.exception.ErrorKind;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of an operation applied item by item. A failure of one item never prevents the others
 * from being applied.
 */
public record BatchResult<T, R>(List<T> succeeded, List<BatchFailure<R>> failed) {

  public BatchResult {
    succeeded = List.copyOf(succeeded);
    failed = List.copyOf(failed);
  }

  public long countFailed(ErrorKind kind) {
    return failed.stream().filter(f -> f.kind() == kind).count();
  }

  public boolean hasFailures() {
    return !failed.isEmpty();
  }

  /** Mutable accumulator used while a batch is being processed. */
  public static final class Collector<T, R> {

    private final List<T> succeeded = new ArrayList<>();
    private final List<BatchFailure<R>> failed = new ArrayList<>();

    public void succeeded(T item) {
      succeeded.add(item);
    }

    public void failed(BatchFailure<R> failure) {
      failed.add(failure);
    }

    public BatchResult<T, R> build() {
      return new BatchResult<>(succeeded, failed);
    }
  }
}
