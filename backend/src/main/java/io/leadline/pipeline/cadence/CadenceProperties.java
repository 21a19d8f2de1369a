package io.leadline.pipeline.cadence;

import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * System-paced interval table. Loaded once at startup; an invalid table fails startup rather than
 * producing surprising schedules at runtime.
 *
 * @param intervals ordered intervals for attempts 1..n
 * @param overflow interval used for every attempt after the last configured one
 */
@ConfigurationProperties(prefix = "pipeline.cadence")
public record CadenceProperties(List<CadenceInterval> intervals, CadenceInterval overflow) {

  public CadenceProperties {
    if (intervals == null || intervals.isEmpty()) {
      throw new IllegalArgumentException("pipeline.cadence.intervals must not be empty");
    }
    if (overflow == null) {
      throw new IllegalArgumentException("pipeline.cadence.overflow is required");
    }
    intervals = List.copyOf(intervals);
    CadenceInterval previous = null;
    for (int i = 0; i < intervals.size(); i++) {
      var interval = intervals.get(i);
      if (interval.attempt() != i + 1) {
        throw new IllegalArgumentException(
            "pipeline.cadence.intervals[" + i + "] must be attempt " + (i + 1)
                + " but was " + interval.attempt());
      }
      requireOrdered("attempt " + interval.attempt(), interval, previous);
      previous = interval;
    }
    requireOrdered("overflow", overflow, previous);
  }

  /** The built-in table: 3/5/7/10 business days, then every 14. */
  public static CadenceProperties defaults() {
    return new CadenceProperties(
        List.of(
            new CadenceInterval(1, 3, 5, ContactChannel.CALL),
            new CadenceInterval(2, 5, 7, ContactChannel.CALL),
            new CadenceInterval(3, 7, 10, ContactChannel.EMAIL),
            new CadenceInterval(4, 10, 14, ContactChannel.COMBO)),
        new CadenceInterval(0, 14, 21, ContactChannel.COMBO));
  }

  /** Interval for the given attempt number; the overflow interval past the end of the table. */
  public CadenceInterval intervalFor(int attemptNumber) {
    if (attemptNumber >= 1 && attemptNumber <= intervals.size()) {
      return intervals.get(attemptNumber - 1);
    }
    return attemptNumber < 1 ? intervals.get(0) : overflow;
  }

  public CadenceInterval firstInterval() {
    return intervals.get(0);
  }

  private static void requireOrdered(
      String name, CadenceInterval interval, CadenceInterval previous) {
    if (interval.minDays() < 0 || interval.maxDays() < interval.minDays()) {
      throw new IllegalArgumentException(
          "Cadence interval " + name + " must satisfy 0 <= minDays <= maxDays, got "
              + interval.minDays() + ".." + interval.maxDays());
    }
    if (interval.channel() == null) {
      throw new IllegalArgumentException("Cadence interval " + name + " requires a channel");
    }
    if (previous != null
        && (interval.minDays() < previous.minDays() || interval.maxDays() < previous.maxDays())) {
      throw new IllegalArgumentException(
          "Cadence interval " + name + " is shorter than the interval before it; intervals must"
              + " be non-decreasing");
    }
  }
}
