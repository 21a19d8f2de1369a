package io.leadline.pipeline.cadence;

import java.time.DayOfWeek;
import java.time.LocalDate;

/** Weekend-skipping date arithmetic. Holidays are not considered. */
public final class BusinessDays {

  private BusinessDays() {}

  /**
   * Adds business days to a date. Adding zero returns the start date unchanged, even on a weekend.
   *
   * @throws IllegalArgumentException if {@code businessDays} is negative
   */
  public static LocalDate add(LocalDate start, int businessDays) {
    if (businessDays < 0) {
      throw new IllegalArgumentException("businessDays must be >= 0, got " + businessDays);
    }
    LocalDate result = start;
    int added = 0;
    while (added < businessDays) {
      result = result.plusDays(1);
      if (isBusinessDay(result)) {
        added++;
      }
    }
    return result;
  }

  public static boolean isBusinessDay(LocalDate date) {
    DayOfWeek day = date.getDayOfWeek();
    return day != DayOfWeek.SATURDAY && day != DayOfWeek.SUNDAY;
  }
}
