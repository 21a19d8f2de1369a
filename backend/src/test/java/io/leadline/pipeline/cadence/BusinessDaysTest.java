package io.leadline.pipeline.cadence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class BusinessDaysTest {

  private static final LocalDate THURSDAY = LocalDate.of(2026, 2, 5);
  private static final LocalDate FRIDAY = LocalDate.of(2026, 2, 6);

  @Test
  void addingZeroReturnsSameDate() {
    assertThat(BusinessDays.add(FRIDAY, 0)).isEqualTo(FRIDAY);
    assertThat(BusinessDays.add(LocalDate.of(2026, 2, 7), 0)).isEqualTo(LocalDate.of(2026, 2, 7));
  }

  @Test
  void oneBusinessDayFromThursdayIsFriday() {
    assertThat(BusinessDays.add(THURSDAY, 1)).isEqualTo(FRIDAY);
  }

  @Test
  void weekendIsSkipped() {
    assertThat(BusinessDays.add(FRIDAY, 1)).isEqualTo(LocalDate.of(2026, 2, 9));
    // Saturday start counts Monday as the first business day
    assertThat(BusinessDays.add(LocalDate.of(2026, 2, 7), 1)).isEqualTo(LocalDate.of(2026, 2, 9));
  }

  @Test
  void negativeDaysAreRejected() {
    assertThatThrownBy(() -> BusinessDays.add(FRIDAY, -1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void largeCountsNeverLandOnWeekend() {
    var result = BusinessDays.add(FRIDAY, 1000);
    assertThat(result.getYear()).isGreaterThanOrEqualTo(2029);
    assertThat(BusinessDays.isBusinessDay(result)).isTrue();
  }
}
