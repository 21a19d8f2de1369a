package io.leadline.pipeline.cadence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class CadencePropertiesTest {

  private static final CadenceInterval OVERFLOW =
      new CadenceInterval(0, 14, 21, ContactChannel.COMBO);

  @Test
  void defaultTableIsValid() {
    var defaults = CadenceProperties.defaults();

    assertThat(defaults.intervals()).hasSize(4);
    assertThat(defaults.intervalFor(1).minDays()).isEqualTo(3);
    assertThat(defaults.intervalFor(4).channel()).isEqualTo(ContactChannel.COMBO);
    assertThat(defaults.intervalFor(5)).isEqualTo(defaults.overflow());
    assertThat(defaults.intervalFor(50).minDays()).isEqualTo(14);
  }

  @Test
  void emptyTableIsRejected() {
    assertThatThrownBy(() -> new CadenceProperties(List.of(), OVERFLOW))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("must not be empty");
  }

  @Test
  void decreasingIntervalsAreRejected() {
    var intervals =
        List.of(
            new CadenceInterval(1, 5, 7, ContactChannel.CALL),
            new CadenceInterval(2, 3, 7, ContactChannel.CALL));

    assertThatThrownBy(() -> new CadenceProperties(intervals, OVERFLOW))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("non-decreasing");
  }

  @Test
  void overflowShorterThanLastIntervalIsRejected() {
    var intervals = List.of(new CadenceInterval(1, 20, 25, ContactChannel.CALL));

    assertThatThrownBy(() -> new CadenceProperties(intervals, OVERFLOW))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("overflow");
  }

  @Test
  void gapsInAttemptNumbersAreRejected() {
    var intervals =
        List.of(
            new CadenceInterval(1, 3, 5, ContactChannel.CALL),
            new CadenceInterval(3, 5, 7, ContactChannel.CALL));

    assertThatThrownBy(() -> new CadenceProperties(intervals, OVERFLOW))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("must be attempt 2");
  }

  @Test
  void minGreaterThanMaxIsRejected() {
    var intervals = List.of(new CadenceInterval(1, 6, 5, ContactChannel.CALL));

    assertThatThrownBy(() -> new CadenceProperties(intervals, OVERFLOW))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("minDays <= maxDays");
  }
}
