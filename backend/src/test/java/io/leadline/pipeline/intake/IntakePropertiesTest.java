package io.leadline.pipeline.intake;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class IntakePropertiesTest {

  @Test
  void unsetValuesFallBackToDefaults() {
    var properties = new IntakeProperties(0, 0);

    assertThat(properties.nameSimilarityThreshold()).isEqualTo(0.85);
    assertThat(properties.fuzzyCandidateLimit()).isEqualTo(500);
  }

  @Test
  void thresholdAboveOneIsRejected() {
    assertThatThrownBy(() -> new IntakeProperties(1.2, 10))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("name-similarity-threshold");
  }

  @Test
  void negativeValuesAreRejected() {
    assertThatThrownBy(() -> new IntakeProperties(-0.5, 10))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new IntakeProperties(0.9, -1))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("fuzzy-candidate-limit");
  }
}
