package io.leadline.pipeline.intake;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

class SequenceRatioSimilarityTest {

  private final SequenceRatioSimilarity similarity = new SequenceRatioSimilarity();

  @Test
  void identicalNamesScoreOne() {
    assertThat(similarity.similarity("John Smith", "John Smith")).isEqualTo(1.0);
  }

  @Test
  void comparisonIgnoresCaseAndSurroundingWhitespace() {
    assertThat(similarity.similarity("  JOHN smith ", "john Smith")).isEqualTo(1.0);
  }

  @Test
  void missingLetterStaysAboveDefaultThreshold() {
    // "jon smith" vs "john smith": 9 matching characters out of 19
    assertThat(similarity.similarity("Jon Smith", "John Smith")).isCloseTo(18.0 / 19, within(1e-9));
  }

  @Test
  void unrelatedNamesScoreLow() {
    assertThat(similarity.similarity("Alice Jones", "Bob Miller")).isLessThan(0.5);
  }

  @Test
  void scoreIsSymmetric() {
    String[][] pairs = {
      {"Katherine Lee", "Kathy Leigh"},
      {"abcd", "bcda"},
      {"Maria Garcia", "Mario Garza"},
    };
    for (String[] pair : pairs) {
      assertThat(similarity.similarity(pair[0], pair[1]))
          .isEqualTo(similarity.similarity(pair[1], pair[0]));
    }
  }

  @Test
  void emptyAndNullNames() {
    assertThat(similarity.similarity("", "")).isEqualTo(1.0);
    assertThat(similarity.similarity(null, "  ")).isEqualTo(1.0);
    assertThat(similarity.similarity("", "John")).isZero();
  }

  @Test
  void rawRatioFollowsLongestCommonBlocks() {
    // "abcd" vs "bcda": block "bcd" gives 2 * 3 / 8
    assertThat(SequenceRatioSimilarity.ratio("abcd", "bcda")).isEqualTo(0.75);
  }
}
