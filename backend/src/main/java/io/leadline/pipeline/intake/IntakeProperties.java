package io.leadline.pipeline.intake;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Dedup tuning for the intake funnel.
 *
 * @param nameSimilarityThreshold minimum name similarity (inclusive) for a fuzzy merge
 * @param fuzzyCandidateLimit maximum prospects of one company compared by name
 */
@ConfigurationProperties(prefix = "pipeline.intake")
public record IntakeProperties(double nameSimilarityThreshold, int fuzzyCandidateLimit) {

  public static final double DEFAULT_THRESHOLD = 0.85;
  public static final int DEFAULT_CANDIDATE_LIMIT = 500;

  public IntakeProperties {
    if (nameSimilarityThreshold == 0) {
      nameSimilarityThreshold = DEFAULT_THRESHOLD;
    }
    if (fuzzyCandidateLimit == 0) {
      fuzzyCandidateLimit = DEFAULT_CANDIDATE_LIMIT;
    }
    if (nameSimilarityThreshold <= 0 || nameSimilarityThreshold > 1) {
      throw new IllegalArgumentException(
          "pipeline.intake.name-similarity-threshold must be in (0, 1], got "
              + nameSimilarityThreshold);
    }
    if (fuzzyCandidateLimit < 1) {
      throw new IllegalArgumentException(
          "pipeline.intake.fuzzy-candidate-limit must be positive, got " + fuzzyCandidateLimit);
    }
  }

  public static IntakeProperties defaults() {
    return new IntakeProperties(DEFAULT_THRESHOLD, DEFAULT_CANDIDATE_LIMIT);
  }
}
