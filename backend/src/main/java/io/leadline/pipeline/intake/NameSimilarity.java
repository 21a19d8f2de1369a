package io.leadline.pipeline.intake;

/**
 * Similarity of two person names, from 0.0 (nothing in common) to 1.0 (identical). Implementations
 * must be symmetric and case-insensitive.
 */
public interface NameSimilarity {

  double similarity(String first, String second);
}
