package io.leadline.pipeline.intake;

import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Ratcliff/Obershelp ratio: {@code 2 * M / T} where M counts the characters in the recursively
 * found longest common blocks and T is the combined length. The raw ratio depends on argument
 * order, so the larger of both orders is returned.
 */
@Component
public class SequenceRatioSimilarity implements NameSimilarity {

  @Override
  public double similarity(String first, String second) {
    String a = prepare(first);
    String b = prepare(second);
    return Math.max(ratio(a, b), ratio(b, a));
  }

  static double ratio(String a, String b) {
    int total = a.length() + b.length();
    if (total == 0) {
      return 1.0;
    }
    return 2.0 * matchingCharacters(a, 0, a.length(), b, 0, b.length()) / total;
  }

  private static int matchingCharacters(
      String a, int aLow, int aHigh, String b, int bLow, int bHigh) {
    if (aLow >= aHigh || bLow >= bHigh) {
      return 0;
    }
    // longest common block; ties go to the earliest start in a, then in b
    int bestA = aLow;
    int bestB = bLow;
    int bestSize = 0;
    int[] previous = new int[bHigh - bLow + 1];
    for (int i = aLow; i < aHigh; i++) {
      int[] current = new int[bHigh - bLow + 1];
      for (int j = bLow; j < bHigh; j++) {
        if (a.charAt(i) == b.charAt(j)) {
          int size = previous[j - bLow] + 1;
          current[j - bLow + 1] = size;
          if (size > bestSize) {
            bestSize = size;
            bestA = i - size + 1;
            bestB = j - size + 1;
          }
        }
      }
      previous = current;
    }
    if (bestSize == 0) {
      return 0;
    }
    return bestSize
        + matchingCharacters(a, aLow, bestA, b, bLow, bestB)
        + matchingCharacters(a, bestA + bestSize, aHigh, b, bestB + bestSize, bHigh);
  }

  private static String prepare(String name) {
    return name == null ? "" : name.strip().toLowerCase(Locale.ROOT);
  }
}
