package io.leadline.pipeline.company;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Company name normalization used as the company dedup key. Only legal entity suffixes are removed;
 * business identity words such as Holdings, Capital or Group are kept.
 */
public final class CompanyNames {

  public static final String UNKNOWN_COMPANY = "Unknown";

  private static final List<Pattern> LEGAL_SUFFIXES =
      List.of(
          "llc\\.?",
          "l\\.l\\.c\\.?",
          "inc\\.?",
          "incorporated",
          "corp\\.?",
          "corporation",
          "ltd\\.?",
          "limited",
          "lp\\.?",
          "l\\.p\\.?",
          "co\\.?",
          "company")
          .stream()
          .map(suffix -> Pattern.compile(",?\\s*\\b" + suffix + "$"))
          .toList();

  private CompanyNames() {}

  /**
   * Lowercases, trims and strips trailing legal suffixes. "ABC Lending, LLC" and "abc lending"
   * normalize to the same key.
   */
  public static String normalize(String name) {
    if (name == null) {
      return "";
    }
    String result = name.toLowerCase(Locale.ROOT).strip();
    for (Pattern suffix : LEGAL_SUFFIXES) {
      result = suffix.matcher(result).replaceAll("").strip();
    }
    return result;
  }
}
