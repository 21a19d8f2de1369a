package io.leadline.pipeline.company;

import java.util.Locale;
import java.util.Map;

/** Maps two-letter US state codes to the calling-hours timezone bucket of a company. */
public final class StateTimezones {

  public static final String DEFAULT_TIMEZONE = "central";

  private static final Map<String, String> STATE_TO_TIMEZONE =
      Map.ofEntries(
          Map.entry("AL", "central"),
          Map.entry("AK", "alaska"),
          Map.entry("AZ", "mountain"),
          Map.entry("AR", "central"),
          Map.entry("CA", "pacific"),
          Map.entry("CO", "mountain"),
          Map.entry("CT", "eastern"),
          Map.entry("DE", "eastern"),
          Map.entry("DC", "eastern"),
          Map.entry("FL", "eastern"),
          Map.entry("GA", "eastern"),
          Map.entry("HI", "hawaii"),
          Map.entry("ID", "mountain"),
          Map.entry("IL", "central"),
          Map.entry("IN", "eastern"),
          Map.entry("IA", "central"),
          Map.entry("KS", "central"),
          Map.entry("KY", "eastern"),
          Map.entry("LA", "central"),
          Map.entry("ME", "eastern"),
          Map.entry("MD", "eastern"),
          Map.entry("MA", "eastern"),
          Map.entry("MI", "eastern"),
          Map.entry("MN", "central"),
          Map.entry("MS", "central"),
          Map.entry("MO", "central"),
          Map.entry("MT", "mountain"),
          Map.entry("NE", "central"),
          Map.entry("NV", "pacific"),
          Map.entry("NH", "eastern"),
          Map.entry("NJ", "eastern"),
          Map.entry("NM", "mountain"),
          Map.entry("NY", "eastern"),
          Map.entry("NC", "eastern"),
          Map.entry("ND", "central"),
          Map.entry("OH", "eastern"),
          Map.entry("OK", "central"),
          Map.entry("OR", "pacific"),
          Map.entry("PA", "eastern"),
          Map.entry("RI", "eastern"),
          Map.entry("SC", "eastern"),
          Map.entry("SD", "central"),
          Map.entry("TN", "central"),
          Map.entry("TX", "central"),
          Map.entry("UT", "mountain"),
          Map.entry("VT", "eastern"),
          Map.entry("VA", "eastern"),
          Map.entry("WA", "pacific"),
          Map.entry("WV", "eastern"),
          Map.entry("WI", "central"),
          Map.entry("WY", "mountain"));

  private StateTimezones() {}

  public static String forState(String state) {
    if (state == null || state.isBlank()) {
      return DEFAULT_TIMEZONE;
    }
    return STATE_TO_TIMEZONE.getOrDefault(state.strip().toUpperCase(Locale.ROOT), DEFAULT_TIMEZONE);
  }

  /** Two-letter uppercase state code, or null when the value is not a known code. */
  public static String normalizeState(String state) {
    if (state == null) {
      return null;
    }
    String code = state.strip().toUpperCase(Locale.ROOT);
    return STATE_TO_TIMEZONE.containsKey(code) ? code : null;
  }
}
