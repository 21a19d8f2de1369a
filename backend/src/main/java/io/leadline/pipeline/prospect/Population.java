package io.leadline.pipeline.prospect;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Top-level pipeline state of a prospect with validated transitions. */
public enum Population {
  BROKEN,
  UNENGAGED,
  ENGAGED,
  PARKED,
  DEAD_DNC,
  LOST,
  PARTNERSHIP,
  CLOSED_WON;

  private static final Map<Population, Set<Population>> ALLOWED_TRANSITIONS =
      Map.of(
          BROKEN, Set.of(UNENGAGED, DEAD_DNC),
          UNENGAGED, Set.of(ENGAGED, DEAD_DNC, LOST, PARKED, PARTNERSHIP),
          ENGAGED, Set.of(CLOSED_WON, LOST, PARKED, DEAD_DNC),
          PARKED, Set.of(UNENGAGED, DEAD_DNC),
          LOST, Set.of(UNENGAGED, DEAD_DNC),
          CLOSED_WON, Set.of(),
          PARTNERSHIP, Set.of(),
          DEAD_DNC, Set.of());

  /** Returns true if transitioning from this population to the target is allowed. */
  public boolean canTransitionTo(Population target) {
    return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of()).contains(target);
  }

  /** Targets reachable in one step, in declaration order. */
  public List<Population> availableTransitions() {
    return Arrays.stream(values()).filter(this::canTransitionTo).toList();
  }

  /** Terminal populations have no outgoing edges. */
  public boolean isTerminal() {
    return ALLOWED_TRANSITIONS.get(this).isEmpty();
  }

  /** Text stored in the {@code population} column. */
  public String storageValue() {
    return switch (this) {
      case BROKEN -> "broken";
      case UNENGAGED -> "unengaged";
      case ENGAGED -> "engaged";
      case PARKED -> "parked";
      case DEAD_DNC -> "dead_dnc";
      case LOST -> "lost";
      case PARTNERSHIP -> "partnership";
      case CLOSED_WON -> "closed_won";
    };
  }

  /**
   * Maps stored column text back to a population.
   *
   * @throws IllegalStateException if the stored text is not a known population
   */
  public static Population fromStorage(String value) {
    for (Population population : values()) {
      if (population.storageValue().equals(value)) {
        return population;
      }
    }
    throw new IllegalStateException("Unknown stored population: '" + value + "'");
  }

  /**
   * Parses an API value (enum name, case-insensitive) to a Population.
   *
   * @throws IllegalArgumentException if the value is not a valid population
   */
  public static Population from(String value) {
    if (value != null) {
      for (Population population : values()) {
        if (population.name().equalsIgnoreCase(value.trim())) {
          return population;
        }
      }
    }
    throw new IllegalArgumentException(
        "Invalid population: '"
            + value
            + "'. Valid values: BROKEN, UNENGAGED, ENGAGED, PARKED, DEAD_DNC, LOST, PARTNERSHIP,"
            + " CLOSED_WON");
  }
}
