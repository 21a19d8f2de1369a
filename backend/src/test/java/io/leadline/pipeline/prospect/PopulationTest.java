package io.leadline.pipeline.prospect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class PopulationTest {

  private static final Map<Population, Set<Population>> EXPECTED_EDGES =
      Map.of(
          Population.BROKEN, EnumSet.of(Population.UNENGAGED, Population.DEAD_DNC),
          Population.UNENGAGED,
              EnumSet.of(
                  Population.ENGAGED,
                  Population.DEAD_DNC,
                  Population.LOST,
                  Population.PARKED,
                  Population.PARTNERSHIP),
          Population.ENGAGED,
              EnumSet.of(
                  Population.CLOSED_WON,
                  Population.LOST,
                  Population.PARKED,
                  Population.DEAD_DNC),
          Population.PARKED, EnumSet.of(Population.UNENGAGED, Population.DEAD_DNC),
          Population.LOST, EnumSet.of(Population.UNENGAGED, Population.DEAD_DNC),
          Population.CLOSED_WON, EnumSet.noneOf(Population.class),
          Population.PARTNERSHIP, EnumSet.noneOf(Population.class),
          Population.DEAD_DNC, EnumSet.noneOf(Population.class));

  @Test
  void everyPairMatchesTransitionTable() {
    for (Population from : Population.values()) {
      for (Population to : Population.values()) {
        assertThat(from.canTransitionTo(to))
            .as("%s -> %s", from, to)
            .isEqualTo(EXPECTED_EDGES.get(from).contains(to));
      }
    }
  }

  @Test
  void noPopulationTransitionsToItself() {
    for (Population population : Population.values()) {
      assertThat(population.canTransitionTo(population)).isFalse();
    }
  }

  @Test
  void terminalPopulationsHaveNoTargets() {
    assertThat(Population.DEAD_DNC.isTerminal()).isTrue();
    assertThat(Population.CLOSED_WON.isTerminal()).isTrue();
    assertThat(Population.PARTNERSHIP.isTerminal()).isTrue();
    assertThat(Population.LOST.isTerminal()).isFalse();
    assertThat(Population.DEAD_DNC.availableTransitions()).isEmpty();
  }

  @Test
  void availableTransitionsFollowDeclarationOrder() {
    assertThat(Population.UNENGAGED.availableTransitions())
        .containsExactly(
            Population.ENGAGED,
            Population.PARKED,
            Population.DEAD_DNC,
            Population.LOST,
            Population.PARTNERSHIP);
  }

  @Test
  void storageValueRoundTripsForEveryConstant() {
    for (Population population : Population.values()) {
      assertThat(Population.fromStorage(population.storageValue())).isEqualTo(population);
    }
    assertThat(Population.DEAD_DNC.storageValue()).isEqualTo("dead_dnc");
  }

  @Test
  void unknownStoredValueFailsLoudly() {
    assertThatThrownBy(() -> Population.fromStorage("zombie"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("zombie");
  }

  @Test
  void fromParsesCaseInsensitively() {
    assertThat(Population.from("engaged")).isEqualTo(Population.ENGAGED);
    assertThat(Population.from(" Dead_Dnc ")).isEqualTo(Population.DEAD_DNC);
    assertThatThrownBy(() -> Population.from("HOT"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Invalid population");
  }
}
