package io.leadline.pipeline.cadence;

import io.leadline.pipeline.prospect.Population;

/** Who owns the schedule of a prospect. Exactly one mode applies per population. */
public enum CadenceMode {
  /** The engine computes follow-ups from the interval table. */
  SYSTEM_PACED,
  /** The follow-up is an explicit date agreed with the prospect; never overwritten. */
  PROSPECT_PACED,
  /** No scheduling obligation. */
  NONE;

  public static CadenceMode forPopulation(Population population) {
    if (population == null) {
      return NONE;
    }
    return switch (population) {
      case UNENGAGED, BROKEN -> SYSTEM_PACED;
      case ENGAGED -> PROSPECT_PACED;
      case PARKED, DEAD_DNC, LOST, PARTNERSHIP, CLOSED_WON -> NONE;
    };
  }
}
