package com.scholary.intervals.scenario;

import com.scholary.intervals.interval.Interval;
import java.util.List;

/** The fixed set of hand-written merge scenarios. */
public final class ScenarioCatalog {

  private ScenarioCatalog() {}

  public static List<MergeScenario> defaultScenarios() {
    return List.of(
        new MergeScenario(
            "chain-and-gap",
            List.of(iv(25, 30), iv(2, 19), iv(14, 23), iv(4, 8)),
            List.of(iv(25, 30), iv(2, 23))),
        new MergeScenario(
            "touching-bounds", List.of(iv(1, 5), iv(5, 10)), List.of(iv(1, 10))),
        new MergeScenario(
            "one-unit-gap", List.of(iv(1, 4), iv(5, 10)), List.of(iv(1, 4), iv(5, 10))),
        new MergeScenario(
            "contained-shared-upper", List.of(iv(1, 4), iv(2, 4)), List.of(iv(1, 4))),
        new MergeScenario("right-overlap", List.of(iv(1, 4), iv(2, 5)), List.of(iv(1, 5))),
        new MergeScenario(
            "contained-shared-lower", List.of(iv(1, 3), iv(1, 4)), List.of(iv(1, 4))),
        new MergeScenario("duplicates", List.of(iv(1, 4), iv(1, 4)), List.of(iv(1, 4))),
        new MergeScenario(
            "overlap-chain", List.of(iv(1, 3), iv(2, 4), iv(3, 5)), List.of(iv(1, 5))),
        new MergeScenario(
            "duplicate-and-chain",
            List.of(iv(3, 30), iv(10, 20), iv(3, 30), iv(1, 2), iv(27, 40)),
            List.of(iv(1, 2), iv(3, 40))),
        new MergeScenario("singleton", List.of(iv(3, 30)), List.of(iv(3, 30))));
  }

  private static Interval iv(int min, int max) {
    return new Interval(min, max);
  }
}
