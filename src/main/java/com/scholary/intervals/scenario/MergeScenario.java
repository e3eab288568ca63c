package com.scholary.intervals.scenario;

import com.scholary.intervals.interval.Interval;
import java.util.List;

/**
 * A hand-written merge input together with the intervals it should merge into.
 *
 * <p>The expected list is compared as an unordered multiset.
 */
public record MergeScenario(String name, List<Interval> input, List<Interval> expected) {

  public MergeScenario {
    input = List.copyOf(input);
    expected = List.copyOf(expected);
  }
}
