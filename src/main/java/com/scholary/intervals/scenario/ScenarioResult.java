package com.scholary.intervals.scenario;

import com.scholary.intervals.interval.Interval;
import java.util.List;

/** Outcome of running one scenario. */
public record ScenarioResult(
    MergeScenario scenario, List<Interval> result, Outcome outcome) {

  public enum Outcome {
    PASSED,
    /** Result and expected collections differ in size. */
    SIZE_MISMATCH,
    /** Same size, different intervals. */
    CONTENT_MISMATCH
  }

  public boolean passed() {
    return outcome == Outcome.PASSED;
  }
}
