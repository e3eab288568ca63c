package com.scholary.intervals.scenario;

import com.scholary.intervals.merge.MergeMode;
import java.util.List;

/** Results of a full scenario run. */
public record ScenarioReport(MergeMode mode, List<ScenarioResult> results) {

  public ScenarioReport {
    results = List.copyOf(results);
  }

  public long passedCount() {
    return results.stream().filter(ScenarioResult::passed).count();
  }

  public long failedCount() {
    return results.size() - passedCount();
  }

  public boolean allPassed() {
    return failedCount() == 0;
  }
}
