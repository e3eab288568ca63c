package com.scholary.intervals.api;

import com.scholary.intervals.merge.MergeMode;
import com.scholary.intervals.scenario.ScenarioReport;
import com.scholary.intervals.scenario.ScenarioResult;
import java.util.List;

/**
 * Response for a scenario run.
 *
 * <p>Lists every scenario with its outcome, the merged result and the expected intervals.
 */
public record ScenarioReportResponse(
    MergeMode mode, long passed, long failed, List<ScenarioEntry> results) {

  public record ScenarioEntry(
      String name,
      ScenarioResult.Outcome outcome,
      List<IntervalPayload> result,
      List<IntervalPayload> expected) {}

  public static ScenarioReportResponse from(ScenarioReport report) {
    List<ScenarioEntry> entries =
        report.results().stream()
            .map(
                r ->
                    new ScenarioEntry(
                        r.scenario().name(),
                        r.outcome(),
                        r.result().stream().map(IntervalPayload::from).toList(),
                        r.scenario().expected().stream().map(IntervalPayload::from).toList()))
            .toList();
    return new ScenarioReportResponse(
        report.mode(), report.passedCount(), report.failedCount(), entries);
  }
}
