package com.scholary.intervals.api;

import com.scholary.intervals.merge.MergeMode;
import com.scholary.intervals.service.MergeOutcome;
import java.util.List;

/** Response for a merge request. */
public record MergeResponse(
    MergeMode mode,
    String strategy,
    List<IntervalPayload> intervals,
    int inputCount,
    int outputCount,
    boolean cacheHit) {

  public static MergeResponse from(MergeOutcome outcome) {
    return new MergeResponse(
        outcome.mode(),
        outcome.strategyName(),
        outcome.intervals().stream().map(IntervalPayload::from).toList(),
        outcome.inputCount(),
        outcome.outputCount(),
        outcome.cacheHit());
  }
}
