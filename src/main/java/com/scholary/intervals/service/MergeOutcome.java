package com.scholary.intervals.service;

import com.scholary.intervals.interval.Interval;
import com.scholary.intervals.merge.MergeMode;
import java.util.List;

/**
 * Result of a merge request, with the bookkeeping callers usually want alongside it.
 */
public record MergeOutcome(
    MergeMode mode,
    String strategyName,
    List<Interval> intervals,
    int inputCount,
    int outputCount,
    boolean cacheHit) {}
