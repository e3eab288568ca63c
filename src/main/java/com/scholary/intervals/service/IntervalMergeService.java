package com.scholary.intervals.service;

import com.scholary.intervals.cache.MergeResultCache;
import com.scholary.intervals.config.IntervalMergeProperties;
import com.scholary.intervals.interval.Interval;
import com.scholary.intervals.interval.InvalidIntervalException;
import com.scholary.intervals.logging.StructuredLogger;
import com.scholary.intervals.merge.MergeMode;
import com.scholary.intervals.merge.MergeStrategy;
import com.scholary.intervals.merge.PairwiseReductionMerger;
import com.scholary.intervals.merge.SortedSweepMerger;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for merging interval collections.
 *
 * <p>Validates the request at the boundary, picks the strategy for the requested mode (or the
 * configured default), and serves repeated requests from the result cache when caching is enabled.
 */
@Service
public class IntervalMergeService {

  private static final Logger LOGGER = LoggerFactory.getLogger(IntervalMergeService.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final Map<MergeMode, MergeStrategy> strategies;
  private final MergeResultCache resultCache;
  private final MergeMode defaultMode;
  private final int maxIntervals;
  private final int maxPairwiseIntervals;
  private final boolean cacheEnabled;

  public IntervalMergeService(
      SortedSweepMerger sortedSweepMerger,
      PairwiseReductionMerger pairwiseReductionMerger,
      MergeResultCache resultCache,
      IntervalMergeProperties properties) {

    this.strategies = new EnumMap<>(MergeMode.class);
    for (MergeStrategy strategy : List.of(sortedSweepMerger, pairwiseReductionMerger)) {
      this.strategies.put(strategy.mode(), strategy);
    }

    this.resultCache = resultCache;
    this.defaultMode = properties.merge().defaultMode();
    this.maxIntervals = properties.merge().maxIntervals();
    this.maxPairwiseIntervals = properties.merge().maxPairwiseIntervals();
    this.cacheEnabled = properties.cache().enabled();

    LOGGER.info(
        "Interval merge service ready: defaultMode={}, maxIntervals={}, maxPairwiseIntervals={}, "
            + "cacheEnabled={}",
        defaultMode,
        maxIntervals,
        maxPairwiseIntervals,
        cacheEnabled);
  }

  /**
   * Merge intervals using the configured default mode.
   *
   * @param intervals the intervals to merge; null is treated as empty
   * @return the merge outcome
   * @throws InvalidIntervalException if the input is rejected
   */
  public MergeOutcome merge(List<Interval> intervals) {
    return merge(intervals, null);
  }

  /**
   * Merge intervals using the given mode.
   *
   * @param intervals the intervals to merge; null is treated as empty
   * @param mode the algorithm to use, or null for the configured default
   * @return the merge outcome
   * @throws InvalidIntervalException if the input is rejected
   */
  public MergeOutcome merge(List<Interval> intervals, MergeMode mode) {
    MergeMode effectiveMode = mode != null ? mode : defaultMode;
    MergeStrategy strategy = strategies.get(effectiveMode);
    List<Interval> input = intervals != null ? intervals : List.of();

    validate(input, effectiveMode);
    structuredLogger.logMergeStarted(effectiveMode.name(), input.size());

    long startNanos = System.nanoTime();
    boolean cacheHit = false;
    List<Interval> merged;

    if (cacheEnabled) {
      MergeResultCache.Key key = MergeResultCache.generateKey(effectiveMode, input);
      Optional<List<Interval>> cached = resultCache.get(key);
      if (cached.isPresent()) {
        merged = cached.get();
        cacheHit = true;
      } else {
        merged = strategy.merge(input);
        resultCache.put(key, merged);
      }
    } else {
      merged = strategy.merge(input);
    }

    long durationMicros = (System.nanoTime() - startNanos) / 1_000;
    structuredLogger.logMergeCompleted(
        effectiveMode.name(), input.size(), merged.size(), cacheHit, durationMicros);

    return new MergeOutcome(
        effectiveMode,
        strategy.getStrategyName(),
        List.copyOf(merged),
        input.size(),
        merged.size(),
        cacheHit);
  }

  /** Currently configured default mode. */
  public MergeMode getDefaultMode() {
    return defaultMode;
  }

  private void validate(List<Interval> input, MergeMode mode) {
    int limit =
        mode == MergeMode.PAIRWISE ? Math.min(maxIntervals, maxPairwiseIntervals) : maxIntervals;
    if (input.size() > limit) {
      String reason =
          "Too many intervals for " + mode + ": " + input.size() + " (max " + limit + ")";
      structuredLogger.logMergeRejected(mode.name(), input.size(), reason);
      throw new InvalidIntervalException(reason);
    }
    for (int i = 0; i < input.size(); i++) {
      if (input.get(i) == null) {
        String reason = "Interval at position " + i + " is null";
        structuredLogger.logMergeRejected(mode.name(), input.size(), reason);
        throw new InvalidIntervalException(reason);
      }
    }
  }
}
