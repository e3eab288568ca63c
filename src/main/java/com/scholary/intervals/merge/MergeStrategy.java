package com.scholary.intervals.merge;

import com.scholary.intervals.interval.Interval;
import com.scholary.intervals.interval.InvalidIntervalException;
import java.util.ArrayList;
import java.util.List;

/**
 * Strategy interface for merging interval collections.
 *
 * <p>Every implementation returns a new list in which no two intervals overlap, touch or nest, and
 * whose union covers exactly the same points as the input. The caller's list is never modified.
 * Result ordering is implementation specific.
 */
public interface MergeStrategy {

  /**
   * Merge overlapping, touching and contained intervals.
   *
   * @param intervals the intervals to merge; may be null or empty
   * @return merged intervals, never null
   * @throws InvalidIntervalException if an element is null
   */
  List<Interval> merge(List<Interval> intervals);

  /** The mode this strategy implements. */
  MergeMode mode();

  /**
   * Get the strategy name for logging and debugging.
   *
   * @return strategy name
   */
  String getStrategyName();

  /**
   * Copy the input into a list the strategy may freely mutate.
   *
   * @param intervals the caller's intervals; may be null
   * @return a mutable copy, empty for null input
   * @throws InvalidIntervalException if an element is null
   */
  static List<Interval> workingCopy(List<Interval> intervals) {
    if (intervals == null) {
      return new ArrayList<>();
    }
    List<Interval> copy = new ArrayList<>(intervals.size());
    for (int i = 0; i < intervals.size(); i++) {
      Interval interval = intervals.get(i);
      if (interval == null) {
        throw new InvalidIntervalException("Interval at position " + i + " is null");
      }
      copy.add(interval);
    }
    return copy;
  }
}
