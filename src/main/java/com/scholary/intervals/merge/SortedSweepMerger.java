package com.scholary.intervals.merge;

import com.scholary.intervals.interval.Interval;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Sort-then-sweep merger.
 *
 * <p>Intervals are sorted by lower bound (then upper bound) and folded in one left-to-right pass:
 * each interval either extends the running last output interval, when it starts at or before that
 * interval's upper bound, or opens a new one. Touching bounds merge; a gap of one unit does not.
 *
 * <p>The result is ascending by lower bound.
 */
@Component
public class SortedSweepMerger implements MergeStrategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(SortedSweepMerger.class);

  private static final Comparator<Interval> BY_BOUNDS =
      Comparator.comparingInt(Interval::min).thenComparingInt(Interval::max);

  @Override
  public List<Interval> merge(List<Interval> intervals) {
    List<Interval> sorted = MergeStrategy.workingCopy(intervals);
    if (sorted.isEmpty()) {
      return List.of();
    }
    sorted.sort(BY_BOUNDS);

    List<Interval> merged = new ArrayList<>();
    Interval current = sorted.get(0);

    for (int i = 1; i < sorted.size(); i++) {
      Interval next = sorted.get(i);
      if (next.min() <= current.max()) {
        if (next.max() > current.max()) {
          current = new Interval(current.min(), next.max());
        }
      } else {
        merged.add(current);
        current = next;
      }
    }
    merged.add(current);

    LOGGER.debug("Sweep merged {} intervals into {}", sorted.size(), merged.size());
    return merged;
  }

  @Override
  public MergeMode mode() {
    return MergeMode.SWEEP;
  }

  @Override
  public String getStrategyName() {
    return "SORTED_SWEEP";
  }
}
