package com.scholary.intervals.merge;

import com.scholary.intervals.interval.Interval;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Pairwise reduction merger.
 *
 * <p>A cursor walks the collection from the last interval to the first. The interval under the
 * cursor (the candidate) is compared, in collection order, with every other surviving interval:
 *
 * <ul>
 *   <li>Subset: the candidate lies inside the other interval, so it is dropped. This also removes
 *       exact duplicates.
 *   <li>Left extension: the candidate's upper bound falls inside the other interval and its lower
 *       bound is further left, so the other interval's lower bound is lowered to the candidate's and
 *       the candidate is dropped. Touching bounds count.
 * </ul>
 *
 * <p>The first match wins and the cursor moves on. If nothing matches, the candidate survives.
 *
 * <p>Intervals live in a fixed array with a live-bit set, so dropping is a bit flip and positions
 * never shift while the cursor is scanning. Sweeps repeat until one completes without a merge. At a
 * stable state any two overlapping survivors would have matched one of the two relations from one
 * side or the other, so the survivors are pairwise disjoint. Every merge kills a slot, so there are
 * at most n + 1 sweeps.
 *
 * <p>Survivors are returned in their original slot order.
 */
@Component
public class PairwiseReductionMerger implements MergeStrategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(PairwiseReductionMerger.class);

  @Override
  public List<Interval> merge(List<Interval> intervals) {
    List<Interval> working = MergeStrategy.workingCopy(intervals);
    if (working.isEmpty()) {
      return List.of();
    }

    Interval[] slots = working.toArray(new Interval[0]);
    BitSet live = new BitSet(slots.length);
    live.set(0, slots.length);

    int sweeps = 0;
    int merges;
    do {
      merges = sweep(slots, live);
      sweeps++;
      LOGGER.trace(
          "Sweep {} applied {} merges, {} intervals left", sweeps, merges, live.cardinality());
    } while (merges > 0);

    List<Interval> merged = new ArrayList<>(live.cardinality());
    for (int i = live.nextSetBit(0); i >= 0; i = live.nextSetBit(i + 1)) {
      merged.add(slots[i]);
    }

    LOGGER.debug(
        "Pairwise reduction merged {} intervals into {} in {} sweeps",
        slots.length,
        merged.size(),
        sweeps);
    return merged;
  }

  /**
   * One back-to-front pass over the live slots.
   *
   * @return number of candidates dropped during this pass
   */
  private int sweep(Interval[] slots, BitSet live) {
    int merges = 0;
    for (int cursor = live.previousSetBit(slots.length - 1);
        cursor >= 0;
        cursor = live.previousSetBit(cursor - 1)) {
      if (reduce(slots, live, cursor)) {
        merges++;
      }
    }
    return merges;
  }

  /**
   * Compare the candidate at {@code cursor} against every other live slot and apply the first
   * matching relation.
   *
   * @return true if the candidate was dropped
   */
  private boolean reduce(Interval[] slots, BitSet live, int cursor) {
    Interval candidate = slots[cursor];

    for (int i = live.nextSetBit(0); i >= 0; i = live.nextSetBit(i + 1)) {
      if (i == cursor) {
        continue;
      }
      Interval other = slots[i];

      if (other.encloses(candidate)) {
        live.clear(cursor);
        return true;
      }

      if (extendsLeftward(candidate, other)) {
        slots[i] = new Interval(candidate.min(), other.max());
        live.clear(cursor);
        return true;
      }
    }
    return false;
  }

  /** Candidate ends inside {@code other} (inclusive) and starts strictly before it. */
  private static boolean extendsLeftward(Interval candidate, Interval other) {
    return other.min() <= candidate.max()
        && candidate.max() <= other.max()
        && candidate.min() < other.min();
  }

  @Override
  public MergeMode mode() {
    return MergeMode.PAIRWISE;
  }

  @Override
  public String getStrategyName() {
    return "PAIRWISE_REDUCTION";
  }
}
