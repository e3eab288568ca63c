package com.scholary.intervals.cache;

import com.scholary.intervals.interval.Interval;
import com.scholary.intervals.merge.MergeMode;
import java.util.List;
import java.util.Optional;

/**
 * Cache for merge results.
 *
 * <p>Merging is deterministic for a given mode and input order, so a stored result can be served
 * for a repeated request without re-running the strategy.
 *
 * <p>Keys are built from the mode plus the input intervals exactly as given.
 */
public interface MergeResultCache {

  /**
   * Retrieve a cached merge result.
   *
   * @param key the cache key
   * @return the merged intervals, or empty if not found
   */
  Optional<List<Interval>> get(Key key);

  /**
   * Store a merge result.
   *
   * @param key the cache key
   * @param merged the merged intervals
   */
  void put(Key key, List<Interval> merged);

  /** Drop every cached result. */
  void invalidateAll();

  /**
   * Get cache statistics for monitoring.
   *
   * @return human readable stats line
   */
  String getStats();

  /**
   * Generate a cache key.
   *
   * @param mode the merge mode
   * @param intervals the input intervals, in request order
   * @return an immutable key
   */
  static Key generateKey(MergeMode mode, List<Interval> intervals) {
    return new Key(mode, List.copyOf(intervals));
  }

  /** Cache key: mode plus an immutable snapshot of the input. */
  record Key(MergeMode mode, List<Interval> intervals) {}
}
