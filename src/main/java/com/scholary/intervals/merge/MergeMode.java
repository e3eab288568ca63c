package com.scholary.intervals.merge;

/**
 * Merge algorithm selection.
 */
public enum MergeMode {
  /**
   * Sort by lower bound, then fold in one left-to-right pass.
   *
   * <p>O(n log n). Output is ascending.
   */
  SWEEP,

  /**
   * Back-to-front pairwise subset/extension reduction, repeated until stable.
   *
   * <p>O(n²) per sweep. Output order follows the input's surviving positions.
   */
  PAIRWISE
}
