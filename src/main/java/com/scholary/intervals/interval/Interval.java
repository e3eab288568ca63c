package com.scholary.intervals.interval;

/**
 * A closed integer interval {@code [min, max]}.
 *
 * <p>Both bounds are inclusive. Intervals are plain values: two intervals with the same bounds are
 * interchangeable.
 */
public record Interval(int min, int max) {

  public Interval {
    if (min > max) {
      throw new InvalidIntervalException(
          "Lower bound must be <= upper bound: [" + min + "," + max + "]");
    }
  }

  /** Number of integer points covered by this interval. */
  public long length() {
    return (long) max - min + 1;
  }

  /**
   * Check if this interval contains a given point.
   *
   * @param point the point to check
   * @return true if point is within [min, max]
   */
  public boolean contains(int point) {
    return point >= min && point <= max;
  }

  /**
   * Check if another interval lies entirely within this one.
   *
   * <p>Equal intervals enclose each other.
   *
   * @param other the other interval
   * @return true if other is a subset of this interval
   */
  public boolean encloses(Interval other) {
    return other.min >= this.min && other.max <= this.max;
  }

  /**
   * Check if this interval shares at least one point with another.
   *
   * <p>Boundary contact counts: {@code [1,5]} and {@code [5,10]} touch. {@code [1,4]} and {@code
   * [5,10]} do not.
   *
   * @param other the other interval
   * @return true if the intervals overlap or touch
   */
  public boolean touchesOrOverlaps(Interval other) {
    return this.min <= other.max && other.min <= this.max;
  }

  /** Smallest interval covering both this and {@code other}. */
  public Interval span(Interval other) {
    return new Interval(Math.min(this.min, other.min), Math.max(this.max, other.max));
  }
}
