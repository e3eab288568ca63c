package com.scholary.intervals.api;

import com.scholary.intervals.interval.Interval;
import jakarta.validation.constraints.NotNull;

/**
 * JSON form of an interval.
 *
 * <p>Bounds are boxed so a missing field is reported as a validation error instead of silently
 * defaulting to zero.
 */
public record IntervalPayload(@NotNull Integer min, @NotNull Integer max) {

  public static IntervalPayload from(Interval interval) {
    return new IntervalPayload(interval.min(), interval.max());
  }

  /**
   * Convert to the domain type.
   *
   * @throws com.scholary.intervals.interval.InvalidIntervalException if min > max
   */
  public Interval toInterval() {
    return new Interval(min, max);
  }
}
