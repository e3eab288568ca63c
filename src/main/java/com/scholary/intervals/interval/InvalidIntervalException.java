package com.scholary.intervals.interval;

/**
 * Exception thrown when an interval or an interval collection cannot be merged.
 *
 * <p>Raised at the boundary, before any merging happens: inverted bounds, null elements, or a
 * collection larger than the configured limit.
 */
public class InvalidIntervalException extends IllegalArgumentException {

  public InvalidIntervalException(String message) {
    super(message);
  }
}
