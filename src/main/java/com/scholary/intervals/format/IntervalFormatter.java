package com.scholary.intervals.format;

import com.scholary.intervals.interval.Interval;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Renders intervals as human readable text.
 *
 * <p>Each interval becomes one {@code [min,max]} line.
 */
@Component
public class IntervalFormatter {

  public String format(Interval interval) {
    return "[" + interval.min() + "," + interval.max() + "]";
  }

  public List<String> formatLines(Collection<Interval> intervals) {
    List<String> lines = new ArrayList<>(intervals.size());
    for (Interval interval : intervals) {
      lines.add(format(interval));
    }
    return lines;
  }

  /**
   * Render a collection as newline separated lines.
   *
   * @param intervals the intervals to render
   * @return rendered text, empty for an empty collection
   */
  public String render(Collection<Interval> intervals) {
    return String.join("\n", formatLines(intervals));
  }
}
