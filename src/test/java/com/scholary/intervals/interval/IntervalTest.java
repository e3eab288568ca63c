package com.scholary.intervals.interval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class IntervalTest {

  @Test
  void constructor_shouldRejectInvertedBounds() {
    assertThatThrownBy(() -> new Interval(10, 5))
        .isInstanceOf(InvalidIntervalException.class)
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("[10,5]");
  }

  @Test
  void constructor_shouldAcceptSinglePointAndNegativeBounds() {
    assertThat(new Interval(7, 7).length()).isEqualTo(1);
    assertThat(new Interval(-5, -1).length()).isEqualTo(5);
  }

  @Test
  void length_shouldNotOverflowForFullIntRange() {
    Interval all = new Interval(Integer.MIN_VALUE, Integer.MAX_VALUE);
    assertThat(all.length()).isEqualTo(1L << 32);
  }

  @Test
  void contains_shouldIncludeBothBounds() {
    Interval interval = new Interval(10, 20);
    assertThat(interval.contains(10)).isTrue();
    assertThat(interval.contains(15)).isTrue();
    assertThat(interval.contains(20)).isTrue();
    assertThat(interval.contains(9)).isFalse();
    assertThat(interval.contains(21)).isFalse();
  }

  @Test
  void encloses_shouldDetectSubsetsIncludingEquality() {
    Interval outer = new Interval(1, 4);
    assertThat(outer.encloses(new Interval(2, 4))).isTrue();
    assertThat(outer.encloses(new Interval(1, 4))).isTrue();
    assertThat(outer.encloses(new Interval(0, 3))).isFalse();
    assertThat(new Interval(2, 4).encloses(outer)).isFalse();
  }

  @Test
  void touchesOrOverlaps_shouldTreatSharedBoundAsOverlap() {
    Interval left = new Interval(1, 5);
    Interval right = new Interval(5, 10);
    assertThat(left.touchesOrOverlaps(right)).isTrue();
    assertThat(right.touchesOrOverlaps(left)).isTrue();
  }

  @Test
  void touchesOrOverlaps_shouldReturnFalseAcrossOneUnitGap() {
    Interval left = new Interval(1, 4);
    Interval right = new Interval(5, 10);
    assertThat(left.touchesOrOverlaps(right)).isFalse();
    assertThat(right.touchesOrOverlaps(left)).isFalse();
  }

  @Test
  void span_shouldCoverBothIntervals() {
    assertThat(new Interval(14, 23).span(new Interval(2, 19))).isEqualTo(new Interval(2, 23));
    assertThat(new Interval(1, 2).span(new Interval(8, 9))).isEqualTo(new Interval(1, 9));
  }
}
