package com.scholary.intervals.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.intervals.cache.MergeResultCache;
import com.scholary.intervals.config.IntervalMergeProperties;
import com.scholary.intervals.config.IntervalMergeProperties.CacheProperties;
import com.scholary.intervals.config.IntervalMergeProperties.MergeProperties;
import com.scholary.intervals.config.IntervalMergeProperties.ScenarioProperties;
import com.scholary.intervals.interval.Interval;
import com.scholary.intervals.interval.InvalidIntervalException;
import com.scholary.intervals.merge.MergeMode;
import com.scholary.intervals.merge.PairwiseReductionMerger;
import com.scholary.intervals.merge.SortedSweepMerger;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class IntervalMergeServiceTest {

  private static final List<Interval> INPUT =
      List.of(new Interval(25, 30), new Interval(2, 19), new Interval(14, 23), new Interval(4, 8));

  @Mock private MergeResultCache resultCache;

  private IntervalMergeService createService(MergeMode defaultMode, int maxIntervals, boolean cache) {
    return createService(defaultMode, maxIntervals, maxIntervals, cache);
  }

  private IntervalMergeService createService(
      MergeMode defaultMode, int maxIntervals, int maxPairwiseIntervals, boolean cache) {
    IntervalMergeProperties properties =
        new IntervalMergeProperties(
            new MergeProperties(defaultMode, maxIntervals, maxPairwiseIntervals),
            new CacheProperties(cache, 100, 10),
            new ScenarioProperties(false, false));
    return new IntervalMergeService(
        new SortedSweepMerger(), new PairwiseReductionMerger(), resultCache, properties);
  }

  @Test
  void merge_shouldUseConfiguredDefaultMode() {
    IntervalMergeService service = createService(MergeMode.PAIRWISE, 100, false);

    MergeOutcome outcome = service.merge(INPUT);

    assertThat(outcome.mode()).isEqualTo(MergeMode.PAIRWISE);
    assertThat(outcome.strategyName()).isEqualTo("PAIRWISE_REDUCTION");
    assertThat(outcome.intervals())
        .containsExactlyInAnyOrder(new Interval(2, 23), new Interval(25, 30));
    assertThat(outcome.inputCount()).isEqualTo(4);
    assertThat(outcome.outputCount()).isEqualTo(2);
    assertThat(outcome.cacheHit()).isFalse();
    verifyNoInteractions(resultCache);
  }

  @Test
  void merge_shouldHonourRequestedMode() {
    IntervalMergeService service = createService(MergeMode.PAIRWISE, 100, false);

    MergeOutcome outcome = service.merge(INPUT, MergeMode.SWEEP);

    assertThat(outcome.mode()).isEqualTo(MergeMode.SWEEP);
    assertThat(outcome.intervals()).containsExactly(new Interval(2, 23), new Interval(25, 30));
  }

  @Test
  void merge_shouldTreatNullAsEmpty() {
    IntervalMergeService service = createService(MergeMode.SWEEP, 100, false);

    MergeOutcome outcome = service.merge(null);

    assertThat(outcome.intervals()).isEmpty();
    assertThat(outcome.inputCount()).isZero();
    assertThat(outcome.outputCount()).isZero();
  }

  @Test
  void merge_shouldRejectTooManyIntervals() {
    IntervalMergeService service = createService(MergeMode.SWEEP, 3, true);

    assertThatThrownBy(() -> service.merge(INPUT))
        .isInstanceOf(InvalidIntervalException.class)
        .hasMessageContaining("Too many intervals for SWEEP: 4 (max 3)");
    verifyNoInteractions(resultCache);
  }

  @Test
  void merge_shouldApplyLowerLimitToPairwiseOnly() {
    IntervalMergeService service = createService(MergeMode.SWEEP, 100, 3, false);

    assertThatThrownBy(() -> service.merge(INPUT, MergeMode.PAIRWISE))
        .isInstanceOf(InvalidIntervalException.class)
        .hasMessageContaining("Too many intervals for PAIRWISE: 4 (max 3)");

    MergeOutcome outcome = service.merge(INPUT, MergeMode.SWEEP);
    assertThat(outcome.intervals()).containsExactly(new Interval(2, 23), new Interval(25, 30));
  }

  @Test
  void merge_shouldApplyPairwiseLimitWhenPairwiseIsDefault() {
    IntervalMergeService service = createService(MergeMode.PAIRWISE, 100, 3, false);

    assertThatThrownBy(() -> service.merge(INPUT))
        .isInstanceOf(InvalidIntervalException.class)
        .hasMessageContaining("max 3");
  }

  @Test
  void merge_shouldRejectNullElementBeforeTouchingCache() {
    IntervalMergeService service = createService(MergeMode.SWEEP, 100, true);
    List<Interval> input = Arrays.asList(new Interval(1, 2), null, new Interval(3, 4));

    assertThatThrownBy(() -> service.merge(input))
        .isInstanceOf(InvalidIntervalException.class)
        .hasMessageContaining("position 1");
    verifyNoInteractions(resultCache);
  }

  @Test
  void merge_shouldStoreResultOnCacheMiss() {
    IntervalMergeService service = createService(MergeMode.SWEEP, 100, true);
    MergeResultCache.Key key = MergeResultCache.generateKey(MergeMode.SWEEP, INPUT);
    when(resultCache.get(key)).thenReturn(Optional.empty());

    MergeOutcome outcome = service.merge(INPUT);

    assertThat(outcome.cacheHit()).isFalse();
    verify(resultCache).put(eq(key), eq(List.of(new Interval(2, 23), new Interval(25, 30))));
  }

  @Test
  void merge_shouldServeCachedResult() {
    IntervalMergeService service = createService(MergeMode.SWEEP, 100, true);
    List<Interval> cached = List.of(new Interval(2, 23), new Interval(25, 30));
    when(resultCache.get(MergeResultCache.generateKey(MergeMode.SWEEP, INPUT)))
        .thenReturn(Optional.of(cached));

    MergeOutcome outcome = service.merge(INPUT);

    assertThat(outcome.cacheHit()).isTrue();
    assertThat(outcome.intervals()).isEqualTo(cached);
    verify(resultCache, never()).put(any(), any());
  }

  @Test
  void merge_shouldKeyCacheByMode() {
    IntervalMergeService service = createService(MergeMode.SWEEP, 100, true);
    when(resultCache.get(any())).thenReturn(Optional.empty());

    service.merge(INPUT, MergeMode.PAIRWISE);

    verify(resultCache).get(MergeResultCache.generateKey(MergeMode.PAIRWISE, INPUT));
    verify(resultCache).put(eq(MergeResultCache.generateKey(MergeMode.PAIRWISE, INPUT)), any());
  }
}
