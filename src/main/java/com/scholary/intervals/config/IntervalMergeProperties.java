package com.scholary.intervals.config;

import com.scholary.intervals.merge.MergeMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for interval merging.
 *
 * <p>Controls the default algorithm, input limits, result caching and the startup scenario run.
 */
@ConfigurationProperties(prefix = "intervals")
@Validated
public record IntervalMergeProperties(
    @Valid @NotNull MergeProperties merge,
    @Valid @NotNull CacheProperties cache,
    @Valid @NotNull ScenarioProperties scenarios) {

  /**
   * Merge limits.
   *
   * <p>{@code maxPairwiseIntervals} caps PAIRWISE requests separately, since its cost grows with the
   * square of the input size.
   */
  public record MergeProperties(
      @NotNull MergeMode defaultMode,
      @Positive int maxIntervals,
      @Positive int maxPairwiseIntervals) {}

  /** Result cache settings. {@code maxWeight} counts cached intervals (inputs plus results). */
  public record CacheProperties(boolean enabled, @Positive long maxWeight, @Positive int ttlMinutes) {}

  public record ScenarioProperties(boolean runOnStartup, boolean verbose) {}
}
