package com.scholary.intervals.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.intervals.config.IntervalMergeProperties;
import com.scholary.intervals.interval.Interval;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory implementation of MergeResultCache using Caffeine.
 *
 * <p>Entries expire a configurable time after being written. The cache is bounded by the total
 * number of intervals it holds, counting both the key's input and the merged result, so a burst of
 * large requests evicts older entries instead of exhausting memory.
 */
@Component
public class InMemoryMergeResultCache implements MergeResultCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryMergeResultCache.class);

  private final Cache<Key, List<Interval>> cache;

  public InMemoryMergeResultCache(IntervalMergeProperties properties) {
    long maxWeight = properties.cache().maxWeight();
    int ttlMinutes = properties.cache().ttlMinutes();

    this.cache =
        Caffeine.newBuilder()
            .maximumWeight(maxWeight)
            .<Key, List<Interval>>weigher(InMemoryMergeResultCache::weigh)
            .expireAfterWrite(Duration.ofMinutes(ttlMinutes))
            .recordStats()
            .build();

    LOGGER.info(
        "Initialized merge result cache: maxWeight={} intervals, ttlMinutes={}",
        maxWeight,
        ttlMinutes);
  }

  @Override
  public Optional<List<Interval>> get(Key key) {
    List<Interval> merged = cache.getIfPresent(key);
    if (merged != null) {
      LOGGER.debug("Cache hit: mode={}, intervals={}", key.mode(), key.intervals().size());
      return Optional.of(merged);
    } else {
      LOGGER.debug("Cache miss: mode={}, intervals={}", key.mode(), key.intervals().size());
      return Optional.empty();
    }
  }

  @Override
  public void put(Key key, List<Interval> merged) {
    cache.put(key, List.copyOf(merged));
  }

  @Override
  public void invalidateAll() {
    cache.invalidateAll();
    LOGGER.info("Merge result cache cleared");
  }

  /** Run pending eviction work now. */
  void cleanUp() {
    cache.cleanUp();
  }

  long estimatedSize() {
    return cache.estimatedSize();
  }

  private static int weigh(Key key, List<Interval> merged) {
    return key.intervals().size() + merged.size();
  }

  @Override
  public String getStats() {
    var stats = cache.stats();
    return String.format(
        "MergeResultCache[size=%d, hitRate=%.2f%%, evictions=%d]",
        cache.estimatedSize(), stats.hitRate() * 100, stats.evictionCount());
  }
}
