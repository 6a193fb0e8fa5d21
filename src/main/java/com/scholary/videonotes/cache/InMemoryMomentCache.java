package com.scholary.videonotes.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.videonotes.moment.Moment;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * In-memory implementation of MomentCache using Caffeine.
 *
 * <p>Entries expire after a configurable duration (default: 6 hours) and the cache size is
 * bounded; least recently used entries are evicted when the limit is reached.
 */
@Component
public class InMemoryMomentCache implements MomentCache {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryMomentCache.class);

  private final Cache<String, List<Moment>> cache;

  public InMemoryMomentCache(
      @Value("${moments.cache.maxSize:500}") int maxSize,
      @Value("${moments.cache.ttlHours:6}") int ttlHours) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofHours(ttlHours))
            .recordStats()
            .build();

    LOGGER.info("Initialized moment cache: maxSize={}, ttlHours={}", maxSize, ttlHours);
  }

  @Override
  public void put(String cacheKey, List<Moment> moments) {
    cache.put(cacheKey, List.copyOf(moments));
    LOGGER.debug("Cached chunk moments: key={}, moments={}", cacheKey, moments.size());
  }

  @Override
  public Optional<List<Moment>> get(String cacheKey) {
    List<Moment> moments = cache.getIfPresent(cacheKey);
    if (moments != null) {
      LOGGER.debug("Cache hit: key={}", cacheKey);
      return Optional.of(moments);
    } else {
      LOGGER.debug("Cache miss: key={}", cacheKey);
      return Optional.empty();
    }
  }

  @Override
  public String getStats() {
    var stats = cache.stats();
    return String.format(
        "MomentCache[size=%d, hitRate=%.2f%%, evictions=%d]",
        cache.estimatedSize(), stats.hitRate() * 100, stats.evictionCount());
  }
}
