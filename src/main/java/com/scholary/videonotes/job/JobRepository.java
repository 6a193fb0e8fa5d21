package com.scholary.videonotes.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for synthesis jobs.
 *
 * <p>Uses Caffeine cache for automatic eviction of old jobs, so completed jobs and their notes do
 * not accumulate. Jobs do not survive a restart.
 */
@Repository
public class JobRepository {

  private final Cache<String, SynthesisJob> cache;

  public JobRepository(
      @Value("${jobstore.maxSize:1000}") int maxSize,
      @Value("${jobstore.expireAfterMinutes:60}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(SynthesisJob job) {
    cache.put(job.getJobId(), job);
  }

  public Optional<SynthesisJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  public void delete(String jobId) {
    cache.invalidate(jobId);
  }
}
