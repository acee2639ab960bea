package com.scholary.survey.translator.batch;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.survey.translator.config.BatchProperties;
import java.time.Duration;
import java.util.Optional;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for batch jobs.
 *
 * <p>Uses a Caffeine cache keyed by job id so that concurrent clients each get their own batch.
 * Jobs a client stops continuing are evicted after the configured idle window. Nothing survives a
 * restart.
 */
@Repository
public class BatchJobRepository {

  private final Cache<String, BatchJob> cache;

  public BatchJobRepository(BatchProperties properties) {
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(properties.jobStore().maxSize())
            .expireAfterAccess(Duration.ofMinutes(properties.jobStore().expireAfterMinutes()))
            .build();
  }

  public void save(BatchJob job) {
    cache.put(job.getJobId(), job);
  }

  public void remove(String jobId) {
    cache.invalidate(jobId);
  }

  public Optional<BatchJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }
}
