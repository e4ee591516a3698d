package com.scholary.chapters.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory store of job snapshots.
 *
 * <p>Uses Caffeine cache for automatic eviction of old jobs, so finished jobs are archived away
 * after {@code jobstore.expireAfterMinutes} independently of how long their output files are kept.
 */
@Repository
public class JobRepository {

  private final Cache<String, ConcatenationJob> cache;

  public JobRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(ConcatenationJob job) {
    cache.put(job.jobId(), job);
  }

  /**
   * Replace a job's snapshot atomically.
   *
   * @return the new snapshot, or empty if the job is unknown (never stored or already evicted)
   */
  public Optional<ConcatenationJob> update(String jobId, UnaryOperator<ConcatenationJob> change) {
    return Optional.ofNullable(
        cache.asMap().computeIfPresent(jobId, (id, job) -> change.apply(job)));
  }

  public Optional<ConcatenationJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  public List<ConcatenationJob> findBySession(String sessionId) {
    return cache.asMap().values().stream()
        .filter(job -> job.sessionId().equals(sessionId))
        .sorted(Comparator.comparing(ConcatenationJob::createdAt))
        .toList();
  }

  public long countInState(JobState state) {
    return cache.asMap().values().stream().filter(job -> job.state() == state).count();
  }

  public void delete(String jobId) {
    cache.invalidate(jobId);
  }
}
