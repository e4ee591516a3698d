package com.scholary.chapters.job;

import com.scholary.chapters.grouping.SequenceGroup;
import com.scholary.chapters.logging.StructuredLogger;
import com.scholary.chapters.storage.OutputFile;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

/**
 * JobQueue backed by a bounded worker pool and the in-memory JobRepository.
 *
 * <p>The executor's thread count is the number of jobs that run at once; its queue capacity is the
 * backlog. When the backlog is full the job is not created and {@link
 * ChannelUnavailableException} is thrown, so callers learn about saturation immediately instead of
 * through a job that never starts.
 */
@Component
public class InMemoryJobQueue implements JobQueue {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryJobQueue.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final JobRepository repository;
  private final TaskExecutor executor;

  private volatile JobHandler handler;
  private volatile boolean accepting = true;

  public InMemoryJobQueue(
      JobRepository repository, @Qualifier("jobExecutor") TaskExecutor executor) {
    this.repository = repository;
    this.executor = executor;
  }

  @Override
  public void onJobPicked(JobHandler handler) {
    this.handler = handler;
  }

  @Override
  public ConcatenationJob enqueue(String sessionId, SequenceGroup group) {
    if (!accepting) {
      throw new ChannelUnavailableException("Job queue is shutting down");
    }
    if (handler == null) {
      throw new ChannelUnavailableException("No worker is registered for the job queue");
    }

    ConcatenationJob job = ConcatenationJob.queued(UUID.randomUUID().toString(), sessionId, group);
    repository.save(job);

    try {
      executor.execute(() -> pick(job.jobId()));
    } catch (RejectedExecutionException e) {
      repository.delete(job.jobId());
      LOGGER.warn(
          "Job queue saturated, rejected group {} of session {}", group.groupId(), sessionId);
      throw new ChannelUnavailableException("Job queue is full, try again later", e);
    }

    structuredLogger.logJobQueued(
        job.jobId(), group.groupId(), group.chapterCount(), group.totalSizeBytes());
    return job;
  }

  private void pick(String jobId) {
    Optional<ConcatenationJob> picked = repository.update(jobId, ConcatenationJob::activate);
    if (picked.isEmpty()) {
      LOGGER.warn("Job {} was evicted before a worker picked it up", jobId);
      return;
    }

    ConcatenationJob job = picked.get();
    StructuredLogger.setJobContext(job.jobId(), job.sessionId(), job.groupId());
    try {
      handler.handle(job);
    } catch (RuntimeException e) {
      LOGGER.error("Worker crashed while running job {}", jobId, e);
      failIfActive(jobId, JobError.concatenationFailed("Unexpected error: " + e.getMessage()));
    } finally {
      StructuredLogger.clearJobContext();
    }
  }

  @Override
  public void reportProgress(String jobId, int percent, String stage) {
    repository.update(jobId, job -> job.withProgress(percent, stage));
    structuredLogger.logJobProgress(jobId, percent, stage);
  }

  @Override
  public void complete(String jobId, OutputFile outputFile) {
    repository.update(jobId, job -> job.complete(outputFile));
  }

  @Override
  public void fail(String jobId, JobError error) {
    repository.update(jobId, job -> job.fail(error));
  }

  private void failIfActive(String jobId, JobError error) {
    repository.update(jobId, job -> job.state().isTerminal() ? job : job.fail(error));
  }

  @Override
  public Optional<ConcatenationJob> find(String jobId) {
    return repository.findById(jobId);
  }

  @Override
  public List<ConcatenationJob> findBySession(String sessionId) {
    return repository.findBySession(sessionId);
  }

  @PreDestroy
  public void shutdown() {
    accepting = false;
    LOGGER.info("Job queue stopped accepting work");
  }
}
