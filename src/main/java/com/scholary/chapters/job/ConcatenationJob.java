package com.scholary.chapters.job;

import com.scholary.chapters.grouping.SequenceGroup;
import com.scholary.chapters.storage.OutputFile;
import java.time.Instant;

/**
 * Immutable snapshot of a concatenation job.
 *
 * <p>Every change produces a new snapshot; readers never see a half-updated job. Only the worker
 * running the job creates new snapshots for it, and the transition methods reject anything the
 * state machine does not allow, including progress going backwards.
 */
public record ConcatenationJob(
    String jobId,
    String sessionId,
    SequenceGroup group,
    JobState state,
    int progress,
    String stage,
    JobError error,
    OutputFile outputFile,
    Instant createdAt,
    Instant updatedAt) {

  public static ConcatenationJob queued(String jobId, String sessionId, SequenceGroup group) {
    Instant now = Instant.now();
    return new ConcatenationJob(
        jobId, sessionId, group, JobState.QUEUED, 0, "queued", null, null, now, now);
  }

  public String groupId() {
    return group.groupId();
  }

  /** Picked up by a worker. */
  public ConcatenationJob activate() {
    return transition(JobState.ACTIVE, 10, "preparing", null, null);
  }

  public ConcatenationJob withProgress(int newProgress, String newStage) {
    if (newProgress < progress) {
      throw new IllegalStateException(
          String.format(
              "Progress of job %s cannot go back from %d to %d", jobId, progress, newProgress));
    }
    if (newProgress > 100) {
      throw new IllegalArgumentException("Progress cannot exceed 100: " + newProgress);
    }
    return transition(JobState.ACTIVE, newProgress, newStage, null, null);
  }

  public ConcatenationJob complete(OutputFile output) {
    return transition(JobState.COMPLETED, 100, "completed", null, output);
  }

  public ConcatenationJob fail(JobError jobError) {
    return transition(JobState.FAILED, progress, "failed", jobError, null);
  }

  private ConcatenationJob transition(
      JobState next, int newProgress, String newStage, JobError newError, OutputFile output) {
    if (!state.canTransitionTo(next)) {
      throw new IllegalStateException(
          String.format("Job %s cannot move from %s to %s", jobId, state, next));
    }
    return new ConcatenationJob(
        jobId,
        sessionId,
        group,
        next,
        Math.max(progress, newProgress),
        newStage,
        newError,
        output,
        createdAt,
        Instant.now());
  }
}
