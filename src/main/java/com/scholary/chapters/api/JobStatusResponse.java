package com.scholary.chapters.api;

import com.scholary.chapters.job.ConcatenationJob;
import java.time.Instant;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of a job. {@code errorKind} and {@code error} are set only for failed
 * jobs, {@code outputFilename} only for completed ones.
 */
public record JobStatusResponse(
    String jobId,
    String sessionId,
    String groupId,
    String state,
    int progress,
    String stage,
    String errorKind,
    String error,
    String outputFilename,
    Instant createdAt,
    Instant updatedAt) {

  public static JobStatusResponse from(ConcatenationJob job) {
    return new JobStatusResponse(
        job.jobId(),
        job.sessionId(),
        job.groupId(),
        job.state().wireName(),
        job.progress(),
        job.stage(),
        job.error() == null ? null : job.error().kind().name(),
        job.error() == null ? null : job.error().message(),
        job.outputFile() == null ? null : job.outputFile().filename(),
        job.createdAt(),
        job.updatedAt());
  }
}
