package com.scholary.chapters.api;

import com.scholary.chapters.job.ConcatenationJob;
import java.util.List;

/**
 * Response for a processing request.
 *
 * <p>One entry per queued job; progress then arrives on the session's event stream.
 */
public record ProcessResponse(String sessionId, List<QueuedJob> jobs) {

  public record QueuedJob(String jobId, String groupId, String state) {

    static QueuedJob from(ConcatenationJob job) {
      return new QueuedJob(job.jobId(), job.groupId(), job.state().wireName());
    }
  }
}
