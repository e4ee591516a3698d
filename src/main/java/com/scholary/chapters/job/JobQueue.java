package com.scholary.chapters.job;

import com.scholary.chapters.grouping.SequenceGroup;
import com.scholary.chapters.storage.OutputFile;
import java.util.List;
import java.util.Optional;

/**
 * Queue of concatenation jobs and owner of their state.
 *
 * <p>Implementations decide where jobs wait and which worker picks them up; an in-process pool
 * and a broker-backed queue both fit. A retrying implementation must simply run the handler
 * again: the handler re-verifies inputs and writes a fresh output every time.
 */
public interface JobQueue {

  /**
   * Queue one job for a group.
   *
   * @return the QUEUED snapshot, carrying the assigned job id
   * @throws ChannelUnavailableException if the queue cannot accept work
   */
  ConcatenationJob enqueue(String sessionId, SequenceGroup group);

  /** Register the handler that workers run for every picked job. */
  void onJobPicked(JobHandler handler);

  void reportProgress(String jobId, int percent, String stage);

  void complete(String jobId, OutputFile outputFile);

  void fail(String jobId, JobError error);

  Optional<ConcatenationJob> find(String jobId);

  /** All known jobs of a session, oldest first. */
  List<ConcatenationJob> findBySession(String sessionId);

  /** Runs one ACTIVE job to completion or failure on the calling worker thread. */
  @FunctionalInterface
  interface JobHandler {
    void handle(ConcatenationJob job);
  }
}
