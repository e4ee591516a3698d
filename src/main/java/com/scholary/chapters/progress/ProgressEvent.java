package com.scholary.chapters.progress;

import com.scholary.chapters.storage.OutputFile;

/**
 * Something that happened to a job, as seen by session subscribers.
 *
 * <p>Three kinds exist: progress updates, completion and failure. The last two are terminal; no
 * event for the same job is delivered after them.
 */
public interface ProgressEvent {

  String jobId();

  String groupId();

  /** Channel event name, e.g. {@code job-progress}. */
  String eventName();

  boolean isTerminal();

  /** Progress of an active job. {@code detail} carries the elapsed media time when known. */
  record JobProgress(String jobId, String groupId, int progress, String stage, String detail)
      implements ProgressEvent {

    @Override
    public String eventName() {
      return "job-progress";
    }

    @Override
    public boolean isTerminal() {
      return false;
    }
  }

  /** The job produced an output file. */
  record JobCompleted(String jobId, String groupId, String outputFilename, long sizeBytes)
      implements ProgressEvent {

    public static JobCompleted of(String jobId, OutputFile outputFile) {
      return new JobCompleted(
          jobId, outputFile.groupId(), outputFile.filename(), outputFile.sizeBytes());
    }

    @Override
    public String eventName() {
      return "job-complete";
    }

    @Override
    public boolean isTerminal() {
      return true;
    }
  }

  /** The job ended without an output. */
  record JobFailed(String jobId, String groupId, String errorKind, String error)
      implements ProgressEvent {

    @Override
    public String eventName() {
      return "job-error";
    }

    @Override
    public boolean isTerminal() {
      return true;
    }
  }
}
