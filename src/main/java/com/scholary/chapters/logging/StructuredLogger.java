package com.scholary.chapters.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Provides methods to log job lifecycle events with structured fields that a log pipeline can
 * index and query.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log job queued event. */
  public void logJobQueued(String jobId, String groupId, int chapterCount, long totalBytes) {
    try {
      MDC.put("event_type", "job_queued");
      MDC.put("chapterCount", String.valueOf(chapterCount));
      MDC.put("totalBytes", String.valueOf(totalBytes));

      logger.info(
          "Job queued: jobId={}, group={}, chapters={}, bytes={}",
          jobId,
          groupId,
          chapterCount,
          totalBytes);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(String jobId, int percentComplete, String stage) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("percentComplete", String.valueOf(percentComplete));
      MDC.put("stage", stage);

      logger.debug("Job progress: jobId={}, stage={}, progress={}%", jobId, stage, percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Log job completed event. */
  public void logJobCompleted(String jobId, String outputFilename, long sizeBytes, long elapsedMs) {
    try {
      MDC.put("event_type", "job_completed");
      MDC.put("outputFilename", outputFilename);
      MDC.put("sizeBytes", String.valueOf(sizeBytes));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Job completed: jobId={}, output={}, size={} bytes, took={}ms",
          jobId,
          outputFilename,
          sizeBytes,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log job failed event. */
  public void logJobFailed(String jobId, String errorKind, String message, long elapsedMs) {
    try {
      MDC.put("event_type", "job_failed");
      MDC.put("errorKind", errorKind);
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.error(
          "Job failed: jobId={}, kind={}, took={}ms, message={}",
          jobId,
          errorKind,
          elapsedMs,
          message);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String sessionId, String groupId) {
    MDC.put("jobId", jobId);
    MDC.put("sessionId", sessionId);
    MDC.put("groupId", groupId);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("sessionId");
    MDC.remove("groupId");
  }

  /** Set session context in MDC for request handling. */
  public static void setSessionContext(String sessionId) {
    MDC.put("sessionId", sessionId);
  }

  /** Clear session context from MDC. */
  public static void clearSessionContext() {
    MDC.remove("sessionId");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("chapterCount");
    MDC.remove("totalBytes");
    MDC.remove("percentComplete");
    MDC.remove("stage");
    MDC.remove("outputFilename");
    MDC.remove("sizeBytes");
    MDC.remove("elapsedMs");
    MDC.remove("errorKind");
  }
}
