package com.scholary.chapters.job;

import com.scholary.chapters.ffmpeg.ElapsedTimeListener;
import com.scholary.chapters.ffmpeg.FfmpegProgressParser;
import com.scholary.chapters.progress.ProgressEvent.JobProgress;
import com.scholary.chapters.progress.ProgressNotifier;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Progress bookkeeping for one running job.
 *
 * <p>Fixed milestones: 10 preparing, 20 files verified, 30 output path prepared, 100 done. While
 * ffmpeg runs, elapsed media time is mapped onto [30, 90] against an estimate of the total
 * duration derived from the input sizes. The estimate can be off in either direction, so the value
 * is clamped at 90 until the process exits and never decreases.
 *
 * <p>Not thread-safe; owned by the worker running the job.
 */
class JobProgressTracker implements ElapsedTimeListener {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobProgressTracker.class);

  static final int PREPARING = 10;
  static final int FILES_VERIFIED = 20;
  static final int OUTPUT_PREPARED = 30;
  static final int CONCAT_CEILING = 90;
  static final int DONE = 100;

  private final ConcatenationJob job;
  private final JobQueue queue;
  private final ProgressNotifier notifier;
  private final Duration estimatedDuration;

  private int current;

  JobProgressTracker(
      ConcatenationJob job,
      JobQueue queue,
      ProgressNotifier notifier,
      Duration estimatedDuration) {
    this.job = job;
    this.queue = queue;
    this.notifier = notifier;
    this.estimatedDuration = estimatedDuration;
    this.current = job.progress();
  }

  /**
   * Estimate media duration from byte size.
   *
   * @param totalBytes combined size of all chapters
   * @param bytesPerSecond assumed average bitrate in bytes per second
   */
  static Duration estimateDuration(long totalBytes, long bytesPerSecond) {
    return Duration.ofMillis(totalBytes * 1000 / bytesPerSecond);
  }

  /** Map elapsed media time onto the concatenation sub-range. */
  static int concatPercent(Duration elapsed, Duration estimated) {
    if (estimated.isZero() || estimated.isNegative()) {
      return OUTPUT_PREPARED;
    }
    double fraction = Math.min(1.0, (double) elapsed.toMillis() / estimated.toMillis());
    int span = CONCAT_CEILING - OUTPUT_PREPARED;
    return Math.min(CONCAT_CEILING, OUTPUT_PREPARED + (int) Math.floor(span * fraction));
  }

  /** Publish the event for the pick-up transition already recorded by the queue. */
  void started() {
    publish(current, job.stage(), null);
  }

  void advance(int percent, String stage) {
    advance(percent, stage, null);
  }

  private void advance(int percent, String stage, String detail) {
    int next = Math.max(current, percent);
    current = next;
    queue.reportProgress(job.jobId(), next, stage);
    publish(next, stage, detail);
  }

  @Override
  public void onElapsed(Duration elapsed) {
    int percent = Math.max(OUTPUT_PREPARED, concatPercent(elapsed, estimatedDuration));
    advance(Math.min(percent, CONCAT_CEILING), "processing", FfmpegProgressParser.format(elapsed));
  }

  int current() {
    return current;
  }

  private void publish(int percent, String stage, String detail) {
    try {
      notifier.publish(
          job.sessionId(), new JobProgress(job.jobId(), job.groupId(), percent, stage, detail));
    } catch (RuntimeException e) {
      LOGGER.warn("Could not publish progress for job {}: {}", job.jobId(), e.getMessage());
    }
  }
}
