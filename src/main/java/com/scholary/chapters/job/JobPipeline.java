package com.scholary.chapters.job;

import com.scholary.chapters.config.MergerProperties;
import com.scholary.chapters.ffmpeg.ConcatenationEngine;
import com.scholary.chapters.grouping.Chapter;
import com.scholary.chapters.grouping.SequenceGroup;
import com.scholary.chapters.grouping.ValidationException;
import com.scholary.chapters.logging.StructuredLogger;
import com.scholary.chapters.objectstore.OutputArchiver;
import com.scholary.chapters.progress.ProgressEvent;
import com.scholary.chapters.progress.ProgressEvent.JobCompleted;
import com.scholary.chapters.progress.ProgressEvent.JobFailed;
import com.scholary.chapters.progress.ProgressNotifier;
import com.scholary.chapters.storage.OutputFile;
import com.scholary.chapters.storage.OutputFileRegistry;
import com.scholary.chapters.storage.StorageLayout;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs one concatenation per sequence group and enforces the failure policy.
 *
 * <p>Per job, on a single worker thread:
 *
 * <ol>
 *   <li>10 preparing: the queue has marked the job ACTIVE
 *   <li>Verify every chapter still exists; a missing file fails the job with INPUT_MISSING before
 *       any output is created
 *   <li>20 files verified, then create the session output directory
 *   <li>30 output path prepared, then run the engine; progress moves within [30, 90]
 *   <li>Record the output, then 100 and COMPLETED
 * </ol>
 *
 * <p>Any failure after step 3 fails the job with CONCATENATION_FAILED. A partial output is deleted
 * and never recorded, so only complete files are ever listed for download. Job-level failures end
 * here: they are attached to the job and published, never rethrown to the worker.
 *
 * <p>A group has at most one job in flight. The terminal event is published before the job is
 * marked terminal, so a follow-up job for the same group cannot emit events ahead of it.
 */
@Service
public class JobPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(JobPipeline.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final JobQueue queue;
  private final ConcatenationEngine engine;
  private final StorageLayout layout;
  private final OutputFileRegistry outputs;
  private final OutputArchiver archiver;
  private final ProgressNotifier notifier;
  private final long estimatedBytesPerSecond;
  private final int maxErrorDetailLength;

  public JobPipeline(
      JobQueue queue,
      ConcatenationEngine engine,
      StorageLayout layout,
      OutputFileRegistry outputs,
      OutputArchiver archiver,
      ProgressNotifier notifier,
      MergerProperties properties) {
    this.queue = queue;
    this.engine = engine;
    this.layout = layout;
    this.outputs = outputs;
    this.archiver = archiver;
    this.notifier = notifier;
    this.estimatedBytesPerSecond = properties.estimatedBytesPerSecond();
    this.maxErrorDetailLength = properties.maxErrorDetailLength();

    queue.onJobPicked(this::execute);
  }

  /**
   * Queue one job per group.
   *
   * <p>Nothing is queued if any of the groups already has a QUEUED or ACTIVE job.
   *
   * @return the QUEUED snapshots, in the order of the groups
   * @throws ValidationException if there is nothing to process or the session id is unsafe
   * @throws GroupBusyException if a group is still being processed
   * @throws ChannelUnavailableException if the queue cannot take more work; jobs queued before
   *     the failure keep running
   */
  public synchronized List<ConcatenationJob> submit(String sessionId, List<SequenceGroup> groups) {
    StorageLayout.requireValidSessionId(sessionId);
    if (groups.isEmpty()) {
      throw new ValidationException("No groups selected for processing");
    }

    for (SequenceGroup group : groups) {
      if (group.chapters().isEmpty()) {
        throw new ValidationException("Group " + group.groupId() + " has no chapters");
      }
      rejectIfInFlight(sessionId, group.groupId());
    }

    List<ConcatenationJob> jobs = new ArrayList<>(groups.size());
    for (SequenceGroup group : groups) {
      jobs.add(queue.enqueue(sessionId, group));
    }
    LOGGER.info("Queued {} jobs for session {}", jobs.size(), sessionId);
    return jobs;
  }

  private void rejectIfInFlight(String sessionId, String groupId) {
    for (ConcatenationJob job : queue.findBySession(sessionId)) {
      if (job.groupId().equals(groupId) && !job.state().isTerminal()) {
        throw new GroupBusyException(
            groupId,
            job.jobId(),
            String.format(
                "Group %s is already being processed by job %s", groupId, job.jobId()));
      }
    }
  }

  /** Worker entry point for one ACTIVE job. */
  void execute(ConcatenationJob job) {
    long startTime = System.currentTimeMillis();
    try {
      run(job, startTime);
    } catch (RuntimeException e) {
      LOGGER.error("Job {} failed outside the concatenation step", job.jobId(), e);
      if (isInFlight(job.jobId())) {
        String detail = truncate("Unexpected error: " + describe(e));
        fail(job, JobError.concatenationFailed(detail), startTime);
      }
    }
  }

  private void run(ConcatenationJob job, long startTime) {
    SequenceGroup group = job.group();
    JobProgressTracker tracker =
        new JobProgressTracker(
            job,
            queue,
            notifier,
            JobProgressTracker.estimateDuration(group.totalSizeBytes(), estimatedBytesPerSecond));
    tracker.started();

    for (Chapter chapter : group.chapters()) {
      if (!Files.isRegularFile(chapter.file().storedPath())) {
        fail(
            job,
            JobError.inputMissing("Input file not found: " + chapter.file().originalName()),
            startTime);
        return;
      }
    }
    tracker.advance(JobProgressTracker.FILES_VERIFIED, "files verified");

    Path output = layout.newOutputPath(job.sessionId(), job.groupId(), job.jobId(), Instant.now());
    try {
      Files.createDirectories(output.getParent());
      tracker.advance(JobProgressTracker.OUTPUT_PREPARED, "output path prepared");

      engine.concatenate(group.inputPaths(), output, tracker);

      OutputFile outputFile =
          new OutputFile(
              job.sessionId(),
              job.groupId(),
              output.getFileName().toString(),
              Files.size(output),
              Instant.now(),
              archiver.archive(job.sessionId(), output));

      outputs.record(outputFile);
      tracker.advance(JobProgressTracker.DONE, "completed");
      publish(job, JobCompleted.of(job.jobId(), outputFile));
      queue.complete(job.jobId(), outputFile);

      structuredLogger.logJobCompleted(
          job.jobId(),
          outputFile.filename(),
          outputFile.sizeBytes(),
          System.currentTimeMillis() - startTime);

    } catch (IOException | RuntimeException e) {
      discardPartialOutput(output);
      fail(job, JobError.concatenationFailed(truncate(describe(e))), startTime);
    }
  }

  private void fail(ConcatenationJob job, JobError error, long startTime) {
    publish(job, new JobFailed(job.jobId(), job.groupId(), error.kind().name(), error.message()));
    queue.fail(job.jobId(), error);
    structuredLogger.logJobFailed(
        job.jobId(), error.kind().name(), error.message(), System.currentTimeMillis() - startTime);
  }

  private boolean isInFlight(String jobId) {
    return queue.find(jobId).map(job -> !job.state().isTerminal()).orElse(false);
  }

  private void publish(ConcatenationJob job, ProgressEvent event) {
    try {
      notifier.publish(job.sessionId(), event);
    } catch (RuntimeException e) {
      LOGGER.warn(
          "Could not publish {} for job {}: {}", event.eventName(), job.jobId(), e.getMessage());
    }
  }

  private void discardPartialOutput(Path output) {
    try {
      if (Files.deleteIfExists(output)) {
        LOGGER.debug("Deleted partial output {}", output);
      }
    } catch (IOException e) {
      LOGGER.warn("Could not delete partial output {}", output, e);
    }
  }

  private static String describe(Exception e) {
    String message = e.getMessage();
    return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
  }

  String truncate(String message) {
    if (message.length() <= maxErrorDetailLength) {
      return message;
    }
    return message.substring(0, maxErrorDetailLength) + "...";
  }
}
