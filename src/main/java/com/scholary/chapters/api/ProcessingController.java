package com.scholary.chapters.api;

import com.scholary.chapters.grouping.SequenceGroup;
import com.scholary.chapters.job.ConcatenationJob;
import com.scholary.chapters.job.JobPipeline;
import com.scholary.chapters.logging.StructuredLogger;
import com.scholary.chapters.storage.StorageLayout;
import com.scholary.chapters.upload.SessionFileRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Starts concatenation jobs.
 *
 * <p>Processing is asynchronous: the response only confirms that the jobs are queued.
 */
@RestController
@Tag(name = "Processing", description = "Merge detected sequences into single files")
public class ProcessingController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessingController.class);

  private final SessionFileRegistry sessionFiles;
  private final JobPipeline pipeline;

  public ProcessingController(SessionFileRegistry sessionFiles, JobPipeline pipeline) {
    this.sessionFiles = sessionFiles;
    this.pipeline = pipeline;
  }

  @PostMapping("/api/process")
  @Operation(
      summary = "Process groups",
      description = "Queue one concatenation job per requested group and return the job ids")
  public ResponseEntity<ProcessResponse> process(@Valid @RequestBody ProcessRequest request) {
    String sessionId = StorageLayout.requireValidSessionId(request.sessionId());
    try {
      StructuredLogger.setSessionContext(sessionId);
      LOGGER.info("Process request: groups={}", request.groupIds());

      List<SequenceGroup> groups = sessionFiles.resolveGroups(sessionId, request.groupIds());
      List<ConcatenationJob> jobs = pipeline.submit(sessionId, groups);

      return ResponseEntity.accepted()
          .body(
              new ProcessResponse(
                  sessionId, jobs.stream().map(ProcessResponse.QueuedJob::from).toList()));
    } finally {
      StructuredLogger.clearSessionContext();
    }
  }
}
