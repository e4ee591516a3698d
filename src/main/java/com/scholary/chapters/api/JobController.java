package com.scholary.chapters.api;

import com.scholary.chapters.job.JobRepository;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/** Polling access to job snapshots, for clients that do not keep an event stream open. */
@RestController
@Tag(name = "Jobs", description = "Job status")
public class JobController {

  private final JobRepository jobRepository;

  public JobController(JobRepository jobRepository) {
    this.jobRepository = jobRepository;
  }

  @GetMapping("/api/jobs/{jobId}")
  @Operation(summary = "Get job status", description = "Current snapshot of one job")
  public ResponseEntity<JobStatusResponse> getJob(@PathVariable String jobId) {
    return jobRepository
        .findById(jobId)
        .map(job -> ResponseEntity.ok(JobStatusResponse.from(job)))
        .orElse(ResponseEntity.notFound().build());
  }

  @GetMapping("/api/sessions/{sessionId}/jobs")
  @Operation(
      summary = "List session jobs",
      description = "All known jobs of a session, oldest first")
  public List<JobStatusResponse> getSessionJobs(@PathVariable String sessionId) {
    return jobRepository.findBySession(sessionId).stream().map(JobStatusResponse::from).toList();
  }
}
