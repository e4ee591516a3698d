package com.scholary.chapters.api;

import com.scholary.chapters.job.JobRepository;
import com.scholary.chapters.job.JobState;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/** Health check endpoint for monitoring and load balancers. */
@RestController
public class HealthController {

  private final JobRepository jobRepository;
  private final Instant startedAt = Instant.now();

  public HealthController(JobRepository jobRepository) {
    this.jobRepository = jobRepository;
  }

  @GetMapping("/health")
  public ResponseEntity<Map<String, Object>> health() {
    Instant now = Instant.now();
    Map<String, Object> health = new LinkedHashMap<>();
    health.put("status", "healthy");
    health.put("timestamp", now.toString());
    health.put("uptimeSeconds", Duration.between(startedAt, now).getSeconds());
    health.put("activeJobs", jobRepository.countInState(JobState.ACTIVE));

    return ResponseEntity.ok(health);
  }
}
