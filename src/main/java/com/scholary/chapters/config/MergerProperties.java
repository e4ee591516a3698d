package com.scholary.chapters.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ingestion, storage and the job pipeline.
 *
 * <p>Controls where files live, how many jobs run at once and how long results are kept.
 */
@ConfigurationProperties(prefix = "merger")
@Validated
public record MergerProperties(
    @NotBlank String uploadRoot,
    @NotBlank String outputRoot,
    @NotBlank String tempDir,
    @Positive int maxConcurrentJobs,
    @Positive int jobQueueCapacity,
    @Positive int maxFilesPerUpload,
    @Positive int fileRetentionHours,
    boolean retentionSweepEnabled,
    @Positive long estimatedBytesPerSecond,
    @Positive int maxErrorDetailLength) {}
