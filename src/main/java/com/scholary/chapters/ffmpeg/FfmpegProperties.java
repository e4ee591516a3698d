package com.scholary.chapters.ffmpeg;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the ffmpeg concat subprocess.
 *
 * @param binary executable name or absolute path
 * @param timeout wall-clock limit for one concatenation; zero disables it
 * @param diagnosticTailLines how many trailing stderr lines to keep for failure reports
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(
    @NotBlank String binary, @NotNull Duration timeout, @Positive int diagnosticTailLines) {

  public boolean hasTimeout() {
    return !timeout.isZero() && !timeout.isNegative();
  }
}
