package com.scholary.chapters.ffmpeg;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Lossless concatenation through ffmpeg's concat demuxer.
 *
 * <p>Steps:
 *
 * <ol>
 *   <li>Write a temporary manifest listing the inputs in order
 *   <li>Run {@code ffmpeg -f concat -safe 0 -i manifest -c copy -avoid_negative_ts make_zero}
 *   <li>Stream stderr, forwarding the latest {@code time=} marker to the listener
 *   <li>Delete the manifest, whatever happened
 * </ol>
 *
 * <p>{@code -c copy} keeps every stream bit-for-bit. {@code -avoid_negative_ts make_zero} shifts
 * timestamps so chapters whose start times do not line up still produce a valid stream.
 */
@Component
public class FfmpegConcatenationEngine implements ConcatenationEngine {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegConcatenationEngine.class);

  private final FfmpegProperties properties;
  private final Path tempDir;

  public FfmpegConcatenationEngine(
      FfmpegProperties properties, @Value("${merger.tempDir}") String tempDir) {
    this.properties = properties;
    this.tempDir = Paths.get(tempDir);
  }

  @Override
  public void concatenate(List<Path> orderedInputs, Path output, ElapsedTimeListener listener) {
    if (orderedInputs.isEmpty()) {
      throw new IllegalArgumentException("Nothing to concatenate");
    }

    Path manifest = null;
    try {
      manifest = ConcatManifest.write(tempDir, orderedInputs);
      LOGGER.debug("Wrote concat manifest {} for {} inputs", manifest, orderedInputs.size());
      run(buildCommand(manifest, output), listener);
    } catch (IOException | IllegalArgumentException e) {
      throw new ConcatenationException("Concatenation failed: " + e.getMessage(), e);
    } finally {
      deleteManifest(manifest);
    }
  }

  List<String> buildCommand(Path manifest, Path output) {
    return List.of(
        properties.binary(),
        "-hide_banner",
        "-nostdin",
        "-f",
        "concat",
        "-safe",
        "0",
        "-i",
        manifest.toAbsolutePath().toString(),
        "-c",
        "copy",
        "-avoid_negative_ts",
        "make_zero",
        "-y",
        output.toAbsolutePath().toString());
  }

  private void run(List<String> command, ElapsedTimeListener listener) throws IOException {
    LOGGER.debug("Executing: {}", String.join(" ", command));

    Process process;
    try {
      process =
          new ProcessBuilder(command).redirectOutput(ProcessBuilder.Redirect.DISCARD).start();
    } catch (IOException e) {
      throw new ConcatenationException(
          "Could not start " + properties.binary() + ": " + e.getMessage(), e);
    }

    AtomicBoolean timedOut = new AtomicBoolean(false);
    if (properties.hasTimeout()) {
      process
          .onExit()
          .orTimeout(properties.timeout().toMillis(), TimeUnit.MILLISECONDS)
          .whenComplete(
              (exited, error) -> {
                Throwable cause = error instanceof CompletionException ? error.getCause() : error;
                if (cause instanceof TimeoutException) {
                  timedOut.set(true);
                  LOGGER.warn("ffmpeg exceeded {}, destroying process", properties.timeout());
                  process.destroyForcibly();
                }
              });
    }

    Deque<String> tail = new ArrayDeque<>();
    boolean finished = false;
    try {
      readDiagnostics(process, listener, tail);
      int exitCode = process.waitFor();
      finished = true;

      if (timedOut.get()) {
        throw new ConcatenationException(
            "ffmpeg timed out after " + properties.timeout() + ": " + String.join("\n", tail),
            exitCode);
      }
      if (exitCode != 0) {
        throw new ConcatenationException(
            "ffmpeg exited with code " + exitCode + ": " + String.join("\n", tail), exitCode);
      }
      LOGGER.debug("ffmpeg finished successfully");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ConcatenationException("Concatenation interrupted", e);
    } finally {
      if (!finished && process.isAlive()) {
        process.destroyForcibly();
      }
    }
  }

  /**
   * Stream stderr line by line.
   *
   * <p>ffmpeg ends its status lines with a bare carriage return, which {@link
   * BufferedReader#readLine()} treats as a line terminator, so each status update arrives as its
   * own line. Only the trailing lines are retained.
   */
  private void readDiagnostics(Process process, ElapsedTimeListener listener, Deque<String> tail)
      throws IOException {
    Duration latest = Duration.ZERO;
    try (BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8), 8192)) {
      String line;
      while ((line = reader.readLine()) != null) {
        if (line.isBlank()) {
          continue;
        }
        tail.addLast(line.strip());
        if (tail.size() > properties.diagnosticTailLines()) {
          tail.removeFirst();
        }

        Optional<Duration> elapsed = FfmpegProgressParser.parseElapsed(line);
        if (elapsed.isPresent() && elapsed.get().compareTo(latest) > 0) {
          latest = elapsed.get();
          listener.onElapsed(latest);
        }
      }
    }
  }

  private void deleteManifest(Path manifest) {
    if (manifest == null) {
      return;
    }
    try {
      Files.deleteIfExists(manifest);
    } catch (IOException e) {
      // Never overrides the concatenation outcome
      LOGGER.warn("Failed to delete concat manifest {}", manifest, e);
    }
  }
}
