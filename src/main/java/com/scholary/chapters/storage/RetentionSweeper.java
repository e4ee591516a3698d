package com.scholary.chapters.storage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Deletes session directories that have outlived the retention window.
 *
 * <p>Runs outside the job pipeline. A job whose inputs vanish because of a sweep fails with an
 * input-missing error like any other vanished file.
 */
@Component
@ConditionalOnProperty(name = "merger.retentionSweepEnabled", havingValue = "true")
public class RetentionSweeper {

  private static final Logger LOGGER = LoggerFactory.getLogger(RetentionSweeper.class);

  private final StorageLayout layout;
  private final Duration retention;

  public RetentionSweeper(
      StorageLayout layout, @Value("${merger.fileRetentionHours}") int retentionHours) {
    this.layout = layout;
    this.retention = Duration.ofHours(retentionHours);
  }

  @Scheduled(
      fixedDelayString = "${merger.retentionSweepIntervalMs:900000}",
      initialDelayString = "${merger.retentionSweepIntervalMs:900000}")
  public void sweep() {
    Instant cutoff = Instant.now().minus(retention);
    int removed = sweep(layout.uploadRoot(), cutoff) + sweep(layout.outputRoot(), cutoff);
    if (removed > 0) {
      LOGGER.info("Retention sweep removed {} expired session directories", removed);
    }
  }

  /**
   * Remove session directories under a root whose last modification is before the cutoff.
   *
   * @return how many directories were removed
   */
  int sweep(Path root, Instant cutoff) {
    if (!Files.isDirectory(root)) {
      return 0;
    }

    List<Path> sessions;
    try (Stream<Path> children = Files.list(root)) {
      sessions = children.filter(Files::isDirectory).toList();
    } catch (IOException e) {
      LOGGER.warn("Could not list {} for retention sweep", root, e);
      return 0;
    }

    int removed = 0;
    for (Path session : sessions) {
      try {
        if (Files.getLastModifiedTime(session).toInstant().isBefore(cutoff)) {
          deleteRecursively(session);
          removed++;
          LOGGER.debug("Removed expired session directory {}", session);
        }
      } catch (IOException e) {
        LOGGER.warn("Could not remove expired session directory {}", session, e);
      }
    }
    return removed;
  }

  private static void deleteRecursively(Path directory) throws IOException {
    List<Path> entries;
    try (Stream<Path> walk = Files.walk(directory)) {
      entries = walk.sorted(Comparator.reverseOrder()).toList();
    }
    for (Path entry : entries) {
      Files.deleteIfExists(entry);
    }
  }
}
