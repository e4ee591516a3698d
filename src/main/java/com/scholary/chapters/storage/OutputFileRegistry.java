package com.scholary.chapters.storage;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * Completed outputs per session.
 *
 * <p>Only successful jobs add records here, so anything listed is a complete file. Entries expire
 * with the same retention window as the files on disk.
 */
@Repository
public class OutputFileRegistry {

  private final Cache<String, List<OutputFile>> cache;

  public OutputFileRegistry(@Value("${merger.fileRetentionHours}") int retentionHours) {
    this.cache =
        Caffeine.newBuilder().expireAfterWrite(Duration.ofHours(retentionHours)).build();
  }

  public void record(OutputFile outputFile) {
    cache
        .asMap()
        .compute(
            outputFile.sessionId(),
            (sessionId, existing) -> {
              List<OutputFile> updated =
                  existing == null ? new ArrayList<>() : new ArrayList<>(existing);
              updated.add(outputFile);
              return List.copyOf(updated);
            });
  }

  public List<OutputFile> findBySession(String sessionId) {
    List<OutputFile> files = cache.getIfPresent(sessionId);
    return files == null ? List.of() : files;
  }

  public Optional<OutputFile> find(String sessionId, String filename) {
    return findBySession(sessionId).stream()
        .filter(file -> file.filename().equals(filename))
        .findFirst();
  }
}
