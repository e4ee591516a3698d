package com.scholary.chapters.storage;

import java.time.Instant;

/**
 * A finished, downloadable result of one successful job. Never mutated after creation.
 *
 * @param archiveKey object store key of the archived copy, or null when archiving is off
 */
public record OutputFile(
    String sessionId,
    String groupId,
    String filename,
    long sizeBytes,
    Instant createdAt,
    String archiveKey) {

  public boolean isArchived() {
    return archiveKey != null;
  }
}
