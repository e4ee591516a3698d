package com.scholary.chapters.grouping;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One uploaded file as handed over by the upload boundary.
 *
 * @param originalName the client-side filename, used for parsing
 * @param storedPath where the bytes live on disk
 * @param sizeBytes size of the stored file
 */
public record FileDescriptor(String originalName, Path storedPath, long sizeBytes) {

  public FileDescriptor {
    Objects.requireNonNull(originalName, "originalName");
    Objects.requireNonNull(storedPath, "storedPath");
    if (sizeBytes < 0) {
      throw new IllegalArgumentException("File size cannot be negative: " + sizeBytes);
    }
  }
}
