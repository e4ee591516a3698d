package com.scholary.chapters.naming;

import java.util.Locale;
import java.util.Optional;

/** File kinds a camera writes for each chapter. Only {@link #VIDEO} is ever concatenated. */
public enum MediaExtension {
  VIDEO("MP4"),
  LOW_RES_PROXY("LRV"),
  THUMBNAIL("THM");

  private final String suffix;

  MediaExtension(String suffix) {
    this.suffix = suffix;
  }

  public String suffix() {
    return suffix;
  }

  /**
   * Look up an extension by its file suffix, ignoring case.
   *
   * @param suffix suffix without the leading dot
   * @return the matching extension, or empty if the suffix is not a camera file type
   */
  public static Optional<MediaExtension> fromSuffix(String suffix) {
    if (suffix == null) {
      return Optional.empty();
    }
    String normalized = suffix.toUpperCase(Locale.ROOT);
    for (MediaExtension extension : values()) {
      if (extension.suffix.equals(normalized)) {
        return Optional.of(extension);
      }
    }
    return Optional.empty();
  }
}
