package com.scholary.chapters.naming;

/**
 * Structured view of a chapter filename.
 *
 * <p>Unrecognized names are represented by {@link #UNRECOGNIZED} rather than by null or an
 * exception; a name that does not follow the camera convention is a normal outcome.
 */
public record ParsedName(
    boolean recognized,
    Encoding encoding,
    int chapterNumber,
    int sequenceNumber,
    MediaExtension extension) {

  public static final ParsedName UNRECOGNIZED = new ParsedName(false, null, 0, 0, null);

  public ParsedName {
    if (recognized) {
      if (encoding == null || extension == null) {
        throw new IllegalArgumentException("Recognized names need an encoding and extension");
      }
      if (chapterNumber < 1) {
        throw new IllegalArgumentException("Chapter number must be >= 1, got " + chapterNumber);
      }
      if (sequenceNumber < 0) {
        throw new IllegalArgumentException("Sequence number must be >= 0, got " + sequenceNumber);
      }
    }
  }

  public static ParsedName of(
      Encoding encoding, int chapterNumber, int sequenceNumber, MediaExtension extension) {
    return new ParsedName(true, encoding, chapterNumber, sequenceNumber, extension);
  }

  public boolean isVideo() {
    return recognized && extension == MediaExtension.VIDEO;
  }

  /** Render back to the canonical upper-case filename. */
  public String toFilename() {
    if (!recognized) {
      throw new IllegalStateException("Unrecognized names have no canonical filename");
    }
    return String.format(
        "G%s%02d%04d.%s", encoding.name(), chapterNumber, sequenceNumber, extension.suffix());
  }
}
