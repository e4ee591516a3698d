package com.scholary.chapters.ffmpeg;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the ordered input list read by ffmpeg's concat demuxer.
 *
 * <p>Format, one record per line:
 *
 * <pre>
 * file '/uploads/s1/GX010150.MP4'
 * file '/uploads/s1/it'\''s GX020150.MP4'
 * </pre>
 *
 * <p>Inside single quotes the demuxer takes every character literally, so the only character that
 * needs treatment is the quote itself: close the quote, emit an escaped quote, reopen. Line breaks
 * cannot be represented at all because the demuxer reads the manifest line by line.
 */
final class ConcatManifest {

  private ConcatManifest() {}

  static String render(List<Path> orderedInputs) {
    StringBuilder manifest = new StringBuilder();
    for (Path input : orderedInputs) {
      manifest.append("file ").append(quote(input.toAbsolutePath().toString())).append('\n');
    }
    return manifest.toString();
  }

  static String quote(String path) {
    if (path.indexOf('\n') >= 0 || path.indexOf('\r') >= 0) {
      throw new IllegalArgumentException("Path contains a line break: " + path);
    }
    return "'" + path.replace("'", "'\\''") + "'";
  }

  /**
   * Write a manifest to a fresh temporary file.
   *
   * <p>If writing fails partway the half-written file is removed before the exception propagates.
   *
   * @param directory where to create the file
   * @param orderedInputs inputs in playback order
   * @return the manifest path; the caller owns its deletion
   */
  static Path write(Path directory, List<Path> orderedInputs) throws IOException {
    String content = render(orderedInputs);
    Files.createDirectories(directory);
    Path manifest = Files.createTempFile(directory, "concat-", ".txt");
    try (Writer writer = Files.newBufferedWriter(manifest, StandardCharsets.UTF_8)) {
      writer.write(content);
    } catch (IOException | RuntimeException e) {
      Files.deleteIfExists(manifest);
      throw e;
    }
    return manifest;
  }
}
