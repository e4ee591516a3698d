package com.scholary.chapters.storage;

import com.scholary.chapters.grouping.ValidationException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * On-disk layout of sessions.
 *
 * <pre>
 * uploadRoot/&lt;sessionId&gt;/&lt;originalFilename&gt;
 * outputRoot/&lt;sessionId&gt;/Merged_&lt;groupId&gt;_&lt;timestamp&gt;_&lt;job&gt;.mp4
 * </pre>
 *
 * <p>Input files are written once at upload time and only read afterwards. Output names include
 * the job id, so two jobs never write to the same path even when they merge the same group in the
 * same millisecond.
 */
@Component
public class StorageLayout {

  private static final Pattern SESSION_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");
  private static final DateTimeFormatter STAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS'Z'").withZone(ZoneOffset.UTC);

  private final Path uploadRoot;
  private final Path outputRoot;

  public StorageLayout(
      @Value("${merger.uploadRoot}") String uploadRoot,
      @Value("${merger.outputRoot}") String outputRoot) {
    this.uploadRoot = Paths.get(uploadRoot).toAbsolutePath().normalize();
    this.outputRoot = Paths.get(outputRoot).toAbsolutePath().normalize();
  }

  public Path uploadRoot() {
    return uploadRoot;
  }

  public Path outputRoot() {
    return outputRoot;
  }

  public static boolean isValidSessionId(String sessionId) {
    return sessionId != null && SESSION_ID.matcher(sessionId).matches();
  }

  /**
   * Check a client-supplied session id before it is used to build paths.
   *
   * @throws ValidationException if the id could escape its directory
   */
  public static String requireValidSessionId(String sessionId) {
    if (!isValidSessionId(sessionId)) {
      throw new ValidationException("Invalid session id: " + sessionId);
    }
    return sessionId;
  }

  public Path uploadDir(String sessionId) {
    return uploadRoot.resolve(requireValidSessionId(sessionId));
  }

  public Path outputDir(String sessionId) {
    return outputRoot.resolve(requireValidSessionId(sessionId));
  }

  /**
   * Where an uploaded file is stored. Directory components of the client name are dropped.
   *
   * @throws ValidationException if nothing usable is left of the name
   */
  public Path uploadPath(String sessionId, String originalName) {
    String baseName = baseName(originalName);
    if (baseName.isEmpty() || baseName.equals(".") || baseName.equals("..")) {
      throw new ValidationException("Invalid file name: " + originalName);
    }
    return uploadDir(sessionId).resolve(baseName);
  }

  /** Generate the output path for one job run. */
  public Path newOutputPath(String sessionId, String groupId, String jobId, Instant createdAt) {
    String jobPart = jobId.replace("-", "");
    if (jobPart.length() > 8) {
      jobPart = jobPart.substring(0, 8);
    }
    String filename =
        String.format("Merged_%s_%s_%s.mp4", groupId, STAMP.format(createdAt), jobPart);
    return outputDir(sessionId).resolve(filename);
  }

  /**
   * Resolve a client-supplied output filename.
   *
   * @return the path inside the session's output directory, or empty if the name would leave it
   */
  public Optional<Path> resolveOutput(String sessionId, String filename) {
    if (!isValidSessionId(sessionId) || filename == null || filename.isBlank()) {
      return Optional.empty();
    }
    Path sessionDir = outputRoot.resolve(sessionId);
    Path resolved = sessionDir.resolve(filename).normalize();
    if (resolved.getParent() == null || !resolved.getParent().equals(sessionDir)) {
      return Optional.empty();
    }
    return Optional.of(resolved);
  }

  private static String baseName(String name) {
    if (name == null) {
      return "";
    }
    String normalized = name.replace('\\', '/');
    return normalized.substring(normalized.lastIndexOf('/') + 1).strip();
  }
}
