package com.scholary.chapters.upload;

import com.scholary.chapters.config.MergerProperties;
import com.scholary.chapters.grouping.FileDescriptor;
import com.scholary.chapters.grouping.SequenceGroup;
import com.scholary.chapters.grouping.ValidationException;
import com.scholary.chapters.job.ConcatenationJob;
import com.scholary.chapters.job.GroupBusyException;
import com.scholary.chapters.job.JobRepository;
import com.scholary.chapters.naming.MediaExtension;
import com.scholary.chapters.storage.StorageLayout;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

/**
 * Stores uploaded camera files and groups them into sequences.
 *
 * <p>The whole request is checked before anything is written: an empty request, too many files, a
 * file that is not MP4/LRV/THM, a name given twice, a file still used by a waiting or running job
 * or a chapter the session already has under another name rejects the upload as a whole.
 * Re-uploading a file no job is using replaces it.
 */
@Service
public class UploadService {

  private static final Logger LOGGER = LoggerFactory.getLogger(UploadService.class);

  private final StorageLayout layout;
  private final SessionFileRegistry registry;
  private final JobRepository jobs;
  private final int maxFilesPerUpload;

  public UploadService(
      StorageLayout layout,
      SessionFileRegistry registry,
      JobRepository jobs,
      MergerProperties properties) {
    this.layout = layout;
    this.registry = registry;
    this.jobs = jobs;
    this.maxFilesPerUpload = properties.maxFilesPerUpload();
  }

  /**
   * Store files for a session and return the session's groups.
   *
   * @param requestedSessionId the client's session id, or null/blank to start a new session
   * @param files the uploaded parts
   * @throws ValidationException if the request is rejected or no group can be formed
   * @throws GroupBusyException if a file would replace the input of a waiting or running job
   * @throws IOException if a file cannot be written
   */
  public UploadResult upload(String requestedSessionId, List<MultipartFile> files)
      throws IOException {
    String sessionId =
        requestedSessionId == null || requestedSessionId.isBlank()
            ? UUID.randomUUID().toString()
            : StorageLayout.requireValidSessionId(requestedSessionId);

    validate(files);

    List<FileDescriptor> planned = plan(sessionId, files);
    rejectInUse(sessionId, planned);
    if (registry.preview(sessionId, planned).isEmpty()) {
      throw new ValidationException("No valid chapter groups detected");
    }

    List<FileDescriptor> stored = new ArrayList<>(files.size());
    for (int i = 0; i < files.size(); i++) {
      stored.add(store(files.get(i), planned.get(i).storedPath()));
    }
    LOGGER.info("Stored {} files for session {}", stored.size(), sessionId);

    List<SequenceGroup> groups = registry.register(sessionId, stored);
    LOGGER.info("Session {} now has {} groups", sessionId, groups.size());
    return new UploadResult(sessionId, groups);
  }

  private void validate(List<MultipartFile> files) {
    if (files == null || files.isEmpty()) {
      throw new ValidationException("No files uploaded");
    }
    if (files.size() > maxFilesPerUpload) {
      throw new ValidationException(
          String.format(
              "Too many files: %d uploaded, at most %d allowed", files.size(), maxFilesPerUpload));
    }
    for (MultipartFile file : files) {
      String name = file.getOriginalFilename();
      if (!isSupported(name)) {
        throw new ValidationException("File type not supported: " + name);
      }
    }
  }

  /** Where each file will be written. Names differing only in case count as the same file. */
  private List<FileDescriptor> plan(String sessionId, List<MultipartFile> files) {
    List<FileDescriptor> planned = new ArrayList<>(files.size());
    Set<String> seen = new HashSet<>();
    for (MultipartFile file : files) {
      Path target = layout.uploadPath(sessionId, file.getOriginalFilename());
      String name = target.getFileName().toString();
      if (!seen.add(name.toLowerCase(Locale.ROOT))) {
        throw new ValidationException("Duplicate file in upload: " + name);
      }
      planned.add(new FileDescriptor(name, target, file.getSize()));
    }
    return planned;
  }

  private void rejectInUse(String sessionId, List<FileDescriptor> planned) {
    for (ConcatenationJob job : jobs.findBySession(sessionId)) {
      if (job.state().isTerminal()) {
        continue;
      }
      Set<String> inputs = new HashSet<>();
      job.group().inputPaths().forEach(path -> inputs.add(caseless(path)));
      for (FileDescriptor file : planned) {
        if (inputs.contains(caseless(file.storedPath()))) {
          throw new GroupBusyException(
              job.groupId(),
              job.jobId(),
              String.format(
                  "File %s is in use by job %s of group %s",
                  file.originalName(), job.jobId(), job.groupId()));
        }
      }
    }
  }

  private static String caseless(Path path) {
    return path.toAbsolutePath().normalize().toString().toLowerCase(Locale.ROOT);
  }

  private FileDescriptor store(MultipartFile file, Path target) throws IOException {
    Files.createDirectories(target.getParent());

    try (InputStream in = file.getInputStream()) {
      Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
    }

    LOGGER.debug("Stored {} at {}", file.getOriginalFilename(), target);
    return new FileDescriptor(target.getFileName().toString(), target, Files.size(target));
  }

  /** MP4, LRV and THM in any case; the name itself does not have to follow the camera scheme. */
  static boolean isSupported(String filename) {
    if (filename == null) {
      return false;
    }
    int dot = filename.lastIndexOf('.');
    return dot >= 0 && MediaExtension.fromSuffix(filename.substring(dot + 1)).isPresent();
  }
}
