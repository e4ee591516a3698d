package com.scholary.chapters.api;

import com.scholary.chapters.objectstore.OutputArchiver;
import com.scholary.chapters.storage.OutputFile;
import com.scholary.chapters.storage.OutputFileRegistry;
import com.scholary.chapters.storage.StorageLayout;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.FileSystemResource;
import org.springframework.core.io.Resource;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/**
 * Listing and download of merged files.
 *
 * <p>Only outputs recorded by a successful job are served; a file still being written by a running
 * job is not downloadable even though it exists on disk.
 */
@RestController
@Tag(name = "Outputs", description = "List and download merged files")
public class OutputController {

  private static final Logger LOGGER = LoggerFactory.getLogger(OutputController.class);

  private final StorageLayout layout;
  private final OutputFileRegistry outputs;
  private final OutputArchiver archiver;

  public OutputController(
      StorageLayout layout, OutputFileRegistry outputs, OutputArchiver archiver) {
    this.layout = layout;
    this.outputs = outputs;
    this.archiver = archiver;
  }

  @GetMapping("/api/files/{sessionId}")
  @Operation(summary = "List outputs", description = "Completed merged files of a session")
  public OutputFilesResponse listFiles(@PathVariable String sessionId) {
    StorageLayout.requireValidSessionId(sessionId);
    return new OutputFilesResponse(
        sessionId,
        outputs.findBySession(sessionId).stream()
            .map(OutputFilesResponse.OutputFileView::from)
            .toList());
  }

  /**
   * Download one merged file.
   *
   * <p>Served from local disk when present. If the local copy is gone but the file was archived,
   * redirects to a presigned object-store URL.
   */
  @GetMapping("/api/download/{sessionId}/{filename}")
  @Operation(summary = "Download output", description = "Stream a merged file as an attachment")
  public ResponseEntity<Resource> download(
      @PathVariable String sessionId, @PathVariable String filename) {
    Optional<Path> path = layout.resolveOutput(sessionId, filename);
    Optional<OutputFile> record = outputs.find(sessionId, filename);
    if (path.isEmpty() || record.isEmpty()) {
      LOGGER.debug("Download of unknown output {}/{}", sessionId, filename);
      return ResponseEntity.notFound().build();
    }

    if (Files.isRegularFile(path.get())) {
      return ResponseEntity.ok()
          .contentType(MediaType.parseMediaType("video/mp4"))
          .header(
              HttpHeaders.CONTENT_DISPOSITION,
              ContentDisposition.attachment().filename(filename).build().toString())
          .body(new FileSystemResource(path.get()));
    }

    Optional<URL> archived = archiver.downloadUrl(record.get().archiveKey());
    if (archived.isPresent()) {
      try {
        return ResponseEntity.status(302).location(archived.get().toURI()).build();
      } catch (URISyntaxException e) {
        LOGGER.warn("Presigned URL for {} is not a valid URI", record.get().archiveKey(), e);
      }
    }

    LOGGER.warn("Output {}/{} is recorded but no copy is available", sessionId, filename);
    return ResponseEntity.notFound().build();
  }
}
