package com.scholary.chapters.api;

import com.scholary.chapters.logging.StructuredLogger;
import com.scholary.chapters.upload.UploadResult;
import com.scholary.chapters.upload.UploadService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.io.IOException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** Upload of camera files into a session. */
@RestController
@Tag(name = "Upload", description = "Upload chapter files and detect recording sequences")
public class UploadController {

  public static final String SESSION_HEADER = "X-Session-Id";

  private static final Logger LOGGER = LoggerFactory.getLogger(UploadController.class);

  private final UploadService uploadService;

  public UploadController(UploadService uploadService) {
    this.uploadService = uploadService;
  }

  /**
   * Upload files and return the session's groups.
   *
   * <p>Without an {@code X-Session-Id} header a new session is started; its id is in the response
   * and should be sent with later uploads and processing requests.
   */
  @PostMapping(path = "/api/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  @Operation(
      summary = "Upload chapter files",
      description =
          "Store MP4/LRV/THM files for a session and group the session's videos by recording "
              + "sequence. Returns every group the session has.")
  public ResponseEntity<UploadResponse> upload(
      @RequestHeader(value = SESSION_HEADER, required = false) String sessionId,
      @RequestParam(value = "files", required = false) List<MultipartFile> files)
      throws IOException {
    try {
      if (sessionId != null) {
        StructuredLogger.setSessionContext(sessionId);
      }
      LOGGER.info("Upload request: files={}", files == null ? 0 : files.size());

      UploadResult result = uploadService.upload(sessionId, files);
      return ResponseEntity.ok(
          new UploadResponse(
              result.sessionId(), result.groups().stream().map(GroupView::from).toList()));
    } finally {
      StructuredLogger.clearSessionContext();
    }
  }
}
