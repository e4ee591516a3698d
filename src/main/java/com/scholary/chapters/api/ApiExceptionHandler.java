package com.scholary.chapters.api;

import com.scholary.chapters.grouping.DuplicateChapterException;
import com.scholary.chapters.grouping.ValidationException;
import com.scholary.chapters.job.ChannelUnavailableException;
import com.scholary.chapters.job.GroupBusyException;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

/**
 * Maps exceptions to JSON error responses.
 *
 * <p>Every error body has the same shape: {@code timestamp, status, error, message, path}. A few
 * errors add fields naming what they are about, such as the group and chapter of a duplicate.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(ValidationException.class)
  public ResponseEntity<Map<String, Object>> handleValidation(
      ValidationException ex, HttpServletRequest request) {
    LOGGER.warn("Validation error: {}", ex.getMessage());
    return buildErrorResponse(HttpStatus.BAD_REQUEST, "Validation Error", ex.getMessage(), request);
  }

  @ExceptionHandler(DuplicateChapterException.class)
  public ResponseEntity<Map<String, Object>> handleDuplicateChapter(
      DuplicateChapterException ex, HttpServletRequest request) {
    LOGGER.warn("Duplicate chapter: {}", ex.getMessage());
    Map<String, Object> body =
        errorBody(HttpStatus.BAD_REQUEST, "Validation Error", ex.getMessage(), request);
    body.put("groupId", ex.getGroupId());
    body.put("chapterNumber", ex.getChapterNumber());
    return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
  }

  @ExceptionHandler(GroupBusyException.class)
  public ResponseEntity<Map<String, Object>> handleGroupBusy(
      GroupBusyException ex, HttpServletRequest request) {
    LOGGER.warn("Group busy: {}", ex.getMessage());
    Map<String, Object> body = errorBody(HttpStatus.CONFLICT, "Conflict", ex.getMessage(), request);
    body.put("groupId", ex.getGroupId());
    body.put("jobId", ex.getJobId());
    return new ResponseEntity<>(body, HttpStatus.CONFLICT);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidBody(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    LOGGER.warn("Invalid request body: {}", message);
    return buildErrorResponse(HttpStatus.BAD_REQUEST, "Validation Error", message, request);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, Object>> handleUnreadableBody(
      HttpMessageNotReadableException ex, HttpServletRequest request) {
    LOGGER.warn("Unreadable request body: {}", ex.getMessage());
    return buildErrorResponse(
        HttpStatus.BAD_REQUEST, "Validation Error", "Invalid request data", request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<Map<String, Object>> handleUploadTooLarge(
      MaxUploadSizeExceededException ex, HttpServletRequest request) {
    LOGGER.warn("Upload too large: {}", ex.getMessage());
    return buildErrorResponse(
        HttpStatus.PAYLOAD_TOO_LARGE,
        "Payload Too Large",
        "Upload exceeds the size limit",
        request);
  }

  @ExceptionHandler(ChannelUnavailableException.class)
  public ResponseEntity<Map<String, Object>> handleChannelUnavailable(
      ChannelUnavailableException ex, HttpServletRequest request) {
    LOGGER.warn("Job queue unavailable: {}", ex.getMessage());
    return buildErrorResponse(
        HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", ex.getMessage(), request);
  }

  @ExceptionHandler(IOException.class)
  public ResponseEntity<Map<String, Object>> handleIo(IOException ex, HttpServletRequest request) {
    LOGGER.error("I/O error: {}", ex.getMessage(), ex);
    return buildErrorResponse(
        HttpStatus.INTERNAL_SERVER_ERROR,
        "Storage Error",
        "Could not store or read files",
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Map<String, Object>> handleUnexpected(
      Exception ex, HttpServletRequest request) {
    if (ex instanceof ErrorResponse) {
      // Framework exceptions (unknown path, wrong method, missing part) carry their own status
      HttpStatus status = HttpStatus.valueOf(((ErrorResponse) ex).getStatusCode().value());
      LOGGER.warn("Request rejected with {}: {}", status.value(), ex.getMessage());
      return buildErrorResponse(status, status.getReasonPhrase(), ex.getMessage(), request);
    }
    LOGGER.error("Unexpected exception occurred: {}", ex.getMessage(), ex);
    return buildErrorResponse(
        HttpStatus.INTERNAL_SERVER_ERROR,
        "Internal Server Error",
        "An unexpected error occurred",
        request);
  }

  private static ResponseEntity<Map<String, Object>> buildErrorResponse(
      HttpStatus status, String error, String message, HttpServletRequest request) {
    return new ResponseEntity<>(errorBody(status, error, message, request), status);
  }

  private static Map<String, Object> errorBody(
      HttpStatus status, String error, String message, HttpServletRequest request) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("timestamp", Instant.now().toString());
    body.put("status", status.value());
    body.put("error", error);
    body.put("message", message);
    body.put("path", request.getRequestURI());
    return body;
  }
}
