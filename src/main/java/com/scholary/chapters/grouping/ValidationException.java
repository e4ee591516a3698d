package com.scholary.chapters.grouping;

/**
 * Thrown when a batch or request cannot be accepted as-is.
 *
 * <p>Reported synchronously to the caller; no job is ever created from a rejected request.
 */
public class ValidationException extends RuntimeException {

  public ValidationException(String message) {
    super(message);
  }
}
