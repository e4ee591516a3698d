package com.scholary.chapters.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Archiving is best-effort, so callers log this and keep the local output.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
