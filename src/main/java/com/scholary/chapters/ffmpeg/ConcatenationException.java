package com.scholary.chapters.ffmpeg;

/**
 * Exception thrown when a concatenation fails.
 *
 * <p>Covers a non-zero exit, a process that could not be spawned, a timeout, or I/O around the
 * manifest. The message carries the diagnostic excerpt to show the user.
 */
public class ConcatenationException extends RuntimeException {

  private final Integer exitCode;

  public ConcatenationException(String message, Integer exitCode) {
    super(message);
    this.exitCode = exitCode;
  }

  public ConcatenationException(String message, Throwable cause) {
    super(message, cause);
    this.exitCode = null;
  }

  /** Exit code of the process, or null if it never ran to completion. */
  public Integer getExitCode() {
    return exitCode;
  }
}
