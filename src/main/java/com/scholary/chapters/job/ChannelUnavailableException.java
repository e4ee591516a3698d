package com.scholary.chapters.job;

/**
 * The job queue or event channel cannot take work right now.
 *
 * <p>A system-level fault, not a job failure: no job was created, and jobs already running are
 * not affected.
 */
public class ChannelUnavailableException extends RuntimeException {

  public ChannelUnavailableException(String message) {
    super(message);
  }

  public ChannelUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
