package com.scholary.chapters.job;

import java.util.Locale;

/**
 * Lifecycle of a concatenation job.
 *
 * <pre>
 * QUEUED -&gt; ACTIVE -&gt; COMPLETED
 *                  \-&gt; FAILED
 * </pre>
 *
 * <p>There is no retry state: one job is one attempt. Re-processing a group creates a new job.
 */
public enum JobState {
  QUEUED,
  ACTIVE,
  COMPLETED,
  FAILED;

  public boolean canTransitionTo(JobState next) {
    return switch (this) {
      case QUEUED -> next == ACTIVE;
      case ACTIVE -> next == ACTIVE || next == COMPLETED || next == FAILED;
      case COMPLETED, FAILED -> false;
    };
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  /** Lower-case name used in API responses, e.g. {@code queued}. */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
