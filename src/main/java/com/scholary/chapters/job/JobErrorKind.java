package com.scholary.chapters.job;

/** Why a job failed. */
public enum JobErrorKind {
  /** An input file vanished between grouping and execution. */
  INPUT_MISSING,
  /** ffmpeg could not be started, exited non-zero, timed out, or an I/O step failed. */
  CONCATENATION_FAILED
}
