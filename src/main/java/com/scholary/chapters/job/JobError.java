package com.scholary.chapters.job;

/** Failure attached to a job in the FAILED state. */
public record JobError(JobErrorKind kind, String message) {

  public static JobError inputMissing(String message) {
    return new JobError(JobErrorKind.INPUT_MISSING, message);
  }

  public static JobError concatenationFailed(String message) {
    return new JobError(JobErrorKind.CONCATENATION_FAILED, message);
  }
}
