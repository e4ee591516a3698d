package com.scholary.chapters.job;

/**
 * A group already has a job waiting or running.
 *
 * <p>At most one job per group is in flight, so its progress events form a single ordered stream
 * and its input files are not replaced while being read.
 */
public class GroupBusyException extends RuntimeException {

  private final String groupId;
  private final String jobId;

  public GroupBusyException(String groupId, String jobId, String message) {
    super(message);
    this.groupId = groupId;
    this.jobId = jobId;
  }

  public String getGroupId() {
    return groupId;
  }

  public String getJobId() {
    return jobId;
  }
}
