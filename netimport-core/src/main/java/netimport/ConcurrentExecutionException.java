package netimport;

import netimport.model.JobStatus;

/**
 * Thrown by the runner when a job is not {@link JobStatus#QUEUED} at the moment it
 * tries to claim it. The job record is left untouched.
 */
public final class ConcurrentExecutionException extends RuntimeException {
  private final String jobId;
  private final JobStatus observedStatus;

  public ConcurrentExecutionException(String jobId, JobStatus observedStatus) {
    super("Job " + jobId + " is " + observedStatus + ", expected QUEUED");
    this.jobId = jobId;
    this.observedStatus = observedStatus;
  }

  public String jobId() {
    return jobId;
  }

  public JobStatus observedStatus() {
    return observedStatus;
  }
}
