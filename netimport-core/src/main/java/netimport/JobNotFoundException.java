package netimport;

/**
 * Thrown when a job id does not resolve to a stored job.
 */
public final class JobNotFoundException extends RuntimeException {
  private final String jobId;

  public JobNotFoundException(String jobId) {
    super("Job not found: " + jobId);
    this.jobId = jobId;
  }

  public String jobId() {
    return jobId;
  }
}
