package netimport;

/**
 * Thrown by {@link netimport.dispatch.JobDispatcher#submit} when the probe reported
 * live workers but the job could not be handed to the transport. The job has already
 * been recorded as failed and can still be inspected through {@link #jobId()}.
 */
public final class DispatchFailureException extends RuntimeException {
  private final String jobId;

  public DispatchFailureException(String jobId, String message, Throwable cause) {
    super(message, cause);
    this.jobId = jobId;
  }

  public String jobId() {
    return jobId;
  }
}
