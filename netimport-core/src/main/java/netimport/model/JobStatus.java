package netimport.model;

import java.util.Locale;

/**
 * Lifecycle state of an import job.
 *
 * <p>Allowed transitions: {@code QUEUED -> RUNNING -> COMPLETED | FAILED} and
 * {@code QUEUED -> FAILED} when the job could not be dispatched. Terminal states
 * have no outgoing transitions.
 */
public enum JobStatus {
  QUEUED(0),
  RUNNING(1),
  COMPLETED(2),
  FAILED(3);

  private final int code;

  JobStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED;
  }

  public boolean canTransitionTo(JobStatus next) {
    switch (this) {
      case QUEUED:
        return next == RUNNING || next == FAILED;
      case RUNNING:
        return next == COMPLETED || next == FAILED;
      default:
        return false;
    }
  }

  /** API representation, e.g. {@code "running"}. */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static JobStatus fromCode(int code) {
    for (JobStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown job status code: " + code);
  }

  /**
   * Parses a case-insensitive status name.
   *
   * @throws IllegalArgumentException if the value names no status
   */
  public static JobStatus parse(String value) {
    if (value != null) {
      for (JobStatus status : values()) {
        if (status.name().equalsIgnoreCase(value.trim())) {
          return status;
        }
      }
    }
    throw new IllegalArgumentException("Unknown job status: " + value);
  }
}
