package netimport.model;

/**
 * Log counters for a single job.
 */
public record JobStats(long logCount, long errorLogCount) {

  public static final JobStats EMPTY = new JobStats(0, 0);

  public boolean hasErrors() {
    return errorLogCount > 0;
  }
}
