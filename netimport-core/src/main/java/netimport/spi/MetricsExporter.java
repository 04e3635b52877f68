package netimport.spi;

import netimport.dispatch.ExecutionMode;

/**
 * Observability hook for exporting job counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of accepted submissions, by how they were executed.
   *
   * @param mode inline or queued
   */
  void incrementSubmitted(ExecutionMode mode);

  /**
   * Increments the count of submissions rejected as invalid.
   */
  void incrementRejected();

  /**
   * Increments the count of jobs that reached COMPLETED.
   */
  void incrementCompleted();

  /**
   * Increments the count of jobs that reached FAILED after running.
   */
  void incrementFailed();

  /**
   * Increments the count of jobs that failed because they could not be enqueued.
   */
  void incrementDispatchFailure();

  /**
   * Increments the count of run attempts rejected because the job was not QUEUED.
   */
  default void incrementConcurrentExecution() {
  }

  /**
   * Increments the count of RUNNING jobs failed after their runner stopped heart-beating.
   */
  default void incrementOrphaned() {
  }

  /**
   * Records the number of jobs currently executing in this process.
   *
   * @param running jobs in progress
   */
  default void recordRunningJobs(int running) {
  }

  /**
   * Records how many live workers the last probe saw.
   *
   * @param workers live worker count
   */
  default void recordLiveWorkers(int workers) {
  }

  /**
   * Records wall-clock time from RUNNING to the terminal state.
   *
   * @param durationMs duration in milliseconds (always non-negative)
   */
  default void recordJobDurationMs(long durationMs) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementSubmitted(ExecutionMode mode) {
    }

    @Override
    public void incrementRejected() {
    }

    @Override
    public void incrementCompleted() {
    }

    @Override
    public void incrementFailed() {
    }

    @Override
    public void incrementDispatchFailure() {
    }
  }
}
