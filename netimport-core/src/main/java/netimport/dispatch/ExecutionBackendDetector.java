package netimport.dispatch;

/**
 * Decides, per submission, whether queued execution is possible right now.
 *
 * <p>Implementations must return within a bounded time and must not throw: any failure
 * is reported as {@code available=false} with a reason. Results are never cached.
 *
 * @see WorkerPoolDetector
 */
@FunctionalInterface
public interface ExecutionBackendDetector {

  BackendProbe probe();

  /**
   * A detector that always reports the backend unavailable, forcing inline execution.
   *
   * @param reason reported with every probe
   * @return the detector
   */
  static ExecutionBackendDetector immediateOnly(String reason) {
    BackendProbe probe = BackendProbe.unavailable(reason);
    return () -> probe;
  }
}
