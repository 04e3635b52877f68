package netimport.dispatch;

import netimport.spi.WorkerTransport;
import netimport.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Probes the {@link WorkerTransport} for live workers, giving up after a fixed timeout.
 *
 * <p>The transport call runs on a daemon thread so that a hung broker cannot block the
 * caller past the timeout; a timed-out call is cancelled and left to finish on its own.
 * At most {@code maxPendingProbes} transport calls are in flight at once. While that many
 * are still stuck, further probes report the backend unavailable without calling the
 * transport.
 */
public final class WorkerPoolDetector implements ExecutionBackendDetector, AutoCloseable {
  private static final Logger logger = Logger.getLogger(WorkerPoolDetector.class.getName());

  static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(2);
  static final int DEFAULT_MAX_PENDING_PROBES = 4;

  private final WorkerTransport transport;
  private final Duration timeout;
  private final ExecutorService probeExecutor;

  public WorkerPoolDetector(WorkerTransport transport) {
    this(transport, DEFAULT_TIMEOUT);
  }

  public WorkerPoolDetector(WorkerTransport transport, Duration timeout) {
    this(transport, timeout, DEFAULT_MAX_PENDING_PROBES);
  }

  public WorkerPoolDetector(WorkerTransport transport, Duration timeout, int maxPendingProbes) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    if (maxPendingProbes <= 0) {
      throw new IllegalArgumentException("maxPendingProbes must be > 0");
    }
    this.probeExecutor = new ThreadPoolExecutor(0, maxPendingProbes, 60L, TimeUnit.SECONDS,
        new SynchronousQueue<>(), new DaemonThreadFactory("netimport-probe-"));
  }

  @Override
  public BackendProbe probe() {
    Future<List<String>> pending;
    try {
      pending = probeExecutor.submit(() -> transport.ping(timeout));
    } catch (RejectedExecutionException e) {
      logger.log(Level.FINE, "Skipping worker probe: earlier probes still pending");
      return BackendProbe.unavailable("earlier probes still pending");
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Worker probe could not be started", e);
      return BackendProbe.unavailable("probe could not be started: " + e.getMessage());
    }
    try {
      List<String> workers = pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (workers == null || workers.isEmpty()) {
        return BackendProbe.unavailable("no live workers");
      }
      return BackendProbe.available(workers);
    } catch (TimeoutException e) {
      pending.cancel(true);
      logger.log(Level.FINE, "Worker probe timed out after {0} ms", timeout.toMillis());
      return BackendProbe.unavailable("probe timed out after " + timeout.toMillis() + " ms");
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      logger.log(Level.FINE, "Worker probe failed", cause);
      return BackendProbe.unavailable("broker unreachable: " + cause.getMessage());
    } catch (InterruptedException e) {
      pending.cancel(true);
      Thread.currentThread().interrupt();
      return BackendProbe.unavailable("probe interrupted");
    }
  }

  public Duration timeout() {
    return timeout;
  }

  @Override
  public void close() {
    probeExecutor.shutdownNow();
  }
}
