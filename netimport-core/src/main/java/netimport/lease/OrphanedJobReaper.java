package netimport.lease;

import netimport.model.Job;
import netimport.model.LogLevel;
import netimport.runner.JobLogSink;
import netimport.runner.JobRunner;
import netimport.spi.ConnectionProvider;
import netimport.spi.JobStore;
import netimport.spi.MetricsExporter;
import netimport.util.Connections;
import netimport.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fails RUNNING jobs whose runner has stopped heart-beating.
 *
 * <p>A job is orphaned when its {@code heartbeat_at} is older than the lease timeout,
 * which happens when the process running it died. Each orphan is moved to FAILED with a
 * conditional update (so a runner that heart-beats in the meantime wins) and then gets an
 * ERROR entry naming the silent runner. Orphans are never re-queued: an import may have
 * partially applied changes.
 *
 * <p>Create instances via {@link #builder()}.
 */
public final class OrphanedJobReaper implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(OrphanedJobReaper.class.getName());

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;
  private final Duration leaseTimeout;
  private final long intervalSeconds;
  private final int batchSize;
  private final MetricsExporter metrics;
  private final Clock clock;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> reapTask;
  private volatile boolean closed;

  private OrphanedJobReaper(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
    if (builder.leaseTimeout.isNegative() || builder.leaseTimeout.isZero()) {
      throw new IllegalArgumentException("leaseTimeout must be positive");
    }
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    this.leaseTimeout = builder.leaseTimeout;
    this.intervalSeconds = builder.intervalSeconds;
    this.batchSize = builder.batchSize;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled reap loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("OrphanedJobReaper has been closed");
    }
    if (reapTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("netimport-reaper-"));
    reapTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Executes a single reap cycle. May be invoked directly for testing.
   *
   * @return number of jobs failed in this cycle
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    try {
      Instant now = clock.instant();
      Instant staleBefore = now.minus(leaseTimeout);
      List<Job> stale = Connections.withConnection(connectionProvider, "find orphaned jobs",
          conn -> jobStore.findStaleRunning(conn, staleBefore, batchSize));
      int reaped = 0;
      for (Job job : stale) {
        if (reap(job, staleBefore, now)) {
          reaped++;
        }
      }
      if (reaped > 0) {
        logger.log(Level.WARNING, "Failed {0} orphaned job(s) with no heartbeat since {1}",
            new Object[]{reaped, staleBefore});
      }
      return reaped;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Reap cycle failed", t);
      return 0;
    }
  }

  private boolean reap(Job job, Instant staleBefore, Instant now) {
    int updated = Connections.withConnection(connectionProvider, "fail orphaned job " + job.id(),
        conn -> jobStore.markOrphaned(conn, job.id(), staleBefore, now));
    if (updated == 0) {
      return false;
    }
    metrics.incrementOrphaned();
    String message = "Runner " + job.runnerId() + " stopped reporting progress (last heartbeat "
        + job.heartbeatAt() + "); job marked failed";
    try {
      JobLogSink.open(connectionProvider, jobStore, job.id(), clock)
          .append(LogLevel.ERROR, message, JobRunner.RUNNER_SOURCE);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to record orphan summary for job " + job.id(), e);
    }
    return true;
  }

  /** Cancels the reap schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (reapTask != null) {
      reapTask.cancel(false);
      reapTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link OrphanedJobReaper}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private JobStore jobStore;
    private Duration leaseTimeout = Duration.ofMinutes(5);
    private long intervalSeconds = 60;
    private int batchSize = 100;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {}

    /**
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param jobStore the job store
     * @return this builder
     */
    public Builder jobStore(JobStore jobStore) {
      this.jobStore = jobStore;
      return this;
    }

    /**
     * Sets how long a RUNNING job may go without a heartbeat.
     *
     * <p>Optional. Defaults to 5 minutes. Must be positive and several times the runner's
     * heartbeat interval.
     *
     * @param leaseTimeout the lease
     * @return this builder
     */
    public Builder leaseTimeout(Duration leaseTimeout) {
      this.leaseTimeout = Objects.requireNonNull(leaseTimeout, "leaseTimeout");
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 60}. Must be &gt; 0.
     *
     * @param intervalSeconds seconds between reap cycles
     * @return this builder
     */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 100}. Must be &gt; 0.
     *
     * @param batchSize maximum jobs examined per cycle
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock time source
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public OrphanedJobReaper build() {
      return new OrphanedJobReaper(this);
    }
  }
}
