package netimport.runner;

import netimport.ConcurrentExecutionException;
import netimport.JobNotFoundException;
import netimport.JobStoreException;
import netimport.SettingsNotFoundException;
import netimport.model.Job;
import netimport.model.JobStatus;
import netimport.model.LogLevel;
import netimport.settings.ImportConfigGenerator;
import netimport.settings.ResolvedSettings;
import netimport.spi.ConnectionProvider;
import netimport.spi.ImportExecutor;
import netimport.spi.ImportLog;
import netimport.spi.ImportRequest;
import netimport.spi.ImportResult;
import netimport.spi.JobStore;
import netimport.spi.MetricsExporter;
import netimport.spi.SettingsResolver;
import netimport.util.Connections;
import netimport.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Executes one import job end to end. The same instance serves inline execution from
 * the dispatcher and queued execution from a {@link netimport.worker.JobWorker}.
 *
 * <p>{@link #run(String)} claims the job with a conditional {@code QUEUED -> RUNNING}
 * update, resolves its settings, invokes the {@link ImportExecutor} while streaming every
 * emitted line into the job log, and finishes with exactly one terminal transition:
 * <ul>
 *   <li>executor returned {@code success=true}: COMPLETED</li>
 *   <li>executor returned {@code success=false}, threw, or settings could not be
 *       resolved: an ERROR summary entry, then FAILED</li>
 * </ul>
 * Nothing is appended to the job log on the success path beyond what the executor emits.
 *
 * <p>While a job runs, its {@code heartbeat_at} is refreshed every
 * {@link Builder#heartbeatIntervalMs heartbeat interval} so that an
 * {@link netimport.lease.OrphanedJobReaper} can tell live jobs from abandoned ones.
 *
 * <p>This class is thread-safe; distinct jobs may run concurrently.
 */
public final class JobRunner implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(JobRunner.class.getName());

  /** {@code source} of entries written by the runner itself. */
  public static final String RUNNER_SOURCE = "netimport";

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;
  private final SettingsResolver settingsResolver;
  private final ImportExecutor importExecutor;
  private final ImportConfigGenerator configGenerator;
  private final MetricsExporter metrics;
  private final String runnerId;
  private final long heartbeatIntervalMs;
  private final String executorSource;
  private final Clock clock;

  private final Set<String> activeJobs = ConcurrentHashMap.newKeySet();
  private ScheduledExecutorService heartbeats;
  private volatile boolean closed;

  private JobRunner(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
    this.settingsResolver = Objects.requireNonNull(builder.settingsResolver, "settingsResolver");
    this.importExecutor = Objects.requireNonNull(builder.importExecutor, "importExecutor");
    if (builder.heartbeatIntervalMs <= 0L) {
      throw new IllegalArgumentException("heartbeatIntervalMs must be > 0");
    }
    this.heartbeatIntervalMs = builder.heartbeatIntervalMs;
    this.configGenerator = builder.configGenerator != null ? builder.configGenerator : new ImportConfigGenerator();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.runnerId = builder.runnerId != null
        ? builder.runnerId
        : "runner-" + UUID.randomUUID().toString().substring(0, 8);
    this.executorSource = Objects.requireNonNull(builder.executorSource, "executorSource");
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Runs a queued job to a terminal state.
   *
   * @param jobId the job to run
   * @return the job as stored after its terminal transition
   * @throws JobNotFoundException         if no such job exists
   * @throws ConcurrentExecutionException if the job is not QUEUED; nothing is modified
   * @throws JobStoreException            if the job record cannot be read or updated
   */
  public Job run(String jobId) {
    Objects.requireNonNull(jobId, "jobId");
    if (closed) {
      throw new IllegalStateException("JobRunner has been closed");
    }
    Instant startedAt = clock.instant();
    claim(jobId, startedAt);
    Job job = load(jobId).orElseThrow(() -> new JobNotFoundException(jobId));

    activeJobs.add(jobId);
    metrics.recordRunningJobs(activeJobs.size());
    ensureHeartbeats();
    JobLogSink sink = null;
    try {
      sink = JobLogSink.open(connectionProvider, jobStore, jobId, clock);
      String failure = execute(job, sink);
      finish(job, sink, failure, startedAt);
    } catch (Throwable t) {
      abort(jobId, sink, t);
      throw t;
    } finally {
      activeJobs.remove(jobId);
      metrics.recordRunningJobs(activeJobs.size());
    }
    return load(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  private void claim(String jobId, Instant startedAt) {
    int updated;
    try {
      updated = Connections.withConnection(connectionProvider, "claim job " + jobId,
          conn -> jobStore.markRunning(conn, jobId, runnerId, startedAt));
    } catch (JobStoreException e) {
      // Some databases abort the losing side of a row-lock race instead of returning 0
      Optional<Job> current = load(jobId);
      if (current.isPresent() && current.get().status() != JobStatus.QUEUED) {
        metrics.incrementConcurrentExecution();
        throw new ConcurrentExecutionException(jobId, current.get().status());
      }
      throw e;
    }
    if (updated == 0) {
      Job current = load(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
      metrics.incrementConcurrentExecution();
      logger.log(Level.WARNING, "Refusing to run job {0}: status is {1}",
          new Object[]{jobId, current.status()});
      throw new ConcurrentExecutionException(jobId, current.status());
    }
  }

  /**
   * Returns {@code null} on success, otherwise the failure summary.
   */
  private String execute(Job job, JobLogSink sink) {
    ImportLog importLog = (level, message) -> sink.append(level, message, executorSource);
    try {
      ResolvedSettings resolved = settingsResolver.resolve(job.siteCode(), job.settings());
      Map<String, String> config = configGenerator.generate(job.siteCode(), resolved);
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Job " + job.id() + " import configuration: " + ImportConfigGenerator.sanitize(config));
      }
      ImportRequest request = new ImportRequest(job.id(), job.siteCode(), job.mode(), resolved, config);
      ImportResult result = importExecutor.execute(request, importLog);
      if (result == null) {
        return "Import returned no result";
      }
      if (result.success()) {
        return null;
      }
      return result.summary() == null || result.summary().isBlank()
          ? "Import reported failure"
          : "Import reported failure: " + result.summary();
    } catch (SettingsNotFoundException e) {
      logger.log(Level.WARNING, "Job " + job.id() + ": " + e.getMessage());
      return "Settings resolution failed: " + e.getMessage();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return "Import interrupted";
    } catch (Exception e) {
      logger.log(Level.WARNING, "Import for job " + job.id() + " raised an exception", e);
      return "Import failed: " + describe(e);
    }
  }

  private void finish(Job job, JobLogSink sink, String failure, Instant startedAt) {
    String jobId = job.id();
    Instant completedAt = clock.instant();
    if (completedAt.isBefore(startedAt)) {
      completedAt = startedAt;
    }
    Instant end = completedAt;
    int updated;
    if (failure == null) {
      updated = Connections.withConnection(connectionProvider, "complete job " + jobId,
          conn -> jobStore.markCompleted(conn, jobId, end));
      if (updated > 0) {
        metrics.incrementCompleted();
      }
    } else {
      try {
        sink.append(LogLevel.ERROR, failure, RUNNER_SOURCE);
      } catch (JobStoreException e) {
        logger.log(Level.SEVERE, "Failed to record failure summary for job " + jobId, e);
      }
      updated = Connections.withConnection(connectionProvider, "fail job " + jobId,
          conn -> jobStore.markFailed(conn, jobId, end));
      if (updated > 0) {
        metrics.incrementFailed();
      }
    }
    if (updated == 0) {
      logger.log(Level.WARNING, "Job {0} left RUNNING before its runner finished; terminal update skipped",
          jobId);
      return;
    }
    metrics.recordJobDurationMs(Math.max(0L, Duration.between(startedAt, end).toMillis()));
  }

  /**
   * Moves a claimed job to FAILED after the run itself broke down. Never throws; a
   * job that cannot be updated here is left for the orphan reaper.
   */
  private void abort(String jobId, JobLogSink sink, Throwable cause) {
    logger.log(Level.SEVERE, "Runner aborted job " + jobId, cause);
    try {
      JobLogSink target = sink != null ? sink : JobLogSink.open(connectionProvider, jobStore, jobId, clock);
      target.append(LogLevel.ERROR, "Runner aborted: " + describe(cause), RUNNER_SOURCE);
    } catch (RuntimeException e) {
      cause.addSuppressed(e);
      logger.log(Level.SEVERE, "Failed to record abort summary for job " + jobId, e);
    }
    try {
      Instant end = clock.instant();
      int updated = Connections.withConnection(connectionProvider, "fail job " + jobId,
          conn -> jobStore.markFailed(conn, jobId, end));
      if (updated > 0) {
        metrics.incrementFailed();
      }
    } catch (RuntimeException e) {
      cause.addSuppressed(e);
      logger.log(Level.SEVERE, "Failed to mark aborted job " + jobId + " as failed", e);
    }
  }

  private Optional<Job> load(String jobId) {
    return Connections.withConnection(connectionProvider, "load job " + jobId,
        conn -> jobStore.findById(conn, jobId));
  }

  private static String describe(Throwable e) {
    String message = e.getMessage();
    if (message == null || message.isBlank()) {
      return e.getClass().getName();
    }
    return message;
  }

  private synchronized void ensureHeartbeats() {
    if (heartbeats != null || closed) {
      return;
    }
    heartbeats = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("netimport-heartbeat-"));
    heartbeats.scheduleWithFixedDelay(this::beat, heartbeatIntervalMs, heartbeatIntervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Refreshes the heartbeat of every job this runner is executing. Called by the
   * heartbeat scheduler; may be invoked directly for testing.
   */
  public void beat() {
    Instant now = clock.instant();
    for (String jobId : activeJobs) {
      try {
        Connections.withConnection(connectionProvider, "heartbeat job " + jobId,
            conn -> jobStore.touchHeartbeat(conn, jobId, runnerId, now));
      } catch (RuntimeException e) {
        logger.log(Level.WARNING, "Heartbeat failed for job " + jobId, e);
      }
    }
  }

  public String runnerId() {
    return runnerId;
  }

  /** Number of jobs currently executing on this runner. */
  public int activeCount() {
    return activeJobs.size();
  }

  /**
   * Stops the heartbeat scheduler. Jobs still running keep running on their threads
   * but no longer refresh their heartbeat.
   */
  @Override
  public synchronized void close() {
    closed = true;
    if (heartbeats != null) {
      heartbeats.shutdownNow();
      try {
        heartbeats.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Builder for {@link JobRunner}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private JobStore jobStore;
    private SettingsResolver settingsResolver;
    private ImportExecutor importExecutor;
    private ImportConfigGenerator configGenerator;
    private MetricsExporter metrics;
    private String runnerId;
    private long heartbeatIntervalMs = 10_000;
    private String executorSource = "network-importer";
    private Clock clock;

    private Builder() {
    }

    /**
     * <b>Required.</b>
     *
     * @param connectionProvider source of JDBC connections
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <b>Required.</b>
     *
     * @param jobStore job and log persistence
     * @return this builder
     */
    public Builder jobStore(JobStore jobStore) {
      this.jobStore = jobStore;
      return this;
    }

    /**
     * <b>Required.</b>
     *
     * @param settingsResolver resolves the job's named settings
     * @return this builder
     */
    public Builder settingsResolver(SettingsResolver settingsResolver) {
      this.settingsResolver = settingsResolver;
      return this;
    }

    /**
     * <b>Required.</b>
     *
     * @param importExecutor adapter to the import library
     * @return this builder
     */
    public Builder importExecutor(ImportExecutor importExecutor) {
      this.importExecutor = importExecutor;
      return this;
    }

    /**
     * Optional. Defaults to a new {@link ImportConfigGenerator}.
     *
     * @param configGenerator configuration generator
     * @return this builder
     */
    public Builder configGenerator(ImportConfigGenerator configGenerator) {
      this.configGenerator = configGenerator;
      return this;
    }

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Identity recorded on claimed jobs. Optional; defaults to {@code runner-<8 hex>}.
     *
     * @param runnerId runner identity, e.g. the worker id
     * @return this builder
     */
    public Builder runnerId(String runnerId) {
      this.runnerId = runnerId;
      return this;
    }

    /**
     * Optional. Defaults to {@code 10000} ms. Must be &gt; 0 and well below the lease
     * timeout used by the reaper.
     *
     * @param heartbeatIntervalMs heartbeat period in milliseconds
     * @return this builder
     */
    public Builder heartbeatIntervalMs(long heartbeatIntervalMs) {
      this.heartbeatIntervalMs = heartbeatIntervalMs;
      return this;
    }

    /**
     * {@code source} recorded for lines emitted by the executor.
     * Optional. Defaults to {@code network-importer}.
     *
     * @param executorSource source label
     * @return this builder
     */
    public Builder executorSource(String executorSource) {
      this.executorSource = executorSource;
      return this;
    }

    /**
     * Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock time source for transitions and log timestamps
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * @return a new runner
     * @throws NullPointerException     if a required component is missing
     * @throws IllegalArgumentException if {@code heartbeatIntervalMs <= 0}
     */
    public JobRunner build() {
      return new JobRunner(this);
    }
  }
}
