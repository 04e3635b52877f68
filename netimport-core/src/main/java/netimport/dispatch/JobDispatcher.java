package netimport.dispatch;

import netimport.DispatchFailureException;
import netimport.InvalidRequestException;
import netimport.JobStoreException;
import netimport.model.Job;
import netimport.model.JobMode;
import netimport.model.JobSettings;
import netimport.model.LogLevel;
import netimport.runner.JobLogSink;
import netimport.runner.JobRunner;
import netimport.settings.ImportConfigGenerator;
import netimport.spi.ConnectionProvider;
import netimport.spi.JobStore;
import netimport.spi.MetricsExporter;
import netimport.spi.WorkerTransport;
import netimport.util.Connections;
import netimport.util.Ids;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Accepts import requests and decides, per request, where each job runs.
 *
 * <p>{@link #submit} validates the request, records a QUEUED job, then probes the
 * {@link ExecutionBackendDetector}:
 * <ul>
 *   <li>no live worker: the job runs inline on the calling thread and the terminal job
 *       is returned</li>
 *   <li>live workers: the job id is enqueued on the {@link WorkerTransport} and the
 *       queued job is returned at once</li>
 * </ul>
 * If enqueueing fails after a positive probe, the job is recorded as FAILED with an ERROR
 * log entry and a {@link DispatchFailureException} carrying the job id is thrown.
 *
 * <p>This class is thread-safe.
 */
public final class JobDispatcher {
  private static final Logger logger = Logger.getLogger(JobDispatcher.class.getName());

  static final int MAX_SITE_LENGTH = 50;

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;
  private final JobRunner runner;
  private final WorkerTransport transport;
  private final ExecutionBackendDetector detector;
  private final MetricsExporter metrics;
  private final Clock clock;

  private JobDispatcher(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(builder.jobStore, "jobStore");
    this.runner = Objects.requireNonNull(builder.runner, "runner");
    this.transport = builder.transport;
    if (builder.detector != null) {
      this.detector = builder.detector;
    } else if (transport != null) {
      throw new IllegalArgumentException("detector is required when a transport is configured");
    } else {
      this.detector = ExecutionBackendDetector.immediateOnly("no worker transport configured");
    }
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a job for {@code request} and runs or enqueues it.
   *
   * @param request   the import request
   * @param principal identity of the submitter
   * @return the job with how it was executed
   * @throws InvalidRequestException   if the request is malformed; no job is created
   * @throws DispatchFailureException  if the job could not be enqueued; the job is FAILED
   * @throws JobStoreException         if the job could not be recorded
   */
  public JobHandle submit(JobRequest request, String principal) {
    Job job;
    try {
      job = newJob(request, principal);
    } catch (InvalidRequestException e) {
      metrics.incrementRejected();
      throw e;
    }
    Connections.run(connectionProvider, "create job", conn -> jobStore.insertQueued(conn, job));

    BackendProbe probe = probe();
    metrics.recordLiveWorkers(probe.workerCount());
    if (!probe.available() || transport == null) {
      logger.log(Level.FINE, "Running job {0} inline: {1}", new Object[]{job.id(), probe.reason()});
      metrics.incrementSubmitted(ExecutionMode.IMMEDIATE);
      Job finished = runner.run(job.id());
      return new JobHandle(finished, ExecutionMode.IMMEDIATE, probe.reason(), probe.workerCount());
    }

    String taskRef;
    try {
      taskRef = transport.enqueue(job.id());
    } catch (RuntimeException e) {
      recordDispatchFailure(job.id(), e);
      metrics.incrementDispatchFailure();
      throw new DispatchFailureException(job.id(),
          "Failed to enqueue job " + job.id() + ": " + e.getMessage(), e);
    }
    try {
      Connections.withConnection(connectionProvider, "record task reference of job " + job.id(),
          conn -> jobStore.updateTaskRef(conn, job.id(), taskRef));
    } catch (JobStoreException e) {
      logger.log(Level.WARNING, "Job " + job.id() + " enqueued as " + taskRef
          + " but the task reference could not be recorded", e);
    }
    metrics.incrementSubmitted(ExecutionMode.QUEUED);
    logger.log(Level.FINE, "Job {0} enqueued as {1} ({2})", new Object[]{job.id(), taskRef, probe.reason()});
    return new JobHandle(job.withTaskRef(taskRef), ExecutionMode.QUEUED, probe.reason(), probe.workerCount());
  }

  /**
   * Probes the execution backend without submitting anything.
   *
   * @return the probe result
   */
  public BackendProbe probe() {
    try {
      return detector.probe();
    } catch (RuntimeException e) {
      logger.log(Level.WARNING, "Execution backend detector threw; treating backend as unavailable", e);
      return BackendProbe.unavailable("detector error: " + e.getMessage());
    }
  }

  private Job newJob(JobRequest request, String principal) {
    if (request == null) {
      throw new InvalidRequestException("request is required");
    }
    JobMode mode = JobMode.fromValue(request.mode()).orElseThrow(() ->
        new InvalidRequestException("mode must be 'check' or 'apply', got '" + request.mode() + "'"));
    if (request.site() == null) {
      throw new InvalidRequestException("site is required");
    }
    String site = request.site().trim();
    if (site.isEmpty()) {
      throw new InvalidRequestException("site may not be blank");
    }
    if (site.length() > MAX_SITE_LENGTH) {
      throw new InvalidRequestException("site may not exceed " + MAX_SITE_LENGTH + " characters");
    }
    validateSettings(request.settings());
    if (principal == null || principal.isBlank()) {
      throw new InvalidRequestException("principal is required");
    }
    return Job.queued(Ids.newJobId(), site, mode, principal, request.settings(), clock.instant());
  }

  private static void validateSettings(JobSettings settings) {
    if (settings == null) {
      throw new InvalidRequestException("settings are required");
    }
    if (settings.inventory() == null || settings.inventory().isBlank()) {
      throw new InvalidRequestException("settings.inventory.name is required");
    }
    if (settings.credentials() == null || settings.credentials().isBlank()) {
      throw new InvalidRequestException("settings.network.credentials_name is required");
    }
    if (settings.batfish() != null && settings.batfish().isBlank()) {
      throw new InvalidRequestException("settings.batfish may not be blank");
    }
    for (Map.Entry<String, String> option : settings.options().entrySet()) {
      String key = option.getKey();
      if (key == null || key.isBlank()) {
        throw new InvalidRequestException("option names may not be blank");
      }
      if (ImportConfigGenerator.isReservedOption(key)) {
        throw new InvalidRequestException("option '" + key + "' is set from the named settings and may not be overridden");
      }
    }
  }

  private void recordDispatchFailure(String jobId, RuntimeException cause) {
    logger.log(Level.SEVERE, "Failed to enqueue job " + jobId, cause);
    try {
      JobLogSink.open(connectionProvider, jobStore, jobId, clock)
          .append(LogLevel.ERROR, "Failed to dispatch job to a worker: " + cause.getMessage(),
              JobRunner.RUNNER_SOURCE);
      int updated = Connections.withConnection(connectionProvider, "fail undispatched job " + jobId,
          conn -> jobStore.markDispatchFailed(conn, jobId));
      if (updated == 0) {
        logger.log(Level.WARNING, "Job {0} was no longer QUEUED when recording its dispatch failure", jobId);
      }
    } catch (JobStoreException e) {
      cause.addSuppressed(e);
      logger.log(Level.SEVERE, "Failed to record dispatch failure of job " + jobId, e);
    }
  }

  /**
   * Builder for {@link JobDispatcher}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private JobStore jobStore;
    private JobRunner runner;
    private WorkerTransport transport;
    private ExecutionBackendDetector detector;
    private MetricsExporter metrics;
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
     * <b>Required.</b> Used for inline execution.
     *
     * @param runner the job runner
     * @return this builder
     */
    public Builder runner(JobRunner runner) {
      this.runner = runner;
      return this;
    }

    /**
     * Optional. Without a transport every job runs inline.
     *
     * @param transport broker used to hand jobs to workers
     * @return this builder
     */
    public Builder transport(WorkerTransport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * Required when a transport is set; otherwise defaults to
     * {@link ExecutionBackendDetector#immediateOnly}.
     *
     * @param detector decides between inline and queued execution
     * @return this builder
     */
    public Builder detector(ExecutionBackendDetector detector) {
      this.detector = detector;
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
     * Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock time source for {@code created_at}
     * @return this builder
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public JobDispatcher build() {
      return new JobDispatcher(this);
    }
  }
}
