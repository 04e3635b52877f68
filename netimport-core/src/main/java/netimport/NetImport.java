package netimport;

import netimport.dispatch.ExecutionBackendDetector;
import netimport.dispatch.JobDispatcher;
import netimport.dispatch.WorkerPoolDetector;
import netimport.lease.OrphanedJobReaper;
import netimport.purge.JobPurgeScheduler;
import netimport.query.JobQueries;
import netimport.runner.JobRunner;
import netimport.settings.ImportConfigGenerator;
import netimport.spi.ConnectionProvider;
import netimport.spi.ImportExecutor;
import netimport.spi.JobPurger;
import netimport.spi.JobStore;
import netimport.spi.MetricsExporter;
import netimport.spi.SettingsResolver;
import netimport.spi.WorkerTransport;
import netimport.worker.JobWorker;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Composite entry point that wires a {@link JobRunner}, {@link JobDispatcher},
 * {@link JobQueries} and the optional background components into a single
 * {@link AutoCloseable} unit.
 *
 * <p>Two builders cover the two process roles:
 * <ul>
 *   <li>{@link #apiNode()}: accepts submissions; runs jobs inline when no worker is
 *       reachable, otherwise enqueues them. May also host an embedded worker.</li>
 *   <li>{@link #workerNode()}: consumes the queue only; {@link #dispatcher()} is absent.</li>
 * </ul>
 * Either role may run the orphan reaper and the purge scheduler.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (NetImport netImport = NetImport.apiNode()
 *     .connectionProvider(connProvider)
 *     .jobStore(store)
 *     .settingsResolver(resolver)
 *     .importExecutor(executor)
 *     .transport(transport)
 *     .build()) {
 *   JobHandle handle = netImport.dispatcher().submit(request, "alice");
 * }
 * }</pre>
 */
public final class NetImport implements AutoCloseable {

  private final JobRunner runner;
  private final JobDispatcher dispatcher;
  private final JobQueries queries;
  private final JobWorker worker;
  private final WorkerPoolDetector detector;
  private final OrphanedJobReaper reaper;
  private final JobPurgeScheduler purgeScheduler;
  private final MetricsExporter metrics;

  private NetImport(JobRunner runner, JobDispatcher dispatcher, JobQueries queries,
      JobWorker worker, WorkerPoolDetector detector, OrphanedJobReaper reaper,
      JobPurgeScheduler purgeScheduler, MetricsExporter metrics) {
    this.runner = runner;
    this.dispatcher = dispatcher;
    this.queries = queries;
    this.worker = worker;
    this.detector = detector;
    this.reaper = reaper;
    this.purgeScheduler = purgeScheduler;
    this.metrics = metrics;
  }

  /**
   * Returns the dispatcher for submitting jobs.
   *
   * @return the dispatcher
   * @throws IllegalStateException on a worker node
   */
  public JobDispatcher dispatcher() {
    if (dispatcher == null) {
      throw new IllegalStateException("Worker nodes do not accept submissions");
    }
    return dispatcher;
  }

  public JobQueries queries() {
    return queries;
  }

  public JobRunner runner() {
    return runner;
  }

  /**
   * @return the worker hosted by this node, or {@code null} if there is none
   */
  public JobWorker worker() {
    return worker;
  }

  /**
   * Shuts down components in order: purge scheduler, reaper, worker, detector, runner.
   */
  @Override
  public void close() {
    List<AutoCloseable> parts = new ArrayList<>();
    parts.add(purgeScheduler);
    parts.add(reaper);
    parts.add(worker);
    parts.add(detector);
    parts.add(runner);
    if (metrics instanceof AutoCloseable closeable) {
      parts.add(closeable);
    }
    RuntimeException first = null;
    for (AutoCloseable part : parts) {
      if (part == null) {
        continue;
      }
      try {
        part.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Creates a builder for a node that accepts submissions.
   *
   * @return a new API node builder
   */
  public static ApiNodeBuilder apiNode() {
    return new ApiNodeBuilder();
  }

  /**
   * Creates a builder for a node that only executes queued jobs.
   *
   * @return a new worker node builder
   */
  public static WorkerNodeBuilder workerNode() {
    return new WorkerNodeBuilder();
  }

  // ── Abstract builder ─────────────────────────────────────────────

  /**
   * Base builder with shared required and optional parameters.
   *
   * @param <B> the concrete builder type (CRTP)
   */
  public static abstract sealed class AbstractBuilder<B extends AbstractBuilder<B>>
      permits ApiNodeBuilder, WorkerNodeBuilder {

    ConnectionProvider connectionProvider;
    JobStore jobStore;
    SettingsResolver settingsResolver;
    ImportExecutor importExecutor;
    WorkerTransport transport;
    ImportConfigGenerator configGenerator;
    MetricsExporter metrics;
    Clock clock;
    long runnerHeartbeatIntervalMs = 10_000;
    Duration leaseTimeout;
    long leaseIntervalSeconds = 60;
    JobPurger purger;
    Duration purgeRetention = Duration.ofDays(30);
    int purgeBatchSize = 500;
    long purgeIntervalSeconds = 3600;
    int workerConcurrency = 2;
    long workerPollIntervalMs = 1000;
    long workerHeartbeatIntervalMs = 5000;
    Duration workerLockTimeout = Duration.ofMinutes(5);
    private final AtomicBoolean built = new AtomicBoolean(false);

    AbstractBuilder() {}

    void markBuilt() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
    }

    @SuppressWarnings("unchecked")
    B self() {
      return (B) this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public B connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return self();
    }

    /**
     * <p><b>Required.</b>
     *
     * @param jobStore job and log persistence
     * @return this builder
     */
    public B jobStore(JobStore jobStore) {
      this.jobStore = jobStore;
      return self();
    }

    /**
     * <p><b>Required.</b>
     *
     * @param settingsResolver resolves named settings
     * @return this builder
     */
    public B settingsResolver(SettingsResolver settingsResolver) {
      this.settingsResolver = settingsResolver;
      return self();
    }

    /**
     * <p><b>Required.</b>
     *
     * @param importExecutor adapter to the import library
     * @return this builder
     */
    public B importExecutor(ImportExecutor importExecutor) {
      this.importExecutor = importExecutor;
      return self();
    }

    /**
     * Sets the broker between API and worker nodes.
     *
     * <p>Optional on API nodes, where its absence means every job runs inline.
     * <b>Required</b> on worker nodes.
     *
     * @param transport the worker transport
     * @return this builder
     */
    public B transport(WorkerTransport transport) {
      this.transport = transport;
      return self();
    }

    /**
     * <p>Optional. Defaults to a new {@link ImportConfigGenerator}.
     *
     * @param configGenerator the configuration generator
     * @return this builder
     */
    public B configGenerator(ImportConfigGenerator configGenerator) {
      this.configGenerator = configGenerator;
      return self();
    }

    /**
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public B metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return self();
    }

    /**
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     *
     * @param clock time source
     * @return this builder
     */
    public B clock(Clock clock) {
      this.clock = clock;
      return self();
    }

    /**
     * <p>Optional. Defaults to {@code 10000} ms.
     *
     * @param runnerHeartbeatIntervalMs how often running jobs refresh their heartbeat
     * @return this builder
     */
    public B runnerHeartbeatIntervalMs(long runnerHeartbeatIntervalMs) {
      this.runnerHeartbeatIntervalMs = runnerHeartbeatIntervalMs;
      return self();
    }

    /**
     * Enables the {@link OrphanedJobReaper}.
     *
     * @param leaseTimeout    heartbeat age after which a RUNNING job is failed
     * @param intervalSeconds seconds between reap cycles
     * @return this builder
     */
    public B orphanReaper(Duration leaseTimeout, long intervalSeconds) {
      this.leaseTimeout = Objects.requireNonNull(leaseTimeout, "leaseTimeout");
      this.leaseIntervalSeconds = intervalSeconds;
      return self();
    }

    /**
     * Enables the {@link JobPurgeScheduler}.
     *
     * @param purger          dialect-specific delete strategy
     * @param retention       age of terminal jobs to delete
     * @param batchSize       jobs per delete statement
     * @param intervalSeconds seconds between purge cycles
     * @return this builder
     */
    public B purge(JobPurger purger, Duration retention, int batchSize, long intervalSeconds) {
      this.purger = Objects.requireNonNull(purger, "purger");
      this.purgeRetention = Objects.requireNonNull(retention, "retention");
      this.purgeBatchSize = batchSize;
      this.purgeIntervalSeconds = intervalSeconds;
      return self();
    }

    void validateRequired() {
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(jobStore, "jobStore");
      Objects.requireNonNull(settingsResolver, "settingsResolver");
      Objects.requireNonNull(importExecutor, "importExecutor");
    }

    JobRunner buildRunner(String runnerId) {
      JobRunner.Builder rb = JobRunner.builder()
          .connectionProvider(connectionProvider)
          .jobStore(jobStore)
          .settingsResolver(settingsResolver)
          .importExecutor(importExecutor)
          .configGenerator(configGenerator)
          .metrics(metrics)
          .runnerId(runnerId)
          .heartbeatIntervalMs(runnerHeartbeatIntervalMs)
          .clock(clock);
      return rb.build();
    }

    JobWorker buildWorker(String workerId, JobRunner runner) {
      return JobWorker.builder()
          .transport(transport)
          .runner(runner)
          .workerId(workerId)
          .concurrency(workerConcurrency)
          .pollIntervalMs(workerPollIntervalMs)
          .heartbeatIntervalMs(workerHeartbeatIntervalMs)
          .lockTimeout(workerLockTimeout)
          .build();
    }

    /**
     * Builds the optional background components and starts them together with
     * {@code worker}. On failure everything created so far is closed before rethrowing.
     */
    NetImport assemble(JobRunner runner, JobDispatcher dispatcher, JobWorker worker,
        WorkerPoolDetector detector) {
      OrphanedJobReaper reaper = null;
      JobPurgeScheduler purgeScheduler = null;
      NetImport composite = null;
      try {
        if (leaseTimeout != null) {
          reaper = OrphanedJobReaper.builder()
              .connectionProvider(connectionProvider)
              .jobStore(jobStore)
              .leaseTimeout(leaseTimeout)
              .intervalSeconds(leaseIntervalSeconds)
              .metrics(metrics)
              .clock(clock)
              .build();
        }
        if (purger != null) {
          purgeScheduler = JobPurgeScheduler.builder()
              .connectionProvider(connectionProvider)
              .purger(purger)
              .retention(purgeRetention)
              .batchSize(purgeBatchSize)
              .intervalSeconds(purgeIntervalSeconds)
              .build();
        }
        composite = new NetImport(runner, dispatcher, new JobQueries(connectionProvider, jobStore),
            worker, detector, reaper, purgeScheduler, metrics);
        if (worker != null) {
          worker.start();
        }
        if (reaper != null) {
          reaper.start();
        }
        if (purgeScheduler != null) {
          purgeScheduler.start();
        }
        return composite;
      } catch (RuntimeException e) {
        if (composite != null) {
          try {
            composite.close();
          } catch (RuntimeException suppressed) {
            e.addSuppressed(suppressed);
          }
        } else {
          closeQuietly(e, reaper, worker, detector, runner);
        }
        throw e;
      }
    }

    private static void closeQuietly(RuntimeException failure, AutoCloseable... parts) {
      for (AutoCloseable part : parts) {
        if (part == null) {
          continue;
        }
        try {
          part.close();
        } catch (Exception e) {
          failure.addSuppressed(e);
        }
      }
    }

    /**
     * Builds and starts the composite.
     *
     * @return a new {@link NetImport} instance
     */
    public abstract NetImport build();
  }

  // ── API node builder ─────────────────────────────────────────────

  /**
   * Builder for nodes that accept submissions.
   *
   * <p>Without a {@link #transport transport}, or with {@link #forceImmediate(boolean)}
   * set, every job runs inline on the submitting thread.
   */
  public static final class ApiNodeBuilder extends AbstractBuilder<ApiNodeBuilder> {
    private Duration probeTimeout = Duration.ofSeconds(2);
    private boolean forceImmediate;
    private boolean embeddedWorker;

    ApiNodeBuilder() {}

    /**
     * <p>Optional. Defaults to 2 seconds.
     *
     * @param probeTimeout how long a submission waits for the worker probe
     * @return this builder
     */
    public ApiNodeBuilder probeTimeout(Duration probeTimeout) {
      this.probeTimeout = Objects.requireNonNull(probeTimeout, "probeTimeout");
      return this;
    }

    /**
     * Runs every job inline regardless of worker availability.
     *
     * <p>Optional. Defaults to {@code false}.
     *
     * @param forceImmediate whether to skip the worker probe
     * @return this builder
     */
    public ApiNodeBuilder forceImmediate(boolean forceImmediate) {
      this.forceImmediate = forceImmediate;
      return this;
    }

    /**
     * Hosts a worker in this process as well. Requires a transport.
     *
     * @param concurrency         jobs executed at once
     * @param pollIntervalMs      queue poll period
     * @param heartbeatIntervalMs worker liveness period
     * @param lockTimeout         claim lifetime
     * @return this builder
     */
    public ApiNodeBuilder embeddedWorker(int concurrency, long pollIntervalMs,
        long heartbeatIntervalMs, Duration lockTimeout) {
      this.embeddedWorker = true;
      this.workerConcurrency = concurrency;
      this.workerPollIntervalMs = pollIntervalMs;
      this.workerHeartbeatIntervalMs = heartbeatIntervalMs;
      this.workerLockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
      return this;
    }

    @Override
    public NetImport build() {
      validateRequired();
      if (embeddedWorker && transport == null) {
        throw new IllegalStateException("embeddedWorker() requires a transport");
      }
      markBuilt();
      String nodeId = "api-" + UUID.randomUUID().toString().substring(0, 8);
      JobRunner runner = buildRunner(nodeId);
      WorkerPoolDetector detector = null;
      JobWorker worker = null;
      try {
        JobDispatcher.Builder db = JobDispatcher.builder()
            .connectionProvider(connectionProvider)
            .jobStore(jobStore)
            .runner(runner)
            .metrics(metrics)
            .clock(clock);
        if (transport != null && forceImmediate) {
          db.transport(transport)
              .detector(ExecutionBackendDetector.immediateOnly("immediate execution forced by configuration"));
        } else if (transport != null) {
          detector = new WorkerPoolDetector(transport, probeTimeout);
          db.transport(transport).detector(detector);
        }
        JobDispatcher dispatcher = db.build();
        if (embeddedWorker) {
          worker = buildWorker(nodeId, runner);
        }
        return assemble(runner, dispatcher, worker, detector);
      } catch (RuntimeException e) {
        if (detector != null) {
          detector.close();
        }
        runner.close();
        throw e;
      }
    }
  }

  // ── Worker node builder ──────────────────────────────────────────

  /**
   * Builder for nodes that only execute queued jobs. A transport is required.
   */
  public static final class WorkerNodeBuilder extends AbstractBuilder<WorkerNodeBuilder> {
    private String workerId;

    WorkerNodeBuilder() {}

    /**
     * <p>Optional. Defaults to {@code worker-<8 hex>}.
     *
     * @param workerId identity registered with the transport and recorded on jobs
     * @return this builder
     */
    public WorkerNodeBuilder workerId(String workerId) {
      this.workerId = workerId;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 2}.
     *
     * @param concurrency jobs executed at once
     * @return this builder
     */
    public WorkerNodeBuilder concurrency(int concurrency) {
      this.workerConcurrency = concurrency;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 1000} ms.
     *
     * @param pollIntervalMs queue poll period
     * @return this builder
     */
    public WorkerNodeBuilder pollIntervalMs(long pollIntervalMs) {
      this.workerPollIntervalMs = pollIntervalMs;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@code 5000} ms.
     *
     * @param heartbeatIntervalMs worker liveness period
     * @return this builder
     */
    public WorkerNodeBuilder heartbeatIntervalMs(long heartbeatIntervalMs) {
      this.workerHeartbeatIntervalMs = heartbeatIntervalMs;
      return this;
    }

    /**
     * <p>Optional. Defaults to 5 minutes.
     *
     * @param lockTimeout claim lifetime
     * @return this builder
     */
    public WorkerNodeBuilder lockTimeout(Duration lockTimeout) {
      this.workerLockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
      return this;
    }

    @Override
    public NetImport build() {
      validateRequired();
      Objects.requireNonNull(transport, "transport");
      markBuilt();
      String id = workerId != null ? workerId : "worker-" + UUID.randomUUID().toString().substring(0, 8);
      JobRunner runner = buildRunner(id);
      try {
        JobWorker worker = buildWorker(id, runner);
        return assemble(runner, null, worker, null);
      } catch (RuntimeException e) {
        runner.close();
        throw e;
      }
    }
  }
}
