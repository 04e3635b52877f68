package netimport.worker;

import netimport.ConcurrentExecutionException;
import netimport.JobNotFoundException;
import netimport.runner.JobRunner;
import netimport.spi.ClaimedTask;
import netimport.spi.WorkerTransport;
import netimport.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Worker-side loop: claims queued jobs from a {@link WorkerTransport} and runs them
 * with a {@link JobRunner}.
 *
 * <p>After {@link #start()}, the worker registers itself with the transport, heart-beats
 * on a fixed interval (which is what makes it visible to the dispatcher's probe) and
 * polls for tasks whenever it has free capacity. At most {@code concurrency} jobs run at
 * once.
 *
 * <p>A task is acknowledged once the runner has returned, or when the runner refuses it
 * because the job is no longer QUEUED or no longer exists. A task whose handling fails
 * for any other reason (typically the store being unavailable) stays claimed; when its
 * lock expires it is delivered again and the runner's QUEUED guard decides.
 *
 * <p>Create instances via {@link #builder()}. {@link #start()} and {@link #close()} are
 * synchronized.
 */
public final class JobWorker implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(JobWorker.class.getName());

    private final WorkerTransport transport;
    private final JobRunner runner;
    private final String workerId;
    private final int concurrency;
    private final long pollIntervalMs;
    private final long heartbeatIntervalMs;
    private final Duration lockTimeout;
    private final long drainTimeoutMs;

    private final AtomicInteger inFlight = new AtomicInteger();
    private ScheduledExecutorService scheduler;
    private ExecutorService executors;
    private volatile ScheduledFuture<?> pollTask;
    private volatile ScheduledFuture<?> heartbeatTask;
    private volatile boolean closed;

    private JobWorker(Builder builder) {
        this.transport = Objects.requireNonNull(builder.transport, "transport");
        this.runner = Objects.requireNonNull(builder.runner, "runner");
        if (builder.concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be > 0");
        }
        if (builder.pollIntervalMs <= 0L) {
            throw new IllegalArgumentException("pollIntervalMs must be > 0");
        }
        if (builder.heartbeatIntervalMs <= 0L) {
            throw new IllegalArgumentException("heartbeatIntervalMs must be > 0");
        }
        if (builder.lockTimeout.isNegative() || builder.lockTimeout.isZero()) {
            throw new IllegalArgumentException("lockTimeout must be positive");
        }
        if (builder.drainTimeoutMs < 0L) {
            throw new IllegalArgumentException("drainTimeoutMs must be >= 0");
        }
        this.workerId = builder.workerId != null
                ? builder.workerId
                : "worker-" + UUID.randomUUID().toString().substring(0, 8);
        this.concurrency = builder.concurrency;
        this.pollIntervalMs = builder.pollIntervalMs;
        this.heartbeatIntervalMs = builder.heartbeatIntervalMs;
        this.lockTimeout = builder.lockTimeout;
        this.drainTimeoutMs = builder.drainTimeoutMs;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registers the worker and starts the heartbeat and poll schedules. Subsequent calls
     * are no-ops if already started.
     */
    public synchronized void start() {
        if (closed) {
            throw new IllegalStateException("JobWorker has been closed");
        }
        if (pollTask != null) {
            return;
        }
        transport.register(workerId);
        scheduler = Executors.newScheduledThreadPool(2, new DaemonThreadFactory("netimport-worker-sched-"));
        executors = Executors.newFixedThreadPool(concurrency, new DaemonThreadFactory("netimport-worker-"));
        heartbeatTask = scheduler.scheduleWithFixedDelay(
                this::heartbeat, heartbeatIntervalMs, heartbeatIntervalMs, TimeUnit.MILLISECONDS);
        pollTask = scheduler.scheduleWithFixedDelay(
                this::poll, 0L, pollIntervalMs, TimeUnit.MILLISECONDS);
        logger.log(Level.INFO, "Worker {0} started with concurrency {1}", new Object[]{workerId, concurrency});
    }

    /**
     * Claims tasks up to the free capacity and hands them to the worker threads.
     * Called by the scheduler after {@link #start()}.
     */
    void poll() {
        if (closed) {
            return;
        }
        try {
            int capacity = concurrency - inFlight.get();
            if (capacity <= 0) {
                return;
            }
            for (ClaimedTask task : transport.claim(workerId, lockTimeout, capacity)) {
                inFlight.incrementAndGet();
                try {
                    executors.execute(() -> {
                        try {
                            handle(task);
                        } finally {
                            inFlight.decrementAndGet();
                        }
                    });
                } catch (RejectedExecutionException e) {
                    inFlight.decrementAndGet();
                    logger.log(Level.FINE, "Worker shutting down; task {0} left for redelivery", task.taskRef());
                }
            }
        } catch (Throwable t) {
            logger.log(Level.SEVERE, "Worker poll cycle failed", t);
        }
    }

    /**
     * Claims up to {@code concurrency} tasks and handles them on the calling thread.
     * Does not require {@link #start()}; intended for tests and one-shot draining.
     *
     * @return number of tasks claimed
     */
    public int runOnce() {
        List<ClaimedTask> tasks = transport.claim(workerId, lockTimeout, concurrency);
        for (ClaimedTask task : tasks) {
            handle(task);
        }
        return tasks.size();
    }

    private void handle(ClaimedTask task) {
        String jobId = task.jobId();
        try {
            runner.run(jobId);
        } catch (ConcurrentExecutionException e) {
            logger.log(Level.FINE, "Skipping task {0}: job {1} is {2}",
                    new Object[]{task.taskRef(), jobId, e.observedStatus()});
        } catch (JobNotFoundException e) {
            logger.log(Level.WARNING, "Dropping task {0}: job {1} does not exist", new Object[]{task.taskRef(), jobId});
        } catch (RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to run job " + jobId + " (task " + task.taskRef()
                    + ", delivery " + task.deliveries() + "); leaving it for redelivery", e);
            return;
        }
        acknowledge(task);
    }

    private void acknowledge(ClaimedTask task) {
        try {
            transport.acknowledge(task.taskRef());
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to acknowledge task " + task.taskRef(), e);
        }
    }

    private void heartbeat() {
        try {
            transport.heartbeat(workerId);
        } catch (Throwable t) {
            logger.log(Level.WARNING, "Worker heartbeat failed for " + workerId, t);
        }
    }

    public String workerId() {
        return workerId;
    }

    public int inFlight() {
        return inFlight.get();
    }

    /**
     * Stops claiming, waits up to the drain timeout for running jobs, then deregisters.
     */
    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (pollTask != null) {
            pollTask.cancel(false);
            pollTask = null;
        }
        if (heartbeatTask != null) {
            heartbeatTask.cancel(false);
            heartbeatTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdownNow();
        }
        if (executors != null) {
            executors.shutdown();
            try {
                if (!executors.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
                    logger.log(Level.WARNING, "Worker {0} closed with {1} job(s) still running",
                            new Object[]{workerId, inFlight.get()});
                    executors.shutdownNow();
                }
            } catch (InterruptedException e) {
                executors.shutdownNow();
                Thread.currentThread().interrupt();
            }
            try {
                transport.deregister(workerId);
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Failed to deregister worker " + workerId, e);
            }
        }
    }

    /**
     * Builder for {@link JobWorker}.
     */
    public static final class Builder {
        private WorkerTransport transport;
        private JobRunner runner;
        private String workerId;
        private int concurrency = 2;
        private long pollIntervalMs = 1000;
        private long heartbeatIntervalMs = 5000;
        private Duration lockTimeout = Duration.ofMinutes(5);
        private long drainTimeoutMs = 30_000;

        private Builder() {
        }

        /**
         * Sets the transport tasks are claimed from.
         *
         * <p><b>Required.</b>
         *
         * @param transport the worker transport
         * @return this builder
         */
        public Builder transport(WorkerTransport transport) {
            this.transport = transport;
            return this;
        }

        /**
         * Sets the runner that executes claimed jobs.
         *
         * <p><b>Required.</b>
         *
         * @param runner the job runner
         * @return this builder
         */
        public Builder runner(JobRunner runner) {
            this.runner = runner;
            return this;
        }

        /**
         * Sets the id this worker registers under.
         *
         * <p>Optional. Defaults to {@code worker-<8 hex>}.
         *
         * @param workerId unique worker id (e.g. hostname or pod name)
         * @return this builder
         */
        public Builder workerId(String workerId) {
            this.workerId = workerId;
            return this;
        }

        /**
         * Sets the maximum number of jobs run at once.
         *
         * <p>Optional. Defaults to {@code 2}. Must be &gt; 0.
         *
         * @param concurrency worker thread count
         * @return this builder
         */
        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        /**
         * Sets the delay between claim attempts.
         *
         * <p>Optional. Defaults to {@code 1000} ms. Must be &gt; 0.
         *
         * @param pollIntervalMs poll interval in milliseconds
         * @return this builder
         */
        public Builder pollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
            return this;
        }

        /**
         * Sets the worker registry heartbeat period. Must be shorter than the liveness
         * window the transport uses to answer probes.
         *
         * <p>Optional. Defaults to {@code 5000} ms. Must be &gt; 0.
         *
         * @param heartbeatIntervalMs heartbeat interval in milliseconds
         * @return this builder
         */
        public Builder heartbeatIntervalMs(long heartbeatIntervalMs) {
            this.heartbeatIntervalMs = heartbeatIntervalMs;
            return this;
        }

        /**
         * Sets how long a claimed task stays locked before another worker may reclaim it.
         *
         * <p>Optional. Defaults to 5 minutes. Must be positive.
         *
         * @param lockTimeout claim lifetime
         * @return this builder
         */
        public Builder lockTimeout(Duration lockTimeout) {
            this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
            return this;
        }

        /**
         * Sets how long {@link JobWorker#close()} waits for running jobs.
         *
         * <p>Optional. Defaults to {@code 30000} ms. Must be &ge; 0.
         *
         * @param drainTimeoutMs drain timeout in milliseconds
         * @return this builder
         */
        public Builder drainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
            return this;
        }

        public JobWorker build() {
            return new JobWorker(this);
        }
    }
}
