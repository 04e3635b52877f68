package netimport.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import netimport.dispatch.ExecutionMode;
import netimport.spi.MetricsExporter;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters, gauges and a timer with a {@link MeterRegistry} for export to
 * Prometheus, Grafana, Datadog, and other monitoring backends.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code netimport.jobs.submitted} (tag {@code execution=immediate|queued}) - accepted submissions</li>
 *   <li>{@code netimport.jobs.rejected} - submissions rejected as invalid</li>
 *   <li>{@code netimport.jobs.completed} - jobs that reached COMPLETED</li>
 *   <li>{@code netimport.jobs.failed} - jobs that failed after running</li>
 *   <li>{@code netimport.dispatch.failure} - jobs that could not be enqueued</li>
 *   <li>{@code netimport.runner.concurrent} - run attempts on jobs that were not QUEUED</li>
 *   <li>{@code netimport.jobs.orphaned} - RUNNING jobs failed by the reaper</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code netimport.jobs.running} - jobs executing in this process</li>
 *   <li>{@code netimport.workers.live} - live workers seen by the last probe</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code netimport.jobs.duration} - RUNNING to terminal</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

    private final MeterRegistry registry;
    private final Counter submittedImmediate;
    private final Counter submittedQueued;
    private final Counter rejected;
    private final Counter completed;
    private final Counter failed;
    private final Counter dispatchFailure;
    private final Counter concurrent;
    private final Counter orphaned;
    private final Gauge runningGauge;
    private final Gauge liveWorkersGauge;
    private final Timer duration;

    private final AtomicInteger running = new AtomicInteger();
    private final AtomicInteger liveWorkers = new AtomicInteger();
    private volatile boolean closed;

    /**
     * Creates an exporter with the default metric name prefix {@code "netimport"}.
     *
     * @param registry the Micrometer meter registry
     */
    public MicrometerMetricsExporter(MeterRegistry registry) {
        this(registry, "netimport");
    }

    /**
     * Creates an exporter with a custom metric name prefix for multi-instance use.
     *
     * @param registry   the Micrometer meter registry
     * @param namePrefix prefix for all meter names (e.g. {@code "lab.netimport"})
     */
    public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (namePrefix.isEmpty()) {
            throw new IllegalArgumentException("namePrefix must not be empty");
        }
        if (namePrefix.endsWith(".")) {
            throw new IllegalArgumentException("namePrefix must not end with '.'");
        }

        this.registry = registry;
        this.submittedImmediate = Counter.builder(namePrefix + ".jobs.submitted")
                .tag("execution", ExecutionMode.IMMEDIATE.value())
                .description("Jobs accepted and run inline")
                .register(registry);
        this.submittedQueued = Counter.builder(namePrefix + ".jobs.submitted")
                .tag("execution", ExecutionMode.QUEUED.value())
                .description("Jobs accepted and handed to a worker")
                .register(registry);
        this.rejected = Counter.builder(namePrefix + ".jobs.rejected")
                .description("Submissions rejected as invalid")
                .register(registry);
        this.completed = Counter.builder(namePrefix + ".jobs.completed")
                .description("Jobs that completed successfully")
                .register(registry);
        this.failed = Counter.builder(namePrefix + ".jobs.failed")
                .description("Jobs that failed after running")
                .register(registry);
        this.dispatchFailure = Counter.builder(namePrefix + ".dispatch.failure")
                .description("Jobs that could not be enqueued")
                .register(registry);
        this.concurrent = Counter.builder(namePrefix + ".runner.concurrent")
                .description("Run attempts rejected because the job was not queued")
                .register(registry);
        this.orphaned = Counter.builder(namePrefix + ".jobs.orphaned")
                .description("Running jobs failed after their runner went silent")
                .register(registry);

        this.runningGauge = Gauge.builder(namePrefix + ".jobs.running", running, AtomicInteger::get)
                .register(registry);
        this.liveWorkersGauge = Gauge.builder(namePrefix + ".workers.live", liveWorkers, AtomicInteger::get)
                .register(registry);

        this.duration = Timer.builder(namePrefix + ".jobs.duration")
                .description("Time from running to a terminal state")
                .register(registry);
    }

    @Override
    public void incrementSubmitted(ExecutionMode mode) {
        if (closed) return;
        if (mode == ExecutionMode.QUEUED) {
            submittedQueued.increment();
        } else {
            submittedImmediate.increment();
        }
    }

    @Override
    public void incrementRejected() {
        if (closed) return;
        rejected.increment();
    }

    @Override
    public void incrementCompleted() {
        if (closed) return;
        completed.increment();
    }

    @Override
    public void incrementFailed() {
        if (closed) return;
        failed.increment();
    }

    @Override
    public void incrementDispatchFailure() {
        if (closed) return;
        dispatchFailure.increment();
    }

    @Override
    public void incrementConcurrentExecution() {
        if (closed) return;
        concurrent.increment();
    }

    @Override
    public void incrementOrphaned() {
        if (closed) return;
        orphaned.increment();
    }

    @Override
    public void recordRunningJobs(int running) {
        if (closed) return;
        this.running.set(running);
    }

    @Override
    public void recordLiveWorkers(int workers) {
        if (closed) return;
        this.liveWorkers.set(workers);
    }

    @Override
    public void recordJobDurationMs(long durationMs) {
        if (closed) return;
        duration.record(Duration.ofMillis(durationMs));
    }

    /**
     * Removes all meters registered by this exporter from the registry.
     *
     * <p>Call this when the exporter is no longer needed (e.g. when the
     * {@link netimport.NetImport} is closed) to prevent stale gauges.
     */
    @Override
    public void close() {
        closed = true;
        RuntimeException first = null;
        for (Meter meter : List.of(submittedImmediate, submittedQueued, rejected,
                completed, failed, dispatchFailure, concurrent, orphaned,
                runningGauge, liveWorkersGauge, duration)) {
            try {
                registry.remove(meter);
            } catch (RuntimeException e) {
                if (first == null) first = e;
                else first.addSuppressed(e);
            }
        }
        if (first != null) throw first;
    }
}
