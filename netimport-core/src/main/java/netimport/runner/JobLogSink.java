package netimport.runner;

import netimport.model.LogEntry;
import netimport.model.LogLevel;
import netimport.spi.ConnectionProvider;
import netimport.spi.JobStore;
import netimport.util.Connections;

import java.time.Clock;
import java.util.Objects;

/**
 * Ordered, append-only writer for one job's log stream.
 *
 * <p>Sequence numbers continue from the highest one already stored when the sink is
 * opened, so a new job starts at 1. Appends are serialized and each is persisted before
 * {@link #append} returns; a failed write does not consume a sequence number.
 *
 * <p>Only one sink should write to a given job at a time. The {@code (job_id, sequence)}
 * key rejects a second writer's colliding append instead of silently interleaving.
 */
public final class JobLogSink {
  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;
  private final String jobId;
  private final Clock clock;
  private long lastSequence;

  private JobLogSink(ConnectionProvider connectionProvider, JobStore jobStore, String jobId,
      Clock clock, long lastSequence) {
    this.connectionProvider = connectionProvider;
    this.jobStore = jobStore;
    this.jobId = jobId;
    this.clock = clock;
    this.lastSequence = lastSequence;
  }

  public static JobLogSink open(ConnectionProvider connectionProvider, JobStore jobStore,
      String jobId, Clock clock) {
    Objects.requireNonNull(connectionProvider, "connectionProvider");
    Objects.requireNonNull(jobStore, "jobStore");
    Objects.requireNonNull(jobId, "jobId");
    Objects.requireNonNull(clock, "clock");
    long last = Connections.withConnection(connectionProvider, "read log sequence of job " + jobId,
        conn -> jobStore.maxSequence(conn, jobId));
    return new JobLogSink(connectionProvider, jobStore, jobId, clock, last);
  }

  /**
   * Persists one entry with the next sequence number.
   *
   * @param level   severity
   * @param message text, {@code null} is stored as empty
   * @param source  logical emitter
   * @return the stored entry
   * @throws netimport.JobStoreException if the entry could not be written
   */
  public synchronized LogEntry append(LogLevel level, String message, String source) {
    Objects.requireNonNull(level, "level");
    LogEntry entry = new LogEntry(jobId, lastSequence + 1, level,
        message == null ? "" : message, source, clock.instant());
    Connections.run(connectionProvider, "append log entry to job " + jobId,
        conn -> jobStore.appendLog(conn, entry));
    lastSequence = entry.sequence();
    return entry;
  }

  public synchronized long lastSequence() {
    return lastSequence;
  }

  public String jobId() {
    return jobId;
  }
}
