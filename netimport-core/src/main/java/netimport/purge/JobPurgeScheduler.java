package netimport.purge;

import netimport.spi.ConnectionProvider;
import netimport.spi.JobPurger;
import netimport.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically deletes COMPLETED and FAILED jobs older than a retention period,
 * together with their log entries.
 *
 * <p>Each cycle deletes in batches until a batch comes back short. Every batch runs on
 * its own auto-committed connection. Jobs that are QUEUED or RUNNING are never touched.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see JobPurger
 */
public final class JobPurgeScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(JobPurgeScheduler.class.getName());

  private final ConnectionProvider connectionProvider;
  private final JobPurger purger;
  private final Duration retention;
  private final int batchSize;
  private final long intervalSeconds;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> purgeTask;
  private volatile boolean closed;

  private JobPurgeScheduler(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.purger = Objects.requireNonNull(builder.purger, "purger");
    if (builder.retention.isNegative()) {
      throw new IllegalArgumentException("retention must be >= 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }
    this.retention = builder.retention;
    this.batchSize = builder.batchSize;
    this.intervalSeconds = builder.intervalSeconds;
  }

  public static Builder builder() {
    return new Builder();
  }

  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("JobPurgeScheduler has been closed");
    }
    if (purgeTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("netimport-purge-"));
    purgeTask = scheduler.scheduleWithFixedDelay(
        this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Runs one purge cycle. May be invoked directly for testing or one-off cleanup.
   *
   * @return number of jobs deleted
   */
  public long runOnce() {
    if (closed) {
      return 0;
    }
    long total = 0;
    try {
      Instant cutoff = Instant.now().minus(retention);
      int deleted;
      do {
        deleted = purgeBatch(cutoff);
        total += deleted;
      } while (deleted >= batchSize);
      if (total > 0) {
        logger.log(Level.INFO, "Purged {0} finished jobs created before {1}", new Object[]{total, cutoff});
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Purge cycle failed", t);
    }
    return total;
  }

  private int purgeBatch(Instant cutoff) throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return purger.purge(conn, cutoff, batchSize);
    }
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (purgeTask != null) {
      purgeTask.cancel(false);
      purgeTask = null;
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

  /** Builder for {@link JobPurgeScheduler}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private JobPurger purger;
    private Duration retention = Duration.ofDays(30);
    private int batchSize = 500;
    private long intervalSeconds = 3600;

    private Builder() {}

    /**
     * <b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <b>Required.</b>
     *
     * @param purger dialect-specific delete strategy
     * @return this builder
     */
    public Builder purger(JobPurger purger) {
      this.purger = purger;
      return this;
    }

    /**
     * Optional. Defaults to 30 days. Must be &ge; 0.
     *
     * @param retention how long finished jobs are kept
     * @return this builder
     */
    public Builder retention(Duration retention) {
      this.retention = Objects.requireNonNull(retention, "retention");
      return this;
    }

    /**
     * Optional. Defaults to {@code 500}. Must be &gt; 0.
     *
     * @param batchSize jobs deleted per statement
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Optional. Defaults to {@code 3600}. Must be &gt; 0.
     *
     * @param intervalSeconds seconds between cycles
     * @return this builder
     */
    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    public JobPurgeScheduler build() {
      return new JobPurgeScheduler(this);
    }
  }
}
