package netimport.jdbc.transport;

import netimport.jdbc.JdbcTemplate;
import netimport.jdbc.TableNames;
import netimport.spi.ClaimedTask;
import netimport.spi.ConnectionProvider;
import netimport.spi.WorkerTransport;
import netimport.util.Connections;
import netimport.util.Ids;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;

/**
 * {@link WorkerTransport} backed by two tables in the job database: a task queue and a
 * worker registry.
 *
 * <p>Workers claim queue rows by stamping {@code locked_by} and {@code locked_at}; a claim
 * older than the lock timeout can be taken over by another worker. Acknowledged tasks are
 * deleted. A worker counts as live while its registry row was refreshed within the
 * liveness window.
 *
 * <p>The default claim is a two-phase {@code UPDATE} with a {@code LIMIT} subquery followed
 * by a {@code SELECT}, which H2 accepts. Subclasses override
 * {@link #claimRows(Connection, String, Instant, Instant, int)} with the database's
 * single-statement or lock-skipping form.
 *
 * @see JdbcWorkerTransports
 */
public abstract class AbstractJdbcWorkerTransport implements WorkerTransport {

  public static final Duration DEFAULT_LIVENESS_WINDOW = Duration.ofSeconds(30);

  protected static final String TASK_COLUMNS = "task_id, job_id, enqueued_at, deliveries";

  protected static final JdbcTemplate.RowMapper<ClaimedTask> TASK_ROW_MAPPER = rs -> new ClaimedTask(
      rs.getString("task_id"),
      rs.getString("job_id"),
      rs.getTimestamp("enqueued_at").toInstant(),
      rs.getInt("deliveries"));

  private final ConnectionProvider connectionProvider;
  private final TableNames tables;
  private final Duration livenessWindow;
  private final Clock clock;

  protected AbstractJdbcWorkerTransport(ConnectionProvider connectionProvider, TableNames tables,
      Duration livenessWindow, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.tables = Objects.requireNonNull(tables, "tables");
    this.livenessWindow = Objects.requireNonNull(livenessWindow, "livenessWindow");
    this.clock = Objects.requireNonNull(clock, "clock");
    if (livenessWindow.isNegative() || livenessWindow.isZero()) {
      throw new IllegalArgumentException("livenessWindow must be positive");
    }
  }

  /** Database this transport targets, matching the job store name. */
  public abstract String name();

  protected String queueTable() {
    return tables.queue();
  }

  protected String workerTable() {
    return tables.worker();
  }

  public Duration livenessWindow() {
    return livenessWindow;
  }

  // ── Dispatch side ────────────────────────────────────────────────

  @Override
  public String enqueue(String jobId) {
    Objects.requireNonNull(jobId, "jobId");
    String taskId = Ids.newTaskId();
    String sql = "INSERT INTO " + queueTable()
        + " (task_id, job_id, enqueued_at, deliveries, locked_by, locked_at)"
        + " VALUES (?, ?, ?, 0, NULL, NULL)";
    Connections.run(connectionProvider, "enqueue job " + jobId,
        conn -> JdbcTemplate.update(conn, sql, taskId, jobId, now()));
    return taskId;
  }

  @Override
  public List<String> ping(Duration timeout) {
    Instant liveSince = now().minus(livenessWindow);
    String sql = "SELECT worker_id FROM " + workerTable()
        + " WHERE heartbeat_at >= ? ORDER BY worker_id";
    return Connections.withConnection(connectionProvider, "list live workers",
        conn -> JdbcTemplate.query(conn, sql, rs -> rs.getString("worker_id"), liveSince));
  }

  // ── Worker registry ──────────────────────────────────────────────

  @Override
  public void register(String workerId) {
    Objects.requireNonNull(workerId, "workerId");
    Instant now = now();
    Connections.run(connectionProvider, "register worker " + workerId, conn -> {
      if (touchWorker(conn, workerId, now) == 0) {
        String sql = "INSERT INTO " + workerTable()
            + " (worker_id, registered_at, heartbeat_at) VALUES (?, ?, ?)";
        JdbcTemplate.update(conn, sql, workerId, now, now);
      }
    });
  }

  @Override
  public void heartbeat(String workerId) {
    Instant now = now();
    int updated = Connections.withConnection(connectionProvider, "heartbeat worker " + workerId,
        conn -> touchWorker(conn, workerId, now));
    if (updated == 0) {
      // Row was removed, e.g. by deregister racing shutdown; come back.
      register(workerId);
    }
  }

  @Override
  public void deregister(String workerId) {
    String sql = "DELETE FROM " + workerTable() + " WHERE worker_id=?";
    Connections.run(connectionProvider, "deregister worker " + workerId,
        conn -> JdbcTemplate.update(conn, sql, workerId));
  }

  private int touchWorker(Connection conn, String workerId, Instant now) {
    String sql = "UPDATE " + workerTable() + " SET heartbeat_at=? WHERE worker_id=?";
    return JdbcTemplate.update(conn, sql, now, workerId);
  }

  // ── Claiming ─────────────────────────────────────────────────────

  @Override
  public List<ClaimedTask> claim(String workerId, Duration lockTimeout, int limit) {
    Objects.requireNonNull(workerId, "workerId");
    if (limit <= 0) {
      return List.of();
    }
    Instant now = now();
    Instant lockExpiry = now.minus(lockTimeout);
    return Connections.withConnection(connectionProvider, "claim tasks for " + workerId,
        conn -> claimRows(conn, workerId, now, lockExpiry, limit));
  }

  /**
   * Claims up to {@code limit} unlocked or expired rows for {@code workerId}.
   *
   * @param conn       connection in auto-commit mode
   * @param workerId   claiming worker
   * @param now        lock time, truncated to milliseconds
   * @param lockExpiry claims stamped before this may be taken over
   * @param limit      maximum rows
   * @return claimed tasks, oldest first
   */
  protected List<ClaimedTask> claimRows(Connection conn, String workerId, Instant now,
      Instant lockExpiry, int limit) {
    String claimSql = "UPDATE " + queueTable()
        + " SET locked_by=?, locked_at=?, deliveries=deliveries+1"
        + " WHERE task_id IN (SELECT task_id FROM " + queueTable()
        + " WHERE locked_by IS NULL OR locked_at < ? ORDER BY enqueued_at LIMIT ?)";
    int updated = JdbcTemplate.update(conn, claimSql, workerId, now, lockExpiry, limit);
    if (updated == 0) {
      return List.of();
    }
    return selectClaimed(conn, workerId, now);
  }

  protected List<ClaimedTask> selectClaimed(Connection conn, String workerId, Instant lockedAt) {
    String sql = "SELECT " + TASK_COLUMNS + " FROM " + queueTable()
        + " WHERE locked_by=? AND locked_at=? ORDER BY enqueued_at";
    return JdbcTemplate.query(conn, sql, TASK_ROW_MAPPER, workerId, lockedAt);
  }

  @Override
  public void acknowledge(String taskRef) {
    String sql = "DELETE FROM " + queueTable() + " WHERE task_id=?";
    Connections.run(connectionProvider, "acknowledge task " + taskRef,
        conn -> JdbcTemplate.update(conn, sql, taskRef));
  }

  /** Current time truncated to the millisecond precision of every supported column type. */
  protected Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MILLIS);
  }
}
