package netimport.jdbc.store;

import netimport.jdbc.JdbcTemplate;
import netimport.jdbc.TableNames;
import netimport.model.Job;
import netimport.model.JobFilter;
import netimport.model.JobMode;
import netimport.model.JobOrdering;
import netimport.model.JobSettings;
import netimport.model.JobStats;
import netimport.model.JobStatus;
import netimport.model.LogEntry;
import netimport.model.LogLevel;
import netimport.spi.JobStore;
import netimport.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC job store with standard SQL shared by all supported databases.
 *
 * <p>Status transitions are single conditional {@code UPDATE}s guarded on the current
 * status, so concurrent callers race on the row and exactly one of them sees an update
 * count of 1. Log entries are keyed on {@code (job_id, sequence_no)}.
 *
 * <p>Subclasses identify the database through {@link #name()} and
 * {@link #jdbcUrlPrefixes()} for auto-detection by {@link JdbcJobStores}.
 *
 * @see H2JobStore
 * @see MySqlJobStore
 * @see PostgresJobStore
 */
public abstract class AbstractJdbcJobStore implements JobStore {

  protected static final String JOB_COLUMNS =
      "job_id, site_code, job_mode, status, success, principal, settings, task_ref, runner_id, "
          + "created_at, started_at, completed_at, heartbeat_at";

  protected static final String LOG_COLUMNS =
      "job_id, sequence_no, log_level, message, log_source, logged_at";

  private final TableNames tables;
  private final JsonCodec jsonCodec;

  protected AbstractJdbcJobStore() {
    this(TableNames.DEFAULT);
  }

  protected AbstractJdbcJobStore(TableNames tables) {
    this(tables, JsonCodec.getDefault());
  }

  protected AbstractJdbcJobStore(TableNames tables, JsonCodec jsonCodec) {
    this.tables = Objects.requireNonNull(tables, "tables");
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  /** Short identifier for this store, e.g. "h2", "mysql", "postgresql". */
  public abstract String name();

  /** JDBC URL prefixes this store handles, used for auto-detection. */
  public abstract List<String> jdbcUrlPrefixes();

  protected TableNames tables() {
    return tables;
  }

  protected String jobTable() {
    return tables.job();
  }

  protected String logTable() {
    return tables.log();
  }

  protected final JdbcTemplate.RowMapper<Job> jobMapper() {
    return this::mapJob;
  }

  // ── Job records ──────────────────────────────────────────────────

  @Override
  public void insertQueued(Connection conn, Job job) {
    if (job.status() != JobStatus.QUEUED) {
      throw new IllegalArgumentException("New jobs must be QUEUED, got " + job.status());
    }
    String sql = "INSERT INTO " + jobTable() + " (" + JOB_COLUMNS + ") "
        + "VALUES (?, ?, ?, ?, NULL, ?, ?, ?, NULL, ?, NULL, NULL, NULL)";
    JdbcTemplate.update(conn, sql,
        job.id(),
        job.siteCode(),
        job.mode().value(),
        JobStatus.QUEUED.code(),
        job.principal(),
        jsonCodec.toJson(job.settings().toMap()),
        job.taskRef(),
        job.createdAt());
  }

  @Override
  public Optional<Job> findById(Connection conn, String jobId) {
    String sql = "SELECT " + JOB_COLUMNS + " FROM " + jobTable() + " WHERE job_id=?";
    List<Job> rows = JdbcTemplate.query(conn, sql, jobMapper(), jobId);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public int markRunning(Connection conn, String jobId, String runnerId, Instant startedAt) {
    String sql = "UPDATE " + jobTable()
        + " SET status=" + JobStatus.RUNNING.code() + ", runner_id=?, started_at=?, heartbeat_at=?"
        + " WHERE job_id=? AND status=" + JobStatus.QUEUED.code();
    return JdbcTemplate.update(conn, sql, runnerId, startedAt, startedAt, jobId);
  }

  @Override
  public int markCompleted(Connection conn, String jobId, Instant completedAt) {
    return finishRunning(conn, jobId, JobStatus.COMPLETED, true, completedAt);
  }

  @Override
  public int markFailed(Connection conn, String jobId, Instant completedAt) {
    return finishRunning(conn, jobId, JobStatus.FAILED, false, completedAt);
  }

  private int finishRunning(Connection conn, String jobId, JobStatus status, boolean success,
      Instant completedAt) {
    String sql = "UPDATE " + jobTable()
        + " SET status=" + status.code() + ", success=" + (success ? "TRUE" : "FALSE")
        + ", completed_at=? WHERE job_id=? AND status=" + JobStatus.RUNNING.code();
    return JdbcTemplate.update(conn, sql, completedAt, jobId);
  }

  @Override
  public int markDispatchFailed(Connection conn, String jobId) {
    String sql = "UPDATE " + jobTable()
        + " SET status=" + JobStatus.FAILED.code() + ", success=FALSE"
        + " WHERE job_id=? AND status=" + JobStatus.QUEUED.code();
    return JdbcTemplate.update(conn, sql, jobId);
  }

  @Override
  public int markOrphaned(Connection conn, String jobId, Instant staleBefore, Instant completedAt) {
    String sql = "UPDATE " + jobTable()
        + " SET status=" + JobStatus.FAILED.code() + ", success=FALSE, completed_at=?"
        + " WHERE job_id=? AND status=" + JobStatus.RUNNING.code() + " AND heartbeat_at < ?";
    return JdbcTemplate.update(conn, sql, completedAt, jobId, staleBefore);
  }

  @Override
  public int updateTaskRef(Connection conn, String jobId, String taskRef) {
    String sql = "UPDATE " + jobTable() + " SET task_ref=? WHERE job_id=? AND task_ref IS NULL";
    return JdbcTemplate.update(conn, sql, taskRef, jobId);
  }

  @Override
  public int touchHeartbeat(Connection conn, String jobId, String runnerId, Instant at) {
    String sql = "UPDATE " + jobTable() + " SET heartbeat_at=?"
        + " WHERE job_id=? AND runner_id=? AND status=" + JobStatus.RUNNING.code();
    return JdbcTemplate.update(conn, sql, at, jobId, runnerId);
  }

  @Override
  public List<Job> findStaleRunning(Connection conn, Instant staleBefore, int limit) {
    String sql = "SELECT " + JOB_COLUMNS + " FROM " + jobTable()
        + " WHERE status=" + JobStatus.RUNNING.code() + " AND heartbeat_at < ?"
        + " ORDER BY heartbeat_at LIMIT ?";
    return JdbcTemplate.query(conn, sql, jobMapper(), staleBefore, limit);
  }

  // ── Listing ──────────────────────────────────────────────────────

  @Override
  public List<Job> list(Connection conn, JobFilter filter, JobOrdering ordering, int limit, int offset) {
    List<Object> params = new ArrayList<>();
    StringBuilder sql = new StringBuilder("SELECT ").append(JOB_COLUMNS)
        .append(" FROM ").append(jobTable());
    appendWhere(sql, params, filter);
    sql.append(" ORDER BY ").append(orderBy(ordering))
        .append(", job_id").append(ordering.descending() ? " DESC" : " ASC")
        .append(" LIMIT ? OFFSET ?");
    params.add(limit);
    params.add(offset);
    return JdbcTemplate.query(conn, sql.toString(), jobMapper(), params.toArray());
  }

  @Override
  public long count(Connection conn, JobFilter filter) {
    List<Object> params = new ArrayList<>();
    StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM ").append(jobTable());
    appendWhere(sql, params, filter);
    return JdbcTemplate.queryLong(conn, sql.toString(), params.toArray());
  }

  /**
   * Sort expression for {@code ordering}. Unset timestamps sort as the lowest values,
   * which is the default on H2 and MySQL.
   */
  protected String orderBy(JobOrdering ordering) {
    return ordering.column() + (ordering.descending() ? " DESC" : " ASC");
  }

  private static void appendWhere(StringBuilder sql, List<Object> params, JobFilter filter) {
    List<String> clauses = new ArrayList<>();
    if (filter.status() != null) {
      clauses.add("status=?");
      params.add(filter.status().code());
    }
    if (filter.mode() != null) {
      clauses.add("job_mode=?");
      params.add(filter.mode().value());
    }
    if (filter.siteCode() != null) {
      clauses.add("site_code=?");
      params.add(filter.siteCode());
    }
    if (!clauses.isEmpty()) {
      sql.append(" WHERE ").append(String.join(" AND ", clauses));
    }
  }

  // ── Log entries ──────────────────────────────────────────────────

  @Override
  public void appendLog(Connection conn, LogEntry entry) {
    String sql = "INSERT INTO " + logTable() + " (" + LOG_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?)";
    JdbcTemplate.update(conn, sql,
        entry.jobId(),
        entry.sequence(),
        entry.level().name(),
        entry.message(),
        entry.source(),
        entry.timestamp());
  }

  @Override
  public long maxSequence(Connection conn, String jobId) {
    String sql = "SELECT COALESCE(MAX(sequence_no), 0) FROM " + logTable() + " WHERE job_id=?";
    return JdbcTemplate.queryLong(conn, sql, jobId);
  }

  @Override
  public List<LogEntry> listLogs(Connection conn, String jobId, LogLevel level) {
    if (level == null) {
      String sql = "SELECT " + LOG_COLUMNS + " FROM " + logTable()
          + " WHERE job_id=? ORDER BY sequence_no";
      return JdbcTemplate.query(conn, sql, AbstractJdbcJobStore::mapLog, jobId);
    }
    String sql = "SELECT " + LOG_COLUMNS + " FROM " + logTable()
        + " WHERE job_id=? AND log_level=? ORDER BY sequence_no";
    return JdbcTemplate.query(conn, sql, AbstractJdbcJobStore::mapLog, jobId, level.name());
  }

  @Override
  public JobStats stats(Connection conn, String jobId) {
    String sql = "SELECT COUNT(*), "
        + "COALESCE(SUM(CASE WHEN log_level IN ('ERROR', 'CRITICAL') THEN 1 ELSE 0 END), 0)"
        + " FROM " + logTable() + " WHERE job_id=?";
    List<JobStats> rows = JdbcTemplate.query(conn, sql,
        rs -> new JobStats(rs.getLong(1), rs.getLong(2)), jobId);
    return rows.isEmpty() ? JobStats.EMPTY : rows.get(0);
  }

  // ── Row mapping ──────────────────────────────────────────────────

  private Job mapJob(ResultSet rs) throws SQLException {
    boolean success = rs.getBoolean("success");
    Boolean outcome = rs.wasNull() ? null : success;
    String mode = rs.getString("job_mode");
    return new Job(
        rs.getString("job_id"),
        rs.getString("site_code"),
        JobMode.fromValue(mode)
            .orElseThrow(() -> new SQLException("Unknown job mode in store: " + mode)),
        JobStatus.fromCode(rs.getInt("status")),
        outcome,
        rs.getString("principal"),
        JobSettings.fromMap(jsonCodec.parseObject(rs.getString("settings"))),
        rs.getString("task_ref"),
        rs.getString("runner_id"),
        JdbcTemplate.instant(rs, "created_at"),
        JdbcTemplate.instant(rs, "started_at"),
        JdbcTemplate.instant(rs, "completed_at"),
        JdbcTemplate.instant(rs, "heartbeat_at"));
  }

  private static LogEntry mapLog(ResultSet rs) throws SQLException {
    String level = rs.getString("log_level");
    return new LogEntry(
        rs.getString("job_id"),
        rs.getLong("sequence_no"),
        LogLevel.lookup(level).orElseThrow(() -> new SQLException("Unknown log level in store: " + level)),
        rs.getString("message"),
        rs.getString("log_source"),
        JdbcTemplate.instant(rs, "logged_at"));
  }
}
