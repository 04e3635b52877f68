package netimport.jdbc.purge;

import netimport.jdbc.JdbcTemplate;
import netimport.jdbc.TableNames;
import netimport.model.JobStatus;
import netimport.spi.JobPurger;

import java.sql.Connection;
import java.time.Instant;
import java.util.Objects;

/**
 * Base JDBC job purger with default subquery-based SQL that works for H2
 * and PostgreSQL.
 *
 * <p>Only COMPLETED and FAILED jobs are eligible. Age is measured from
 * {@code completed_at}, or {@code created_at} for jobs that failed before running.
 * Log entries go with their job through the {@code ON DELETE CASCADE} foreign key
 * declared in the bundled schemas.
 *
 * <p>Subclasses may override {@link #purge} for databases that support more
 * efficient syntax (e.g. MySQL supports {@code DELETE ... ORDER BY ... LIMIT}).
 *
 * @see H2JobPurger
 * @see MySqlJobPurger
 * @see PostgresJobPurger
 */
public abstract class AbstractJdbcJobPurger implements JobPurger {

  protected static final String TERMINAL_STATUS_IN =
      "(" + JobStatus.COMPLETED.code() + "," + JobStatus.FAILED.code() + ")";

  private final TableNames tables;

  protected AbstractJdbcJobPurger() {
    this(TableNames.DEFAULT);
  }

  protected AbstractJdbcJobPurger(TableNames tables) {
    this.tables = Objects.requireNonNull(tables, "tables");
  }

  protected String jobTable() {
    return tables.job();
  }

  /**
   * Deletes terminal jobs older than {@code before}, up to {@code limit} rows.
   */
  @Override
  public int purge(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + jobTable() + " WHERE job_id IN ("
        + "SELECT job_id FROM " + jobTable()
        + " WHERE status IN " + TERMINAL_STATUS_IN
        + " AND COALESCE(completed_at, created_at) < ?"
        + " ORDER BY created_at LIMIT ?)";
    return JdbcTemplate.update(conn, sql, before, limit);
  }
}
