package netimport.jdbc.transport;

import netimport.jdbc.JdbcTemplate;
import netimport.jdbc.TableNames;
import netimport.spi.ClaimedTask;
import netimport.spi.ConnectionProvider;

import java.sql.Connection;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * PostgreSQL worker transport.
 */
public final class PostgresWorkerTransport extends AbstractJdbcWorkerTransport {

  public PostgresWorkerTransport(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.DEFAULT, DEFAULT_LIVENESS_WINDOW, Clock.systemUTC());
  }

  public PostgresWorkerTransport(ConnectionProvider connectionProvider, TableNames tables,
      Duration livenessWindow, Clock clock) {
    super(connectionProvider, tables, livenessWindow, clock);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  protected List<ClaimedTask> claimRows(Connection conn, String workerId, Instant now,
      Instant lockExpiry, int limit) {
    // Single round-trip: FOR UPDATE SKIP LOCKED + RETURNING
    String sql = "UPDATE " + queueTable()
        + " SET locked_by=?, locked_at=?, deliveries=deliveries+1"
        + " WHERE task_id IN (SELECT task_id FROM " + queueTable()
        + " WHERE locked_by IS NULL OR locked_at < ?"
        + " ORDER BY enqueued_at LIMIT ? FOR UPDATE SKIP LOCKED)"
        + " RETURNING " + TASK_COLUMNS;
    List<ClaimedTask> claimed = JdbcTemplate.updateReturning(conn, sql, TASK_ROW_MAPPER,
        workerId, now, lockExpiry, limit);
    return claimed.stream()
        .sorted((a, b) -> a.enqueuedAt().compareTo(b.enqueuedAt()))
        .toList();
  }
}
