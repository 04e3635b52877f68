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
 * MySQL worker transport. Also compatible with TiDB.
 */
public final class MySqlWorkerTransport extends AbstractJdbcWorkerTransport {

  public MySqlWorkerTransport(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.DEFAULT, DEFAULT_LIVENESS_WINDOW, Clock.systemUTC());
  }

  public MySqlWorkerTransport(ConnectionProvider connectionProvider, TableNames tables,
      Duration livenessWindow, Clock clock) {
    super(connectionProvider, tables, livenessWindow, clock);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  protected List<ClaimedTask> claimRows(Connection conn, String workerId, Instant now,
      Instant lockExpiry, int limit) {
    // MySQL rejects LIMIT inside IN subqueries but supports UPDATE...ORDER BY...LIMIT
    String claimSql = "UPDATE " + queueTable()
        + " SET locked_by=?, locked_at=?, deliveries=deliveries+1"
        + " WHERE locked_by IS NULL OR locked_at < ?"
        + " ORDER BY enqueued_at LIMIT ?";
    int updated = JdbcTemplate.update(conn, claimSql, workerId, now, lockExpiry, limit);
    if (updated == 0) {
      return List.of();
    }
    return selectClaimed(conn, workerId, now);
  }
}
