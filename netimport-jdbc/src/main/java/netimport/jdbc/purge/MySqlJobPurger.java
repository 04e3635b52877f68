package netimport.jdbc.purge;

import netimport.jdbc.JdbcTemplate;
import netimport.jdbc.TableNames;

import java.sql.Connection;
import java.time.Instant;

/**
 * MySQL job purger. Also compatible with TiDB.
 *
 * <p>Overrides with {@code DELETE ... ORDER BY ... LIMIT}, which MySQL supports
 * natively and avoids the self-referencing subquery.
 */
public final class MySqlJobPurger extends AbstractJdbcJobPurger {

  public MySqlJobPurger() {
    super();
  }

  public MySqlJobPurger(TableNames tables) {
    super(tables);
  }

  @Override
  public int purge(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + jobTable()
        + " WHERE status IN " + TERMINAL_STATUS_IN
        + " AND COALESCE(completed_at, created_at) < ?"
        + " ORDER BY created_at LIMIT ?";
    return JdbcTemplate.update(conn, sql, before, limit);
  }
}
