package netimport.spi;

import java.sql.Connection;
import java.time.Instant;

/**
 * Deletes terminal jobs, and with them their log entries, older than a cutoff.
 *
 * @see netimport.purge.JobPurgeScheduler
 */
public interface JobPurger {

  /**
   * Deletes up to {@code limit} COMPLETED or FAILED jobs created before {@code before}.
   *
   * @param conn   the JDBC connection
   * @param before age cutoff
   * @param limit  maximum jobs deleted
   * @return number of jobs deleted
   */
  int purge(Connection conn, Instant before, int limit);
}
