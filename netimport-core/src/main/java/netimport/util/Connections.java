package netimport.util;

import netimport.JobStoreException;
import netimport.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Runs a unit of work on an auto-committed connection from a {@link ConnectionProvider},
 * translating {@link SQLException} into {@link JobStoreException}.
 */
public final class Connections {

  @FunctionalInterface
  public interface SqlFunction<T> {
    T apply(Connection conn) throws SQLException;
  }

  @FunctionalInterface
  public interface SqlAction {
    void execute(Connection conn) throws SQLException;
  }

  private Connections() {}

  public static <T> T withConnection(ConnectionProvider provider, String action, SqlFunction<T> work) {
    try (Connection conn = provider.getConnection()) {
      conn.setAutoCommit(true);
      return work.apply(conn);
    } catch (SQLException e) {
      throw new JobStoreException("Failed to " + action, e);
    }
  }

  public static void run(ConnectionProvider provider, String action, SqlAction work) {
    withConnection(provider, action, conn -> {
      work.execute(conn);
      return null;
    });
  }
}
