package netimport.jdbc.transport;

import netimport.jdbc.TableNames;
import netimport.spi.ConnectionProvider;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;

/**
 * Creates the worker transport matching a detected job store.
 *
 * <pre>{@code
 * AbstractJdbcJobStore store = JdbcJobStores.detect(dataSource);
 * WorkerTransport transport = JdbcWorkerTransports.create(store.name(), connectionProvider);
 * }</pre>
 */
public final class JdbcWorkerTransports {

  private JdbcWorkerTransports() {
  }

  public static AbstractJdbcWorkerTransport create(String name, ConnectionProvider connectionProvider) {
    return create(name, connectionProvider, TableNames.DEFAULT,
        AbstractJdbcWorkerTransport.DEFAULT_LIVENESS_WINDOW);
  }

  /**
   * @param name               job store name, e.g. "h2", "mysql", "postgresql"
   * @param connectionProvider connection source for queue and registry operations
   * @param tables             table names
   * @param livenessWindow     how recently a worker must have heart-beaten to count as live
   * @throws IllegalArgumentException for an unknown name
   */
  public static AbstractJdbcWorkerTransport create(String name, ConnectionProvider connectionProvider,
      TableNames tables, Duration livenessWindow) {
    Clock clock = Clock.systemUTC();
    switch (name.toLowerCase(Locale.ROOT)) {
      case "h2":
        return new H2WorkerTransport(connectionProvider, tables, livenessWindow, clock);
      case "mysql":
        return new MySqlWorkerTransport(connectionProvider, tables, livenessWindow, clock);
      case "postgresql":
        return new PostgresWorkerTransport(connectionProvider, tables, livenessWindow, clock);
      default:
        throw new IllegalArgumentException("No worker transport for database: " + name);
    }
  }
}
