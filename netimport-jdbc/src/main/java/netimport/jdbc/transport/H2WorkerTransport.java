package netimport.jdbc.transport;

import netimport.jdbc.TableNames;
import netimport.spi.ConnectionProvider;

import java.time.Clock;
import java.time.Duration;

/**
 * H2 worker transport using the default two-phase claim.
 */
public final class H2WorkerTransport extends AbstractJdbcWorkerTransport {

  public H2WorkerTransport(ConnectionProvider connectionProvider) {
    this(connectionProvider, TableNames.DEFAULT, DEFAULT_LIVENESS_WINDOW, Clock.systemUTC());
  }

  public H2WorkerTransport(ConnectionProvider connectionProvider, TableNames tables,
      Duration livenessWindow, Clock clock) {
    super(connectionProvider, tables, livenessWindow, clock);
  }

  @Override
  public String name() {
    return "h2";
  }
}
