package netimport.jdbc.store;

import netimport.jdbc.TableNames;

import java.util.List;

/**
 * H2 job store. Uses the standard SQL of {@link AbstractJdbcJobStore} unchanged.
 */
public final class H2JobStore extends AbstractJdbcJobStore {

  public H2JobStore() {
    super();
  }

  public H2JobStore(TableNames tables) {
    super(tables);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
