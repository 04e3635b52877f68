package netimport.jdbc.store;

import netimport.jdbc.TableNames;
import netimport.model.JobOrdering;

import java.util.List;

/**
 * PostgreSQL job store.
 *
 * <p>PostgreSQL sorts NULL as the highest value, so listings spell out the null
 * placement to match the other databases.
 */
public final class PostgresJobStore extends AbstractJdbcJobStore {

  public PostgresJobStore() {
    super();
  }

  public PostgresJobStore(TableNames tables) {
    super(tables);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected String orderBy(JobOrdering ordering) {
    return ordering.column() + (ordering.descending() ? " DESC NULLS LAST" : " ASC NULLS FIRST");
  }
}
