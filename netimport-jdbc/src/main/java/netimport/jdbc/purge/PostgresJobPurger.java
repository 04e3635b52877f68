package netimport.jdbc.purge;

import netimport.jdbc.TableNames;

/**
 * PostgreSQL job purger. Uses the default subquery-based {@code DELETE}
 * from {@link AbstractJdbcJobPurger}.
 */
public final class PostgresJobPurger extends AbstractJdbcJobPurger {

  public PostgresJobPurger() {
    super();
  }

  public PostgresJobPurger(TableNames tables) {
    super(tables);
  }
}
