package netimport.jdbc.purge;

import netimport.jdbc.TableNames;

/**
 * H2 job purger. Uses the default subquery-based {@code DELETE}
 * from {@link AbstractJdbcJobPurger}.
 */
public final class H2JobPurger extends AbstractJdbcJobPurger {

  public H2JobPurger() {
    super();
  }

  public H2JobPurger(TableNames tables) {
    super(tables);
  }
}
