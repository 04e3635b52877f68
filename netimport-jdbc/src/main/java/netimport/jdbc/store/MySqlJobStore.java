package netimport.jdbc.store;

import netimport.jdbc.TableNames;

import java.util.List;

/**
 * MySQL / TiDB job store.
 *
 * <p>MariaDB URLs are matched as well; the schema in {@code schema/mysql.sql} works on both.
 */
public final class MySqlJobStore extends AbstractJdbcJobStore {

  public MySqlJobStore() {
    super();
  }

  public MySqlJobStore(TableNames tables) {
    super(tables);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:mariadb:", "jdbc:tidb:");
  }
}
