package netimport.jdbc.purge;

import netimport.jdbc.TableNames;

import java.util.Locale;

/**
 * Creates the purger matching a detected job store name.
 */
public final class JdbcJobPurgers {

  private JdbcJobPurgers() {
  }

  /**
   * @param name   job store name, e.g. "h2", "mysql", "postgresql"
   * @param tables table names
   * @throws IllegalArgumentException for an unknown name
   */
  public static AbstractJdbcJobPurger create(String name, TableNames tables) {
    switch (name.toLowerCase(Locale.ROOT)) {
      case "h2":
        return new H2JobPurger(tables);
      case "mysql":
        return new MySqlJobPurger(tables);
      case "postgresql":
        return new PostgresJobPurger(tables);
      default:
        throw new IllegalArgumentException("No purger for database: " + name);
    }
  }
}
