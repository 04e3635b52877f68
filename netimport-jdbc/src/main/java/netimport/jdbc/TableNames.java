package netimport.jdbc;

import java.util.Objects;

/**
 * Names of the four tables used by the JDBC components, validated against SQL injection.
 *
 * <p>Tables are named {@code <prefix>job}, {@code <prefix>job_log}, {@code <prefix>job_queue}
 * and {@code <prefix>worker}; the default prefix is {@code ni_}.
 */
public final class TableNames {
  public static final String DEFAULT_PREFIX = "ni_";
  public static final TableNames DEFAULT = withPrefix(DEFAULT_PREFIX);
  private static final String TABLE_NAME_PATTERN = "[a-zA-Z_][a-zA-Z0-9_]*";

  private final String job;
  private final String log;
  private final String queue;
  private final String worker;

  private TableNames(String job, String log, String queue, String worker) {
    this.job = validate(job);
    this.log = validate(log);
    this.queue = validate(queue);
    this.worker = validate(worker);
  }

  public static TableNames withPrefix(String prefix) {
    Objects.requireNonNull(prefix, "prefix");
    return new TableNames(prefix + "job", prefix + "job_log", prefix + "job_queue", prefix + "worker");
  }

  public static String validate(String tableName) {
    Objects.requireNonNull(tableName, "tableName");
    if (!tableName.matches(TABLE_NAME_PATTERN)) {
      throw new IllegalArgumentException("Invalid table name: " + tableName);
    }
    return tableName;
  }

  public String job() {
    return job;
  }

  public String log() {
    return log;
  }

  public String queue() {
    return queue;
  }

  public String worker() {
    return worker;
  }

  @Override
  public String toString() {
    return "TableNames[" + job + ", " + log + ", " + queue + ", " + worker + "]";
  }
}
