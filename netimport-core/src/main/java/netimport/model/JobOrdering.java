package netimport.model;

/**
 * Sort orders accepted when listing jobs. Parsed from the
 * {@code [-]field} form, e.g. {@code -created_at}.
 */
public enum JobOrdering {
  CREATED_AT_DESC("created_at", true),
  CREATED_AT_ASC("created_at", false),
  STARTED_AT_DESC("started_at", true),
  STARTED_AT_ASC("started_at", false),
  COMPLETED_AT_DESC("completed_at", true),
  COMPLETED_AT_ASC("completed_at", false);

  private final String column;
  private final boolean descending;

  JobOrdering(String column, boolean descending) {
    this.column = column;
    this.descending = descending;
  }

  /** Column the ordering sorts on; always one of a fixed set of names. */
  public String column() {
    return column;
  }

  public boolean descending() {
    return descending;
  }

  public static JobOrdering defaultOrdering() {
    return CREATED_AT_DESC;
  }

  /**
   * Parses {@code created_at}, {@code -started_at} and so on. Blank input yields the default.
   *
   * @throws IllegalArgumentException for unknown fields
   */
  public static JobOrdering parse(String value) {
    if (value == null || value.isBlank()) {
      return defaultOrdering();
    }
    String trimmed = value.trim();
    boolean desc = trimmed.startsWith("-");
    String field = desc ? trimmed.substring(1) : trimmed;
    for (JobOrdering ordering : values()) {
      if (ordering.column.equals(field) && ordering.descending == desc) {
        return ordering;
      }
    }
    throw new IllegalArgumentException("Unsupported ordering: " + value);
  }
}
