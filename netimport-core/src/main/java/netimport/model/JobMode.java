package netimport.model;

import java.util.Optional;

/**
 * What the import does with the computed differences.
 */
public enum JobMode {
  /** Dry run: compute and report differences, persist nothing. */
  CHECK("check"),
  /** Persist the computed differences to the inventory. */
  APPLY("apply");

  private final String value;

  JobMode(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /** Exact match on the lowercase API value; anything else is empty. */
  public static Optional<JobMode> fromValue(String value) {
    for (JobMode mode : values()) {
      if (mode.value.equals(value)) {
        return Optional.of(mode);
      }
    }
    return Optional.empty();
  }
}
