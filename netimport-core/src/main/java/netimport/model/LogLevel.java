package netimport.model;

import java.util.Locale;
import java.util.Optional;

public enum LogLevel {
  DEBUG,
  INFO,
  WARNING,
  ERROR,
  CRITICAL;

  /** ERROR and CRITICAL entries count towards a job's error total. */
  public boolean isError() {
    return this == ERROR || this == CRITICAL;
  }

  /**
   * Lenient, case-insensitive lookup that also accepts {@code WARN} and {@code FATAL}.
   */
  public static Optional<LogLevel> lookup(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String upper = value.trim().toUpperCase(Locale.ROOT);
    switch (upper) {
      case "WARN":
        return Optional.of(WARNING);
      case "FATAL":
        return Optional.of(CRITICAL);
      default:
        for (LogLevel level : values()) {
          if (level.name().equals(upper)) {
            return Optional.of(level);
          }
        }
        return Optional.empty();
    }
  }
}
