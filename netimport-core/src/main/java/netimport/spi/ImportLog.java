package netimport.spi;

import netimport.model.LogLevel;

/**
 * Receives log lines from an import while it runs. Each call is persisted before it
 * returns, so clients polling the job's logs see lines as they happen.
 *
 * <p>Implementations supplied by the runner are thread-safe.
 */
@FunctionalInterface
public interface ImportLog {

  void log(LogLevel level, String message);

  default void debug(String message) {
    log(LogLevel.DEBUG, message);
  }

  default void info(String message) {
    log(LogLevel.INFO, message);
  }

  default void warning(String message) {
    log(LogLevel.WARNING, message);
  }

  default void error(String message) {
    log(LogLevel.ERROR, message);
  }
}
