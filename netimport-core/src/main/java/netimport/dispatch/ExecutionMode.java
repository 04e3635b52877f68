package netimport.dispatch;

import java.util.Locale;

/**
 * Where a submitted job was executed.
 */
public enum ExecutionMode {
  /** Run synchronously on the submitting thread. */
  IMMEDIATE,
  /** Handed to a worker through the transport. */
  QUEUED;

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
