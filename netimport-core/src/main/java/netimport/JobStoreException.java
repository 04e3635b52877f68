package netimport;

/**
 * Unchecked exception wrapping persistence errors raised while reading or
 * writing job records and log entries.
 */
public final class JobStoreException extends RuntimeException {
  public JobStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
