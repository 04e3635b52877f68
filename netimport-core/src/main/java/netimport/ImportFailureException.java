package netimport;

/**
 * Raised by an {@link netimport.spi.ImportExecutor} to signal that the import ran
 * but did not succeed. The runner records it the same way as any other failure.
 */
public class ImportFailureException extends RuntimeException {

  public ImportFailureException(String message) {
    super(message);
  }

  public ImportFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
