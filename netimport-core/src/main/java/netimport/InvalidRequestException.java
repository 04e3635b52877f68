package netimport;

/**
 * Thrown when a job request is rejected before any job record is created:
 * unknown mode, blank or oversized site code, or missing settings selectors. Query
 * endpoints also raise it for filters they cannot parse.
 */
public final class InvalidRequestException extends RuntimeException {

  public InvalidRequestException(String message) {
    super(message);
  }

  public InvalidRequestException(String message, Throwable cause) {
    super(message, cause);
  }
}
