package netimport.spi;

/**
 * Outcome reported by an {@link ImportExecutor} that returned normally.
 *
 * @param success whether the import succeeded
 * @param summary short description, recorded on failure
 */
public record ImportResult(boolean success, String summary) {

  public static ImportResult succeeded() {
    return new ImportResult(true, null);
  }

  public static ImportResult failed(String summary) {
    return new ImportResult(false, summary);
  }
}
