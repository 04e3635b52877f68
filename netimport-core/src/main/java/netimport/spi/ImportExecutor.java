package netimport.spi;

/**
 * Adapter to the network import library.
 *
 * <p>Called by the runner on the thread that runs the job. Implementations stream
 * progress through {@code log}, then either return a result or throw. A thrown exception
 * and a result with {@code success=false} both fail the job.
 */
@FunctionalInterface
public interface ImportExecutor {

  /**
   * Runs one import.
   *
   * @param request what to import and how
   * @param log     sink for progress lines
   * @return the outcome
   * @throws Exception any failure of the import library
   */
  ImportResult execute(ImportRequest request, ImportLog log) throws Exception;
}
