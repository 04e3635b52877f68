package netimport.dispatch;

import java.util.List;
import java.util.Objects;

/**
 * Result of one worker availability probe.
 *
 * @param available whether at least one live worker answered in time
 * @param reason    human-readable explanation, never {@code null}
 * @param workerIds ids of the workers that answered
 */
public record BackendProbe(boolean available, String reason, List<String> workerIds) {

  public BackendProbe {
    Objects.requireNonNull(reason, "reason");
    workerIds = workerIds == null ? List.of() : List.copyOf(workerIds);
  }

  public static BackendProbe available(List<String> workerIds) {
    return new BackendProbe(true, workerIds.size() + " live worker(s)", workerIds);
  }

  public static BackendProbe unavailable(String reason) {
    return new BackendProbe(false, reason, List.of());
  }

  public int workerCount() {
    return workerIds.size();
  }
}
