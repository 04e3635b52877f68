package netimport.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a stored import job.
 *
 * <p>{@code startedAt} is set by the transition to {@link JobStatus#RUNNING};
 * {@code completedAt} and {@code success} only by the transition out of it.
 * A job failed at dispatch has {@code success=false} and no timestamps beyond
 * {@code createdAt}.
 *
 * @param id          ULID assigned at creation
 * @param siteCode    site the import targets
 * @param mode        check or apply
 * @param status      current lifecycle state
 * @param success     outcome, {@code null} until terminal
 * @param principal   identity that submitted the job
 * @param settings    named settings selectors and options
 * @param taskRef     transport task reference when dispatched to a worker, else {@code null}
 * @param runnerId    identity of the runner that claimed the job, else {@code null}
 * @param createdAt   creation time
 * @param startedAt   time of the RUNNING transition, else {@code null}
 * @param completedAt time of the terminal transition from RUNNING, else {@code null}
 * @param heartbeatAt last liveness mark written by the runner, else {@code null}
 */
public record Job(
    String id,
    String siteCode,
    JobMode mode,
    JobStatus status,
    Boolean success,
    String principal,
    JobSettings settings,
    String taskRef,
    String runnerId,
    Instant createdAt,
    Instant startedAt,
    Instant completedAt,
    Instant heartbeatAt
) {

  public Job {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(siteCode, "siteCode");
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(principal, "principal");
    Objects.requireNonNull(settings, "settings");
    Objects.requireNonNull(createdAt, "createdAt");
  }

  /**
   * A freshly created job awaiting execution.
   */
  public static Job queued(String id, String siteCode, JobMode mode, String principal,
      JobSettings settings, Instant createdAt) {
    return new Job(id, siteCode, mode, JobStatus.QUEUED, null, principal, settings,
        null, null, createdAt, null, null, null);
  }

  /** Copy of this job carrying a transport task reference. */
  public Job withTaskRef(String taskRef) {
    return new Job(id, siteCode, mode, status, success, principal, settings, taskRef, runnerId,
        createdAt, startedAt, completedAt, heartbeatAt);
  }

  public boolean isTerminal() {
    return status.isTerminal();
  }
}
