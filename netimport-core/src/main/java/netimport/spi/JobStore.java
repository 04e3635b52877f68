package netimport.spi;

import netimport.model.Job;
import netimport.model.JobFilter;
import netimport.model.JobOrdering;
import netimport.model.JobStats;
import netimport.model.LogEntry;
import netimport.model.LogLevel;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence operations for import jobs and their log streams.
 *
 * <p>All methods take an explicit {@link Connection}; callers own the connection and
 * its transaction. Every mutating method that changes {@code status} is a conditional
 * update guarded on the expected current status and returns the number of rows it
 * changed, so {@code 0} means the job was not in the expected state (or does not exist).
 *
 * <p>Implementations throw {@link netimport.JobStoreException} on persistence errors.
 *
 * @see netimport.jdbc.store.AbstractJdbcJobStore
 */
public interface JobStore {

  /**
   * Inserts a new job in {@link netimport.model.JobStatus#QUEUED}.
   *
   * @param conn the JDBC connection
   * @param job  the job to insert; its status must be QUEUED
   */
  void insertQueued(Connection conn, Job job);

  /**
   * Finds a job by id.
   *
   * @param conn  the JDBC connection
   * @param jobId the job id
   * @return the job, or empty if no such job exists
   */
  Optional<Job> findById(Connection conn, String jobId);

  /**
   * QUEUED to RUNNING. Sets {@code started_at}, {@code heartbeat_at} and {@code runner_id}.
   *
   * @param conn      the JDBC connection
   * @param jobId     the job id
   * @param runnerId  identity of the claiming runner
   * @param startedAt transition time
   * @return 1 if this call claimed the job, 0 otherwise
   */
  int markRunning(Connection conn, String jobId, String runnerId, Instant startedAt);

  /**
   * RUNNING to COMPLETED with {@code success=true}.
   *
   * @param conn        the JDBC connection
   * @param jobId       the job id
   * @param completedAt transition time
   * @return rows updated (0 if the job was not RUNNING)
   */
  int markCompleted(Connection conn, String jobId, Instant completedAt);

  /**
   * RUNNING to FAILED with {@code success=false}.
   *
   * @param conn        the JDBC connection
   * @param jobId       the job id
   * @param completedAt transition time
   * @return rows updated (0 if the job was not RUNNING)
   */
  int markFailed(Connection conn, String jobId, Instant completedAt);

  /**
   * QUEUED to FAILED with {@code success=false}, leaving {@code started_at} and
   * {@code completed_at} unset. Used only when the job could not be dispatched.
   *
   * @param conn  the JDBC connection
   * @param jobId the job id
   * @return rows updated (0 if the job was not QUEUED)
   */
  int markDispatchFailed(Connection conn, String jobId);

  /**
   * RUNNING to FAILED for a job whose heartbeat is older than {@code staleBefore}.
   *
   * @param conn        the JDBC connection
   * @param jobId       the job id
   * @param staleBefore heartbeat cutoff
   * @param completedAt transition time
   * @return rows updated (0 if the job is no longer RUNNING or has heart-beaten since)
   */
  int markOrphaned(Connection conn, String jobId, Instant staleBefore, Instant completedAt);

  /**
   * Records the transport task reference. Only the first reference is kept.
   *
   * @param conn    the JDBC connection
   * @param jobId   the job id
   * @param taskRef the reference returned by {@link WorkerTransport#enqueue}
   * @return rows updated
   */
  int updateTaskRef(Connection conn, String jobId, String taskRef);

  /**
   * Refreshes {@code heartbeat_at} for a RUNNING job owned by {@code runnerId}.
   *
   * @param conn     the JDBC connection
   * @param jobId    the job id
   * @param runnerId the owning runner
   * @param at       heartbeat time
   * @return rows updated
   */
  int touchHeartbeat(Connection conn, String jobId, String runnerId, Instant at);

  /**
   * RUNNING jobs whose heartbeat is older than {@code staleBefore}, oldest first.
   *
   * @param conn        the JDBC connection
   * @param staleBefore heartbeat cutoff
   * @param limit       maximum rows returned
   * @return stale jobs
   */
  List<Job> findStaleRunning(Connection conn, Instant staleBefore, int limit);

  /**
   * Lists jobs matching {@code filter}.
   *
   * @param conn     the JDBC connection
   * @param filter   equality filters
   * @param ordering sort order
   * @param limit    maximum rows returned
   * @param offset   rows to skip
   * @return matching jobs
   */
  List<Job> list(Connection conn, JobFilter filter, JobOrdering ordering, int limit, int offset);

  /**
   * Counts jobs matching {@code filter}.
   *
   * @param conn   the JDBC connection
   * @param filter equality filters
   * @return number of matching jobs
   */
  long count(Connection conn, JobFilter filter);

  /**
   * Appends one log entry. {@code (job_id, sequence)} is unique, so a duplicate sequence fails.
   *
   * @param conn  the JDBC connection
   * @param entry the entry to persist
   */
  void appendLog(Connection conn, LogEntry entry);

  /**
   * Highest sequence number recorded for a job, or 0 when it has none.
   *
   * @param conn  the JDBC connection
   * @param jobId the job id
   * @return the highest sequence
   */
  long maxSequence(Connection conn, String jobId);

  /**
   * Log entries for a job ordered by sequence.
   *
   * @param conn  the JDBC connection
   * @param jobId the job id
   * @param level exact level to keep, or {@code null} for all
   * @return ordered entries
   */
  List<LogEntry> listLogs(Connection conn, String jobId, LogLevel level);

  /**
   * Total and error entry counts for a job.
   *
   * @param conn  the JDBC connection
   * @param jobId the job id
   * @return log counters
   */
  JobStats stats(Connection conn, String jobId);
}
