package netimport.query;

import netimport.JobNotFoundException;
import netimport.model.Job;
import netimport.model.JobFilter;
import netimport.model.JobOrdering;
import netimport.model.JobStats;
import netimport.model.LogEntry;
import netimport.model.LogLevel;
import netimport.spi.ConnectionProvider;
import netimport.spi.JobStore;
import netimport.util.Connections;

import java.util.List;
import java.util.Objects;

/**
 * Read-only access to jobs and their logs. Manages connections internally.
 *
 * <p>Persistence errors surface as {@link netimport.JobStoreException}.
 */
public final class JobQueries {
  public static final int MAX_PAGE_SIZE = 500;

  private final ConnectionProvider connectionProvider;
  private final JobStore jobStore;

  public JobQueries(ConnectionProvider connectionProvider, JobStore jobStore) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.jobStore = Objects.requireNonNull(jobStore, "jobStore");
  }

  /**
   * @param jobId the job id
   * @return the job
   * @throws JobNotFoundException if no such job exists
   */
  public Job getJob(String jobId) {
    return Connections.withConnection(connectionProvider, "load job " + jobId,
        conn -> jobStore.findById(conn, jobId)).orElseThrow(() -> new JobNotFoundException(jobId));
  }

  /**
   * Lists jobs. {@code limit} is capped at {@value #MAX_PAGE_SIZE}.
   *
   * @param filter   equality filters
   * @param ordering sort order, {@code null} for newest first
   * @param limit    page size, must be &gt; 0
   * @param offset   rows to skip, must be &ge; 0
   * @return matching jobs
   */
  public List<Job> listJobs(JobFilter filter, JobOrdering ordering, int limit, int offset) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    if (offset < 0) {
      throw new IllegalArgumentException("offset must be >= 0");
    }
    JobFilter f = filter != null ? filter : JobFilter.all();
    JobOrdering o = ordering != null ? ordering : JobOrdering.defaultOrdering();
    int capped = Math.min(limit, MAX_PAGE_SIZE);
    return Connections.withConnection(connectionProvider, "list jobs",
        conn -> jobStore.list(conn, f, o, capped, offset));
  }

  public long countJobs(JobFilter filter) {
    JobFilter f = filter != null ? filter : JobFilter.all();
    return Connections.withConnection(connectionProvider, "count jobs", conn -> jobStore.count(conn, f));
  }

  /**
   * Log entries of a job, ordered by sequence.
   *
   * @param jobId the job id
   * @param level exact level to keep, or {@code null} for all
   * @return the entries
   * @throws JobNotFoundException if no such job exists
   */
  public List<LogEntry> getLogs(String jobId, LogLevel level) {
    return Connections.withConnection(connectionProvider, "list logs of job " + jobId, conn -> {
      if (jobStore.findById(conn, jobId).isEmpty()) {
        throw new JobNotFoundException(jobId);
      }
      return jobStore.listLogs(conn, jobId, level);
    });
  }

  public List<LogEntry> getLogs(String jobId) {
    return getLogs(jobId, null);
  }

  /**
   * @param jobId the job id
   * @return log counters; zero for a job without entries
   */
  public JobStats stats(String jobId) {
    return Connections.withConnection(connectionProvider, "count logs of job " + jobId,
        conn -> jobStore.stats(conn, jobId));
  }
}
