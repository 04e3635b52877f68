package netimport.jdbc.store;

import netimport.JobStoreException;
import netimport.jdbc.Schemas;
import netimport.jdbc.TableNames;
import netimport.model.Job;
import netimport.model.JobFilter;
import netimport.model.JobMode;
import netimport.model.JobOrdering;
import netimport.model.JobSettings;
import netimport.model.JobStats;
import netimport.model.JobStatus;
import netimport.model.LogEntry;
import netimport.model.LogLevel;
import netimport.util.Ids;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JdbcJobStoreTest {
  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

  private final H2JobStore store = new H2JobStore();
  private Connection conn;

  @BeforeEach
  void setup() throws Exception {
    JdbcDataSource ds = Schemas.h2();
    conn = ds.getConnection();
    conn.setAutoCommit(true);
  }

  @AfterEach
  void tearDown() throws Exception {
    conn.close();
  }

  private Job insert(String site, JobMode mode, Instant createdAt) {
    Job job = Job.queued(Ids.newJobId(), site, mode, "alice",
        JobSettings.of("x", "y"), createdAt);
    store.insertQueued(conn, job);
    return job;
  }

  private LogEntry entry(String jobId, long seq, LogLevel level, String message) {
    return new LogEntry(jobId, seq, level, message, "network-importer", T0.plusSeconds(seq));
  }

  // ── Records ─────────────────────────────────────────────────────

  @Test
  void insertAndFindRoundTripsAllFields() {
    JobSettings settings = new JobSettings("x", "y", "bf", Map.of("main.import_ips", "true"));
    Job job = Job.queued(Ids.newJobId(), "lab01", JobMode.APPLY, "bob", settings, T0);
    store.insertQueued(conn, job);

    Job found = store.findById(conn, job.id()).orElseThrow();
    assertEquals(job.id(), found.id());
    assertEquals("lab01", found.siteCode());
    assertEquals(JobMode.APPLY, found.mode());
    assertEquals(JobStatus.QUEUED, found.status());
    assertNull(found.success());
    assertEquals("bob", found.principal());
    assertEquals(settings, found.settings());
    assertEquals(T0, found.createdAt());
    assertNull(found.startedAt());
    assertNull(found.completedAt());
    assertNull(found.taskRef());
  }

  @Test
  void findUnknownIsEmpty() {
    assertTrue(store.findById(conn, "missing").isEmpty());
  }

  @Test
  void insertRejectsNonQueuedJob() {
    Job running = new Job(Ids.newJobId(), "lab01", JobMode.CHECK, JobStatus.RUNNING, null, "alice",
        JobSettings.of("x", "y"), null, "r1", T0, T0, null, T0);
    assertThrows(IllegalArgumentException.class, () -> store.insertQueued(conn, running));
  }

  @Test
  void duplicateIdFails() {
    Job job = insert("lab01", JobMode.CHECK, T0);
    assertThrows(JobStoreException.class, () -> store.insertQueued(conn, job));
  }

  // ── Transitions ─────────────────────────────────────────────────

  @Test
  void markRunningOnlyOnce() {
    Job job = insert("lab01", JobMode.CHECK, T0);
    assertEquals(1, store.markRunning(conn, job.id(), "runner-a", T0.plusSeconds(1)));
    assertEquals(0, store.markRunning(conn, job.id(), "runner-b", T0.plusSeconds(2)));

    Job found = store.findById(conn, job.id()).orElseThrow();
    assertEquals(JobStatus.RUNNING, found.status());
    assertEquals("runner-a", found.runnerId());
    assertEquals(T0.plusSeconds(1), found.startedAt());
    assertEquals(T0.plusSeconds(1), found.heartbeatAt());
  }

  @Test
  void markCompletedRequiresRunning() {
    Job job = insert("lab01", JobMode.CHECK, T0);
    assertEquals(0, store.markCompleted(conn, job.id(), T0.plusSeconds(5)));

    store.markRunning(conn, job.id(), "r", T0.plusSeconds(1));
    assertEquals(1, store.markCompleted(conn, job.id(), T0.plusSeconds(5)));
    assertEquals(0, store.markFailed(conn, job.id(), T0.plusSeconds(6)));

    Job found = store.findById(conn, job.id()).orElseThrow();
    assertEquals(JobStatus.COMPLETED, found.status());
    assertEquals(Boolean.TRUE, found.success());
    assertEquals(T0.plusSeconds(5), found.completedAt());
  }

  @Test
  void markFailedSetsSuccessFalse() {
    Job job = insert("lab01", JobMode.CHECK, T0);
    store.markRunning(conn, job.id(), "r", T0.plusSeconds(1));
    assertEquals(1, store.markFailed(conn, job.id(), T0.plusSeconds(2)));

    Job found = store.findById(conn, job.id()).orElseThrow();
    assertEquals(JobStatus.FAILED, found.status());
    assertEquals(Boolean.FALSE, found.success());
  }

  @Test
  void markDispatchFailedLeavesTimestampsUnset() {
    Job job = insert("lab01", JobMode.CHECK, T0);
    assertEquals(1, store.markDispatchFailed(conn, job.id()));
    assertEquals(0, store.markDispatchFailed(conn, job.id()));

    Job found = store.findById(conn, job.id()).orElseThrow();
    assertEquals(JobStatus.FAILED, found.status());
    assertEquals(Boolean.FALSE, found.success());
    assertNull(found.startedAt());
    assertNull(found.completedAt());
  }

  @Test
  void markOrphanedOnlyWhenHeartbeatIsStale() {
    Job job = insert("lab01", JobMode.CHECK, T0);
    store.markRunning(conn, job.id(), "r", T0);
    store.touchHeartbeat(conn, job.id(), "r", T0.plusSeconds(60));

    assertEquals(0, store.markOrphaned(conn, job.id(), T0.plusSeconds(30), T0.plusSeconds(90)));
    assertEquals(1, store.markOrphaned(conn, job.id(), T0.plusSeconds(61), T0.plusSeconds(90)));
    assertEquals(JobStatus.FAILED, store.findById(conn, job.id()).orElseThrow().status());
  }

  @Test
  void touchHeartbeatRequiresOwner() {
    Job job = insert("lab01", JobMode.CHECK, T0);
    store.markRunning(conn, job.id(), "owner", T0);
    assertEquals(0, store.touchHeartbeat(conn, job.id(), "intruder", T0.plusSeconds(5)));
    assertEquals(1, store.touchHeartbeat(conn, job.id(), "owner", T0.plusSeconds(5)));
    assertEquals(T0.plusSeconds(5), store.findById(conn, job.id()).orElseThrow().heartbeatAt());
  }

  @Test
  void taskRefFirstWriteWins() {
    Job job = insert("lab01", JobMode.CHECK, T0);
    assertEquals(1, store.updateTaskRef(conn, job.id(), "task-1"));
    assertEquals(0, store.updateTaskRef(conn, job.id(), "task-2"));
    assertEquals("task-1", store.findById(conn, job.id()).orElseThrow().taskRef());
  }

  @Test
  void findStaleRunningReturnsOldestHeartbeatFirst() {
    Job a = insert("lab01", JobMode.CHECK, T0);
    Job b = insert("lab02", JobMode.CHECK, T0);
    Job fresh = insert("lab03", JobMode.CHECK, T0);
    insert("lab04", JobMode.CHECK, T0);
    store.markRunning(conn, a.id(), "r", T0.plusSeconds(20));
    store.markRunning(conn, b.id(), "r", T0.plusSeconds(10));
    store.markRunning(conn, fresh.id(), "r", T0.plusSeconds(500));

    List<Job> stale = store.findStaleRunning(conn, T0.plusSeconds(100), 10);
    assertEquals(List.of(b.id(), a.id()), stale.stream().map(Job::id).toList());
    assertEquals(1, store.findStaleRunning(conn, T0.plusSeconds(100), 1).size());
  }

  // ── Listing ─────────────────────────────────────────────────────

  @Test
  void listFiltersAndCounts() {
    Job a = insert("lab01", JobMode.CHECK, T0);
    insert("lab01", JobMode.APPLY, T0.plusSeconds(1));
    insert("lab02", JobMode.CHECK, T0.plusSeconds(2));
    store.markRunning(conn, a.id(), "r", T0.plusSeconds(3));

    assertEquals(3, store.count(conn, JobFilter.all()));
    assertEquals(2, store.count(conn, JobFilter.all().withSiteCode("lab01")));
    assertEquals(1, store.count(conn, JobFilter.all().withSiteCode("lab01").withMode(JobMode.APPLY)));
    assertEquals(1, store.count(conn, JobFilter.all().withStatus(JobStatus.RUNNING)));

    List<Job> running = store.list(conn, JobFilter.all().withStatus(JobStatus.RUNNING),
        JobOrdering.defaultOrdering(), 10, 0);
    assertEquals(List.of(a.id()), running.stream().map(Job::id).toList());
  }

  @Test
  void listOrdersAndPages() {
    Job first = insert("lab01", JobMode.CHECK, T0);
    Job second = insert("lab01", JobMode.CHECK, T0.plusSeconds(1));
    Job third = insert("lab01", JobMode.CHECK, T0.plusSeconds(2));

    List<Job> desc = store.list(conn, JobFilter.all(), JobOrdering.CREATED_AT_DESC, 10, 0);
    assertEquals(List.of(third.id(), second.id(), first.id()), desc.stream().map(Job::id).toList());

    List<Job> asc = store.list(conn, JobFilter.all(), JobOrdering.CREATED_AT_ASC, 2, 1);
    assertEquals(List.of(second.id(), third.id()), asc.stream().map(Job::id).toList());
  }

  // ── Logs ────────────────────────────────────────────────────────

  @Test
  void logsAreReturnedInSequenceOrder() {
    Job job = insert("lab01", JobMode.CHECK, T0);
    store.appendLog(conn, entry(job.id(), 2, LogLevel.WARNING, "second"));
    store.appendLog(conn, entry(job.id(), 1, LogLevel.INFO, "first"));
    store.appendLog(conn, entry(job.id(), 3, LogLevel.ERROR, "third"));

    List<LogEntry> logs = store.listLogs(conn, job.id(), null);
    assertEquals(List.of(1L, 2L, 3L), logs.stream().map(LogEntry::sequence).toList());
    LogEntry first = logs.get(0);
    assertEquals("first", first.message());
    assertEquals(LogLevel.INFO, first.level());
    assertEquals("network-importer", first.source());
    assertEquals(T0.plusSeconds(1), first.timestamp());
    assertEquals(3, store.maxSequence(conn, job.id()));
  }

  @Test
  void listLogsFiltersByLevel() {
    Job job = insert("lab01", JobMode.CHECK, T0);
    store.appendLog(conn, entry(job.id(), 1, LogLevel.INFO, "a"));
    store.appendLog(conn, entry(job.id(), 2, LogLevel.ERROR, "b"));
    store.appendLog(conn, entry(job.id(), 3, LogLevel.INFO, "c"));

    List<LogEntry> errors = store.listLogs(conn, job.id(), LogLevel.ERROR);
    assertEquals(1, errors.size());
    assertEquals("b", errors.get(0).message());
  }

  @Test
  void duplicateSequenceIsRejected() {
    Job job = insert("lab01", JobMode.CHECK, T0);
    store.appendLog(conn, entry(job.id(), 1, LogLevel.INFO, "a"));
    assertThrows(JobStoreException.class,
        () -> store.appendLog(conn, entry(job.id(), 1, LogLevel.INFO, "again")));
  }

  @Test
  void maxSequenceIsZeroWithoutLogs() {
    Job job = insert("lab01", JobMode.CHECK, T0);
    assertEquals(0, store.maxSequence(conn, job.id()));
  }

  @Test
  void statsCountErrorsAndCritical() {
    Job job = insert("lab01", JobMode.CHECK, T0);
    assertEquals(JobStats.EMPTY, store.stats(conn, job.id()));

    store.appendLog(conn, entry(job.id(), 1, LogLevel.INFO, "a"));
    store.appendLog(conn, entry(job.id(), 2, LogLevel.ERROR, "b"));
    store.appendLog(conn, entry(job.id(), 3, LogLevel.CRITICAL, "c"));
    store.appendLog(conn, entry(job.id(), 4, LogLevel.WARNING, "d"));

    assertEquals(new JobStats(4, 2), store.stats(conn, job.id()));
  }

  @Test
  void customTableNamesAreUsed() throws Exception {
    try (var st = conn.createStatement()) {
      st.execute("CREATE TABLE lab_job AS SELECT * FROM ni_job WHERE 1=0");
    }
    H2JobStore custom = new H2JobStore(TableNames.withPrefix("lab_"));
    Job job = Job.queued(Ids.newJobId(), "lab01", JobMode.CHECK, "alice",
        JobSettings.of("x", "y"), T0.truncatedTo(ChronoUnit.MILLIS));
    custom.insertQueued(conn, job);

    assertTrue(custom.findById(conn, job.id()).isPresent());
    assertTrue(store.findById(conn, job.id()).isEmpty());
  }
}
