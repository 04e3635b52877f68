package netimport.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import netimport.ConcurrentExecutionException;
import netimport.NetImport;
import netimport.dispatch.JobHandle;
import netimport.dispatch.JobRequest;
import netimport.jdbc.store.H2JobStore;
import netimport.jdbc.transport.H2WorkerTransport;
import netimport.model.Job;
import netimport.model.JobMode;
import netimport.model.JobStatus;
import netimport.runner.JobRunner;
import netimport.spi.ImportResult;
import netimport.util.Ids;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class HikariCPIntegrationTest {
  private HikariDataSource hikariDs;
  private H2JobStore store;
  private DataSourceConnectionProvider connectionProvider;

  @BeforeEach
  void setup() throws Exception {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";MODE=MySQL;DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(8);
    config.setMinimumIdle(1);
    config.setPoolName("netimport-test-pool");

    hikariDs = new HikariDataSource(config);
    store = new H2JobStore();
    connectionProvider = new DataSourceConnectionProvider(hikariDs);
    Schemas.apply(hikariDs, "/schema/h2.sql");
  }

  @AfterEach
  void tearDown() {
    if (hikariDs != null && !hikariDs.isClosed()) {
      hikariDs.close();
    }
  }

  @Test
  void concurrentRunnersClaimJobExactlyOnce() throws Exception {
    Job job = Job.queued(Ids.newJobId(), "lab01", JobMode.CHECK, "alice",
        TestSettings.settings(), Instant.now());
    try (Connection conn = hikariDs.getConnection()) {
      store.insertQueued(conn, job);
    }

    AtomicInteger executions = new AtomicInteger();
    int contenders = 6;
    CountDownLatch start = new CountDownLatch(1);
    List<JobRunner> runners = new ArrayList<>();
    ExecutorService executor = Executors.newFixedThreadPool(contenders);
    try {
      List<Future<Job>> results = new ArrayList<>();
      for (int i = 0; i < contenders; i++) {
        JobRunner runner = JobRunner.builder()
            .connectionProvider(connectionProvider)
            .jobStore(store)
            .settingsResolver(TestSettings.resolver())
            .importExecutor((request, log) -> {
              executions.incrementAndGet();
              log.info("connected");
              return ImportResult.succeeded();
            })
            .runnerId("runner-" + i)
            .build();
        runners.add(runner);
        Callable<Job> call = () -> {
          start.await();
          return runner.run(job.id());
        };
        results.add(executor.submit(call));
      }
      start.countDown();

      int winners = 0;
      int rejected = 0;
      for (Future<Job> result : results) {
        try {
          assertEquals(JobStatus.COMPLETED, result.get(5, TimeUnit.SECONDS).status());
          winners++;
        } catch (ExecutionException e) {
          assertInstanceOf(ConcurrentExecutionException.class, e.getCause());
          rejected++;
        }
      }
      assertEquals(1, winners);
      assertEquals(contenders - 1, rejected);
      assertEquals(1, executions.get());
    } finally {
      executor.shutdownNow();
      runners.forEach(JobRunner::close);
    }

    try (Connection conn = hikariDs.getConnection()) {
      assertEquals(1, store.listLogs(conn, job.id(), null).size());
    }
    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }

  @Test
  void queuedJobsThroughPoolLeaveNoLeakedConnections() throws Exception {
    H2WorkerTransport transport = new H2WorkerTransport(connectionProvider);
    List<String> ids = new ArrayList<>();
    try (NetImport worker = NetImport.workerNode()
        .connectionProvider(connectionProvider)
        .jobStore(store)
        .transport(transport)
        .settingsResolver(TestSettings.resolver())
        .importExecutor((request, log) -> {
          log.info("site " + request.siteCode());
          return ImportResult.succeeded();
        })
        .concurrency(3)
        .pollIntervalMs(20)
        .heartbeatIntervalMs(200)
        .build();
         NetImport api = NetImport.apiNode()
             .connectionProvider(connectionProvider)
             .jobStore(store)
             .transport(transport)
             .settingsResolver(TestSettings.resolver())
             .importExecutor((request, log) -> ImportResult.succeeded())
             .build()) {
      for (int i = 0; i < 10; i++) {
        JobHandle handle = api.dispatcher().submit(
            new JobRequest("lab" + i, "check", TestSettings.settings()), "alice");
        ids.add(handle.job().id());
      }

      long deadline = System.currentTimeMillis() + 10_000;
      for (String id : ids) {
        Job job = api.queries().getJob(id);
        while (!job.isTerminal() && System.currentTimeMillis() < deadline) {
          Thread.sleep(20);
          job = api.queries().getJob(id);
        }
        assertEquals(JobStatus.COMPLETED, job.status(), id);
        assertEquals(1, api.queries().getLogs(id).size());
      }
    }
    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }
}
