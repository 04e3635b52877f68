package netimport;

import netimport.dispatch.ExecutionMode;
import netimport.dispatch.JobHandle;
import netimport.dispatch.JobRequest;
import netimport.model.JobStatus;
import netimport.spi.ImportResult;
import netimport.testing.Fixtures;
import netimport.testing.InMemoryJobStore;
import netimport.testing.StubConnections;
import netimport.testing.StubTransport;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NetImportTest {

  private final InMemoryJobStore store = new InMemoryJobStore();
  private final StubTransport transport = new StubTransport();

  private NetImport.ApiNodeBuilder api() {
    return NetImport.apiNode()
        .connectionProvider(StubConnections.noop())
        .jobStore(store)
        .settingsResolver(Fixtures.resolver())
        .importExecutor((request, log) -> {
          log.info("ok");
          return ImportResult.succeeded();
        });
  }

  // ── Validation ──────────────────────────────────────────────────

  @Test
  void apiNode_missingJobStore_throwsNPE() {
    assertThrows(NullPointerException.class, () -> NetImport.apiNode()
        .connectionProvider(StubConnections.noop())
        .settingsResolver(Fixtures.resolver())
        .importExecutor((r, l) -> ImportResult.succeeded())
        .build());
  }

  @Test
  void workerNode_missingTransport_throwsNPE() {
    assertThrows(NullPointerException.class, () -> NetImport.workerNode()
        .connectionProvider(StubConnections.noop())
        .jobStore(store)
        .settingsResolver(Fixtures.resolver())
        .importExecutor((r, l) -> ImportResult.succeeded())
        .build());
  }

  @Test
  void embeddedWorkerWithoutTransport_throwsISE() {
    assertThrows(IllegalStateException.class, () ->
        api().embeddedWorker(1, 100, 100, Duration.ofMinutes(1)).build());
  }

  @Test
  void builderCannotBeReused() {
    NetImport.ApiNodeBuilder builder = api();
    builder.build().close();
    assertThrows(IllegalStateException.class, builder::build);
  }

  // ── Wiring ──────────────────────────────────────────────────────

  @Test
  void apiNodeWithoutTransportRunsInline() {
    try (NetImport netImport = api().build()) {
      JobHandle handle = netImport.dispatcher().submit(new JobRequest("lab01", "check", Fixtures.settings()), "alice");

      assertEquals(ExecutionMode.IMMEDIATE, handle.executionMode());
      assertEquals(JobStatus.COMPLETED, netImport.queries().getJob(handle.job().id()).status());
      assertNull(netImport.worker());
    }
  }

  @Test
  void forceImmediateIgnoresLiveWorkers() {
    transport.register("w1");
    try (NetImport netImport = api().transport(transport).forceImmediate(true).build()) {
      JobHandle handle = netImport.dispatcher().submit(new JobRequest("lab01", "check", Fixtures.settings()), "alice");

      assertEquals(ExecutionMode.IMMEDIATE, handle.executionMode());
      assertTrue(transport.queue.isEmpty());
    }
  }

  @Test
  void apiNodeWithEmbeddedWorkerQueuesToItself() throws Exception {
    try (NetImport netImport = api().transport(transport)
        .embeddedWorker(1, 60_000, 60_000, Duration.ofMinutes(1))
        .build()) {
      assertNotNull(netImport.worker());
      JobHandle handle = netImport.dispatcher().submit(new JobRequest("lab01", "apply", Fixtures.settings()), "alice");

      assertEquals(ExecutionMode.QUEUED, handle.executionMode());
      netImport.worker().runOnce();
      assertEquals(JobStatus.COMPLETED, awaitTerminal(netImport, handle.job().id()));
    }
  }

  private static JobStatus awaitTerminal(NetImport netImport, String jobId) throws InterruptedException {
    long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
    JobStatus status = netImport.queries().getJob(jobId).status();
    while (!status.isTerminal() && System.nanoTime() < deadline) {
      Thread.sleep(10);
      status = netImport.queries().getJob(jobId).status();
    }
    return status;
  }

  @Test
  void workerNodeHasNoDispatcher() {
    try (NetImport netImport = NetImport.workerNode()
        .connectionProvider(StubConnections.noop())
        .jobStore(store)
        .settingsResolver(Fixtures.resolver())
        .importExecutor((r, l) -> ImportResult.succeeded())
        .transport(transport)
        .workerId("w-only")
        .build()) {
      assertThrows(IllegalStateException.class, netImport::dispatcher);
      assertEquals("w-only", netImport.worker().workerId());
      assertTrue(transport.liveWorkers.contains("w-only"));
    }
    assertTrue(transport.liveWorkers.isEmpty());
  }

  @Test
  void closeIsIdempotent() {
    NetImport netImport = api().transport(transport).orphanReaper(Duration.ofMinutes(5), 60).build();
    netImport.close();
    assertDoesNotThrow(netImport::close);
  }
}
