package netimport.dispatch;

import netimport.testing.StubTransport;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkerPoolDetectorTest {

  private final StubTransport transport = new StubTransport();

  @Test
  void liveWorkersMakeBackendAvailable() {
    transport.register("w1");
    try (WorkerPoolDetector detector = new WorkerPoolDetector(transport)) {
      BackendProbe probe = detector.probe();
      assertTrue(probe.available());
      assertEquals(1, probe.workerCount());
    }
  }

  @Test
  void noWorkersMeansUnavailable() {
    try (WorkerPoolDetector detector = new WorkerPoolDetector(transport)) {
      BackendProbe probe = detector.probe();
      assertFalse(probe.available());
      assertEquals("no live workers", probe.reason());
    }
  }

  @Test
  void slowBrokerTimesOut() {
    transport.register("w1");
    transport.pingDelayMs = 2_000;
    try (WorkerPoolDetector detector = new WorkerPoolDetector(transport, Duration.ofMillis(100))) {
      long start = System.nanoTime();
      BackendProbe probe = detector.probe();
      long elapsedMs = (System.nanoTime() - start) / 1_000_000;

      assertFalse(probe.available());
      assertTrue(probe.reason().startsWith("probe timed out"));
      assertTrue(elapsedMs < 1_500, "probe took " + elapsedMs + " ms");
    }
  }

  @Test
  void hungProbesAreCappedAndLaterProbesSkipTheTransport() {
    transport.register("w1");
    CountDownLatch gate = new CountDownLatch(1);
    transport.pingGate = gate;
    try (WorkerPoolDetector detector = new WorkerPoolDetector(transport, Duration.ofMillis(100), 1)) {
      BackendProbe first = detector.probe();
      assertTrue(first.reason().startsWith("probe timed out"));

      BackendProbe second = detector.probe();
      assertFalse(second.available());
      assertEquals("earlier probes still pending", second.reason());
    } finally {
      gate.countDown();
    }
  }

  @Test
  void unreachableBrokerIsUnavailable() {
    transport.pingFailure = new IllegalStateException("connection refused");
    try (WorkerPoolDetector detector = new WorkerPoolDetector(transport)) {
      BackendProbe probe = detector.probe();
      assertFalse(probe.available());
      assertTrue(probe.reason().contains("connection refused"));
    }
  }

  @Test
  void rejectsNonPositiveTimeout() {
    assertThrows(IllegalArgumentException.class, () -> new WorkerPoolDetector(transport, Duration.ZERO));
    assertThrows(IllegalArgumentException.class,
        () -> new WorkerPoolDetector(transport, Duration.ofSeconds(1), 0));
  }
}
