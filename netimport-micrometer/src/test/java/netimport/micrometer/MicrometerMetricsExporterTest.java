package netimport.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import netimport.dispatch.ExecutionMode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void submittedIsTaggedByExecution() {
    exporter.incrementSubmitted(ExecutionMode.IMMEDIATE);
    exporter.incrementSubmitted(ExecutionMode.QUEUED);
    exporter.incrementSubmitted(ExecutionMode.QUEUED);

    assertEquals(1.0, registry.find("netimport.jobs.submitted").tag("execution", "immediate").counter().count());
    assertEquals(2.0, registry.find("netimport.jobs.submitted").tag("execution", "queued").counter().count());
  }

  @Test
  void outcomeCounters() {
    exporter.incrementCompleted();
    exporter.incrementCompleted();
    exporter.incrementFailed();
    exporter.incrementRejected();
    exporter.incrementDispatchFailure();
    exporter.incrementConcurrentExecution();
    exporter.incrementOrphaned();

    assertEquals(2.0, counter("netimport.jobs.completed").count());
    assertEquals(1.0, counter("netimport.jobs.failed").count());
    assertEquals(1.0, counter("netimport.jobs.rejected").count());
    assertEquals(1.0, counter("netimport.dispatch.failure").count());
    assertEquals(1.0, counter("netimport.runner.concurrent").count());
    assertEquals(1.0, counter("netimport.jobs.orphaned").count());
  }

  @Test
  void gaugesFollowLatestValue() {
    exporter.recordRunningJobs(3);
    exporter.recordLiveWorkers(2);
    assertEquals(3.0, gauge("netimport.jobs.running").value());
    assertEquals(2.0, gauge("netimport.workers.live").value());

    exporter.recordLiveWorkers(0);
    assertEquals(0.0, gauge("netimport.workers.live").value());
  }

  @Test
  void durationIsTimed() {
    exporter.recordJobDurationMs(1500);
    Timer timer = registry.find("netimport.jobs.duration").timer();
    assertNotNull(timer);
    assertEquals(1, timer.count());
    assertEquals(1500.0, timer.totalTime(TimeUnit.MILLISECONDS));
  }

  @Test
  void customNamePrefix() {
    var custom = new MicrometerMetricsExporter(registry, "lab.netimport");
    custom.incrementCompleted();
    custom.recordRunningJobs(4);

    assertEquals(1.0, counter("lab.netimport.jobs.completed").count());
    assertEquals(4.0, gauge("lab.netimport.jobs.running").value());
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.close();
    exporter.incrementCompleted();

    assertNull(registry.find("netimport.jobs.completed").counter());
    assertNull(registry.find("netimport.jobs.running").gauge());
  }

  @Test
  void invalidArgumentsThrow() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, "x."));
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
