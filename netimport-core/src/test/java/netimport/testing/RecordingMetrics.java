package netimport.testing;

import netimport.dispatch.ExecutionMode;
import netimport.spi.MetricsExporter;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * MetricsExporter that counts calls by name.
 */
public class RecordingMetrics implements MetricsExporter {
  private final Map<String, AtomicInteger> counts = new ConcurrentHashMap<>();

  public int count(String name) {
    AtomicInteger c = counts.get(name);
    return c == null ? 0 : c.get();
  }

  private void inc(String name) {
    counts.computeIfAbsent(name, k -> new AtomicInteger()).incrementAndGet();
  }

  @Override
  public void incrementSubmitted(ExecutionMode mode) {
    inc("submitted." + mode.value());
  }

  @Override
  public void incrementRejected() {
    inc("rejected");
  }

  @Override
  public void incrementCompleted() {
    inc("completed");
  }

  @Override
  public void incrementFailed() {
    inc("failed");
  }

  @Override
  public void incrementDispatchFailure() {
    inc("dispatchFailure");
  }

  @Override
  public void incrementConcurrentExecution() {
    inc("concurrent");
  }

  @Override
  public void incrementOrphaned() {
    inc("orphaned");
  }

  @Override
  public void recordJobDurationMs(long durationMs) {
    inc("duration");
  }
}
