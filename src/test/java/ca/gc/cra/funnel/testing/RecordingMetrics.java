package ca.gc.cra.funnel.testing;

import ca.gc.cra.funnel.application.port.MetricsPort;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Thread-safe {@link MetricsPort} that remembers counters and the last observation per key. */
public final class RecordingMetrics implements MetricsPort {
  private final Map<String, Long> counters = new ConcurrentHashMap<>();
  private final Map<String, Long> observations = new ConcurrentHashMap<>();

  @Override
  public void increment(String key) {
    counters.merge(key, 1L, Long::sum);
  }

  @Override
  public void observe(String key, long value) {
    observations.put(key, value);
  }

  public long counter(String key) {
    return counters.getOrDefault(key, 0L);
  }

  public long observation(String key) {
    return observations.getOrDefault(key, 0L);
  }
}
