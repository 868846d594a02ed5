package ca.gc.cra.sentinel.testutil;

import ca.gc.cra.sentinel.application.port.MetricsPort;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test double capturing metric usage for assertions. Safe to share with worker threads.
 */
public final class RecordingMetricsPort implements MetricsPort {
  private final Map<String, AtomicInteger> counters = new ConcurrentHashMap<>();
  private final Map<String, List<Long>> observations = new ConcurrentHashMap<>();

  @Override
  public void increment(String key) {
    counters.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
  }

  @Override
  public void observe(String key, long value) {
    observations.computeIfAbsent(key, k -> Collections.synchronizedList(new ArrayList<>())).add(value);
  }

  public int count(String key) {
    AtomicInteger counter = counters.get(key);
    return counter == null ? 0 : counter.get();
  }

  public List<Long> observed(String key) {
    List<Long> values = observations.get(key);
    if (values == null) {
      return List.of();
    }
    synchronized (values) {
      return List.copyOf(values);
    }
  }

  public boolean hasObservation(String key) {
    return observations.containsKey(key);
  }

  public boolean hasCounter(String key) {
    return counters.containsKey(key);
  }
}
