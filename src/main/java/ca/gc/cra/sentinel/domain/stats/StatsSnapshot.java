package ca.gc.cra.sentinel.domain.stats;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Point-in-time aggregate over the rolling stats window.
 * <p><strong>Role:</strong> Derived value; never persisted, recomputed by the stats aggregator.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param totalRequests entries in the window
 * @param tunnelDetections entries in the window that carried a verdict
 * @param deniedRequests entries in the window denied by block enforcement
 * @param averageResponseTimeMs mean response time over the window; {@code 0} when empty
 * @param statusCounts status code to count, ordered by status code; values sum to {@code totalRequests}
 * @param topIps client addresses ranked by descending count, ties broken by address
 * @param generatedAt time the snapshot was computed
 * @since 0.1.0
 */
public record StatsSnapshot(
    long totalRequests,
    long tunnelDetections,
    long deniedRequests,
    double averageResponseTimeMs,
    Map<Integer, Long> statusCounts,
    List<IpCount> topIps,
    Instant generatedAt) {

  public StatsSnapshot {
    statusCounts = Collections.unmodifiableMap(new TreeMap<>(Objects.requireNonNull(statusCounts, "statusCounts")));
    topIps = List.copyOf(Objects.requireNonNull(topIps, "topIps"));
    generatedAt = Objects.requireNonNull(generatedAt, "generatedAt");
    long sum = 0L;
    for (long count : statusCounts.values()) {
      sum += count;
    }
    if (sum != totalRequests) {
      throw new IllegalArgumentException(
          "statusCounts sum " + sum + " does not match totalRequests " + totalRequests);
    }
  }

  public static StatsSnapshot empty(Instant at) {
    return new StatsSnapshot(0L, 0L, 0L, 0d, Map.of(), List.of(), at);
  }
}
