package ca.gc.cra.sentinel.application.port;

/**
 * <strong>What:</strong> Port abstracting SENTINEL metrics emission.
 * <p><strong>Why:</strong> Lets the pipeline, bus, and classifier record counters and latencies without binding to
 * a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from every worker thread.</p>
 * <p><strong>Performance:</strong> Calls should be non-blocking and amortized O(1).</p>
 *
 * @implNote Metric keys use dotted names such as {@code pipeline.entry.processed}.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (nanoseconds, bytes, depth); semantics defined by the caller
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
