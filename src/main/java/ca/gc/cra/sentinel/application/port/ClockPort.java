package ca.gc.cra.sentinel.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock time to ingest, classification, rule, and stats components.
 * <p><strong>Why:</strong> Rate-based indicators and rolling windows need a deterministic clock in tests.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.sentinel.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }
}
