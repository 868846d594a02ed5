package ca.gc.cra.sentinel.application.stream;

/**
 * Jitter-free exponential backoff between reconnection attempts.
 *
 * @param initialMillis delay before the first retry
 * @param multiplier growth factor per failed attempt; at least 1
 * @param maxMillis upper bound of any delay
 * @since 0.1.0
 */
public record ReconnectBackoff(long initialMillis, double multiplier, long maxMillis) {
  public ReconnectBackoff {
    if (initialMillis <= 0) {
      throw new IllegalArgumentException("initialMillis must be positive");
    }
    if (!(multiplier >= 1d) || Double.isInfinite(multiplier)) {
      throw new IllegalArgumentException("multiplier must be a finite value >= 1");
    }
    if (maxMillis < initialMillis) {
      throw new IllegalArgumentException("maxMillis must be >= initialMillis");
    }
  }

  public static ReconnectBackoff defaults() {
    return new ReconnectBackoff(1_000L, 2d, 30_000L);
  }

  /**
   * Delay before the given retry.
   *
   * @param attempt zero-based count of consecutive failures
   * @return delay in milliseconds, capped at {@code maxMillis}
   */
  public long delayMillis(int attempt) {
    double delay = initialMillis * Math.pow(multiplier, Math.max(0, attempt));
    return delay >= maxMillis ? maxMillis : (long) delay;
  }
}
