package ca.gc.cra.sentinel.application.stats;

/**
 * Rolling statistics window tuning.
 *
 * @param windowSize maximum number of entries in the window
 * @param windowSeconds maximum age of entries in the window; {@code 0} disables the age bound
 * @param topIps number of ranked source addresses reported
 * @param publishIntervalMillis cadence of {@code stats_update} events
 * @since 0.1.0
 */
public record StatsSettings(int windowSize, long windowSeconds, int topIps, long publishIntervalMillis) {
  public StatsSettings {
    if (windowSize <= 0) {
      throw new IllegalArgumentException("stats.windowSize must be positive");
    }
    if (windowSeconds < 0L) {
      throw new IllegalArgumentException("stats.windowSeconds must not be negative");
    }
    if (topIps <= 0) {
      throw new IllegalArgumentException("stats.topIps must be positive");
    }
    if (publishIntervalMillis < 100L) {
      throw new IllegalArgumentException("stats.publishIntervalMillis must be at least 100");
    }
  }

  public static StatsSettings defaults() {
    return new StatsSettings(1_000, 0L, 10, 5_000L);
  }
}
