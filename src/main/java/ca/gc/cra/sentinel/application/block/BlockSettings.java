package ca.gc.cra.sentinel.application.block;

import java.util.List;
import java.util.Objects;

/**
 * Block enforcement tuning.
 *
 * @param exemptPaths paths that are always allowed, compared exactly
 * @param lockTimeoutMillis maximum wait for the rule store write lock
 * @since 0.1.0
 */
public record BlockSettings(List<String> exemptPaths, long lockTimeoutMillis) {
  public static final List<String> DEFAULT_EXEMPT_PATHS = List.of("/health", "/api/health");
  public static final long DEFAULT_LOCK_TIMEOUT_MILLIS = 2_000L;

  public BlockSettings {
    exemptPaths = List.copyOf(Objects.requireNonNull(exemptPaths, "exemptPaths"));
    if (lockTimeoutMillis <= 0L) {
      throw new IllegalArgumentException("lockTimeoutMillis must be positive");
    }
  }

  public static BlockSettings defaults() {
    return new BlockSettings(DEFAULT_EXEMPT_PATHS, DEFAULT_LOCK_TIMEOUT_MILLIS);
  }
}
