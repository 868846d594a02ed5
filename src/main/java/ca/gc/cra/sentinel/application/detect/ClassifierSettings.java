package ca.gc.cra.sentinel.application.detect;

import ca.gc.cra.sentinel.application.detect.indicators.IndicatorCatalog;
import java.util.List;
import java.util.Objects;

/**
 * Compiled classifier rules: confidence bands, enabled checks and per-IP history sizing.
 *
 * @param bands confidence bands
 * @param checks enabled checks in evaluation order
 * @param maxTrackedIps addresses tracked per worker arena
 * @param historyPerIp exchanges retained per address
 * @since 0.1.0
 */
public record ClassifierSettings(
    ConfidenceBands bands, List<IndicatorCheck> checks, int maxTrackedIps, int historyPerIp) {

  public ClassifierSettings {
    Objects.requireNonNull(bands, "bands");
    checks = List.copyOf(Objects.requireNonNull(checks, "checks"));
    if (maxTrackedIps <= 0 || historyPerIp <= 0) {
      throw new IllegalArgumentException("activity.maxTrackedIps and activity.historyPerIp must be positive");
    }
    for (IndicatorCheck check : checks) {
      check.requireHistory(historyPerIp);
    }
  }

  public static ClassifierSettings defaults() {
    return new ClassifierSettings(
        ConfidenceBands.defaults(),
        IndicatorCatalog.defaults(),
        IpActivityArena.DEFAULT_MAX_TRACKED_IPS,
        IpActivityArena.DEFAULT_HISTORY_PER_IP);
  }

  public IpActivityArena newArena() {
    return new IpActivityArena(maxTrackedIps, historyPerIp);
  }
}
