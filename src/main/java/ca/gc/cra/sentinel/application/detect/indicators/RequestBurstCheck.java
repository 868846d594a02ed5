package ca.gc.cra.sentinel.application.detect.indicators;

import ca.gc.cra.sentinel.application.detect.IndicatorHit;
import ca.gc.cra.sentinel.application.detect.IndicatorParams;
import ca.gc.cra.sentinel.application.detect.IpActivity;
import ca.gc.cra.sentinel.domain.detect.TunnelType;
import ca.gc.cra.sentinel.domain.traffic.LogEntry;
import java.util.Optional;

/**
 * Fires when one address sends many tiny exchanges in a short window, the rhythm of an interactive command channel.
 *
 * <p>The count is bounded by the per-IP history size, so {@code threshold} must stay below it.</p>
 */
public final class RequestBurstCheck extends WeightedIndicator {
  public static final String NAME = "request_burst";

  private final int threshold;
  private final long windowMillis;
  private final long smallBytes;

  public RequestBurstCheck(IndicatorParams params) {
    super(NAME, params, 25, TunnelType.HTTP_TUNNEL);
    this.threshold = params.integer("threshold", 50);
    this.windowMillis = params.integer("windowSeconds", 60) * 1_000L;
    this.smallBytes = params.integer("smallBytes", 50);
    if (threshold <= 0 || windowMillis <= 0) {
      throw new IllegalArgumentException("indicators." + NAME + ": threshold and windowSeconds must be positive");
    }
  }

  @Override
  public void requireHistory(int historyPerIp) {
    if (threshold >= historyPerIp) {
      throw new IllegalArgumentException("indicators." + NAME + ".threshold (" + threshold
          + ") must be below activity.historyPerIp (" + historyPerIp + ")");
    }
  }

  @Override
  public Optional<IndicatorHit> evaluate(LogEntry entry, IpActivity activity) {
    long cutoff = entry.timestamp().toEpochMilli() - windowMillis;
    int small = 0;
    for (int i = activity.size() - 1; i >= 0; i--) {
      if (activity.timestampAt(i) < cutoff) {
        continue;
      }
      if (activity.requestSizeAt(i) < smallBytes && activity.responseSizeAt(i) < smallBytes) {
        small++;
      }
    }
    if (small > threshold) {
      return hit("Rapid small request pattern (" + small + " in " + (windowMillis / 1_000L) + "s)");
    }
    return Optional.empty();
  }
}
