package ca.gc.cra.sentinel.application.detect.indicators;

import ca.gc.cra.sentinel.application.detect.IndicatorHit;
import ca.gc.cra.sentinel.application.detect.IndicatorParams;
import ca.gc.cra.sentinel.application.detect.IpActivity;
import ca.gc.cra.sentinel.domain.detect.TunnelType;
import ca.gc.cra.sentinel.domain.traffic.LogEntry;
import java.util.Optional;

/** Fires when a response was held open long enough to act as a covert downstream channel. */
public final class LongPollCheck extends WeightedIndicator {
  public static final String NAME = "long_poll";

  private final double thresholdMillis;

  public LongPollCheck(IndicatorParams params) {
    super(NAME, params, 20, TunnelType.LONG_POLL_COVERT);
    this.thresholdMillis = params.decimal("thresholdMillis", 30_000d);
  }

  @Override
  public Optional<IndicatorHit> evaluate(LogEntry entry, IpActivity activity) {
    if (entry.responseTimeMs() > thresholdMillis) {
      return hit("Long-polling behavior (" + Math.round(entry.responseTimeMs()) + " ms)");
    }
    return Optional.empty();
  }
}
