package ca.gc.cra.sentinel.application.detect.indicators;

import ca.gc.cra.sentinel.application.detect.IndicatorHit;
import ca.gc.cra.sentinel.application.detect.IndicatorParams;
import ca.gc.cra.sentinel.application.detect.IpActivity;
import ca.gc.cra.sentinel.domain.detect.TunnelType;
import ca.gc.cra.sentinel.domain.traffic.LogEntry;
import java.util.Locale;
import java.util.Optional;

/**
 * Fires when an address contacts the edge on a regular cadence.
 *
 * <p>Regularity is the coefficient of variation (standard deviation over mean) of the positive intervals between
 * retained timestamps.</p>
 */
public final class BeaconingCheck extends WeightedIndicator {
  public static final String NAME = "beaconing";

  private final int minSamples;
  private final int minIntervals;
  private final double maxVariation;
  private final double maxMeanSeconds;

  public BeaconingCheck(IndicatorParams params) {
    super(NAME, params, 35, TunnelType.BEACONING);
    this.minSamples = params.integer("minSamples", 10);
    this.minIntervals = params.integer("minIntervals", 5);
    this.maxVariation = params.decimal("maxVariation", 0.3d);
    this.maxMeanSeconds = params.decimal("maxMeanIntervalSeconds", 300d);
  }

  @Override
  public void requireHistory(int historyPerIp) {
    if (minSamples > historyPerIp) {
      throw new IllegalArgumentException("indicators." + NAME + ".minSamples (" + minSamples
          + ") must not exceed activity.historyPerIp (" + historyPerIp + ")");
    }
  }

  @Override
  public Optional<IndicatorHit> evaluate(LogEntry entry, IpActivity activity) {
    if (activity.size() < minSamples) {
      return Optional.empty();
    }
    double sum = 0d;
    int count = 0;
    double[] intervals = new double[activity.size() - 1];
    for (int i = 1; i < activity.size(); i++) {
      double delta = (activity.timestampAt(i) - activity.timestampAt(i - 1)) / 1_000d;
      if (delta > 0d) {
        intervals[count++] = delta;
        sum += delta;
      }
    }
    if (count < minIntervals) {
      return Optional.empty();
    }
    double mean = sum / count;
    double squares = 0d;
    for (int i = 0; i < count; i++) {
      double diff = intervals[i] - mean;
      squares += diff * diff;
    }
    double variation = Math.sqrt(squares / count) / mean;
    if (variation < maxVariation && mean < maxMeanSeconds) {
      return hit(String.format(Locale.ROOT, "Beaconing detected (interval: %.1fs, variation %.2f)", mean, variation));
    }
    return Optional.empty();
  }
}
