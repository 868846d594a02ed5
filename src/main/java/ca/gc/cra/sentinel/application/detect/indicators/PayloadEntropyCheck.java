package ca.gc.cra.sentinel.application.detect.indicators;

import ca.gc.cra.sentinel.application.detect.IndicatorHit;
import ca.gc.cra.sentinel.application.detect.IndicatorParams;
import ca.gc.cra.sentinel.application.detect.IpActivity;
import ca.gc.cra.sentinel.domain.detect.TunnelType;
import ca.gc.cra.sentinel.domain.traffic.LogEntry;
import java.util.Optional;

/** Fires when the request body is large enough to judge and looks encrypted or compressed. */
public final class PayloadEntropyCheck extends WeightedIndicator {
  public static final String NAME = "payload_entropy";

  private final int minBytes;
  private final double threshold;

  public PayloadEntropyCheck(IndicatorParams params) {
    super(NAME, params, 25, TunnelType.HTTP_TUNNEL);
    this.minBytes = params.integer("minBytes", 100);
    this.threshold = params.decimal("threshold", 0.9d);
  }

  @Override
  public Optional<IndicatorHit> evaluate(LogEntry entry, IpActivity activity) {
    if (entry.requestBody().storedLength() <= minBytes) {
      return Optional.empty();
    }
    double entropy = entry.requestBody().normalizedEntropy();
    if (entropy <= threshold) {
      return Optional.empty();
    }
    return hit("High entropy body (" + twoDecimals(entropy) + ")");
  }
}
