package ca.gc.cra.sentinel.application.detect.indicators;

import ca.gc.cra.sentinel.application.detect.IndicatorHit;
import ca.gc.cra.sentinel.application.detect.IndicatorParams;
import ca.gc.cra.sentinel.application.detect.IpActivity;
import ca.gc.cra.sentinel.domain.detect.TunnelType;
import ca.gc.cra.sentinel.domain.traffic.LogEntry;
import java.util.Optional;

/** Fires on large uploads answered with an almost empty response, the shape of exfiltration. */
public final class AsymmetricTransferCheck extends WeightedIndicator {
  public static final String NAME = "asymmetric_transfer";

  private final long minRequestBytes;
  private final long maxResponseBytes;

  public AsymmetricTransferCheck(IndicatorParams params) {
    super(NAME, params, 25, TunnelType.HTTP_TUNNEL);
    this.minRequestBytes = params.integer("minRequestBytes", 10_000);
    this.maxResponseBytes = params.integer("maxResponseBytes", 100);
  }

  @Override
  public Optional<IndicatorHit> evaluate(LogEntry entry, IpActivity activity) {
    if (!"POST".equals(entry.method())) {
      return Optional.empty();
    }
    long sent = entry.requestBody().size();
    long received = entry.responseBody().size();
    if (sent > minRequestBytes && received < maxResponseBytes) {
      return hit("Large POST with minimal response (" + sent + " bytes sent, " + received + " received)");
    }
    return Optional.empty();
  }
}
