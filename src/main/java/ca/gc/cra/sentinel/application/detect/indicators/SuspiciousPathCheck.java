package ca.gc.cra.sentinel.application.detect.indicators;

import ca.gc.cra.sentinel.application.detect.IndicatorHit;
import ca.gc.cra.sentinel.application.detect.IndicatorParams;
import ca.gc.cra.sentinel.application.detect.IpActivity;
import ca.gc.cra.sentinel.domain.detect.TunnelType;
import ca.gc.cra.sentinel.domain.traffic.LogEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Fires when the path names a relay style endpoint. */
public final class SuspiciousPathCheck extends WeightedIndicator {
  public static final String NAME = "suspicious_path";

  private final List<String> fragments;

  public SuspiciousPathCheck(IndicatorParams params) {
    super(NAME, params, 25, TunnelType.HTTP_TUNNEL);
    this.fragments = lower(params.strings("paths", List.of("/proxy", "/tunnel", "/conn", "/socket", "/relay")));
  }

  @Override
  public Optional<IndicatorHit> evaluate(LogEntry entry, IpActivity activity) {
    String path = entry.path().toLowerCase(Locale.ROOT);
    List<String> evidence = new ArrayList<>();
    for (String fragment : fragments) {
      if (path.contains(fragment)) {
        evidence.add("Suspicious path: " + fragment);
      }
    }
    return hit(evidence);
  }
}
