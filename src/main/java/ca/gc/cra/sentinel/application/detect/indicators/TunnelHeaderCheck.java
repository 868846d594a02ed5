package ca.gc.cra.sentinel.application.detect.indicators;

import ca.gc.cra.sentinel.application.detect.IndicatorHit;
import ca.gc.cra.sentinel.application.detect.IndicatorParams;
import ca.gc.cra.sentinel.application.detect.IpActivity;
import ca.gc.cra.sentinel.domain.detect.TunnelType;
import ca.gc.cra.sentinel.domain.traffic.LogEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Fires when the request carries headers only tunnelling clients send. */
public final class TunnelHeaderCheck extends WeightedIndicator {
  public static final String NAME = "tunnel_headers";
  static final List<String> DEFAULT_HEADERS = List.of("X-Tunnel", "X-Forwarded-TCP", "X-Socket-ID");

  private final List<String> headers;

  public TunnelHeaderCheck(IndicatorParams params) {
    super(NAME, params, 40, TunnelType.HTTP_TUNNEL);
    this.headers = params.strings("headers", DEFAULT_HEADERS);
  }

  @Override
  public Optional<IndicatorHit> evaluate(LogEntry entry, IpActivity activity) {
    List<String> evidence = new ArrayList<>();
    for (String header : headers) {
      if (entry.requestHeaders().contains(header)) {
        evidence.add("Tunnel header found: " + header);
      }
    }
    return hit(evidence);
  }
}
