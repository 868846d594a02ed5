package ca.gc.cra.sentinel.application.detect.indicators;

import ca.gc.cra.sentinel.application.detect.Entropy;
import ca.gc.cra.sentinel.application.detect.IndicatorHit;
import ca.gc.cra.sentinel.application.detect.IndicatorParams;
import ca.gc.cra.sentinel.application.detect.IpActivity;
import ca.gc.cra.sentinel.domain.detect.TunnelType;
import ca.gc.cra.sentinel.domain.traffic.LogEntry;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Fires when a websocket upgrade targets a path outside the expected websocket endpoints and carries an opaque
 * payload.
 */
public final class WebSocketAbuseCheck extends WeightedIndicator {
  public static final String NAME = "websocket_abuse";

  private final List<String> websocketPaths;
  private final double payloadEntropy;

  public WebSocketAbuseCheck(IndicatorParams params) {
    super(NAME, params, 30, TunnelType.WEBSOCKET_ABUSE);
    this.websocketPaths = lower(params.strings("websocketPaths", List.of("/ws", "/websocket", "/socket.io")));
    this.payloadEntropy = params.decimal("payloadEntropy", 0.7d);
  }

  @Override
  public Optional<IndicatorHit> evaluate(LogEntry entry, IpActivity activity) {
    boolean upgrade = entry.requestHeaders().values("Upgrade").stream()
        .anyMatch(value -> value.trim().equalsIgnoreCase("websocket"));
    if (!upgrade) {
      return Optional.empty();
    }
    String path = entry.path().toLowerCase(Locale.ROOT);
    for (String expected : websocketPaths) {
      if (path.startsWith(expected)) {
        return Optional.empty();
      }
    }
    if (entry.requestBody().isEmpty()) {
      return Optional.empty();
    }
    double entropy = Entropy.normalized(entry.requestBody().content());
    if (entropy < payloadEntropy) {
      return Optional.empty();
    }
    return hit("WebSocket upgrade on " + entry.path() + " with opaque payload (" + twoDecimals(entropy) + ")");
  }
}
