package ca.gc.cra.sentinel.application.detect.indicators;

import ca.gc.cra.sentinel.application.detect.IndicatorHit;
import ca.gc.cra.sentinel.application.detect.IndicatorParams;
import ca.gc.cra.sentinel.application.detect.IpActivity;
import ca.gc.cra.sentinel.domain.detect.TunnelType;
import ca.gc.cra.sentinel.domain.traffic.LogEntry;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Fires on chunked transfer encoding combined with proxy buffering disabled, the shape of a streaming relay. */
public final class ChunkedRelayCheck extends WeightedIndicator {
  public static final String NAME = "chunked_relay";

  private final String bufferingHeader;

  public ChunkedRelayCheck(IndicatorParams params) {
    super(NAME, params, 25, TunnelType.CHUNKED_ENCODING);
    this.bufferingHeader = params.strings("bufferingHeader", List.of("X-Accel-Buffering")).get(0);
  }

  @Override
  public Optional<IndicatorHit> evaluate(LogEntry entry, IpActivity activity) {
    boolean chunked = entry.requestHeaders().values("Transfer-Encoding").stream()
        .anyMatch(value -> value.toLowerCase(Locale.ROOT).contains("chunked"));
    if (!chunked) {
      return Optional.empty();
    }
    if (entry.requestHeaders().contains(bufferingHeader) || entry.responseHeaders().contains(bufferingHeader)) {
      return hit("Chunked encoding with buffering disabled");
    }
    return Optional.empty();
  }
}
