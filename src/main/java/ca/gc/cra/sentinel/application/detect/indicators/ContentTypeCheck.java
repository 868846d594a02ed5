package ca.gc.cra.sentinel.application.detect.indicators;

import ca.gc.cra.sentinel.application.detect.IndicatorHit;
import ca.gc.cra.sentinel.application.detect.IndicatorParams;
import ca.gc.cra.sentinel.application.detect.IpActivity;
import ca.gc.cra.sentinel.domain.detect.TunnelType;
import ca.gc.cra.sentinel.domain.traffic.LogEntry;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Fires on opaque request content types typically used to carry raw socket bytes. */
public final class ContentTypeCheck extends WeightedIndicator {
  public static final String NAME = "suspicious_content_type";

  private final List<String> contentTypes;

  public ContentTypeCheck(IndicatorParams params) {
    super(NAME, params, 15, TunnelType.HTTP_TUNNEL);
    this.contentTypes = lower(params.strings(
        "contentTypes", List.of("application/octet-stream", "binary/octet-stream")));
  }

  @Override
  public Optional<IndicatorHit> evaluate(LogEntry entry, IpActivity activity) {
    String contentType = entry.requestHeaders().first("Content-Type").orElse("").toLowerCase(Locale.ROOT);
    if (contentType.isEmpty()) {
      return Optional.empty();
    }
    for (String suspicious : contentTypes) {
      if (contentType.contains(suspicious)) {
        return hit("Suspicious Content-Type: " + contentType);
      }
    }
    return Optional.empty();
  }
}
