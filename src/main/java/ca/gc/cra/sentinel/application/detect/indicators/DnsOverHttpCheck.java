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

/** Fires on DNS wire or JSON media types, or on a DNS query endpoint. */
public final class DnsOverHttpCheck extends WeightedIndicator {
  public static final String NAME = "dns_over_http";

  private final List<String> mediaTypes;
  private final List<String> paths;

  public DnsOverHttpCheck(IndicatorParams params) {
    super(NAME, params, 30, TunnelType.DNS_OVER_HTTP);
    this.mediaTypes = lower(params.strings("contentTypes", List.of("application/dns-message", "application/dns-json")));
    this.paths = lower(params.strings("paths", List.of("/dns-query")));
  }

  @Override
  public Optional<IndicatorHit> evaluate(LogEntry entry, IpActivity activity) {
    List<String> evidence = new ArrayList<>();
    String contentType = entry.requestHeaders().first("Content-Type").orElse("").toLowerCase(Locale.ROOT);
    String accept = entry.requestHeaders().first("Accept").orElse("").toLowerCase(Locale.ROOT);
    for (String mediaType : mediaTypes) {
      if (contentType.contains(mediaType) || accept.contains(mediaType)) {
        evidence.add("DNS media type: " + mediaType);
        break;
      }
    }
    String path = entry.path().toLowerCase(Locale.ROOT);
    for (String dnsPath : paths) {
      if (path.contains(dnsPath)) {
        evidence.add("DNS query endpoint: " + dnsPath);
        break;
      }
    }
    return hit(evidence);
  }
}
