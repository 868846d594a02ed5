package ca.gc.cra.sentinel.application.detect.indicators;

import ca.gc.cra.sentinel.application.detect.Entropy;
import ca.gc.cra.sentinel.application.detect.IndicatorHit;
import ca.gc.cra.sentinel.application.detect.IndicatorParams;
import ca.gc.cra.sentinel.application.detect.IpActivity;
import ca.gc.cra.sentinel.domain.detect.TunnelType;
import ca.gc.cra.sentinel.domain.traffic.Header;
import ca.gc.cra.sentinel.domain.traffic.LogEntry;
import ca.gc.cra.sentinel.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Fires when a long request header value looks like encoded binary, e.g. data smuggled through a custom header.
 *
 * <p>Well known free-text headers are ignored; redacted values never fire.</p>
 */
public final class HeaderEntropyCheck extends WeightedIndicator {
  public static final String NAME = "header_entropy";
  static final List<String> DEFAULT_IGNORED = List.of(
      "user-agent", "accept", "accept-language", "accept-encoding", "referer", "host", "content-type",
      "sec-ch-ua", "if-none-match");

  private final int minLength;
  private final double threshold;
  private final Set<String> ignored;

  public HeaderEntropyCheck(IndicatorParams params) {
    super(NAME, params, 15, TunnelType.UNKNOWN);
    this.minLength = params.integer("minLength", 32);
    this.threshold = params.decimal("threshold", 0.65d);
    this.ignored = Set.copyOf(lower(params.strings("ignoredHeaders", DEFAULT_IGNORED)));
  }

  @Override
  public Optional<IndicatorHit> evaluate(LogEntry entry, IpActivity activity) {
    List<String> evidence = new ArrayList<>();
    for (Header header : entry.requestHeaders().entries()) {
      String value = header.value();
      if (value.length() < minLength || ignored.contains(header.name().toLowerCase(Locale.ROOT))) {
        continue;
      }
      if (Logs.isRedacted(value)) {
        continue;
      }
      double entropy = Entropy.normalized(value);
      if (entropy > threshold) {
        evidence.add("High entropy header " + header.name() + " (" + twoDecimals(entropy) + ")");
      }
    }
    return hit(evidence);
  }
}
