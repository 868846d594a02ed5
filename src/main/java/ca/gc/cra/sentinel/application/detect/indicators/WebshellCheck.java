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

/** Fires when the request target looks like a command passed to a script webshell. */
public final class WebshellCheck extends WeightedIndicator {
  public static final String NAME = "webshell";

  private final List<String> patterns;

  public WebshellCheck(IndicatorParams params) {
    super(NAME, params, 60, TunnelType.WEBSHELL);
    this.patterns = lower(params.strings("patterns", List.of(".php?cmd=", ".asp?exec=", ".jsp?c=")));
  }

  @Override
  public Optional<IndicatorHit> evaluate(LogEntry entry, IpActivity activity) {
    String target = entry.target().toLowerCase(Locale.ROOT);
    List<String> evidence = new ArrayList<>();
    for (String pattern : patterns) {
      if (target.contains(pattern)) {
        evidence.add("Webshell pattern: " + pattern);
      }
    }
    return hit(evidence);
  }
}
