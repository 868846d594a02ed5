package ca.gc.cra.sentinel.application.detect.indicators;

import ca.gc.cra.sentinel.application.detect.IndicatorHit;
import ca.gc.cra.sentinel.application.detect.IndicatorParams;
import ca.gc.cra.sentinel.application.detect.IpActivity;
import ca.gc.cra.sentinel.domain.detect.TunnelType;
import ca.gc.cra.sentinel.domain.traffic.LogEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/** Fires on request targets matching the URL grammar of known HTTP tunnelling toolkits; first match only. */
public final class TunnelToolkitCheck extends WeightedIndicator {
  public static final String NAME = "tunneling_toolkit";
  static final List<String> DEFAULT_PATTERNS = List.of(
      "/conn\\?[a-f0-9]+", "cmd=\\w+&data=", "action=(read|write|open|close)");

  private final List<Pattern> patterns;

  public TunnelToolkitCheck(IndicatorParams params) {
    super(NAME, params, 45, TunnelType.HTTP_TUNNEL);
    List<Pattern> compiled = new ArrayList<>();
    for (String regex : params.strings("patterns", DEFAULT_PATTERNS)) {
      try {
        compiled.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
      } catch (PatternSyntaxException ex) {
        throw new IllegalArgumentException("indicators." + NAME + ".patterns: invalid regex '" + regex + "'", ex);
      }
    }
    this.patterns = List.copyOf(compiled);
  }

  @Override
  public Optional<IndicatorHit> evaluate(LogEntry entry, IpActivity activity) {
    String target = entry.target();
    for (Pattern pattern : patterns) {
      if (pattern.matcher(target).find()) {
        return hit("Tunneling toolkit pattern: " + pattern.pattern());
      }
    }
    return Optional.empty();
  }
}
