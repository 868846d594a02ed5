package ca.gc.cra.sentinel.application.block;

import ca.gc.cra.sentinel.domain.block.BlockRule;
import ca.gc.cra.sentinel.domain.block.EndpointBlockRule;
import ca.gc.cra.sentinel.domain.block.IpBlockRule;
import ca.gc.cra.sentinel.domain.block.PatternBlockRule;
import ca.gc.cra.sentinel.domain.traffic.Header;
import ca.gc.cra.sentinel.domain.traffic.LogEntry;
import java.util.Locale;
import java.util.function.Predicate;

/** Block rule paired with its compiled predicate. */
final class RuleMatcher {
  private final BlockRule rule;
  private final Predicate<LogEntry> predicate;

  private RuleMatcher(BlockRule rule, Predicate<LogEntry> predicate) {
    this.rule = rule;
    this.predicate = predicate;
  }

  static RuleMatcher compile(BlockRule rule) {
    if (rule instanceof IpBlockRule ip) {
      return new RuleMatcher(rule, entry -> entry.sourceIp().equals(ip.ip()));
    }
    if (rule instanceof EndpointBlockRule endpoint) {
      Predicate<String> path = pathMatcher(endpoint.pattern());
      return new RuleMatcher(rule, entry ->
          (endpoint.allMethods() || endpoint.method().equalsIgnoreCase(entry.method())) && path.test(entry.path()));
    }
    if (rule instanceof PatternBlockRule pattern) {
      Predicate<String> value = valueMatcher(pattern.value());
      Predicate<LogEntry> field = switch (pattern.field()) {
        case USER_AGENT -> entry -> value.test(entry.userAgent());
        case PATH -> entry -> value.test(entry.path());
        case QUERY -> entry -> value.test(entry.query());
        case HEADER -> entry -> {
          for (Header header : entry.requestHeaders().entries()) {
            if (value.test(header.value())) {
              return true;
            }
          }
          return false;
        };
      };
      return new RuleMatcher(rule, field);
    }
    throw new IllegalStateException("Unsupported rule type " + rule.getClass().getName());
  }

  BlockRule rule() {
    return rule;
  }

  RuleMatcher withRule(BlockRule refreshed) {
    return new RuleMatcher(refreshed, predicate);
  }

  boolean matches(LogEntry entry) {
    return predicate.test(entry);
  }

  private static Predicate<String> pathMatcher(String pattern) {
    if (GlobMatcher.isGlob(pattern)) {
      GlobMatcher glob = GlobMatcher.compile(pattern);
      return glob::matches;
    }
    String prefix = pattern.toLowerCase(Locale.ROOT);
    return path -> path.toLowerCase(Locale.ROOT).startsWith(prefix);
  }

  private static Predicate<String> valueMatcher(String value) {
    if (GlobMatcher.isGlob(value)) {
      GlobMatcher glob = GlobMatcher.compile(value);
      return glob::matches;
    }
    String needle = value.toLowerCase(Locale.ROOT);
    return candidate -> candidate != null && candidate.toLowerCase(Locale.ROOT).contains(needle);
  }
}
