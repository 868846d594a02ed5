package ca.gc.cra.sentinel.domain.block;

import java.util.Locale;

/**
 * Block rule families in evaluation order: IP rules are consulted first, then endpoint rules, then field
 * pattern rules.
 *
 * @since 0.1.0
 */
public enum RuleKind {
  IP,
  ENDPOINT,
  PATTERN;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static RuleKind fromWire(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("rule kind must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    for (RuleKind kind : values()) {
      if (kind.name().equals(normalized)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("rule kind must be ip, endpoint, or pattern (was " + raw + ")");
  }
}
