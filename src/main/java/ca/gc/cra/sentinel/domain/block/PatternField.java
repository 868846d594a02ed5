package ca.gc.cra.sentinel.domain.block;

import java.util.Locale;

/**
 * Request field inspected by a {@link PatternBlockRule}.
 *
 * @since 0.1.0
 */
public enum PatternField {
  USER_AGENT,
  /** Any request header value. */
  HEADER,
  PATH,
  QUERY;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static PatternField fromWire(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("pattern field must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    for (PatternField field : values()) {
      if (field.name().equals(normalized)) {
        return field;
      }
    }
    throw new IllegalArgumentException(
        "pattern field must be user_agent, header, path, or query (was " + raw + ")");
  }
}
