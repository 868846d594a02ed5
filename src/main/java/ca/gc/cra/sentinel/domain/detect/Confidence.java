package ca.gc.cra.sentinel.domain.detect;

import java.util.Locale;

/**
 * Totally ordered certainty of a tunnel verdict. Declaration order is the ordering:
 * {@code LOW < MEDIUM < HIGH < CONFIRMED}.
 *
 * @since 0.1.0
 */
public enum Confidence {
  LOW,
  MEDIUM,
  HIGH,
  CONFIRMED;

  /** Lower-case name used on the wire and in configuration. */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public boolean atLeast(Confidence other) {
    return compareTo(other) >= 0;
  }

  /**
   * Parses a confidence level case-insensitively.
   *
   * @param raw wire value such as {@code medium}
   * @return parsed level
   * @throws IllegalArgumentException when {@code raw} is blank or unknown
   */
  public static Confidence fromWire(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("confidence must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    for (Confidence value : values()) {
      if (value.name().equals(normalized)) {
        return value;
      }
    }
    throw new IllegalArgumentException(
        "confidence must be one of low, medium, high, confirmed (was " + raw + ")");
  }
}
