package ca.gc.cra.sentinel.domain.events;

import java.util.Locale;

/**
 * Tags of the live stream envelope {@code {type, data}}.
 *
 * @since 0.1.0
 */
public enum EventType {
  LOG,
  TUNNEL_ALERT,
  STATS_UPDATE,
  BLOCK_ADDED,
  CONNECTED,
  PONG;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static EventType fromWire(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("event type must not be blank");
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    for (EventType type : values()) {
      if (type.name().equals(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("unknown event type: " + raw);
  }
}
