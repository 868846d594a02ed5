package ca.gc.cra.sentinel.application.stream;

import ca.gc.cra.sentinel.domain.events.EventType;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One envelope received from the live stream.
 *
 * @param type wire event type such as {@code log} or {@code tunnel_alert}
 * @param data decoded payload object; empty when the payload was not an object
 * @since 0.1.0
 */
public record StreamMessage(String type, Map<String, Object> data) {
  public StreamMessage {
    Objects.requireNonNull(type, "type");
    data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
  }

  /** Returns the typed event kind, or empty for types this build does not know. */
  public Optional<EventType> eventType() {
    try {
      return Optional.of(EventType.fromWire(type));
    } catch (IllegalArgumentException ex) {
      return Optional.empty();
    }
  }
}
