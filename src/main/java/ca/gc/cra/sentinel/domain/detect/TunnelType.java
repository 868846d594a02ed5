package ca.gc.cra.sentinel.domain.detect;

import java.util.Locale;

/**
 * Category of covert channel suggested by the indicators that fired.
 *
 * @since 0.1.0
 */
public enum TunnelType {
  /** Generic TCP-over-HTTP tunnelling (proxy endpoints, tunnel headers, opaque payloads). */
  HTTP_TUNNEL,
  /** DNS queries carried in HTTP request bodies or query strings. */
  DNS_OVER_HTTP,
  /** WebSocket upgrade used to carry an opaque protocol. */
  WEBSOCKET_ABUSE,
  /** Held-open requests used as a low-rate covert channel. */
  LONG_POLL_COVERT,
  /** Chunked transfer used to stream a relayed connection. */
  CHUNKED_ENCODING,
  /** Regular check-in traffic typical of command-and-control implants. */
  BEACONING,
  /** Command execution through a web shell. */
  WEBSHELL,
  UNKNOWN;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static TunnelType fromWire(String raw) {
    if (raw == null || raw.isBlank()) {
      return UNKNOWN;
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
    for (TunnelType value : values()) {
      if (value.name().equals(normalized)) {
        return value;
      }
    }
    throw new IllegalArgumentException("unknown tunnel type: " + raw);
  }
}
