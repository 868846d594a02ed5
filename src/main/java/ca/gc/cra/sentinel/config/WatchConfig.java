package ca.gc.cra.sentinel.config;

import ca.gc.cra.sentinel.application.stream.ConnectionManager;
import ca.gc.cra.sentinel.application.stream.ReconnectBackoff;
import ca.gc.cra.sentinel.domain.events.EventType;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Settings for the {@code watch} command, a streaming client of a running {@code serve} instance.
 *
 * @param baseUri server base URI, for example {@code http://127.0.0.1:8080}
 * @param backoff reconnect schedule
 * @param heartbeatMillis heartbeat cadence
 * @param idleTimeoutMillis silence after which the connection is replaced
 * @param types event types printed; empty prints every type
 * @param maxEvents stop after this many printed events; {@code 0} runs until interrupted
 * @since 0.1.0
 */
public record WatchConfig(
    URI baseUri,
    ReconnectBackoff backoff,
    long heartbeatMillis,
    long idleTimeoutMillis,
    Set<EventType> types,
    long maxEvents) {
  static final String DEFAULT_URL = "http://127.0.0.1:8080";

  public WatchConfig {
    Objects.requireNonNull(baseUri, "baseUri");
    Objects.requireNonNull(backoff, "backoff");
    if (heartbeatMillis <= 0 || idleTimeoutMillis <= heartbeatMillis) {
      throw new IllegalArgumentException("idleTimeoutMillis must exceed a positive heartbeatMillis");
    }
    types = Set.copyOf(Objects.requireNonNull(types, "types"));
    if (maxEvents < 0) {
      throw new IllegalArgumentException("maxEvents must not be negative");
    }
  }

  /**
   * Builds the config from flattened key/value pairs.
   *
   * @param kv merged configuration map
   * @return validated configuration
   */
  public static WatchConfig fromMap(Map<String, String> kv) {
    Objects.requireNonNull(kv, "kv");
    ReconnectBackoff defaults = ReconnectBackoff.defaults();
    ReconnectBackoff backoff = new ReconnectBackoff(
        parseLong(kv, "reconnect.initialMillis", defaults.initialMillis()),
        parseDouble(kv, "reconnect.multiplier", defaults.multiplier()),
        parseLong(kv, "reconnect.maxMillis", defaults.maxMillis()));
    return new WatchConfig(
        parseUri(kv.getOrDefault("url", DEFAULT_URL)),
        backoff,
        parseLong(kv, "heartbeatMillis", ConnectionManager.DEFAULT_HEARTBEAT_MILLIS),
        parseLong(kv, "idleTimeoutMillis", ConnectionManager.DEFAULT_IDLE_TIMEOUT_MILLIS),
        parseTypes(kv.get("types")),
        parseLong(kv, "maxEvents", 0L));
  }

  private static URI parseUri(String raw) {
    String value = raw == null || raw.isBlank() ? DEFAULT_URL : raw.trim();
    try {
      URI uri = new URI(value);
      String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
      if ((!scheme.equals("http") && !scheme.equals("https")) || uri.getHost() == null) {
        throw new IllegalArgumentException("url must be an absolute http(s) URL (was " + raw + ")");
      }
      return uri;
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException("url is not a valid URI: " + raw, ex);
    }
  }

  private static Set<EventType> parseTypes(String raw) {
    Set<EventType> types = EnumSet.noneOf(EventType.class);
    if (raw == null || raw.isBlank()) {
      return types;
    }
    for (String part : raw.split(",")) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        types.add(EventType.fromWire(trimmed));
      }
    }
    return types;
  }

  private static long parseLong(Map<String, String> kv, String key, long fallback) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer (was " + raw + ")", ex);
    }
  }

  private static double parseDouble(Map<String, String> kv, String key, double fallback) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number (was " + raw + ")", ex);
    }
  }
}
