package ca.gc.cra.sentinel.config;

import ca.gc.cra.sentinel.application.stream.ConnectionManager;
import ca.gc.cra.sentinel.application.stream.ReconnectBackoff;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each SENTINEL command.
 *
 * <p>The defaults are the single source of truth for optional YAML keys.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns defaults for {@code mode} merged over the common defaults.
   *
   * @param mode command (serve, replay, waterfall, watch)
   * @return unmodifiable map of default key/value pairs
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "serve" -> buildServeDefaults();
      case "replay" -> buildReplayDefaults();
      case "waterfall" -> buildWaterfallDefaults();
      case "watch" -> buildWatchDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildServeDefaults() {
    MonitorConfig defaults = MonitorConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("bodyCapBytes", Integer.toString(defaults.bodyCapBytes()));
    map.put("trustForwardedHeaders", Boolean.toString(defaults.trustForwardedHeaders()));
    map.put("recentWindow", Integer.toString(defaults.recentWindow()));
    map.put("bus.maxQueue", Integer.toString(defaults.busMaxQueue()));
    map.put("workers", Integer.toString(defaults.workers()));
    map.put("partitionQueueCapacity", Integer.toString(defaults.partitionQueueCapacity()));
    map.put("stats.windowSize", Integer.toString(defaults.statsWindowSize()));
    map.put("stats.windowSeconds", Integer.toString(defaults.statsWindowSeconds()));
    map.put("stats.publishIntervalMillis", Long.toString(defaults.statsPublishIntervalMillis()));
    map.put("stats.topIps", Integer.toString(defaults.statsTopIps()));
    map.put("http.host", defaults.httpHost());
    map.put("http.port", Integer.toString(defaults.httpPort()));
    map.put("kafkaBootstrap", "");
    map.put("kafkaTopic", defaults.kafkaTopic());
    map.put("indicatorRules", "");
    map.put("indicatorRules.reloadMillis", Long.toString(defaults.indicatorRulesReloadMillis()));
    map.put("exemptPaths", String.join(",", defaults.exemptPaths()));
    map.put("ruleLockTimeoutMillis", Long.toString(defaults.ruleLockTimeoutMillis()));
    map.put("waterfall.capacity", Integer.toString(defaults.waterfallCapacity()));
    return map;
  }

  private static Map<String, String> buildReplayDefaults() {
    Map<String, String> map = buildServeDefaults();
    map.remove("http.host");
    map.remove("http.port");
    map.put("in", "");
    map.put("top", "10");
    map.put("peerAddress", "127.0.0.1");
    return map;
  }

  private static Map<String, String> buildWaterfallDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("in", "");
    map.put("sort", "captured");
    map.put("mimeCategory", "all");
    return map;
  }

  private static Map<String, String> buildWatchDefaults() {
    ReconnectBackoff backoff = ReconnectBackoff.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("url", WatchConfig.DEFAULT_URL);
    map.put("reconnect.initialMillis", Long.toString(backoff.initialMillis()));
    map.put("reconnect.multiplier", Double.toString(backoff.multiplier()));
    map.put("reconnect.maxMillis", Long.toString(backoff.maxMillis()));
    map.put("heartbeatMillis", Long.toString(ConnectionManager.DEFAULT_HEARTBEAT_MILLIS));
    map.put("idleTimeoutMillis", Long.toString(ConnectionManager.DEFAULT_IDLE_TIMEOUT_MILLIS));
    map.put("types", "");
    map.put("maxEvents", "0");
    return map;
  }
}
