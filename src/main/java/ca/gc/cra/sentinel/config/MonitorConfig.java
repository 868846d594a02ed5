package ca.gc.cra.sentinel.config;

import ca.gc.cra.sentinel.application.block.BlockSettings;
import ca.gc.cra.sentinel.application.bus.EventBus;
import ca.gc.cra.sentinel.application.ingest.IngestSettings;
import ca.gc.cra.sentinel.application.pipeline.PipelineSettings;
import ca.gc.cra.sentinel.application.query.RecentEntryWindow;
import ca.gc.cra.sentinel.application.stats.StatsSettings;
import ca.gc.cra.sentinel.application.timeline.WaterfallStore;
import ca.gc.cra.sentinel.validation.Net;
import ca.gc.cra.sentinel.validation.Numbers;
import ca.gc.cra.sentinel.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable configuration for the monitoring pipeline ({@code serve} and {@code replay}).
 * <p><strong>Why:</strong> Collects ingest, rule, classifier, bus, stats, worker and delivery settings in one
 * validated snapshot before any thread starts.</p>
 * <p><strong>Role:</strong> Configuration object consumed by {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param bodyCapBytes captured body bytes per direction
 * @param trustForwardedHeaders whether {@code X-Forwarded-For} and {@code X-Real-IP} identify the client
 * @param recentWindow entries retained for pull queries
 * @param busMaxQueue per-subscriber bus queue bound
 * @param workers partition workers
 * @param partitionQueueCapacity pending observations per partition
 * @param statsWindowSize stats window entry bound
 * @param statsWindowSeconds stats window age bound; {@code 0} disables it
 * @param statsPublishIntervalMillis {@code stats_update} cadence
 * @param statsTopIps ranked source addresses in snapshots
 * @param httpHost bind host for the pull and stream interfaces
 * @param httpPort bind port; {@code 0} picks an ephemeral port
 * @param kafkaBootstrap optional Kafka bootstrap servers for archiving
 * @param kafkaTopic archive topic
 * @param indicatorRules optional indicator rule file; the bundled rules apply when empty
 * @param indicatorRulesReloadMillis polling cadence for rule file changes
 * @param exemptPaths request paths that are never blocked
 * @param ruleLockTimeoutMillis bound on waiting for the rule-store write lock
 * @param waterfallCapacity reconstructed waterfalls kept for retrieval
 * @since 0.1.0
 */
public record MonitorConfig(
    int bodyCapBytes,
    boolean trustForwardedHeaders,
    int recentWindow,
    int busMaxQueue,
    int workers,
    int partitionQueueCapacity,
    int statsWindowSize,
    int statsWindowSeconds,
    long statsPublishIntervalMillis,
    int statsTopIps,
    String httpHost,
    int httpPort,
    Optional<String> kafkaBootstrap,
    String kafkaTopic,
    Optional<Path> indicatorRules,
    long indicatorRulesReloadMillis,
    List<String> exemptPaths,
    long ruleLockTimeoutMillis,
    int waterfallCapacity) {

  static final String DEFAULT_HTTP_HOST = "127.0.0.1";
  static final int DEFAULT_HTTP_PORT = 8080;
  static final String DEFAULT_KAFKA_TOPIC = "sentinel.http-traffic.v1";
  static final long DEFAULT_RULES_RELOAD_MILLIS = 5_000L;

  private static final int MAX_BODY_CAP_BYTES = 1_048_576;
  private static final int MAX_WINDOW = 1_000_000;
  private static final int MAX_WORKERS = 256;
  private static final int MAX_QUEUE = 1_000_000;
  private static final int MAX_WINDOW_SECONDS = 86_400;
  private static final int MAX_TOP_IPS = 1_000;
  private static final int MAX_PATH_LENGTH = 1_024;

  public MonitorConfig {
    Numbers.requireRange("bodyCapBytes", bodyCapBytes, 0, MAX_BODY_CAP_BYTES);
    Numbers.requireRange("recentWindow", recentWindow, 1, MAX_WINDOW);
    Numbers.requireRange("bus.maxQueue", busMaxQueue, 1, MAX_QUEUE);
    Numbers.requireRange("workers", workers, 1, MAX_WORKERS);
    Numbers.requireRange("partitionQueueCapacity", partitionQueueCapacity, 1, MAX_QUEUE);
    Numbers.requireRange("stats.windowSize", statsWindowSize, 1, MAX_WINDOW);
    Numbers.requireRange("stats.windowSeconds", statsWindowSeconds, 0, MAX_WINDOW_SECONDS);
    Numbers.requireRange("stats.publishIntervalMillis", statsPublishIntervalMillis, 100, 3_600_000);
    Numbers.requireRange("stats.topIps", statsTopIps, 1, MAX_TOP_IPS);
    httpHost = Net.validateBindHost(httpHost);
    Numbers.requireRange("http.port", httpPort, 0, 65_535);
    kafkaBootstrap = Objects.requireNonNull(kafkaBootstrap, "kafkaBootstrap").map(Net::validateHostPortList);
    kafkaTopic = Strings.sanitizeTopic("kafkaTopic", kafkaTopic);
    indicatorRules = Objects.requireNonNull(indicatorRules, "indicatorRules");
    Numbers.requireRange("indicatorRules.reloadMillis", indicatorRulesReloadMillis, 1_000, 3_600_000);
    exemptPaths = List.copyOf(Objects.requireNonNull(exemptPaths, "exemptPaths"));
    for (String path : exemptPaths) {
      if (!path.startsWith("/")) {
        throw new IllegalArgumentException("exemptPaths entries must start with '/': " + path);
      }
      Strings.requirePrintableAscii("exemptPaths", path, MAX_PATH_LENGTH);
    }
    Numbers.requireRange("ruleLockTimeoutMillis", ruleLockTimeoutMillis, 1, 60_000);
    Numbers.requireRange("waterfall.capacity", waterfallCapacity, 1, 10_000);
  }

  /**
   * Returns the built-in configuration.
   *
   * @return defaults matching {@link DefaultsForMode}
   */
  public static MonitorConfig defaults() {
    IngestSettings ingest = IngestSettings.defaults();
    StatsSettings stats = StatsSettings.defaults();
    PipelineSettings pipeline = PipelineSettings.defaults();
    BlockSettings block = BlockSettings.defaults();
    return new MonitorConfig(
        ingest.bodyCapBytes(),
        ingest.trustForwardedHeaders(),
        RecentEntryWindow.DEFAULT_CAPACITY,
        EventBus.DEFAULT_MAX_QUEUE,
        Math.min(pipeline.workers(), MAX_WORKERS),
        pipeline.partitionQueueCapacity(),
        stats.windowSize(),
        (int) stats.windowSeconds(),
        stats.publishIntervalMillis(),
        stats.topIps(),
        DEFAULT_HTTP_HOST,
        DEFAULT_HTTP_PORT,
        Optional.empty(),
        DEFAULT_KAFKA_TOPIC,
        Optional.empty(),
        DEFAULT_RULES_RELOAD_MILLIS,
        block.exemptPaths(),
        block.lockTimeoutMillis(),
        WaterfallStore.DEFAULT_CAPACITY);
  }

  /**
   * Builds a configuration from flattened key/value pairs; absent keys take their defaults.
   *
   * @param kv merged configuration map
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static MonitorConfig fromMap(Map<String, String> kv) {
    Objects.requireNonNull(kv, "kv");
    MonitorConfig d = defaults();
    return new MonitorConfig(
        parseBoundedInt(kv, "bodyCapBytes", d.bodyCapBytes(), 0, MAX_BODY_CAP_BYTES),
        parseBoolean(kv.get("trustForwardedHeaders"), d.trustForwardedHeaders()),
        parseBoundedInt(kv, "recentWindow", d.recentWindow(), 1, MAX_WINDOW),
        parseBoundedInt(kv, "bus.maxQueue", d.busMaxQueue(), 1, MAX_QUEUE),
        parseBoundedInt(kv, "workers", d.workers(), 1, MAX_WORKERS),
        parseBoundedInt(kv, "partitionQueueCapacity", d.partitionQueueCapacity(), 1, MAX_QUEUE),
        parseBoundedInt(kv, "stats.windowSize", d.statsWindowSize(), 1, MAX_WINDOW),
        parseBoundedInt(kv, "stats.windowSeconds", d.statsWindowSeconds(), 0, MAX_WINDOW_SECONDS),
        parseBoundedInt(kv, "stats.publishIntervalMillis", (int) d.statsPublishIntervalMillis(), 100, 3_600_000),
        parseBoundedInt(kv, "stats.topIps", d.statsTopIps(), 1, MAX_TOP_IPS),
        textOrDefault(kv.get("http.host"), d.httpHost()),
        parseBoundedInt(kv, "http.port", d.httpPort(), 0, 65_535),
        optionalText(kv.get("kafkaBootstrap")),
        textOrDefault(kv.get("kafkaTopic"), d.kafkaTopic()),
        optionalText(kv.get("indicatorRules")).map(value -> parsePath("indicatorRules", value)),
        parseBoundedInt(kv, "indicatorRules.reloadMillis", (int) d.indicatorRulesReloadMillis(), 1_000, 3_600_000),
        kv.containsKey("exemptPaths") ? parseList(kv.get("exemptPaths")) : d.exemptPaths(),
        parseBoundedInt(kv, "ruleLockTimeoutMillis", (int) d.ruleLockTimeoutMillis(), 1, 60_000),
        parseBoundedInt(kv, "waterfall.capacity", d.waterfallCapacity(), 1, 10_000));
  }

  public IngestSettings ingestSettings() {
    return new IngestSettings(bodyCapBytes, trustForwardedHeaders);
  }

  public BlockSettings blockSettings() {
    return new BlockSettings(exemptPaths, ruleLockTimeoutMillis);
  }

  public StatsSettings statsSettings() {
    return new StatsSettings(statsWindowSize, statsWindowSeconds, statsTopIps, statsPublishIntervalMillis);
  }

  public PipelineSettings pipelineSettings() {
    return new PipelineSettings(workers, partitionQueueCapacity);
  }

  static int parseBoundedInt(Map<String, String> kv, String key, int defaultValue, int min, int max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      Numbers.requireRange(key, defaultValue, min, max);
      return defaultValue;
    }
    return Numbers.parseIntInRange(key, raw, min, max);
  }

  static boolean parseBoolean(String value, boolean fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    String normalized = value.trim();
    if ("true".equalsIgnoreCase(normalized)) {
      return true;
    }
    if ("false".equalsIgnoreCase(normalized)) {
      return false;
    }
    throw new IllegalArgumentException("expected true or false (was " + value + ")");
  }

  static Path parsePath(String name, String value) {
    try {
      return Path.of(Strings.requireNonBlank(name, value)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  static Optional<String> optionalText(String value) {
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(value.trim());
  }

  private static String textOrDefault(String value, String fallback) {
    return value == null || value.isBlank() ? fallback : value.trim();
  }

  private static List<String> parseList(String value) {
    List<String> items = new ArrayList<>();
    if (value == null || value.isBlank()) {
      return items;
    }
    for (String part : value.split(",")) {
      String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        items.add(trimmed);
      }
    }
    return items;
  }
}
