package ca.gc.cra.sentinel.infrastructure.metrics;

import ca.gc.cra.sentinel.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetricsPort} backed by OpenTelemetry counters and histograms.
 * <p><strong>Role:</strong> Observability adapter created once per process by the CLI.</p>
 * <p><strong>Thread-safety:</strong> Instruments are cached in concurrent maps; updates may come from any thread.</p>
 * <p><strong>Observability:</strong> Each instrument carries {@code sentinel.component}, the first segment of its
 * dotted key, so dashboards can group {@code pipeline.*} or {@code bus.*} without parsing names.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  private static final AttributeKey<String> COMPONENT = AttributeKey.stringKey("sentinel.component");
  private static final String FALLBACK_NAME = "sentinel.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Histogram> histograms = new ConcurrentHashMap<>();

  /**
   * Builds the exporter from system properties and {@code OTEL_*} environment variables; falls back to
   * {@link MetricsPort#NO_OP} when metrics are disabled or bootstrapping fails.
   *
   * @return metrics port for the process
   */
  public static MetricsPort fromEnvironment() {
    OpenTelemetryBootstrap.BootstrapResult result = OpenTelemetryBootstrap.initialize();
    if (result.isNoop()) {
      log.info("Metrics export disabled; using no-op metrics");
      return MetricsPort.NO_OP;
    }
    return new OpenTelemetryMetricsAdapter(result);
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
  }

  @Override
  public void increment(String key) {
    Counter counter = counters.computeIfAbsent(Objects.requireNonNull(key, "key"), this::newCounter);
    counter.instrument().add(1, counter.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Histogram histogram = histograms.computeIfAbsent(Objects.requireNonNull(key, "key"), this::newHistogram);
    histogram.instrument().record(value, histogram.attributes());
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  /** Flushes pending data and shuts the meter provider down. */
  @Override
  public void close() {
    bootstrap.forceFlush();
    bootstrap.close();
  }

  private Counter newCounter(String key) {
    LongCounter counter = meter.counterBuilder(instrumentName(key))
        .setUnit("1")
        .setDescription("SENTINEL counter " + key)
        .build();
    return new Counter(counter, attributesFor(key));
  }

  private Histogram newHistogram(String key) {
    LongHistogram histogram = meter.histogramBuilder(instrumentName(key))
        .ofLongs()
        .setDescription("SENTINEL observation " + key)
        .build();
    return new Histogram(histogram, attributesFor(key));
  }

  private static Attributes attributesFor(String key) {
    int dot = key.indexOf('.');
    String component = dot > 0 ? key.substring(0, dot) : key;
    return Attributes.of(COMPONENT, component.isBlank() ? "unknown" : component);
  }

  /** OpenTelemetry instrument names must start with a letter and use a limited alphabet. */
  static String instrumentName(String key) {
    String trimmed = key == null ? "" : key.trim();
    if (trimmed.isEmpty()) {
      return FALLBACK_NAME;
    }
    StringBuilder name = new StringBuilder("sentinel.");
    for (int i = 0; i < trimmed.length(); i++) {
      char c = Character.toLowerCase(trimmed.charAt(i));
      boolean allowed = (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || c == '_' || c == '-' || c == '.';
      name.append(allowed ? c : '_');
    }
    String result = name.toString();
    if (!result.equals("sentinel." + trimmed.toLowerCase(Locale.ROOT))) {
      log.debug("Sanitized metric key '{}' -> '{}'", key, result);
    }
    return result;
  }

  private record Counter(LongCounter instrument, Attributes attributes) {}

  private record Histogram(LongHistogram instrument, Attributes attributes) {}
}
