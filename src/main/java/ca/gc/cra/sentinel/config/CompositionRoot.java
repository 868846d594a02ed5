package ca.gc.cra.sentinel.config;

import ca.gc.cra.sentinel.application.detect.ClassifierSettings;
import ca.gc.cra.sentinel.application.detect.IndicatorRulesLoader;
import ca.gc.cra.sentinel.application.port.ArchivePort;
import ca.gc.cra.sentinel.application.port.ClockPort;
import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.infrastructure.archive.KafkaArchiveAdapter;
import ca.gc.cra.sentinel.infrastructure.time.SystemClockAdapter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Central composition root that turns a {@link MonitorConfig} into a runnable
 * {@link MonitorRuntime}.
 * <p><strong>Why:</strong> Keeps adapter selection (archive sink, rule source, clock, metrics) in one place so the
 * CLIs stay thin.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Load indicator rules from the configured file or the bundled resource.</li>
 *   <li>Select the Kafka archive sink when bootstrap servers are configured, else the no-op sink.</li>
 *   <li>Share one metrics port and clock across every component of the runtime.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Holds immutable configuration; factory methods are not synchronized.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final MonitorConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final IndicatorRulesLoader rulesLoader = new IndicatorRulesLoader();

  public CompositionRoot(MonitorConfig config, MetricsPort metrics) {
    this(config, metrics, new SystemClockAdapter());
  }

  public CompositionRoot(MonitorConfig config, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Wires a runtime using the configured archive sink.
   *
   * @return unstarted runtime
   * @throws IOException when the indicator rule file cannot be read
   */
  public MonitorRuntime createRuntime() throws IOException {
    return createRuntime(archive());
  }

  /**
   * Wires a runtime around an explicit archive sink.
   *
   * @param archive archive sink receiving every analyzed entry; closed with the runtime
   * @return unstarted runtime
   * @throws IOException when the indicator rule file cannot be read
   */
  public MonitorRuntime createRuntime(ArchivePort archive) throws IOException {
    Objects.requireNonNull(archive, "archive");
    ClassifierSettings rules = loadRules();
    return new MonitorRuntime(config, rules, rulesLoader, archive, metrics, clock);
  }

  /**
   * Selects the archive sink.
   *
   * @return Kafka sink when {@code kafkaBootstrap} is set, otherwise a no-op sink
   */
  public ArchivePort archive() {
    Optional<String> bootstrap = config.kafkaBootstrap();
    if (bootstrap.isPresent()) {
      log.info("Archiving analyzed entries to Kafka topic {}", config.kafkaTopic());
      return new KafkaArchiveAdapter(bootstrap.get(), config.kafkaTopic(), metrics);
    }
    return ArchivePort.NONE;
  }

  ClassifierSettings loadRules() throws IOException {
    Optional<Path> path = config.indicatorRules();
    if (path.isPresent()) {
      ClassifierSettings settings = rulesLoader.load(path.get());
      log.info("Loaded {} indicators from {}", settings.checks().size(), path.get());
      return settings;
    }
    return rulesLoader.loadBundled();
  }
}
