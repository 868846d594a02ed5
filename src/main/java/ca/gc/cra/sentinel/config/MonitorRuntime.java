package ca.gc.cra.sentinel.config;

import ca.gc.cra.sentinel.application.block.BlockRuleStore;
import ca.gc.cra.sentinel.application.bus.EventBus;
import ca.gc.cra.sentinel.application.detect.ClassifierSettings;
import ca.gc.cra.sentinel.application.detect.IndicatorRulesLoader;
import ca.gc.cra.sentinel.application.detect.TunnelClassifier;
import ca.gc.cra.sentinel.application.ingest.IngestAdapter;
import ca.gc.cra.sentinel.application.pipeline.ExchangeProcessor;
import ca.gc.cra.sentinel.application.pipeline.MonitoringPipeline;
import ca.gc.cra.sentinel.application.port.ArchivePort;
import ca.gc.cra.sentinel.application.port.ClockPort;
import ca.gc.cra.sentinel.application.port.EventPublisher;
import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.application.query.MonitoringQueryService;
import ca.gc.cra.sentinel.application.query.RecentEntryWindow;
import ca.gc.cra.sentinel.application.stats.StatsAggregator;
import ca.gc.cra.sentinel.application.timeline.TimelineReconstructor;
import ca.gc.cra.sentinel.application.timeline.WaterfallStore;
import ca.gc.cra.sentinel.infrastructure.capture.HarCaptureReader;
import ca.gc.cra.sentinel.infrastructure.detect.IndicatorRulesWatcher;
import ca.gc.cra.sentinel.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.sentinel.infrastructure.http.MonitoringHttpServer;
import ca.gc.cra.sentinel.infrastructure.json.LogExporter;
import java.io.IOException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wired monitoring components sharing one bus, rule store, classifier and recent-entry window.
 *
 * <p>{@link #startLive()} runs the stats aggregator on its own bus subscription; {@link #startReplay()} feeds
 * the aggregator synchronously so that a finished replay has complete statistics. Not restartable.</p>
 *
 * @since 0.1.0
 */
public final class MonitorRuntime implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(MonitorRuntime.class);

  private final MonitorConfig config;
  private final MetricsPort metrics;
  private final EventBus bus;
  private final BlockRuleStore blocks;
  private final TunnelClassifier classifier;
  private final StatsAggregator aggregator;
  private final RecentEntryWindow recent;
  private final ArchivePort archive;
  private final MonitoringPipeline pipeline;
  private final MonitoringQueryService queries;
  private final IndicatorRulesWatcher rulesWatcher;

  private volatile boolean directStats;
  private ScheduledExecutorService rulesScheduler;
  private MonitoringHttpServer httpServer;
  private boolean started;
  private boolean closed;

  MonitorRuntime(
      MonitorConfig config,
      ClassifierSettings rules,
      IndicatorRulesLoader rulesLoader,
      ArchivePort archive,
      MetricsPort metrics,
      ClockPort clock) {
    this.config = config;
    this.metrics = metrics;
    this.archive = archive;
    this.bus = new EventBus(config.busMaxQueue(), clock, metrics);
    this.blocks = new BlockRuleStore(config.blockSettings(), metrics);
    this.classifier = new TunnelClassifier(rules, clock, metrics);
    this.aggregator = new StatsAggregator(config.statsSettings(), clock, metrics);
    this.recent = new RecentEntryWindow(config.recentWindow());

    EventPublisher publisher = event -> {
      bus.publish(event);
      if (directStats) {
        aggregator.onEvent(event);
      }
    };
    ExchangeProcessor processor = new ExchangeProcessor(
        new IngestAdapter(config.ingestSettings(), clock, metrics),
        blocks,
        classifier,
        recent,
        archive,
        publisher,
        metrics);
    this.pipeline = new MonitoringPipeline(
        processor, () -> classifier.settings().newArena(), metrics, config.pipelineSettings());
    this.queries = new MonitoringQueryService(
        recent,
        blocks,
        aggregator,
        classifier,
        new HarCaptureReader(),
        new TimelineReconstructor(),
        new WaterfallStore(config.waterfallCapacity()),
        bus,
        clock);
    this.rulesWatcher = config.indicatorRules()
        .map(path -> new IndicatorRulesWatcher(path, rulesLoader, classifier, clock,
            config.indicatorRulesReloadMillis()))
        .orElse(null);
  }

  /** Starts the aggregator, the partition workers and the rule watcher. */
  public synchronized void startLive() {
    markStarted();
    aggregator.start(
        bus,
        prefix -> ExecutorFactories.newDaemonPool(prefix, (thread, ex) -> {
          metrics.increment("stats.consumer.uncaught");
          log.error("Stats consumer thread {} failed", thread.getName(), ex);
        }),
        () -> ExecutorFactories.newScheduler("sentinel-stats-publisher"));
    pipeline.start();
    startRulesWatcher();
  }

  /** Starts the partition workers with statistics recorded on the publishing thread. */
  public synchronized void startReplay() {
    markStarted();
    directStats = true;
    pipeline.start();
  }

  /**
   * Starts the HTTP pull and stream interfaces.
   *
   * @return bound port
   * @throws IOException when the address cannot be bound
   */
  public synchronized int startHttp() throws IOException {
    if (httpServer != null) {
      throw new IllegalStateException("HTTP interface already started");
    }
    MonitoringHttpServer server = new MonitoringHttpServer(
        queries, bus, new LogExporter(), metrics, config.httpHost(), config.httpPort(), pipeline::submit);
    int port = server.start();
    httpServer = server;
    return port;
  }

  /** Stops accepting observations and waits for queued ones to finish. */
  public void drain() {
    pipeline.close();
  }

  public MonitoringPipeline pipeline() {
    return pipeline;
  }

  public MonitoringQueryService queries() {
    return queries;
  }

  public TunnelClassifier classifier() {
    return classifier;
  }

  public StatsAggregator aggregator() {
    return aggregator;
  }

  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (httpServer != null) {
      httpServer.close();
      httpServer = null;
    }
    pipeline.close();
    if (rulesScheduler != null) {
      rulesScheduler.shutdownNow();
      rulesScheduler = null;
    }
    aggregator.close();
    bus.close();
    try {
      archive.close();
    } catch (Exception ex) {
      metrics.increment("archive.close.failed");
      log.warn("Failed to close archive sink", ex);
    }
  }

  private void markStarted() {
    if (started) {
      throw new IllegalStateException("Monitor runtime already started");
    }
    started = true;
  }

  private void startRulesWatcher() {
    if (rulesWatcher == null) {
      return;
    }
    rulesScheduler = ExecutorFactories.newScheduler("sentinel-rules");
    long interval = rulesWatcher.intervalMillis();
    rulesScheduler.scheduleWithFixedDelay(this::reloadRules, interval, interval, TimeUnit.MILLISECONDS);
    log.info("Watching indicator rules every {} ms", interval);
  }

  private void reloadRules() {
    try {
      if (rulesWatcher.maybeReload()) {
        metrics.increment("classifier.rules.reloaded");
      }
    } catch (RuntimeException ex) {
      metrics.increment("classifier.rules.reloadFailed");
      log.warn("Indicator rule reload failed", ex);
    }
  }
}
