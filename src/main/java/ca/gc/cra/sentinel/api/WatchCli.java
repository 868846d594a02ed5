package ca.gc.cra.sentinel.api;

import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.application.stream.ConnectionManager;
import ca.gc.cra.sentinel.application.stream.ConnectionState;
import ca.gc.cra.sentinel.application.stream.StreamListener;
import ca.gc.cra.sentinel.application.stream.StreamMessage;
import ca.gc.cra.sentinel.config.WatchConfig;
import ca.gc.cra.sentinel.domain.events.EventType;
import ca.gc.cra.sentinel.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.sentinel.infrastructure.json.MonitorJson;
import ca.gc.cra.sentinel.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.sentinel.infrastructure.stream.SseStreamTransport;
import ca.gc.cra.sentinel.infrastructure.time.SystemClockAdapter;
import java.io.IOException;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connects to a running {@code serve} instance and prints live events, reconnecting with backoff.
 *
 * @since 0.1.0
 */
public final class WatchCli {
  private static final Logger log = LoggerFactory.getLogger(WatchCli.class);
  private static final String MODE = "watch";
  private static final String SUMMARY_USAGE =
      "usage: watch [url=http://HOST:PORT] [types=log,tunnel_alert,...] [maxEvents=N] "
          + "[heartbeatMillis=N] [idleTimeoutMillis=N] [reconnect.initialMillis=N]";
  private static final String HELP_TEXT = """
      SENTINEL watch

      Usage:
        watch [options]

      Options:
        url=URL                    Base URL of the serve instance (default http://127.0.0.1:8080)
        types=a,b                  Event types to print: log, tunnel_alert, stats_update, block_added
        maxEvents=N                Exit after N printed events (default 0: run until interrupted)
        heartbeatMillis=N          Ping cadence (default 30000)
        idleTimeoutMillis=N        Reconnect after this much silence (default 90000)
        reconnect.initialMillis=N  First reconnect delay (default 1000)
        reconnect.multiplier=X     Delay growth per failure (default 2.0)
        reconnect.maxMillis=N      Delay cap (default 30000)
        config=PATH                YAML file with common/watch sections
        --verbose                  Enable DEBUG logging
      """;

  private WatchCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    CommandSupport.enableVerboseIfRequested(input, MODE);
    CommandSupport.warnUnsupportedFlags(input, MODE, Set.of());

    WatchConfig config;
    try {
      config = WatchConfig.fromMap(ConfigCliUtils.effectiveConfig(MODE, input, SUMMARY_USAGE));
    } catch (CliAbort abort) {
      return abort.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid watch configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    MetricsPort metrics = OpenTelemetryMetricsAdapter.fromEnvironment();
    ExecutorService readers = ExecutorFactories.newDaemonPool("sentinel-watch-reader", (thread, ex) ->
        log.error("Stream reader thread {} failed", thread.getName(), ex));
    CountDownLatch done = new CountDownLatch(1);
    PrintingListener listener = new PrintingListener(config, done);
    ConnectionManager manager = new ConnectionManager(
        new SseStreamTransport(config.baseUri(), SseStreamTransport.defaultClient(), readers),
        config.backoff(),
        config.heartbeatMillis(),
        config.idleTimeoutMillis(),
        new SystemClockAdapter(),
        metrics,
        ExecutorFactories.newScheduler("sentinel-watch"));
    Thread hook = new Thread(done::countDown, "sentinel-watch-shutdown");
    try {
      Runtime.getRuntime().addShutdownHook(hook);
      manager.subscribe(listener);
      manager.start();
      log.info("Watching {}", config.baseUri());
      done.await();
      return ExitCode.SUCCESS;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in watch", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      manager.close();
      readers.shutdownNow();
      removeHook(hook);
      CommandSupport.closeMetrics(metrics);
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down");
    }
  }

  static final class PrintingListener implements StreamListener {
    private final WatchConfig config;
    private final CountDownLatch done;
    private final AtomicLong printed = new AtomicLong();

    PrintingListener(WatchConfig config, CountDownLatch done) {
      this.config = config;
      this.done = done;
    }

    @Override
    public void onMessage(StreamMessage message) {
      Optional<EventType> type = message.eventType();
      if (type.isEmpty() || type.get() == EventType.PONG || type.get() == EventType.CONNECTED) {
        return;
      }
      if (!config.types().isEmpty() && !config.types().contains(type.get())) {
        return;
      }
      try {
        String data = MonitorJson.renderString(gen -> MonitorJson.writeTree(gen, message.data()));
        CliPrinter.println(message.type() + " " + data);
      } catch (IOException ex) {
        log.warn("Unable to render {} event", message.type(), ex);
        return;
      }
      long count = printed.incrementAndGet();
      if (config.maxEvents() > 0 && count >= config.maxEvents()) {
        done.countDown();
      }
    }

    @Override
    public void onStateChange(ConnectionState state) {
      log.info("Stream connection {}", state.name().toLowerCase(Locale.ROOT));
    }
  }
}
