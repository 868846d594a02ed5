package ca.gc.cra.sentinel.api;

import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.config.CompositionRoot;
import ca.gc.cra.sentinel.config.MonitorConfig;
import ca.gc.cra.sentinel.config.MonitorRuntime;
import ca.gc.cra.sentinel.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import java.io.IOException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the live monitoring pipeline with the HTTP pull, stream and observation interfaces until the process is
 * stopped.
 *
 * @since 0.1.0
 */
public final class ServeCli {
  private static final Logger log = LoggerFactory.getLogger(ServeCli.class);
  private static final String MODE = "serve";
  private static final String SUMMARY_USAGE =
      "usage: serve [config=PATH] [http.host=HOST] [http.port=0-65535] [workers=N] [bus.maxQueue=N] "
          + "[indicatorRules=PATH] [kafkaBootstrap=HOST:PORT kafkaTopic=TOPIC] [--dry-run] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      SENTINEL serve

      Usage:
        serve [options]

      Options (CLI > YAML > defaults):
        config=PATH                   YAML file with common/serve sections
        http.host=HOST                Bind host (default 127.0.0.1)
        http.port=0-65535             Bind port (default 8080; 0 picks a free port)
        bodyCapBytes=N                Captured body bytes per direction (default 10000)
        trustForwardedHeaders=BOOL    Resolve clients from X-Forwarded-For/X-Real-IP (default true)
        workers=N                     Partition workers (default: CPU cores)
        partitionQueueCapacity=N      Pending observations per worker (default 1024)
        bus.maxQueue=N                Per-subscriber event queue bound (default 500)
        recentWindow=N                Entries retained for pull queries (default 1000)
        stats.windowSize=N            Stats window entries (default 1000)
        stats.windowSeconds=N         Stats window age; 0 disables (default 0)
        stats.publishIntervalMillis=N stats_update cadence (default 5000)
        stats.topIps=N                Ranked source addresses (default 10)
        indicatorRules=PATH           Indicator rule YAML; reloaded on change
        exemptPaths=/a,/b             Paths never blocked (default /health,/api/health)
        ruleLockTimeoutMillis=N       Rule store write-lock wait (default 2000)
        kafkaBootstrap=HOST:PORT      Archive analyzed entries to Kafka
        kafkaTopic=TOPIC              Archive topic (default sentinel.http-traffic.v1)
        metricsExporter=otlp|none     Metrics exporter (default none)
        otelEndpoint=URL              OTLP metrics endpoint
        otelResourceAttributes=K=V    Comma-separated OTel resource attributes
        --dry-run                     Validate configuration and print the plan
        --verbose                     Enable DEBUG logging
      """;

  private ServeCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Executes the command and returns its exit code.
   *
   * @param args raw CLI arguments
   * @return exit code
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    CommandSupport.enableVerboseIfRequested(input, MODE);
    CommandSupport.warnUnsupportedFlags(input, MODE, Set.of("--dry-run"));

    MonitorConfig config;
    try {
      Map<String, String> effective = ConfigCliUtils.effectiveConfig(MODE, input, SUMMARY_USAGE);
      config = MonitorConfig.fromMap(effective);
    } catch (CliAbort abort) {
      return abort.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid serve configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (input.hasFlag("--dry-run")) {
      printPlan(config);
      return ExitCode.SUCCESS;
    }

    MetricsPort metrics = OpenTelemetryMetricsAdapter.fromEnvironment();
    CountDownLatch stopped = new CountDownLatch(1);
    MonitorRuntime runtime = null;
    try {
      runtime = new CompositionRoot(config, metrics).createRuntime();
      runtime.startLive();
      int port = runtime.startHttp();
      CliPrinter.printf("SENTINEL monitoring on http://%s:%d/api/network", config.httpHost(), port);

      MonitorRuntime running = runtime;
      Runtime.getRuntime().addShutdownHook(new Thread(() -> {
        log.info("Shutdown requested; draining pipeline");
        running.close();
        stopped.countDown();
      }, "sentinel-shutdown"));
      stopped.await();
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Serve I/O failure: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Serve configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Serve interrupted; shutting down");
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in serve", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      if (runtime != null) {
        runtime.close();
      }
      CommandSupport.closeMetrics(metrics);
    }
  }

  private static void printPlan(MonitorConfig config) {
    CliPrinter.printLines(
        "Serve dry-run: nothing will be started.",
        " Listen           : " + config.httpHost() + ":" + config.httpPort(),
        " Workers          : " + config.workers() + " x " + config.partitionQueueCapacity() + " queued",
        " Bus queue        : " + config.busMaxQueue(),
        " Body cap (bytes) : " + config.bodyCapBytes(),
        " Stats window     : " + config.statsWindowSize() + " entries, " + config.statsWindowSeconds() + " s",
        " Indicator rules  : " + config.indicatorRules().map(Object::toString).orElse("<bundled>"),
        " Exempt paths     : " + String.join(",", config.exemptPaths()),
        " Kafka archive    : " + config.kafkaBootstrap().map(b -> b + " -> " + config.kafkaTopic()).orElse("<none>"),
        " Re-run without --dry-run to start monitoring.");
  }
}
