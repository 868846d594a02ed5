package ca.gc.cra.sentinel.api;

import ca.gc.cra.sentinel.application.detect.ClassifierStatistics;
import ca.gc.cra.sentinel.application.pipeline.ReplayUseCase;
import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.application.query.Page;
import ca.gc.cra.sentinel.application.query.QueryResult;
import ca.gc.cra.sentinel.config.CompositionRoot;
import ca.gc.cra.sentinel.config.MonitorConfig;
import ca.gc.cra.sentinel.config.MonitorRuntime;
import ca.gc.cra.sentinel.domain.capture.Capture;
import ca.gc.cra.sentinel.domain.detect.TunnelDetection;
import ca.gc.cra.sentinel.domain.stats.IpCount;
import ca.gc.cra.sentinel.domain.stats.StatsSnapshot;
import ca.gc.cra.sentinel.infrastructure.capture.HarCaptureReader;
import ca.gc.cra.sentinel.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.sentinel.validation.Net;
import ca.gc.cra.sentinel.validation.Numbers;
import ca.gc.cra.sentinel.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feeds a HAR capture through the monitoring pipeline and prints statistics and detections.
 *
 * @since 0.1.0
 */
public final class ReplayCli {
  private static final Logger log = LoggerFactory.getLogger(ReplayCli.class);
  private static final String MODE = "replay";
  private static final long MAX_CAPTURE_BYTES = 512L * 1024 * 1024;
  private static final String SUMMARY_USAGE =
      "usage: replay in=<capture.har> [config=PATH] [top=1-1000] [peerAddress=IP] [indicatorRules=PATH] "
          + "[workers=N] [kafkaBootstrap=HOST:PORT kafkaTopic=TOPIC]";
  private static final String HELP_TEXT = """
      SENTINEL replay

      Usage:
        replay in=<capture.har> [options]

      Required:
        in=PATH                 HAR capture to replay

      Optional:
        config=PATH             YAML file with common/replay sections
        top=1-1000              Detections listed in the summary (default 10)
        peerAddress=IP          Peer address assigned to replayed entries (default 127.0.0.1)
        indicatorRules=PATH     Indicator rule YAML (default: bundled rules)
        exemptPaths=/a,/b       Paths never blocked
        workers=N               Partition workers
        kafkaBootstrap=HOST:PORT  Archive analyzed entries to Kafka (requires kafkaTopic)
        --verbose               Enable DEBUG logging
      """;

  private ReplayCli() {}

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

    MonitorConfig config;
    Path capturePath;
    int top;
    String peerAddress;
    try {
      Map<String, String> effective = ConfigCliUtils.effectiveConfig(MODE, input, SUMMARY_USAGE);
      config = MonitorConfig.fromMap(effective);
      capturePath = Paths.validateReadableFile(Path.of(effective.get("in")), MAX_CAPTURE_BYTES);
      top = Numbers.parseIntInRange("top", effective.get("top"), 1, 1_000);
      peerAddress = Net.requireIpAddress(effective.get("peerAddress"));
    } catch (CliAbort abort) {
      return abort.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid replay configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    MetricsPort metrics = OpenTelemetryMetricsAdapter.fromEnvironment();
    try {
      Capture capture = new HarCaptureReader().read(capturePath);
      try (MonitorRuntime runtime = new CompositionRoot(config, metrics).createRuntime()) {
        runtime.startReplay();
        int accepted = new ReplayUseCase(runtime.pipeline(), metrics, peerAddress).replay(capture);
        runtime.drain();
        printSummary(capturePath, capture, accepted, runtime, top);
      }
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to replay {}: {}", capturePath, ex.getMessage());
      log.debug("Replay failure detail", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Replay configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Replay interrupted");
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in replay", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      CommandSupport.closeMetrics(metrics);
    }
  }

  private static void printSummary(Path path, Capture capture, int accepted, MonitorRuntime runtime, int top) {
    StatsSnapshot stats = runtime.aggregator().snapshot();
    ClassifierStatistics classifier = runtime.classifier().statistics();
    CliPrinter.printLines(
        "Replay of " + path,
        " Entries replayed : " + accepted + " of " + capture.entries().size()
            + (capture.warnings().isEmpty() ? "" : " (" + capture.warnings().size() + " skipped)"),
        " Requests counted : " + stats.totalRequests(),
        " Denied           : " + stats.deniedRequests(),
        " Detections       : " + stats.tunnelDetections()
            + " (beaconing " + classifier.beaconsDetected() + ")");
    CliPrinter.printf(" Avg response (ms): %.2f", stats.averageResponseTimeMs());
    StringBuilder statuses = new StringBuilder(" Status codes     :");
    stats.statusCounts().forEach((status, count) -> statuses.append(' ').append(status).append('=').append(count));
    CliPrinter.println(statuses.toString());
    CliPrinter.println(" Top sources      :");
    for (IpCount ip : stats.topIps()) {
      CliPrinter.printf("   %-39s %d", ip.ip(), ip.count());
    }

    QueryResult<Page<TunnelDetection>> detections = runtime.queries().tunnelDetections("low", top, 0);
    if (!detections.isOk() || detections.value().items().isEmpty()) {
      CliPrinter.println("No tunnel detections.");
      return;
    }
    CliPrinter.println("Tunnel detections (newest first):");
    for (TunnelDetection detection : detections.value().items()) {
      CliPrinter.printf("  %-39s %-16s %-9s %3d  %s",
          detection.sourceIp(),
          detection.tunnelType().wireName(),
          detection.confidence().wireName(),
          detection.riskScore(),
          String.join("; ", detection.indicators()));
    }
  }
}
