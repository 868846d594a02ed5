package ca.gc.cra.sentinel.api;

import ca.gc.cra.sentinel.application.timeline.TimelineReconstructor;
import ca.gc.cra.sentinel.config.WaterfallConfig;
import ca.gc.cra.sentinel.domain.capture.Capture;
import ca.gc.cra.sentinel.domain.timeline.ResourceTiming;
import ca.gc.cra.sentinel.domain.timeline.Waterfall;
import ca.gc.cra.sentinel.infrastructure.capture.HarCaptureReader;
import ca.gc.cra.sentinel.infrastructure.json.MonitorJson;
import ca.gc.cra.sentinel.logging.Logs;
import ca.gc.cra.sentinel.validation.Paths;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reconstructs a HAR capture into a waterfall and prints it as a table or JSON.
 *
 * @since 0.1.0
 */
public final class WaterfallCli {
  private static final Logger log = LoggerFactory.getLogger(WaterfallCli.class);
  private static final String MODE = "waterfall";
  private static final long MAX_CAPTURE_BYTES = 512L * 1024 * 1024;
  private static final int URL_COLUMN_BYTES = 60;
  private static final String SUMMARY_USAGE =
      "usage: waterfall in=<capture.har> [sort=captured|duration|size|domain] [mimeCategory=NAME|all] [--json]";
  private static final String HELP_TEXT = """
      SENTINEL waterfall

      Usage:
        waterfall in=<capture.har> [options]

      Options:
        sort=captured|duration|size|domain  Row order (default captured)
        mimeCategory=NAME|all               Keep rows whose MIME category matches, e.g. image
        config=PATH                         YAML file with common/waterfall sections
        --json                              Print the waterfall as JSON
        --verbose                           Enable DEBUG logging
      """;

  private WaterfallCli() {}

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
    CommandSupport.warnUnsupportedFlags(input, MODE, Set.of("--json"));

    WaterfallConfig config;
    try {
      config = WaterfallConfig.fromMap(ConfigCliUtils.effectiveConfig(MODE, input, SUMMARY_USAGE));
      Paths.validateReadableFile(config.input(), MAX_CAPTURE_BYTES);
    } catch (CliAbort abort) {
      return abort.exitCode();
    } catch (IllegalArgumentException ex) {
      log.error("Invalid waterfall configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      Capture capture = new HarCaptureReader().read(config.input());
      Waterfall waterfall = new TimelineReconstructor().reconstruct(capture)
          .filterByCategory(config.mimeCategory().orElse(null))
          .sortedBy(config.sort());
      if (input.hasFlag("--json")) {
        CliPrinter.println(MonitorJson.renderString(gen -> MonitorJson.writeWaterfall(gen, waterfall)));
      } else {
        printTable(config.input(), waterfall);
      }
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to reconstruct {}: {}", config.input(), ex.getMessage());
      log.debug("Waterfall failure detail", ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in waterfall", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printTable(Path path, Waterfall waterfall) {
    CliPrinter.println("Waterfall of " + path);
    if (waterfall.isEmpty()) {
      CliPrinter.println("No entries.");
    } else {
      CliPrinter.printf("%4s %-6s %-3s %-12s %10s %10s %10s  %s",
          "#", "METHOD", "ST", "CATEGORY", "START_MS", "DUR_MS", "BYTES", "URL");
      for (ResourceTiming timing : waterfall.entries()) {
        CliPrinter.printf("%4d %-6s %3d %-12s %10.1f %10.1f %10d  %s",
            timing.index(),
            timing.method(),
            timing.status(),
            timing.mimeCategory(),
            timing.startOffsetMs(),
            timing.durationMs(),
            timing.sizeBytes(),
            Logs.truncate(timing.url(), URL_COLUMN_BYTES));
      }
    }
    CliPrinter.printf("Total duration: %.1f ms", waterfall.totalDurationMs());
    for (String warning : waterfall.warnings()) {
      CliPrinter.println("warning: " + warning);
    }
  }
}
