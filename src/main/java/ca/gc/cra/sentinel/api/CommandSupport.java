package ca.gc.cra.sentinel.api;

import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.logging.LoggingConfigurator;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Shared steps of the command entry points. */
final class CommandSupport {
  private static final Logger log = LoggerFactory.getLogger(CommandSupport.class);

  private CommandSupport() {}

  static void enableVerboseIfRequested(CliInput input, String command) {
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {}", command);
    }
  }

  static void warnUnsupportedFlags(CliInput input, String command, Set<String> supported) {
    for (String flag : input.unsupportedFlags(supported)) {
      log.warn("Ignoring unsupported {} flag {}", command, flag);
    }
  }

  /** Flushes and closes an exporting metrics port; the no-op port is left alone. */
  static void closeMetrics(MetricsPort metrics) {
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to flush metrics on shutdown", ex);
      }
    }
  }
}
