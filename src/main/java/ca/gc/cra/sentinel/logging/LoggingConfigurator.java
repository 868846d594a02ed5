package ca.gc.cra.sentinel.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts SENTINEL logging for the command-line entry points.
 * <p><strong>Why:</strong> Operators raise verbosity with {@code --verbose} without editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Only the {@code ca.gc.cra.sentinel} hierarchy is raised; Kafka and OpenTelemetry client loggers keep
 *     their configured levels. Other SLF4J bindings log a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  static final String APPLICATION_LOGGER = "ca.gc.cra.sentinel";

  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /** Sets the application logger hierarchy to DEBUG within the running JVM. */
  public static void enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger app = context.getLogger(APPLICATION_LOGGER);
      if (!Level.DEBUG.equals(app.getLevel())) {
        app.setLevel(Level.DEBUG);
      }
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }
}
