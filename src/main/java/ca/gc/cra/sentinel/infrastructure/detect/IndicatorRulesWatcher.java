package ca.gc.cra.sentinel.infrastructure.detect;

import ca.gc.cra.sentinel.application.detect.ClassifierSettings;
import ca.gc.cra.sentinel.application.detect.IndicatorRulesLoader;
import ca.gc.cra.sentinel.application.detect.TunnelClassifier;
import ca.gc.cra.sentinel.application.port.ClockPort;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polling watcher that reloads the indicator rule file when its modification time changes.
 *
 * <p>A rule file that fails to load keeps the previous rules active.</p>
 *
 * @since 0.1.0
 */
public final class IndicatorRulesWatcher {
  private static final Logger log = LoggerFactory.getLogger(IndicatorRulesWatcher.class);

  private final Path rulePath;
  private final IndicatorRulesLoader loader;
  private final TunnelClassifier classifier;
  private final ClockPort clock;
  private final long intervalMillis;

  private volatile long nextCheckAt;
  private FileTime lastModified;

  public IndicatorRulesWatcher(
      Path rulePath,
      IndicatorRulesLoader loader,
      TunnelClassifier classifier,
      ClockPort clock,
      long intervalMillis) {
    this.rulePath = Objects.requireNonNull(rulePath, "rulePath");
    this.loader = Objects.requireNonNull(loader, "loader");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.intervalMillis = Math.max(1_000L, intervalMillis);
    this.lastModified = modificationTime();
  }

  public long intervalMillis() {
    return intervalMillis;
  }

  /**
   * Checks the rule file and reloads it when it changed since the last successful load.
   *
   * @return {@code true} when new rules were installed
   */
  public synchronized boolean maybeReload() {
    long now = clock.nowMillis();
    if (now < nextCheckAt) {
      return false;
    }
    nextCheckAt = now + intervalMillis;

    FileTime current = modificationTime();
    if (current == null || current.equals(lastModified)) {
      return false;
    }

    try {
      ClassifierSettings settings = loader.load(rulePath);
      classifier.update(settings);
      lastModified = current;
      log.info("Reloaded indicator rules from {} ({} indicators enabled)", rulePath, settings.checks().size());
      return true;
    } catch (IOException | IllegalArgumentException ex) {
      log.warn("Failed to reload indicator rules from {}; keeping previous rules", rulePath, ex);
      return false;
    }
  }

  private FileTime modificationTime() {
    try {
      return Files.exists(rulePath) ? Files.getLastModifiedTime(rulePath) : null;
    } catch (IOException ex) {
      log.warn("Unable to read modification time for indicator rules {}", rulePath, ex);
      return null;
    }
  }
}
