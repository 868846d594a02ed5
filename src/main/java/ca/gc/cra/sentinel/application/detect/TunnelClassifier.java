package ca.gc.cra.sentinel.application.detect;

import ca.gc.cra.sentinel.application.detect.indicators.BeaconingCheck;
import ca.gc.cra.sentinel.application.port.ClockPort;
import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.domain.detect.Confidence;
import ca.gc.cra.sentinel.domain.detect.TunnelDetection;
import ca.gc.cra.sentinel.domain.detect.TunnelType;
import ca.gc.cra.sentinel.domain.traffic.LogEntry;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.LongAdder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Scores log entries for tunnel and covert channel behaviour.
 * <p><strong>Why:</strong> Turns independent, individually weak indicators into one banded verdict per entry.</p>
 * <p><strong>Role:</strong> Pipeline stage invoked after block enforcement for allowed entries.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Record the exchange in the worker's per-IP activity arena.</li>
 *   <li>Evaluate every enabled indicator; sum weights clipped to 100.</li>
 *   <li>Rate the score with the configured bands and pick the heaviest indicator's type.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use provided each caller passes its own arena. Rules are
 * swapped atomically by {@link #update(ClassifierSettings)}.</p>
 * <p><strong>Observability:</strong> Emits {@code classifier.entry.analyzed}, {@code classifier.detection},
 * {@code classifier.beacon} and {@code classifier.check.failed}.</p>
 *
 * @since 0.1.0
 */
public final class TunnelClassifier {
  private static final Logger log = LoggerFactory.getLogger(TunnelClassifier.class);

  private final AtomicReference<ClassifierSettings> settings;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final LongAdder requestsAnalyzed = new LongAdder();
  private final LongAdder tunnelsDetected = new LongAdder();
  private final LongAdder beaconsDetected = new LongAdder();

  public TunnelClassifier(ClassifierSettings settings, ClockPort clock, MetricsPort metrics) {
    this.settings = new AtomicReference<>(Objects.requireNonNull(settings, "settings"));
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Replaces the active rules; entries already being classified finish with the previous rules.
   *
   * @param updated compiled rules
   */
  public void update(ClassifierSettings updated) {
    settings.set(Objects.requireNonNull(updated, "updated"));
  }

  public ClassifierSettings settings() {
    return settings.get();
  }

  /**
   * Classifies one entry.
   *
   * @param entry allowed entry
   * @param arena per-IP state owned by the calling worker
   * @return detection when at least one indicator fired
   */
  public Optional<TunnelDetection> classify(LogEntry entry, IpActivityArena arena) {
    Objects.requireNonNull(entry, "entry");
    Objects.requireNonNull(arena, "arena");
    requestsAnalyzed.increment();
    metrics.increment("classifier.entry.analyzed");

    IpActivity activity = arena.record(
        entry.sourceIp(), entry.timestamp().toEpochMilli(), entry.requestBody().size(), entry.responseBody().size());
    ClassifierSettings current = settings.get();

    List<IndicatorHit> hits = new ArrayList<>();
    for (IndicatorCheck check : current.checks()) {
      try {
        check.evaluate(entry, activity).ifPresent(hits::add);
      } catch (RuntimeException ex) {
        metrics.increment("classifier.check.failed");
        log.warn("Indicator {} failed on entry {}", check.name(), entry.id(), ex);
      }
    }
    if (hits.isEmpty()) {
      return Optional.empty();
    }

    int score = 0;
    IndicatorHit heaviest = null;
    List<String> indicators = new ArrayList<>();
    boolean beacon = false;
    for (IndicatorHit hit : hits) {
      score += hit.weight();
      indicators.addAll(hit.evidence());
      if (heaviest == null || hit.weight() > heaviest.weight()) {
        heaviest = hit;
      }
      beacon |= BeaconingCheck.NAME.equals(hit.check());
    }
    int riskScore = Math.min(TunnelDetection.MAX_RISK_SCORE, Math.max(0, score));
    Confidence confidence = current.bands().rate(riskScore);
    TunnelType type = heaviest.suggestedType();

    TunnelDetection detection = new TunnelDetection(
        UUID.randomUUID().toString(),
        entry.id(),
        entry.sourceIp(),
        clock.now(),
        type,
        confidence,
        riskScore,
        indicators);

    tunnelsDetected.increment();
    metrics.increment("classifier.detection");
    if (beacon) {
      beaconsDetected.increment();
      metrics.increment("classifier.beacon");
    }
    if (log.isDebugEnabled()) {
      log.debug("Detection {} for {} type={} confidence={} score={}",
          detection.detectionId(), entry.sourceIp(), type.wireName(), confidence.wireName(), riskScore);
    }
    return Optional.of(detection);
  }

  public ClassifierStatistics statistics() {
    return new ClassifierStatistics(requestsAnalyzed.sum(), tunnelsDetected.sum(), beaconsDetected.sum());
  }
}
