package ca.gc.cra.sentinel.application.detect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sentinel.application.detect.indicators.BeaconingCheck;
import ca.gc.cra.sentinel.application.detect.indicators.SuspiciousPathCheck;
import ca.gc.cra.sentinel.application.detect.indicators.TunnelHeaderCheck;
import ca.gc.cra.sentinel.domain.detect.Confidence;
import ca.gc.cra.sentinel.domain.detect.TunnelDetection;
import ca.gc.cra.sentinel.domain.detect.TunnelType;
import ca.gc.cra.sentinel.domain.traffic.BodyCapture;
import ca.gc.cra.sentinel.domain.traffic.HeaderList;
import ca.gc.cra.sentinel.domain.traffic.LogEntry;
import ca.gc.cra.sentinel.testutil.ManualClock;
import ca.gc.cra.sentinel.testutil.RecordingMetricsPort;
import ca.gc.cra.sentinel.testutil.TrafficFixtures;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class TunnelClassifierTest {
  private final ManualClock clock = new ManualClock(TrafficFixtures.T0);
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void sumsWeightsAndRatesConfidence() {
    TunnelClassifier classifier = new TunnelClassifier(settings(List.of(
        new TunnelHeaderCheck(IndicatorParams.empty(TunnelHeaderCheck.NAME)),
        new SuspiciousPathCheck(IndicatorParams.empty(SuspiciousPathCheck.NAME)))), clock, metrics);

    Optional<TunnelDetection> detection = classifier.classify(
        entry("10.0.0.5", "/tunnel/open", HeaderList.of("X-Tunnel", "1"), TrafficFixtures.T0), arena());

    assertTrue(detection.isPresent());
    assertEquals(65, detection.get().riskScore());
    assertEquals(Confidence.MEDIUM, detection.get().confidence());
    assertEquals(TunnelType.HTTP_TUNNEL, detection.get().tunnelType());
    assertEquals(List.of("Tunnel header found: X-Tunnel", "Suspicious path: /tunnel"), detection.get().indicators());
    assertEquals(1, metrics.count("classifier.detection"));
  }

  @Test
  void cleanEntryProducesNoDetection() {
    TunnelClassifier classifier = new TunnelClassifier(ClassifierSettings.defaults(), clock, metrics);

    assertTrue(classifier.classify(entry("10.0.0.5", "/index.html", HeaderList.empty(), TrafficFixtures.T0), arena())
        .isEmpty());
    assertEquals(1L, classifier.statistics().requestsAnalyzed());
    assertEquals(0L, classifier.statistics().tunnelsDetected());
  }

  @Test
  void scoreIsClippedToHundred() {
    IndicatorCheck heavy = fixed("heavy", 80, TunnelType.WEBSHELL);
    IndicatorCheck heavier = fixed("heavier", 90, TunnelType.CHUNKED_ENCODING);
    TunnelClassifier classifier = new TunnelClassifier(settings(List.of(heavy, heavier)), clock, metrics);

    TunnelDetection detection = classifier.classify(
        entry("10.0.0.5", "/", HeaderList.empty(), TrafficFixtures.T0), arena()).orElseThrow();

    assertEquals(100, detection.riskScore());
    assertEquals(Confidence.CONFIRMED, detection.confidence());
    assertEquals(TunnelType.CHUNKED_ENCODING, detection.tunnelType());
  }

  @Test
  void failingCheckIsSkipped() {
    IndicatorCheck broken = new IndicatorCheck() {
      @Override
      public String name() {
        return "broken";
      }

      @Override
      public Optional<IndicatorHit> evaluate(LogEntry entry, IpActivity activity) {
        throw new IllegalStateException("boom");
      }
    };
    TunnelClassifier classifier = new TunnelClassifier(
        settings(List.of(broken, fixed("ok", 20, TunnelType.UNKNOWN))), clock, metrics);

    TunnelDetection detection = classifier.classify(
        entry("10.0.0.5", "/", HeaderList.empty(), TrafficFixtures.T0), arena()).orElseThrow();

    assertEquals(20, detection.riskScore());
    assertEquals(Confidence.LOW, detection.confidence());
    assertEquals(1, metrics.count("classifier.check.failed"));
  }

  @Test
  void regularCadenceIsReportedAsBeaconing() {
    TunnelClassifier classifier = new TunnelClassifier(
        settings(List.of(new BeaconingCheck(IndicatorParams.empty(BeaconingCheck.NAME)))), clock, metrics);
    IpActivityArena arena = arena();

    Optional<TunnelDetection> last = Optional.empty();
    for (int i = 0; i < 10; i++) {
      last = classifier.classify(
          entry("10.0.0.7", "/status", HeaderList.empty(), TrafficFixtures.T0 + i * 30_000L), arena);
    }

    assertEquals(TunnelType.BEACONING, last.orElseThrow().tunnelType());
    assertEquals(1L, classifier.statistics().beaconsDetected());
    assertEquals(1, metrics.count("classifier.beacon"));
  }

  @Test
  void updateSwapsRules() {
    TunnelClassifier classifier = new TunnelClassifier(settings(List.of()), clock, metrics);
    LogEntry entry = entry("10.0.0.5", "/relay", HeaderList.empty(), TrafficFixtures.T0);
    assertTrue(classifier.classify(entry, arena()).isEmpty());

    classifier.update(settings(List.of(new SuspiciousPathCheck(new IndicatorParams(
        SuspiciousPathCheck.NAME, Map.<String, Object>of("weight", 50))))));

    assertEquals(50, classifier.classify(entry, arena()).orElseThrow().riskScore());
  }

  private static ClassifierSettings settings(List<IndicatorCheck> checks) {
    return new ClassifierSettings(ConfidenceBands.defaults(), checks, 16, 20);
  }

  private static IpActivityArena arena() {
    return new IpActivityArena(16, 20);
  }

  private static IndicatorCheck fixed(String name, int weight, TunnelType type) {
    return new IndicatorCheck() {
      @Override
      public String name() {
        return name;
      }

      @Override
      public Optional<IndicatorHit> evaluate(LogEntry entry, IpActivity activity) {
        return Optional.of(new IndicatorHit(name, weight, List.of(name + " fired"), type));
      }
    };
  }

  private static LogEntry entry(String ip, String path, HeaderList headers, long timestamp) {
    return new LogEntry("id-" + timestamp, Instant.ofEpochMilli(timestamp), ip, "GET", path, "", headers,
        BodyCapture.empty(), 200, HeaderList.empty(), BodyCapture.empty(), 5d, "", "");
  }
}
