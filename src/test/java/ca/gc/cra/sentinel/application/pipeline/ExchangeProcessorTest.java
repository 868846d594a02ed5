package ca.gc.cra.sentinel.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sentinel.application.block.BlockRuleStore;
import ca.gc.cra.sentinel.application.block.BlockSettings;
import ca.gc.cra.sentinel.application.detect.ClassifierSettings;
import ca.gc.cra.sentinel.application.detect.IpActivityArena;
import ca.gc.cra.sentinel.application.detect.TunnelClassifier;
import ca.gc.cra.sentinel.application.ingest.IngestAdapter;
import ca.gc.cra.sentinel.application.ingest.IngestSettings;
import ca.gc.cra.sentinel.application.port.ArchivePort;
import ca.gc.cra.sentinel.application.query.RecentEntryWindow;
import ca.gc.cra.sentinel.domain.block.IpBlockRule;
import ca.gc.cra.sentinel.domain.events.EventType;
import ca.gc.cra.sentinel.domain.events.MonitorEvent;
import ca.gc.cra.sentinel.domain.traffic.AnalyzedEntry;
import ca.gc.cra.sentinel.domain.traffic.HeaderList;
import ca.gc.cra.sentinel.testutil.ManualClock;
import ca.gc.cra.sentinel.testutil.RecordingMetricsPort;
import ca.gc.cra.sentinel.testutil.TrafficFixtures;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ExchangeProcessorTest {
  private final ManualClock clock = new ManualClock(TrafficFixtures.T0);
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final BlockRuleStore blocks = new BlockRuleStore(BlockSettings.defaults(), metrics);
  private final TunnelClassifier classifier = new TunnelClassifier(ClassifierSettings.defaults(), clock, metrics);
  private final RecentEntryWindow recent = new RecentEntryWindow(10);
  private final List<MonitorEvent> published = new ArrayList<>();
  private final List<AnalyzedEntry> archived = new ArrayList<>();

  @Test
  void detectionPublishesAlertBeforeLog() {
    ExchangeProcessor processor = processor(archived::add);

    AnalyzedEntry analyzed = processor.process(TrafficFixtures.get("10.0.0.8", "/tunnel")
        .requestHeaders(HeaderList.of("X-Tunnel", "1")).build(), IpActivityArena.withDefaults());

    assertTrue(analyzed.detection().isPresent());
    assertEquals(List.of(EventType.TUNNEL_ALERT, EventType.LOG), published.stream().map(MonitorEvent::type).toList());
    assertEquals(analyzed, recent.find(analyzed.entry().id()).orElseThrow());
    assertEquals(List.of(analyzed), archived);
  }

  @Test
  void deniedEntrySkipsClassification() {
    blocks.add(new IpBlockRule("10.0.0.8", "", Instant.EPOCH, ""));
    ExchangeProcessor processor = processor(archived::add);

    AnalyzedEntry analyzed = processor.process(TrafficFixtures.get("10.0.0.8", "/tunnel")
        .requestHeaders(HeaderList.of("X-Tunnel", "1")).build(), IpActivityArena.withDefaults());

    assertTrue(analyzed.denied());
    assertTrue(analyzed.detection().isEmpty());
    MonitorEvent.Log log = assertInstanceOf(MonitorEvent.Log.class, published.get(0));
    assertTrue(log.analyzed().denied());
    assertEquals(1, published.size());
    assertEquals(0L, classifier.statistics().requestsAnalyzed());
  }

  @Test
  void archiveFailureDoesNotStopPublishing() {
    ExchangeProcessor processor = processor(entry -> {
      throw new IllegalStateException("broker down");
    });

    processor.process(TrafficFixtures.get("10.0.0.1", "/").build(), IpActivityArena.withDefaults());

    assertEquals(1, metrics.count("archive.failed"));
    assertEquals(1, published.size());
  }

  private ExchangeProcessor processor(ArchivePort archive) {
    return new ExchangeProcessor(new IngestAdapter(IngestSettings.defaults(), clock, metrics), blocks, classifier,
        recent, archive, published::add, metrics);
  }
}
