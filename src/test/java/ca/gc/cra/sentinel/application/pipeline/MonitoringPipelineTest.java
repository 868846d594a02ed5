package ca.gc.cra.sentinel.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sentinel.application.block.BlockRuleStore;
import ca.gc.cra.sentinel.application.block.BlockSettings;
import ca.gc.cra.sentinel.application.detect.ClassifierSettings;
import ca.gc.cra.sentinel.application.detect.TunnelClassifier;
import ca.gc.cra.sentinel.application.ingest.IngestAdapter;
import ca.gc.cra.sentinel.application.ingest.IngestSettings;
import ca.gc.cra.sentinel.application.port.ArchivePort;
import ca.gc.cra.sentinel.application.port.EventPublisher;
import ca.gc.cra.sentinel.application.query.RecentEntryWindow;
import ca.gc.cra.sentinel.domain.events.MonitorEvent;
import ca.gc.cra.sentinel.testutil.ManualClock;
import ca.gc.cra.sentinel.testutil.RecordingMetricsPort;
import ca.gc.cra.sentinel.testutil.TrafficFixtures;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class MonitoringPipelineTest {
  private final ManualClock clock = new ManualClock(TrafficFixtures.T0);
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void preservesOrderPerSourceAddress() throws Exception {
    Map<String, List<String>> pathsByIp = new ConcurrentHashMap<>();
    EventPublisher publisher = event -> {
      if (event instanceof MonitorEvent.Log log) {
        pathsByIp.computeIfAbsent(log.analyzed().entry().sourceIp(), ip -> new CopyOnWriteArrayList<>())
            .add(log.analyzed().entry().path());
      }
    };
    MonitoringPipeline pipeline = pipeline(publisher, new PipelineSettings(4, 256));
    pipeline.start();
    List<String> ips = List.of("10.0.0.1", "10.0.0.2", "10.0.0.3", "10.0.0.4", "10.0.0.5");
    for (int i = 0; i < 40; i++) {
      for (String ip : ips) {
        assertTrue(pipeline.submit(TrafficFixtures.get(ip, "/item/" + i).build()));
      }
    }
    pipeline.close();

    assertEquals(200L, pipeline.processedCount());
    List<String> expected = new ArrayList<>();
    for (int i = 0; i < 40; i++) {
      expected.add("/item/" + i);
    }
    for (String ip : ips) {
      assertEquals(expected, pathsByIp.get(ip), "order for " + ip);
    }
    assertEquals(200, metrics.count("pipeline.entry.processed"));
  }

  @Test
  void dropsWhenPartitionQueueIsFull() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    EventPublisher blocking = event -> {
      entered.countDown();
      try {
        release.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    };
    MonitoringPipeline pipeline = pipeline(blocking, new PipelineSettings(1, 1));
    pipeline.start();
    try {
      assertTrue(pipeline.submit(TrafficFixtures.get("10.0.0.1", "/a").build()));
      assertTrue(entered.await(5, TimeUnit.SECONDS));
      assertTrue(pipeline.submit(TrafficFixtures.get("10.0.0.1", "/b").build()));
      assertFalse(pipeline.submit(TrafficFixtures.get("10.0.0.1", "/c").build()));
      assertFalse(pipeline.submit(TrafficFixtures.get("10.0.0.1", "/d").build(), Duration.ofMillis(20)));
      assertEquals(2L, pipeline.droppedCount());
      assertEquals(2, metrics.count("pipeline.enqueue.dropped"));
    } finally {
      release.countDown();
      pipeline.close();
    }
    assertEquals(2L, pipeline.processedCount());
  }

  @Test
  void rejectsSubmissionsOutsideLifecycle() {
    MonitoringPipeline pipeline = pipeline(event -> { }, new PipelineSettings(1, 4));
    assertThrows(IllegalStateException.class, () -> pipeline.submit(TrafficFixtures.get("10.0.0.1", "/").build()));

    pipeline.start();
    assertThrows(IllegalStateException.class, pipeline::start);
    pipeline.close();
    assertThrows(IllegalStateException.class, () -> pipeline.submit(TrafficFixtures.get("10.0.0.1", "/").build()));
    pipeline.close();
  }

  @Test
  void processingFailureIsCountedAndWorkerContinues() throws Exception {
    EventPublisher failing = event -> {
      if (event instanceof MonitorEvent.Log log && log.analyzed().entry().path().equals("/bad")) {
        throw new IllegalStateException("subscriber bug");
      }
    };
    MonitoringPipeline pipeline = pipeline(failing, new PipelineSettings(1, 8));
    pipeline.start();
    pipeline.submit(TrafficFixtures.get("10.0.0.1", "/bad").build());
    pipeline.submit(TrafficFixtures.get("10.0.0.1", "/good").build());
    pipeline.close();

    assertEquals(1L, pipeline.failedCount());
    assertEquals(1L, pipeline.processedCount());
  }

  @Test
  void partitionIsStableForAddress() {
    MonitoringPipeline pipeline = pipeline(event -> { }, new PipelineSettings(8, 4));
    int partition = pipeline.partitionOf("198.51.100.23");
    assertEquals(partition, pipeline.partitionOf("198.51.100.23"));
    assertTrue(partition >= 0 && partition < 8);
  }

  private MonitoringPipeline pipeline(EventPublisher publisher, PipelineSettings settings) {
    ClassifierSettings classifierSettings = ClassifierSettings.defaults();
    ExchangeProcessor processor = new ExchangeProcessor(
        new IngestAdapter(IngestSettings.defaults(), clock, metrics),
        new BlockRuleStore(BlockSettings.defaults(), metrics),
        new TunnelClassifier(classifierSettings, clock, metrics),
        new RecentEntryWindow(1_000),
        ArchivePort.NONE,
        publisher,
        metrics);
    return new MonitoringPipeline(processor, classifierSettings::newArena, metrics, settings);
  }
}
