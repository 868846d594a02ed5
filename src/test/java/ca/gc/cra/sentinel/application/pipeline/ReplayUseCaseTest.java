package ca.gc.cra.sentinel.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sentinel.application.block.BlockRuleStore;
import ca.gc.cra.sentinel.application.block.BlockSettings;
import ca.gc.cra.sentinel.application.detect.ClassifierSettings;
import ca.gc.cra.sentinel.application.detect.TunnelClassifier;
import ca.gc.cra.sentinel.application.ingest.IngestAdapter;
import ca.gc.cra.sentinel.application.ingest.IngestSettings;
import ca.gc.cra.sentinel.application.port.ArchivePort;
import ca.gc.cra.sentinel.application.query.RecentEntryWindow;
import ca.gc.cra.sentinel.domain.capture.Capture;
import ca.gc.cra.sentinel.domain.capture.CaptureEntry;
import ca.gc.cra.sentinel.domain.events.MonitorEvent;
import ca.gc.cra.sentinel.domain.traffic.LogEntry;
import ca.gc.cra.sentinel.domain.traffic.RawExchange;
import ca.gc.cra.sentinel.infrastructure.capture.HarCaptureReader;
import ca.gc.cra.sentinel.testutil.CaptureFixtures;
import ca.gc.cra.sentinel.testutil.ManualClock;
import ca.gc.cra.sentinel.testutil.RecordingMetricsPort;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.Test;

class ReplayUseCaseTest {
  private final ManualClock clock = new ManualClock(0L);
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void convertsCaptureEntryToObservation() {
    CaptureEntry entry = new CaptureEntry(3, "2024-05-01T12:00:00.000Z", "POST", "https://h.example/a%20b?x=1&y=2",
        null, 10L, 201, null, "application/json", 5L, 5L, Map.of("wait", 40d, "blocked", -1d, "receive", 2.5d), null, null);

    RawExchange raw = ReplayUseCase.toRawExchange(entry, "127.0.0.1");

    assertEquals("/a%20b", raw.path());
    assertEquals("x=1&y=2", raw.query());
    assertEquals(Instant.parse("2024-05-01T12:00:00Z").toEpochMilli(), raw.timestampMillis());
    assertEquals(42.5d, raw.responseTimeMs());
    assertEquals(201, raw.responseStatus());
    assertEquals("127.0.0.1", raw.peerAddress());
  }

  @Test
  void unparsableUrlAndTimestampFallBack() {
    CaptureEntry entry = new CaptureEntry(0, "yesterday", "GET", "not a url", null, 0L, 200, null, "", 0L, 0L,
        Map.of(), null, null);

    RawExchange raw = ReplayUseCase.toRawExchange(entry, "10.0.0.1");

    assertEquals("/", raw.path());
    assertEquals(0L, raw.timestampMillis());
  }

  @Test
  void infiniteTimingPhaseDoesNotReachResponseTime() {
    CaptureEntry entry = new CaptureEntry(0, "", "GET", "http://h.example/", null, 0L, 200, null, "", 0L, 0L,
        Map.of("wait", 12d, "ssl", Double.POSITIVE_INFINITY, "receive", 3d), null, null);

    RawExchange raw = ReplayUseCase.toRawExchange(entry, "10.0.0.1");

    assertEquals(15d, raw.responseTimeMs());
  }

  @Test
  void carriesRecordedBodiesAndDeclaredSizes() {
    byte[] upload = "u".repeat(12_000).getBytes(StandardCharsets.UTF_8);
    CaptureEntry recorded = new CaptureEntry(0, "", "POST", "http://h.example/u", null, 12_000L, 200, null,
        "text/plain", 2L, 2L, Map.of(), upload, "ok".getBytes(StandardCharsets.UTF_8));
    CaptureEntry sizeOnly = new CaptureEntry(1, "", "POST", "http://h.example/u", null, 5_000L, 200, null,
        "", 900L, 20_000L, Map.of(), null, null);

    RawExchange withBodies = ReplayUseCase.toRawExchange(recorded, "10.0.0.1");
    RawExchange withSizes = ReplayUseCase.toRawExchange(sizeOnly, "10.0.0.1");

    assertEquals(12_000, withBodies.requestBody().length);
    assertEquals("ok", new String(withBodies.responseBody(), StandardCharsets.UTF_8));
    assertEquals(0, withSizes.requestBody().length);
    assertEquals(5_000L, withSizes.requestBodySize());
    assertEquals(20_000L, withSizes.responseBodySize());
  }

  @Test
  void replayedBodiesReachLoggedEntries() throws Exception {
    String har = "{\"log\":{\"entries\":["
        + "{\"request\":{\"method\":\"POST\",\"url\":\"http://h.example/upload\",\"bodySize\":12000,"
        + "\"postData\":{\"mimeType\":\"text/plain\",\"text\":\"" + "x".repeat(12_000) + "\"}},"
        + "\"response\":{\"status\":200,\"bodySize\":2,\"content\":{\"size\":2,\"text\":\"ok\"}}},"
        + "{\"request\":{\"method\":\"POST\",\"url\":\"http://h.example/upload\",\"bodySize\":4096},"
        + "\"response\":{\"status\":200,\"bodySize\":-1,\"content\":{\"size\":65536}}}"
        + "]}}";
    List<LogEntry> logged = new CopyOnWriteArrayList<>();
    MonitoringPipeline pipeline = pipeline(logged);
    Capture capture = new HarCaptureReader().read(new ByteArrayInputStream(har.getBytes(StandardCharsets.UTF_8)));

    pipeline.start();
    new ReplayUseCase(pipeline, metrics, "192.0.2.10").replay(capture);
    pipeline.close();

    assertEquals(2, logged.size());
    LogEntry upload = logged.get(0);
    assertEquals(12_000L, upload.requestBody().size());
    assertEquals(IngestSettings.DEFAULT_BODY_CAP_BYTES, upload.requestBody().storedLength());
    assertTrue(upload.requestBody().truncated());
    assertEquals("ok", upload.responseBody().text());
    LogEntry sizeOnly = logged.get(1);
    assertEquals(4096L, sizeOnly.requestBody().size());
    assertEquals(0, sizeOnly.requestBody().storedLength());
    assertEquals(65_536L, sizeOnly.responseBody().size());
  }

  @Test
  void replaysEveryCaptureEntryThroughPipeline() throws Exception {
    List<LogEntry> logged = new CopyOnWriteArrayList<>();
    MonitoringPipeline pipeline = pipeline(logged);
    Capture capture = new HarCaptureReader().read(
        new ByteArrayInputStream(CaptureFixtures.SAMPLE_HAR.getBytes(StandardCharsets.UTF_8)));

    pipeline.start();
    int accepted = new ReplayUseCase(pipeline, metrics, "192.0.2.10").replay(capture);
    pipeline.close();

    assertEquals(2, accepted);
    assertEquals(2, logged.size());
    assertEquals(List.of("/index.html", "/app.js"), logged.stream().map(LogEntry::path).toList());
    assertEquals("lang=en", logged.get(0).query());
    assertEquals("192.0.2.10", logged.get(0).sourceIp());
    assertEquals(2, metrics.count("replay.entry.submitted"));
  }

  private MonitoringPipeline pipeline(List<LogEntry> logged) {
    ClassifierSettings settings = ClassifierSettings.defaults();
    ExchangeProcessor processor = new ExchangeProcessor(
        new IngestAdapter(IngestSettings.defaults(), clock, metrics),
        new BlockRuleStore(BlockSettings.defaults(), metrics),
        new TunnelClassifier(settings, clock, metrics),
        new RecentEntryWindow(100),
        ArchivePort.NONE,
        event -> {
          if (event instanceof MonitorEvent.Log log) {
            logged.add(log.analyzed().entry());
          }
        },
        metrics);
    return new MonitoringPipeline(processor, settings::newArena, metrics, new PipelineSettings(2, 1));
  }
}
