package ca.gc.cra.sentinel.application.timeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sentinel.domain.capture.Capture;
import ca.gc.cra.sentinel.domain.capture.CaptureEntry;
import ca.gc.cra.sentinel.domain.timeline.ResourceTiming;
import ca.gc.cra.sentinel.domain.timeline.Waterfall;
import ca.gc.cra.sentinel.domain.timeline.WaterfallSort;
import ca.gc.cra.sentinel.infrastructure.capture.HarCaptureReader;
import ca.gc.cra.sentinel.testutil.CaptureFixtures;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TimelineReconstructorTest {
  private final TimelineReconstructor reconstructor = new TimelineReconstructor();

  @Test
  void laysEntriesEndToEnd() throws Exception {
    Capture capture = new HarCaptureReader().read(
        new ByteArrayInputStream(CaptureFixtures.SAMPLE_HAR.getBytes(StandardCharsets.UTF_8)));

    Waterfall waterfall = reconstructor.reconstruct(capture);

    assertEquals(200d, waterfall.totalDurationMs());
    ResourceTiming first = waterfall.entries().get(0);
    ResourceTiming second = waterfall.entries().get(1);
    assertEquals(0d, first.startOffsetMs());
    assertEquals(120d, first.endOffsetMs());
    assertEquals(120d, second.startOffsetMs());
    assertEquals(200d, second.endOffsetMs());
    assertEquals("text", first.mimeCategory());
    assertEquals("application", second.mimeCategory());
    assertEquals("www.example.com", first.domain());
    assertEquals(2048L, first.sizeBytes());
    assertEquals(9000L, second.sizeBytes());
    assertEquals(1, waterfall.warnings().size());
  }

  @Test
  void unparsableUrlFallsBackToUnknownDomain() {
    Capture capture = Capture.of(List.of(entry(0, "not a url", "", Map.of("wait", 5d))));

    Waterfall waterfall = reconstructor.reconstruct(capture);

    assertEquals("unknown", waterfall.entries().get(0).domain());
    assertEquals("other", waterfall.entries().get(0).mimeCategory());
    assertTrue(waterfall.warnings().get(0).contains("cannot determine domain"));
  }

  @Test
  void emptyCaptureYieldsEmptyWaterfall() {
    Waterfall waterfall = reconstructor.reconstruct(Capture.of(List.of()));
    assertTrue(waterfall.isEmpty());
    assertEquals(0d, waterfall.totalDurationMs());
  }

  @Test
  void sortsAndFiltersWithoutMovingOffsets() {
    Capture capture = Capture.of(List.of(
        entry(0, "http://b.example/a.png", "image/png", Map.of("wait", 10d)),
        entry(1, "http://a.example/b.css", "text/css", Map.of("wait", 30d)),
        entry(2, "http://c.example/c.png", "image/png", Map.of("wait", 20d))));
    Waterfall waterfall = reconstructor.reconstruct(capture);

    Waterfall byDuration = waterfall.sortedBy(WaterfallSort.fromWire("time"));
    assertEquals(List.of(1, 2, 0), byDuration.entries().stream().map(ResourceTiming::index).toList());
    assertEquals(10d, byDuration.entries().get(0).startOffsetMs());

    Waterfall images = waterfall.filterByCategory("IMAGE");
    assertEquals(2, images.entries().size());
    assertEquals(60d, images.totalDurationMs());

    Waterfall byDomain = waterfall.sortedBy(WaterfallSort.DOMAIN);
    assertEquals("a.example", byDomain.entries().get(0).domain());
  }

  @Test
  void storeEvictsOldestWaterfall() {
    WaterfallStore store = new WaterfallStore(2);
    String first = store.put(Waterfall.empty(List.of()));
    String second = store.put(Waterfall.empty(List.of()));
    String third = store.put(Waterfall.empty(List.of()));

    assertEquals(2, store.size());
    assertTrue(store.get(first).isEmpty());
    assertTrue(store.get(second).isPresent());
    assertTrue(store.get(third).isPresent());
  }

  private static CaptureEntry entry(int index, String url, String mime, Map<String, Double> timings) {
    return new CaptureEntry(index, "", "GET", url, null, 0L, 200, null, mime, 100L, 100L, timings, null, null);
  }
}
