package ca.gc.cra.sentinel.infrastructure.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import io.opentelemetry.sdk.metrics.data.MetricDataType;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenTelemetryMetricsAdapterTest {
  private InMemoryMetricReader reader;
  private OpenTelemetryMetricsAdapter adapter;

  @BeforeEach
  void setUp() {
    reader = InMemoryMetricReader.create();
    adapter = new OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.forTesting(reader));
  }

  @AfterEach
  void tearDown() {
    adapter.close();
  }

  @Test
  void incrementRecordsCounterTaggedWithComponent() {
    adapter.increment("ingest.accepted");
    adapter.increment("ingest.accepted");
    adapter.increment("ingest.accepted");
    adapter.forceFlush();

    MetricData counter = metric("sentinel.ingest.accepted");
    assertEquals(MetricDataType.LONG_SUM, counter.getType());
    LongPointData point = counter.getLongSumData().getPoints().iterator().next();
    assertEquals(3L, point.getValue());
    assertEquals("ingest", point.getAttributes().get(AttributeKey.stringKey("sentinel.component")));
    assertEquals("sentinel", counter.getResource().getAttribute(AttributeKey.stringKey("service.name")));
    assertEquals("ca.gc.cra", counter.getResource().getAttribute(AttributeKey.stringKey("service.namespace")));
  }

  @Test
  void observeRecordsHistogram() {
    adapter.observe("pipeline.latency.ms", 12);
    adapter.observe("pipeline.latency.ms", 30);
    adapter.forceFlush();

    MetricData histogram = metric("sentinel.pipeline.latency.ms");
    assertEquals(MetricDataType.HISTOGRAM, histogram.getType());
    HistogramPointData point = histogram.getHistogramData().getPoints().iterator().next();
    assertEquals(2L, point.getCount());
    assertEquals(42d, point.getSum());
  }

  @Test
  void instrumentNamesAreSanitized() {
    assertEquals("sentinel.bus.dropped_slow", OpenTelemetryMetricsAdapter.instrumentName("Bus.Dropped Slow"));
    assertEquals("sentinel.metric", OpenTelemetryMetricsAdapter.instrumentName("  "));
  }

  private MetricData metric(String name) {
    return reader.collectAllMetrics().stream()
        .filter(metric -> metric.getName().equals(name))
        .findFirst()
        .orElseThrow(() -> new AssertionError("metric " + name + " not exported"));
  }
}
