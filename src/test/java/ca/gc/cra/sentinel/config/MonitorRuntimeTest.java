package ca.gc.cra.sentinel.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sentinel.application.port.ArchivePort;
import ca.gc.cra.sentinel.application.query.BlockRuleRequest;
import ca.gc.cra.sentinel.domain.stats.StatsSnapshot;
import ca.gc.cra.sentinel.domain.traffic.AnalyzedEntry;
import ca.gc.cra.sentinel.testutil.ManualClock;
import ca.gc.cra.sentinel.testutil.RecordingMetricsPort;
import ca.gc.cra.sentinel.testutil.TrafficFixtures;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.Test;

class MonitorRuntimeTest {
  private final ManualClock clock = new ManualClock(TrafficFixtures.T0);
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void replayProcessesEveryExchangeAndCountsDenials() throws Exception {
    List<AnalyzedEntry> archived = new CopyOnWriteArrayList<>();
    CompositionRoot root = new CompositionRoot(MonitorConfig.defaults(), metrics, clock);
    try (MonitorRuntime runtime = root.createRuntime(archived::add)) {
      runtime.startReplay();
      assertTrue(runtime.queries()
          .addBlockRule(new BlockRuleRequest("ip", "203.0.113.5", null, null, "scanner", "ops")).isOk());

      assertTrue(runtime.pipeline().submit(TrafficFixtures.get("203.0.113.5", "/admin").build()));
      assertTrue(runtime.pipeline().submit(TrafficFixtures.get("198.51.100.7", "/index.html").build()));
      runtime.drain();

      StatsSnapshot stats = runtime.queries().stats().value();
      assertEquals(2L, stats.totalRequests());
      assertEquals(1L, stats.deniedRequests());
      assertEquals(2, runtime.queries().recentLogs(null, null).value().total());
      assertEquals(2, archived.size());
      assertThrows(IllegalStateException.class, runtime::startLive);
    }
  }

  @Test
  void liveRuntimeServesHttpUntilClosed() throws Exception {
    MonitorConfig config = MonitorConfig.fromMap(Map.of("http.port", "0", "workers", "2"));
    MonitorRuntime runtime = new CompositionRoot(config, metrics, clock).createRuntime(ArchivePort.NONE);
    int port;
    try {
      runtime.startLive();
      port = runtime.startHttp();
      HttpResponse<String> response = HttpClient.newHttpClient().send(
          HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + port + "/api/network/stats")).GET().build(),
          HttpResponse.BodyHandlers.ofString());

      assertEquals(200, response.statusCode());
      assertTrue(response.body().contains("\"totalRequests\""));
      assertThrows(IllegalStateException.class, runtime::startHttp);
    } finally {
      runtime.close();
    }
    runtime.close();
  }

  @Test
  void missingIndicatorRuleFileFailsWiring() {
    MonitorConfig config = MonitorConfig.fromMap(Map.of("indicatorRules", "/nonexistent/rules.yaml"));
    assertThrows(IOException.class, () -> new CompositionRoot(config, metrics, clock).createRuntime(ArchivePort.NONE));
  }
}
