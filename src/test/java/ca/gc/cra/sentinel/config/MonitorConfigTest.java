package ca.gc.cra.sentinel.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class MonitorConfigTest {

  @Test
  void parsesOverridesAndDerivesSettings() {
    MonitorConfig config = MonitorConfig.fromMap(Map.of(
        "workers", "3",
        "partitionQueueCapacity", "64",
        "trustForwardedHeaders", "TRUE",
        "kafkaBootstrap", "broker-1:9092",
        "indicatorRules", "rules/custom.yaml",
        "exemptPaths", "/health, /metrics",
        "stats.windowSeconds", "0"));

    assertEquals(3, config.pipelineSettings().workers());
    assertEquals(64, config.pipelineSettings().partitionQueueCapacity());
    assertTrue(config.ingestSettings().trustForwardedHeaders());
    assertEquals(Optional.of("broker-1:9092"), config.kafkaBootstrap());
    assertEquals(Path.of("rules/custom.yaml").toAbsolutePath().normalize(), config.indicatorRules().orElseThrow());
    assertEquals(List.of("/health", "/metrics"), config.blockSettings().exemptPaths());
    assertEquals(0L, config.statsSettings().windowSeconds());
  }

  @Test
  void blankValuesFallBackToDefaults() {
    MonitorConfig config = MonitorConfig.fromMap(Map.of("workers", " ", "kafkaBootstrap", "", "http.host", ""));

    assertEquals(MonitorConfig.defaults().workers(), config.workers());
    assertTrue(config.kafkaBootstrap().isEmpty());
    assertEquals("127.0.0.1", config.httpHost());
  }

  @Test
  void rejectsOutOfRangeAndMalformedValues() {
    assertThrows(IllegalArgumentException.class, () -> MonitorConfig.fromMap(Map.of("workers", "0")));
    assertThrows(IllegalArgumentException.class, () -> MonitorConfig.fromMap(Map.of("http.port", "70000")));
    assertThrows(IllegalArgumentException.class, () -> MonitorConfig.fromMap(Map.of("trustForwardedHeaders", "yes")));
    assertThrows(IllegalArgumentException.class, () -> MonitorConfig.fromMap(Map.of("kafkaTopic", "bad topic")));
    assertThrows(IllegalArgumentException.class, () -> MonitorConfig.fromMap(Map.of("exemptPaths", "health")));
    assertThrows(IllegalArgumentException.class, () -> MonitorConfig.fromMap(Map.of("kafkaBootstrap", "broker")));
  }
}
