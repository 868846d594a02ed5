package ca.gc.cra.sentinel.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliBeatsYamlBeatsDefaults() {
    List<String> warnings = new ArrayList<>();
    Map<String, String> effective = ConfigMerger.buildEffectiveConfig(
        "serve",
        Optional.of(Map.of("workers", "4", "http.port", "9000")),
        Map.of("workers", "6"),
        Map.of("workers", "1", "http.port", "8080", "recentWindow", "1000"),
        warnings::add);

    assertEquals("6", effective.get("workers"));
    assertEquals("9000", effective.get("http.port"));
    assertEquals("1000", effective.get("recentWindow"));
    assertEquals(List.of("CLI overrides YAML for key: workers"), warnings);
  }

  @Test
  void kafkaBootstrapRequiresTopic() {
    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        "serve", Optional.empty(), Map.of("kafkaBootstrap", "broker:9092", "kafkaTopic", " "), Map.of(), null));
  }

  @Test
  void captureModesRequireInput() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("waterfall");
    assertThrows(IllegalArgumentException.class,
        () -> ConfigMerger.buildEffectiveConfig("waterfall", Optional.empty(), Map.of(), defaults, null));
    assertEquals("capture.har", ConfigMerger.buildEffectiveConfig(
        "waterfall", Optional.empty(), Map.of("in", "capture.har"), defaults, null).get("in"));
  }
}
