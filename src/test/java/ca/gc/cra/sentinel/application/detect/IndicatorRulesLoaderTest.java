package ca.gc.cra.sentinel.application.detect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sentinel.application.detect.indicators.IndicatorCatalog;
import ca.gc.cra.sentinel.application.detect.indicators.LongPollCheck;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IndicatorRulesLoaderTest {
  private final IndicatorRulesLoader loader = new IndicatorRulesLoader();

  @Test
  void appliesBandsActivityAndDisabledIndicators() {
    String yaml = String.join("\n",
        "version: 1",
        "bands: {medium: 30, high: 60, confirmed: 95}",
        "activity: {maxTrackedIps: 50, historyPerIp: 8}",
        "indicators:",
        "  long_poll: {enabled: false}",
        "  webshell: {weight: 70}",
        "  request_burst: {threshold: 7}",
        "  beaconing: {minSamples: 8}");

    ClassifierSettings settings = loader.parse(new StringReader(yaml), "inline");

    assertEquals(new ConfidenceBands(30, 60, 95), settings.bands());
    assertEquals(50, settings.maxTrackedIps());
    assertEquals(8, settings.historyPerIp());
    assertEquals(IndicatorCatalog.names().size() - 1, settings.checks().size());
    assertFalse(settings.checks().stream().anyMatch(check -> check.name().equals(LongPollCheck.NAME)));
  }

  @Test
  void rejectsUnknownIndicatorAndVersion() {
    assertThrows(IllegalArgumentException.class,
        () -> loader.parse(new StringReader("version: 1\nindicators:\n  nope: {}\n"), "inline"));
    assertThrows(IllegalArgumentException.class, () -> loader.parse(new StringReader("version: 2\n"), "inline"));
    assertThrows(IllegalArgumentException.class,
        () -> loader.parse(new StringReader("version: 1\nbands: {medium: 50, high: 40, confirmed: 90}\n"), "inline"));
    assertThrows(IllegalArgumentException.class,
        () -> loader.parse(new StringReader("version: 1\nindicators:\n  webshell: {weight: 150}\n"), "inline"));
  }

  @Test
  void rejectsRateThresholdsTheHistoryCannotReach() {
    IllegalArgumentException burst = assertThrows(IllegalArgumentException.class, () -> loader.parse(new StringReader(
        "version: 1\nactivity: {historyPerIp: 50}\nindicators:\n  request_burst: {threshold: 50}\n"), "inline"));
    assertTrue(burst.getMessage().contains("request_burst.threshold"), burst.getMessage());

    IllegalArgumentException beacon = assertThrows(IllegalArgumentException.class, () -> loader.parse(new StringReader(
        "version: 1\nactivity: {historyPerIp: 60}\nindicators:\n  beaconing: {minSamples: 61}\n"), "inline"));
    assertTrue(beacon.getMessage().contains("beaconing.minSamples"), beacon.getMessage());

    ClassifierSettings disabled = loader.parse(new StringReader(
        "version: 1\nactivity: {historyPerIp: 5}\nindicators:\n  request_burst: {enabled: false}\n"
            + "  beaconing: {minSamples: 5}\n"), "inline");
    assertEquals(5, disabled.historyPerIp());
  }

  @Test
  void emptyDocumentYieldsDefaults() {
    ClassifierSettings settings = loader.parse(new StringReader(""), "inline");
    assertEquals(ConfidenceBands.defaults(), settings.bands());
    assertEquals(IndicatorCatalog.names().size(), settings.checks().size());
  }

  @Test
  void loadsBundledAndFileRules(@TempDir Path dir) throws IOException {
    assertFalse(loader.loadBundled().checks().isEmpty());

    Path file = dir.resolve("rules.yaml");
    Files.writeString(file, "version: 1\nindicators:\n  beaconing: {enabled: false}\n");
    assertEquals(IndicatorCatalog.names().size() - 1, loader.load(file).checks().size());
    assertThrows(IOException.class, () -> loader.load(dir.resolve("missing.yaml")));
  }

  @Test
  void bandsRateBoundaries() {
    ConfidenceBands bands = ConfidenceBands.defaults();
    assertEquals("low", bands.rate(39).wireName());
    assertEquals("medium", bands.rate(40).wireName());
    assertEquals("high", bands.rate(70).wireName());
    assertEquals("confirmed", bands.rate(90).wireName());
    assertTrue(bands.confirmed() >= 90);
  }
}
