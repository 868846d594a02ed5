package ca.gc.cra.sentinel.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sentinel.domain.timeline.WaterfallSort;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class WaterfallConfigTest {

  @Test
  void allCategoryMeansNoFilter() {
    WaterfallConfig config = WaterfallConfig.fromMap(Map.of("in", "capture.har", "mimeCategory", "ALL"));

    assertTrue(config.mimeCategory().isEmpty());
    assertEquals(WaterfallSort.CAPTURED, config.sort());
    assertTrue(config.input().isAbsolute());
  }

  @Test
  void parsesSortAndCategory() {
    WaterfallConfig config =
        WaterfallConfig.fromMap(Map.of("in", "capture.har", "sort", "duration", "mimeCategory", "Image"));

    assertEquals(WaterfallSort.DURATION, config.sort());
    assertEquals(Optional.of("image"), config.mimeCategory());
    assertThrows(IllegalArgumentException.class,
        () -> WaterfallConfig.fromMap(Map.of("in", "capture.har", "sort", "colour")));
    assertThrows(IllegalArgumentException.class, () -> WaterfallConfig.fromMap(Map.of("in", " ")));
  }
}
