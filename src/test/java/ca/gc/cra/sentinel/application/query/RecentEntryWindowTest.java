package ca.gc.cra.sentinel.application.query;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sentinel.domain.traffic.AnalyzedEntry;
import ca.gc.cra.sentinel.testutil.TrafficFixtures;
import java.util.List;
import org.junit.jupiter.api.Test;

class RecentEntryWindowTest {
  @Test
  void evictsOldestBeyondCapacity() {
    RecentEntryWindow window = new RecentEntryWindow(2);
    window.add(entry("a"));
    window.add(entry("b"));
    window.add(entry("c"));

    assertEquals(2, window.size());
    assertTrue(window.find("a").isEmpty());
    assertEquals(List.of("c", "b"), window.newestFirst().stream().map(e -> e.entry().id()).toList());
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new RecentEntryWindow(0));
  }

  private static AnalyzedEntry entry(String id) {
    return TrafficFixtures.allowed(TrafficFixtures.entry(id, "10.0.0.1", "GET", "/" + id, 200));
  }
}
