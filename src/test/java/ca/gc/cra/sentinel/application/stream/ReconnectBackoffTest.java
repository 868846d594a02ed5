package ca.gc.cra.sentinel.application.stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class ReconnectBackoffTest {

  @Test
  void growsGeometricallyUntilCapped() {
    ReconnectBackoff backoff = new ReconnectBackoff(100, 2d, 1_000);
    assertEquals(100, backoff.delayMillis(0));
    assertEquals(200, backoff.delayMillis(1));
    assertEquals(800, backoff.delayMillis(3));
    assertEquals(1_000, backoff.delayMillis(4));
    assertEquals(1_000, backoff.delayMillis(500));
  }

  @Test
  void defaultsStartAtOneSecondAndCapAtThirty() {
    ReconnectBackoff backoff = ReconnectBackoff.defaults();
    assertEquals(1_000, backoff.delayMillis(0));
    assertEquals(30_000, backoff.delayMillis(10));
  }

  @Test
  void rejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class, () -> new ReconnectBackoff(0, 2d, 10));
    assertThrows(IllegalArgumentException.class, () -> new ReconnectBackoff(10, 0.5d, 100));
    assertThrows(IllegalArgumentException.class, () -> new ReconnectBackoff(10, Double.NaN, 100));
    assertThrows(IllegalArgumentException.class, () -> new ReconnectBackoff(100, 2d, 10));
  }
}
