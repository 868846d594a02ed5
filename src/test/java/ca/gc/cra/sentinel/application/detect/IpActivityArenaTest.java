package ca.gc.cra.sentinel.application.detect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class IpActivityArenaTest {
  @Test
  void ringKeepsNewestExchangesOldestFirst() {
    IpActivityArena arena = new IpActivityArena(4, 3);
    IpActivity activity = null;
    for (long t = 1; t <= 5; t++) {
      activity = arena.record("10.0.0.1", t * 100, t, t * 10);
    }

    IpActivity ring = activity;
    assertEquals(3, ring.size());
    assertEquals(300L, ring.timestampAt(0));
    assertEquals(500L, ring.timestampAt(2));
    assertEquals(3L, ring.requestSizeAt(0));
    assertEquals(50L, ring.responseSizeAt(2));
    assertThrows(IndexOutOfBoundsException.class, () -> ring.timestampAt(3));
  }

  @Test
  void evictsLeastRecentlyUsedAddress() {
    IpActivityArena arena = new IpActivityArena(2, 5);
    arena.record("a", 1, 0, 0);
    arena.record("b", 2, 0, 0);
    arena.record("a", 3, 0, 0);
    IpActivity c = arena.record("c", 4, 0, 0);

    assertEquals(3, arena.record("a", 5, 0, 0).size());
    assertEquals(1, arena.record("b", 6, 0, 0).size());
    IpActivity recycled = arena.record("c", 7, 0, 0);
    assertSame(c, recycled);
    assertEquals(1, recycled.size());
    assertEquals(7L, recycled.timestampAt(0));
  }
}
