package ca.gc.cra.sentinel.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeIsInclusive() {
    assertEquals(1L, Numbers.requireRange("workers", 1, 1, 64));
    assertEquals(64L, Numbers.requireRange("workers", 64, 1, 64));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("workers", 65, 1, 64));
    assertTrue(ex.getMessage().startsWith("workers must be between 1 and 64"));
  }

  @Test
  void parseIntInRangeTrimsAndValidates() {
    assertEquals(8080, Numbers.parseIntInRange("port", " 8080 ", 1, 65535));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("port", "http", 1, 65535));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("port", "", 1, 65535));
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.parseIntInRange("port", "99999999999", 1, 65535));
  }
}
