package ca.gc.cra.sentinel.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.sentinel.domain.events.EventType;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.Test;

class WatchConfigTest {

  @Test
  void parsesTypesAndBackoff() {
    WatchConfig config = WatchConfig.fromMap(Map.of(
        "url", "https://monitor.example:8443",
        "types", "tunnel_alert, block_added",
        "reconnect.initialMillis", "250",
        "reconnect.multiplier", "1.5",
        "reconnect.maxMillis", "5000",
        "maxEvents", "20"));

    assertEquals("monitor.example", config.baseUri().getHost());
    assertEquals(Set.of(EventType.TUNNEL_ALERT, EventType.BLOCK_ADDED), config.types());
    assertEquals(375L, config.backoff().delayMillis(1));
    assertEquals(20L, config.maxEvents());
  }

  @Test
  void rejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class, () -> WatchConfig.fromMap(Map.of("url", "ftp://host")));
    assertThrows(IllegalArgumentException.class, () -> WatchConfig.fromMap(Map.of("types", "log,bogus")));
    assertThrows(IllegalArgumentException.class,
        () -> WatchConfig.fromMap(Map.of("heartbeatMillis", "1000", "idleTimeoutMillis", "1000")));
    assertThrows(IllegalArgumentException.class, () -> WatchConfig.fromMap(Map.of("maxEvents", "-1")));
  }
}
