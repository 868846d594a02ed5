package ca.gc.cra.sentinel.infrastructure.json;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.sentinel.domain.traffic.RawExchange;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class ObservationJsonTest {

  @Test
  void parsesObservationWithBothHeaderShapes() {
    RawExchange exchange = parse("""
        {
          "timestamp": 1700000000000,
          "peerAddress": "198.51.100.4:51234",
          "method": "POST",
          "path": "/upload",
          "query": "a=1",
          "requestHeaders": {"Host": "app.local", "X-Forwarded-For": ["10.1.1.1", "10.2.2.2"]},
          "requestBodyBase64": "AAEC",
          "responseStatus": 201,
          "responseHeaders": [{"name": "Content-Type", "value": "application/json"}],
          "responseBody": "{}",
          "responseTimeMs": 12.5
        }
        """);

    assertEquals(1_700_000_000_000L, exchange.timestampMillis());
    assertEquals("198.51.100.4:51234", exchange.peerAddress());
    assertEquals(List.of("10.1.1.1", "10.2.2.2"), exchange.requestHeaders().values("X-Forwarded-For"));
    assertArrayEquals(new byte[] {0, 1, 2}, exchange.requestBody());
    assertEquals(201, exchange.responseStatus());
    assertEquals("application/json", exchange.responseHeaders().first("content-type").orElseThrow());
    assertEquals("{}", new String(exchange.responseBody(), StandardCharsets.UTF_8));
    assertEquals(12.5d, exchange.responseTimeMs());
  }

  @Test
  void defaultsOptionalFields() {
    RawExchange exchange = parse("{\"method\":\"GET\",\"path\":\"/\"}");

    assertEquals("", exchange.peerAddress());
    assertEquals(0, exchange.requestHeaders().size());
    assertEquals(0, exchange.requestBody().length);
    assertEquals(0d, exchange.responseTimeMs());
  }

  @Test
  void rejectsMalformedObservations() {
    assertThrows(IllegalArgumentException.class, () -> parse("{\"path\":\"/\"}"));
    assertThrows(IllegalArgumentException.class, () -> parse("{\"method\":\"GET\"}"));
    assertThrows(IllegalArgumentException.class,
        () -> parse("{\"method\":\"GET\",\"path\":\"/\",\"responseStatus\":\"ok\"}"));
    assertThrows(IllegalArgumentException.class,
        () -> parse("{\"method\":\"GET\",\"path\":\"/\",\"requestHeaders\":\"Host: x\"}"));
    assertThrows(IllegalArgumentException.class,
        () -> parse("{\"method\":\"GET\",\"path\":\"/\",\"requestBodyBase64\":\"%%%\"}"));
    assertThrows(IllegalArgumentException.class, () -> parse("[]"));
  }

  private static RawExchange parse(String json) {
    return ObservationJson.parse(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
  }
}
