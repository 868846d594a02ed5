package ca.gc.cra.sentinel.application.detect.indicators;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sentinel.application.detect.IndicatorHit;
import ca.gc.cra.sentinel.application.detect.IndicatorParams;
import ca.gc.cra.sentinel.application.detect.IpActivity;
import ca.gc.cra.sentinel.application.detect.IpActivityArena;
import ca.gc.cra.sentinel.domain.detect.TunnelType;
import ca.gc.cra.sentinel.domain.traffic.BodyCapture;
import ca.gc.cra.sentinel.domain.traffic.HeaderList;
import ca.gc.cra.sentinel.domain.traffic.LogEntry;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class IndicatorChecksTest {
  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

  @Test
  void webshellMatchesQueryString() {
    WebshellCheck check = new WebshellCheck(IndicatorParams.empty(WebshellCheck.NAME));
    LogEntry entry = entry("GET", "/uploads/x.php", "cmd=id", HeaderList.empty(), new byte[0], new byte[0], 5d);

    IndicatorHit hit = check.evaluate(entry, activity(entry)).orElseThrow();

    assertEquals(TunnelType.WEBSHELL, hit.suggestedType());
    assertTrue(hit.evidence().get(0).startsWith("Webshell pattern"));
  }

  @Test
  void asymmetricPostNeedsLargeUploadAndTinyResponse() {
    AsymmetricTransferCheck check = new AsymmetricTransferCheck(IndicatorParams.empty(AsymmetricTransferCheck.NAME));
    LogEntry upload = entry("POST", "/sync", "", HeaderList.empty(), new byte[20_000], new byte[2], 5d);
    LogEntry get = entry("GET", "/sync", "", HeaderList.empty(), new byte[20_000], new byte[2], 5d);

    assertTrue(check.evaluate(upload, activity(upload)).isPresent());
    assertTrue(check.evaluate(get, activity(get)).isEmpty());
  }

  @Test
  void dnsOverHttpCollectsMediaTypeAndPath() {
    DnsOverHttpCheck check = new DnsOverHttpCheck(IndicatorParams.empty(DnsOverHttpCheck.NAME));
    LogEntry entry = entry("POST", "/dns-query", "",
        HeaderList.of("Content-Type", "application/dns-message"), new byte[0], new byte[0], 5d);

    Optional<IndicatorHit> hit = check.evaluate(entry, activity(entry));

    assertEquals(2, hit.orElseThrow().evidence().size());
    assertEquals(TunnelType.DNS_OVER_HTTP, hit.get().suggestedType());
  }

  @Test
  void longPollHonoursConfiguredThreshold() {
    LongPollCheck check = new LongPollCheck(new IndicatorParams(LongPollCheck.NAME, Map.<String, Object>of(
        "thresholdMillis", 1_000)));
    LogEntry slow = entry("GET", "/events", "", HeaderList.empty(), new byte[0], new byte[0], 1_500d);

    assertEquals("Long-polling behavior (1500 ms)", check.evaluate(slow, activity(slow)).orElseThrow()
        .evidence().get(0));
  }

  @Test
  void highEntropyBodyFires() {
    PayloadEntropyCheck check = new PayloadEntropyCheck(IndicatorParams.empty(PayloadEntropyCheck.NAME));
    byte[] body = new byte[4_096];
    for (int i = 0; i < body.length; i++) {
      body[i] = (byte) i;
    }
    LogEntry noisy = entry("POST", "/upload", "", HeaderList.empty(), body, new byte[0], 5d);
    LogEntry plain = entry("POST", "/upload", "", HeaderList.empty(),
        "a".repeat(4_096).getBytes(StandardCharsets.US_ASCII), new byte[0], 5d);

    assertTrue(check.evaluate(noisy, activity(noisy)).isPresent());
    assertTrue(check.evaluate(plain, activity(plain)).isEmpty());
  }

  private static IpActivity activity(LogEntry entry) {
    IpActivityArena arena = new IpActivityArena(4, 4);
    return arena.record(entry.sourceIp(), entry.timestamp().toEpochMilli(), entry.requestBody().size(),
        entry.responseBody().size());
  }

  private static LogEntry entry(String method, String path, String query, HeaderList headers, byte[] requestBody,
      byte[] responseBody, double responseTimeMs) {
    return new LogEntry("e", NOW, "10.1.1.1", method, path, query, headers,
        BodyCapture.capture(requestBody, 100_000), 200, HeaderList.empty(),
        BodyCapture.capture(responseBody, 100_000), responseTimeMs, "", "");
  }
}
