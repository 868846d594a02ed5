package ca.gc.cra.sentinel.application.ingest;

import ca.gc.cra.sentinel.application.port.ClockPort;
import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.domain.traffic.BodyCapture;
import ca.gc.cra.sentinel.domain.traffic.HeaderList;
import ca.gc.cra.sentinel.domain.traffic.LogEntry;
import ca.gc.cra.sentinel.domain.traffic.RawExchange;
import ca.gc.cra.sentinel.logging.Logs;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Normalizes raw request/response observations into immutable {@link LogEntry} records.
 * <p><strong>Why:</strong> Gives every downstream stage one canonical shape with bounded bodies, a resolved client
 * address, and credentials stripped from headers.</p>
 * <p><strong>Role:</strong> First pipeline stage; never decides blocking or classification.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Cap request and response bodies, recording the original size and a truncation flag.</li>
 *   <li>Resolve the client address from forwarding headers or the peer.</li>
 *   <li>Redact sensitive request header values.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from injected collaborators; safe for concurrent use.</p>
 * <p><strong>Observability:</strong> Emits {@code ingest.entry.normalized} and {@code ingest.body.truncated}.</p>
 *
 * @since 0.1.0
 */
public final class IngestAdapter {
  private static final Logger log = LoggerFactory.getLogger(IngestAdapter.class);
  private static final List<String> SENSITIVE_HEADER_MARKERS = List.of(
      "authorization", "cookie", "x-api-key", "x-auth-token", "api-key", "access-token", "password");

  private final IngestSettings settings;
  private final ClientAddressResolver addressResolver;
  private final ClockPort clock;
  private final MetricsPort metrics;

  public IngestAdapter(IngestSettings settings, ClockPort clock, MetricsPort metrics) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.addressResolver = new ClientAddressResolver(settings.trustForwardedHeaders());
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Produces the canonical entry for one observation.
   *
   * @param raw observation from the edge
   * @return immutable log entry with a fresh identifier
   */
  public LogEntry normalize(RawExchange raw) {
    Objects.requireNonNull(raw, "raw");
    Instant timestamp = raw.timestampMillis() > 0L ? Instant.ofEpochMilli(raw.timestampMillis()) : clock.now();
    HeaderList requestHeaders = raw.requestHeaders();
    String sourceIp = resolveSourceIp(raw);
    String method = raw.method().isBlank() ? "GET" : raw.method().trim().toUpperCase(Locale.ROOT);

    String path = raw.path().isBlank() ? "/" : raw.path();
    String query = raw.query();
    int queryStart = path.indexOf('?');
    if (queryStart >= 0) {
      if (query.isEmpty()) {
        query = path.substring(queryStart + 1);
      }
      path = path.substring(0, queryStart);
    }

    BodyCapture requestBody = BodyCapture.capture(raw.requestBody(), settings.bodyCapBytes(), raw.requestBodySize());
    BodyCapture responseBody = BodyCapture.capture(raw.responseBody(), settings.bodyCapBytes(), raw.responseBodySize());
    if (requestBody.truncated() || responseBody.truncated()) {
      metrics.increment("ingest.body.truncated");
    }

    double responseTimeMs = raw.responseTimeMs();
    if (!(responseTimeMs >= 0d) || Double.isInfinite(responseTimeMs)) {
      metrics.increment("ingest.responseTime.invalid");
      log.debug("Clamping invalid response time {} for {} {}", responseTimeMs, method, Logs.printable(path, 128));
      responseTimeMs = 0d;
    }

    LogEntry entry = new LogEntry(
        UUID.randomUUID().toString(),
        timestamp,
        sourceIp,
        method,
        path,
        query,
        requestHeaders.replaceValues(IngestAdapter::isSensitive, Logs.redact(null)),
        requestBody,
        raw.responseStatus(),
        raw.responseHeaders(),
        responseBody,
        responseTimeMs,
        requestHeaders.first("User-Agent").orElse(""),
        requestHeaders.first("Referer").orElse(""));
    metrics.increment("ingest.entry.normalized");
    return entry;
  }

  /**
   * Resolves the partition key of an observation without building the full entry.
   *
   * @param raw observation
   * @return client address used for partitioning and per-IP state
   */
  public String resolveSourceIp(RawExchange raw) {
    return addressResolver.resolve(raw.requestHeaders(), raw.peerAddress());
  }

  static boolean isSensitive(String lowerCaseName) {
    for (String marker : SENSITIVE_HEADER_MARKERS) {
      if (lowerCaseName.contains(marker)) {
        return true;
      }
    }
    return false;
  }
}
