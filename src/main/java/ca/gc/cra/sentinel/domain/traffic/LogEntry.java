package ca.gc.cra.sentinel.domain.traffic;

import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> Canonical record of one observed HTTP exchange.
 * <p><strong>Why:</strong> Every downstream stage (block enforcement, classification, broadcasting, statistics,
 * archival) consumes this single immutable shape.</p>
 * <p><strong>Role:</strong> Domain value object produced by the ingest adapter.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share across workers and subscribers.</p>
 *
 * @param id unique entry identifier
 * @param timestamp time the exchange was observed
 * @param sourceIp resolved client address
 * @param method upper-case HTTP method
 * @param path request path
 * @param query query string without {@code ?}; empty when absent
 * @param requestHeaders request headers with sensitive values redacted
 * @param requestBody capped request body
 * @param responseStatus HTTP status code
 * @param responseHeaders response headers
 * @param responseBody capped response body
 * @param responseTimeMs response time in milliseconds; never negative
 * @param userAgent request {@code User-Agent}; empty when absent
 * @param referer request {@code Referer}; empty when absent
 * @since 0.1.0
 */
public record LogEntry(
    String id,
    Instant timestamp,
    String sourceIp,
    String method,
    String path,
    String query,
    HeaderList requestHeaders,
    BodyCapture requestBody,
    int responseStatus,
    HeaderList responseHeaders,
    BodyCapture responseBody,
    double responseTimeMs,
    String userAgent,
    String referer) {

  public LogEntry {
    id = Objects.requireNonNull(id, "id");
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
    sourceIp = Objects.requireNonNull(sourceIp, "sourceIp");
    method = Objects.requireNonNull(method, "method");
    path = Objects.requireNonNull(path, "path");
    query = query == null ? "" : query;
    requestHeaders = Objects.requireNonNullElse(requestHeaders, HeaderList.empty());
    requestBody = Objects.requireNonNullElse(requestBody, BodyCapture.empty());
    responseHeaders = Objects.requireNonNullElse(responseHeaders, HeaderList.empty());
    responseBody = Objects.requireNonNullElse(responseBody, BodyCapture.empty());
    if (!(responseTimeMs >= 0d) || Double.isInfinite(responseTimeMs)) {
      throw new IllegalArgumentException("responseTimeMs must be a finite value >= 0 (was " + responseTimeMs + ")");
    }
    userAgent = userAgent == null ? "" : userAgent;
    referer = referer == null ? "" : referer;
  }

  /** Returns the request target as it appeared on the request line: path plus optional query. */
  public String target() {
    return query.isEmpty() ? path : path + '?' + query;
  }
}
