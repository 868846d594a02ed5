package ca.gc.cra.sentinel.domain.timeline;

import java.util.Objects;

/**
 * <strong>What:</strong> Waterfall row for one captured exchange.
 * <p><strong>Role:</strong> Derived value computed once per capture; filters and sorts reorder rows but never
 * touch the offsets.</p>
 *
 * @param index position of the exchange in the capture
 * @param url request URL
 * @param method request method
 * @param mimeCategory first segment of the response MIME type, or {@code other}
 * @param status response status
 * @param sizeBytes response size in bytes
 * @param durationMs sum of the positive timing phases
 * @param startOffsetMs offset from the capture start; equals the previous row's end
 * @param endOffsetMs {@code startOffsetMs + durationMs}
 * @param domain URL host, or {@code unknown}
 * @since 0.1.0
 */
public record ResourceTiming(
    int index,
    String url,
    String method,
    String mimeCategory,
    int status,
    long sizeBytes,
    double durationMs,
    double startOffsetMs,
    double endOffsetMs,
    String domain) {

  public ResourceTiming {
    Objects.requireNonNull(url, "url");
    Objects.requireNonNull(method, "method");
    Objects.requireNonNull(mimeCategory, "mimeCategory");
    Objects.requireNonNull(domain, "domain");
    if (durationMs < 0d || startOffsetMs < 0d) {
      throw new IllegalArgumentException("durations and offsets must not be negative");
    }
    if (endOffsetMs < startOffsetMs) {
      throw new IllegalArgumentException("endOffsetMs must be >= startOffsetMs");
    }
  }
}
