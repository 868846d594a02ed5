package ca.gc.cra.sentinel.domain.capture;

import ca.gc.cra.sentinel.domain.traffic.HeaderList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One request/response exchange from an HTTP-archive style capture.
 *
 * @param index position in the original capture (zero-based, counting skipped entries)
 * @param startedDateTime raw start timestamp as recorded; may be empty
 * @param method request method
 * @param url absolute request URL
 * @param requestHeaders request headers in recorded order
 * @param requestBodySize recorded request body size; {@code -1} when unknown
 * @param status response status; {@code 0} when no response was recorded
 * @param responseHeaders response headers in recorded order
 * @param mimeType response content MIME type; may be empty
 * @param responseBodySize recorded response body size; {@code -1} when unknown
 * @param contentSize decoded response content size; {@code -1} when unknown
 * @param timings named timing phases in milliseconds, in recorded order; negative means not applicable
 * @param requestBody recorded request body text, empty when the capture kept none
 * @param responseBody recorded response content after decoding, empty when the capture kept none
 * @since 0.1.0
 */
public record CaptureEntry(
    int index,
    String startedDateTime,
    String method,
    String url,
    HeaderList requestHeaders,
    long requestBodySize,
    int status,
    HeaderList responseHeaders,
    String mimeType,
    long responseBodySize,
    long contentSize,
    Map<String, Double> timings,
    byte[] requestBody,
    byte[] responseBody) {

  public CaptureEntry {
    startedDateTime = startedDateTime == null ? "" : startedDateTime;
    method = Objects.requireNonNull(method, "method");
    url = Objects.requireNonNull(url, "url");
    requestHeaders = Objects.requireNonNullElse(requestHeaders, HeaderList.empty());
    responseHeaders = Objects.requireNonNullElse(responseHeaders, HeaderList.empty());
    mimeType = mimeType == null ? "" : mimeType;
    timings = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(timings, "timings")));
    requestBody = requestBody != null ? requestBody.clone() : new byte[0];
    responseBody = responseBody != null ? responseBody.clone() : new byte[0];
  }

  @Override
  public byte[] requestBody() {
    return requestBody.clone();
  }

  @Override
  public byte[] responseBody() {
    return responseBody.clone();
  }

  /** Sum of the positive, finite timing phases in milliseconds. */
  public double durationMs() {
    double total = 0d;
    for (Double phase : timings.values()) {
      if (phase != null && phase > 0d && !phase.isInfinite()) {
        total += phase;
      }
    }
    return total;
  }

  /**
   * Original response size to report alongside the recorded content: the decoded content size when known,
   * otherwise the transferred body size.
   *
   * @return size in bytes; {@code -1} when the capture recorded no positive size
   */
  public long declaredResponseSize() {
    if (contentSize > 0L) {
      return contentSize;
    }
    return responseBodySize > 0L ? responseBodySize : -1L;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CaptureEntry other)) {
      return false;
    }
    return index == other.index
        && requestBodySize == other.requestBodySize
        && status == other.status
        && responseBodySize == other.responseBodySize
        && contentSize == other.contentSize
        && startedDateTime.equals(other.startedDateTime)
        && method.equals(other.method)
        && url.equals(other.url)
        && requestHeaders.equals(other.requestHeaders)
        && responseHeaders.equals(other.responseHeaders)
        && mimeType.equals(other.mimeType)
        && timings.equals(other.timings)
        && Arrays.equals(requestBody, other.requestBody)
        && Arrays.equals(responseBody, other.responseBody);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(index, startedDateTime, method, url, requestBodySize, status, mimeType,
        responseBodySize, contentSize, timings);
    result = 31 * result + Arrays.hashCode(requestBody);
    return 31 * result + Arrays.hashCode(responseBody);
  }

  @Override
  public String toString() {
    return "CaptureEntry[" + index + ' ' + method + ' ' + url + " -> " + status + ']';
  }
}
