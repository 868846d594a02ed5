package ca.gc.cra.sentinel.domain.traffic;

import java.util.Arrays;
import java.util.Objects;

/**
 * <strong>What:</strong> Raw request/response observation handed to the ingest adapter by the monitored edge.
 * <p><strong>Role:</strong> Input value object; nothing is validated or truncated yet.</p>
 * <p><strong>Thread-safety:</strong> Immutable; body arrays are copied.</p>
 *
 * @param timestampMillis epoch milliseconds of the request; {@code <= 0} lets ingest stamp the current time
 * @param peerAddress address of the directly connected peer
 * @param method HTTP method
 * @param path request path without query
 * @param query raw query string without the leading {@code ?}; may be empty
 * @param requestHeaders request headers in observed order
 * @param requestBody full request body bytes
 * @param responseStatus HTTP response status
 * @param responseHeaders response headers in observed order
 * @param responseBody full response body bytes
 * @param responseTimeMs elapsed time between request and response in milliseconds
 * @param requestBodySize original request body size when {@code requestBody} holds only part of it; {@code -1} when
 *     the bytes are complete
 * @param responseBodySize original response body size when {@code responseBody} holds only part of it; {@code -1}
 *     when the bytes are complete
 * @since 0.1.0
 */
public record RawExchange(
    long timestampMillis,
    String peerAddress,
    String method,
    String path,
    String query,
    HeaderList requestHeaders,
    byte[] requestBody,
    int responseStatus,
    HeaderList responseHeaders,
    byte[] responseBody,
    double responseTimeMs,
    long requestBodySize,
    long responseBodySize) {

  public RawExchange {
    peerAddress = peerAddress == null ? "" : peerAddress;
    method = method == null ? "" : method;
    path = path == null ? "" : path;
    query = query == null ? "" : query;
    requestHeaders = Objects.requireNonNullElse(requestHeaders, HeaderList.empty());
    responseHeaders = Objects.requireNonNullElse(responseHeaders, HeaderList.empty());
    requestBody = requestBody != null ? requestBody.clone() : new byte[0];
    responseBody = responseBody != null ? responseBody.clone() : new byte[0];
    requestBodySize = Math.max(requestBodySize, -1L);
    responseBodySize = Math.max(responseBodySize, -1L);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public byte[] requestBody() {
    return requestBody.clone();
  }

  @Override
  public byte[] responseBody() {
    return responseBody.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof RawExchange other)) {
      return false;
    }
    return timestampMillis == other.timestampMillis
        && responseStatus == other.responseStatus
        && Double.compare(responseTimeMs, other.responseTimeMs) == 0
        && requestBodySize == other.requestBodySize
        && responseBodySize == other.responseBodySize
        && peerAddress.equals(other.peerAddress)
        && method.equals(other.method)
        && path.equals(other.path)
        && query.equals(other.query)
        && requestHeaders.equals(other.requestHeaders)
        && responseHeaders.equals(other.responseHeaders)
        && Arrays.equals(requestBody, other.requestBody)
        && Arrays.equals(responseBody, other.responseBody);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(timestampMillis, peerAddress, method, path, query, responseStatus, responseTimeMs,
        requestBodySize, responseBodySize);
    result = 31 * result + Arrays.hashCode(requestBody);
    return 31 * result + Arrays.hashCode(responseBody);
  }

  @Override
  public String toString() {
    return "RawExchange[" + method + ' ' + path + " from " + peerAddress + " -> " + responseStatus + ']';
  }

  /** Mutable builder used by edge adapters and replay tooling. */
  public static final class Builder {
    private long timestampMillis;
    private String peerAddress = "";
    private String method = "GET";
    private String path = "/";
    private String query = "";
    private HeaderList requestHeaders = HeaderList.empty();
    private byte[] requestBody;
    private int responseStatus = 200;
    private HeaderList responseHeaders = HeaderList.empty();
    private byte[] responseBody;
    private double responseTimeMs;
    private long requestBodySize = -1L;
    private long responseBodySize = -1L;

    private Builder() {}

    public Builder timestampMillis(long value) {
      this.timestampMillis = value;
      return this;
    }

    public Builder peerAddress(String value) {
      this.peerAddress = value;
      return this;
    }

    public Builder method(String value) {
      this.method = value;
      return this;
    }

    public Builder path(String value) {
      this.path = value;
      return this;
    }

    public Builder query(String value) {
      this.query = value;
      return this;
    }

    public Builder requestHeaders(HeaderList value) {
      this.requestHeaders = value;
      return this;
    }

    public Builder requestBody(byte[] value) {
      this.requestBody = value;
      return this;
    }

    public Builder responseStatus(int value) {
      this.responseStatus = value;
      return this;
    }

    public Builder responseHeaders(HeaderList value) {
      this.responseHeaders = value;
      return this;
    }

    public Builder responseBody(byte[] value) {
      this.responseBody = value;
      return this;
    }

    public Builder responseTimeMs(double value) {
      this.responseTimeMs = value;
      return this;
    }

    public Builder requestBodySize(long value) {
      this.requestBodySize = value;
      return this;
    }

    public Builder responseBodySize(long value) {
      this.responseBodySize = value;
      return this;
    }

    public RawExchange build() {
      return new RawExchange(
          timestampMillis,
          peerAddress,
          method,
          path,
          query,
          requestHeaders,
          requestBody,
          responseStatus,
          responseHeaders,
          responseBody,
          responseTimeMs,
          requestBodySize,
          responseBodySize);
    }
  }
}
