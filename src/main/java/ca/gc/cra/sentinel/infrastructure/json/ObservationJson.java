package ca.gc.cra.sentinel.infrastructure.json;

import ca.gc.cra.sentinel.domain.traffic.Header;
import ca.gc.cra.sentinel.domain.traffic.HeaderList;
import ca.gc.cra.sentinel.domain.traffic.RawExchange;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;

/**
 * Decodes observations posted by an edge collaborator.
 *
 * <pre>
 * {"timestamp": 1700000000000, "peerAddress": "10.0.0.5", "method": "POST", "path": "/upload",
 *  "query": "a=1", "requestHeaders": {"User-Agent": "curl/8.0", "Accept": ["a", "b"]},
 *  "requestBody": "text", "responseStatus": 200, "responseHeaders": [{"name": "Server", "value": "x"}],
 *  "responseBodyBase64": "AAEC", "responseTimeMs": 12.5}
 * </pre>
 *
 * <p>Headers are either an object (values may be arrays for repeated names) or an array of
 * {@code {name, value}} objects. Bodies are UTF-8 text, or base64 under the {@code *Base64} field.</p>
 *
 * @since 0.1.0
 */
public final class ObservationJson {
  private ObservationJson() {}

  /**
   * Parses one observation document. The stream is not closed.
   *
   * @param in JSON document
   * @return raw observation
   * @throws IllegalArgumentException when the document is malformed
   */
  public static RawExchange parse(InputStream in) {
    return fromMap(JsonDocuments.parseObject(in));
  }

  static RawExchange fromMap(Map<String, Object> doc) {
    String method = JsonDocuments.text(doc, "method");
    String path = JsonDocuments.text(doc, "path");
    if (method == null || method.isEmpty()) {
      throw new IllegalArgumentException("method is required");
    }
    if (path == null || path.isEmpty()) {
      throw new IllegalArgumentException("path is required");
    }
    return RawExchange.builder()
        .timestampMillis(longField(doc, "timestamp", 0L))
        .peerAddress(nullToEmpty(JsonDocuments.text(doc, "peerAddress")))
        .method(method)
        .path(path)
        .query(nullToEmpty(JsonDocuments.text(doc, "query")))
        .requestHeaders(headers(doc.get("requestHeaders"), "requestHeaders"))
        .requestBody(body(doc, "requestBody"))
        .responseStatus((int) longField(doc, "responseStatus", 0L))
        .responseHeaders(headers(doc.get("responseHeaders"), "responseHeaders"))
        .responseBody(body(doc, "responseBody"))
        .responseTimeMs(doubleField(doc, "responseTimeMs"))
        .build();
  }

  private static HeaderList headers(Object node, String field) {
    if (node == null) {
      return HeaderList.empty();
    }
    List<Header> headers = new ArrayList<>();
    if (node instanceof Map<?, ?> map) {
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        String name = String.valueOf(entry.getKey());
        if (entry.getValue() instanceof List<?> values) {
          for (Object value : values) {
            headers.add(new Header(name, scalar(value, field)));
          }
        } else {
          headers.add(new Header(name, scalar(entry.getValue(), field)));
        }
      }
    } else if (node instanceof List<?> list) {
      for (Object item : list) {
        if (!(item instanceof Map<?, ?> pair) || pair.get("name") == null) {
          throw new IllegalArgumentException(field + " entries must be {name, value} objects");
        }
        headers.add(new Header(String.valueOf(pair.get("name")), scalar(pair.get("value"), field)));
      }
    } else {
      throw new IllegalArgumentException(field + " must be an object or an array");
    }
    return new HeaderList(headers);
  }

  private static String scalar(Object value, String field) {
    if (value == null) {
      return "";
    }
    if (value instanceof Map || value instanceof List) {
      throw new IllegalArgumentException(field + " values must be scalars");
    }
    return value.toString();
  }

  private static byte[] body(Map<String, Object> doc, String field) {
    Object encoded = doc.get(field + "Base64");
    if (encoded != null) {
      try {
        return Base64.getDecoder().decode(encoded.toString());
      } catch (IllegalArgumentException ex) {
        throw new IllegalArgumentException(field + "Base64 is not valid base64", ex);
      }
    }
    Object text = doc.get(field);
    return text == null ? new byte[0] : text.toString().getBytes(StandardCharsets.UTF_8);
  }

  private static long longField(Map<String, Object> doc, String field, long fallback) {
    Object value = doc.get(field);
    if (value == null) {
      return fallback;
    }
    if (value instanceof Number number) {
      return number.longValue();
    }
    try {
      return Long.parseLong(value.toString().trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(field + " must be an integer (was " + value + ")", ex);
    }
  }

  private static double doubleField(Map<String, Object> doc, String field) {
    Object value = doc.get(field);
    if (value == null) {
      return 0d;
    }
    if (value instanceof Number number) {
      return number.doubleValue();
    }
    try {
      return Double.parseDouble(value.toString().trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(field + " must be a number (was " + value + ")", ex);
    }
  }

  private static String nullToEmpty(String value) {
    return value == null ? "" : value;
  }
}
