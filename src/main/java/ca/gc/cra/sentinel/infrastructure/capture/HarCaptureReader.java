package ca.gc.cra.sentinel.infrastructure.capture;

import ca.gc.cra.sentinel.application.port.CaptureReader;
import ca.gc.cra.sentinel.domain.capture.Capture;
import ca.gc.cra.sentinel.domain.capture.CaptureEntry;
import ca.gc.cra.sentinel.domain.capture.CaptureFormatException;
import ca.gc.cra.sentinel.domain.traffic.Header;
import ca.gc.cra.sentinel.domain.traffic.HeaderList;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads HTTP-archive (HAR) documents: {@code log.entries[]} with {@code request}, {@code response} and
 * {@code timings}.
 *
 * <p>An entry missing {@code request.url}, {@code request.method} or {@code response} is skipped with a warning.
 * Timing phases that are not numbers are ignored with a warning; negative phases mean "not applicable" and are
 * kept as-is for the reconstructor to ignore.</p>
 *
 * <p>Recorded bodies are read from {@code request.postData.text} and {@code response.content.text}; text whose
 * {@code encoding} is {@code base64} is decoded. A body that fails to decode is dropped with a warning and only its
 * recorded size is kept.</p>
 *
 * @since 0.1.0
 */
public final class HarCaptureReader implements CaptureReader {
  private static final Logger log = LoggerFactory.getLogger(HarCaptureReader.class);
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final ObjectMapper mapper;

  public HarCaptureReader() {
    this(new ObjectMapper());
  }

  public HarCaptureReader(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  /**
   * Reads a capture file.
   *
   * @param path HAR file
   * @return parsed capture
   * @throws IOException when the file cannot be read or is not a capture document
   */
  public Capture read(Path path) throws IOException {
    try (InputStream in = Files.newInputStream(path)) {
      return read(in);
    }
  }

  @Override
  public Capture read(InputStream in) throws IOException {
    JsonNode root;
    try {
      root = mapper.readTree(in);
    } catch (JsonProcessingException ex) {
      throw new CaptureFormatException("Capture is not valid JSON: " + ex.getOriginalMessage(), ex);
    }
    if (root == null || root.isMissingNode() || !root.isObject()) {
      throw new CaptureFormatException("Capture document must be a JSON object");
    }
    JsonNode entries = root.path("log").path("entries");
    if (!entries.isArray()) {
      throw new CaptureFormatException("Capture document has no log.entries array");
    }

    List<CaptureEntry> parsed = new ArrayList<>(entries.size());
    List<String> warnings = new ArrayList<>();
    for (int index = 0; index < entries.size(); index++) {
      JsonNode node = entries.get(index);
      String problem = validate(node);
      if (problem != null) {
        warnings.add("entry " + index + " skipped: " + problem);
        continue;
      }
      parsed.add(toEntry(index, node, warnings));
    }
    if (!warnings.isEmpty()) {
      log.info("Read capture with {} entries; {} warnings", parsed.size(), warnings.size());
    }
    return new Capture(parsed, warnings);
  }

  private static String validate(JsonNode node) {
    if (node == null || !node.isObject()) {
      return "not an object";
    }
    JsonNode request = node.get("request");
    if (request == null || !request.isObject()) {
      return "missing request";
    }
    if (!request.path("url").isTextual() || request.path("url").asText().isBlank()) {
      return "missing request.url";
    }
    if (!request.path("method").isTextual() || request.path("method").asText().isBlank()) {
      return "missing request.method";
    }
    JsonNode response = node.get("response");
    if (response == null || !response.isObject()) {
      return "missing response";
    }
    return null;
  }

  private static CaptureEntry toEntry(int index, JsonNode node, List<String> warnings) {
    JsonNode request = node.get("request");
    JsonNode response = node.get("response");
    JsonNode content = response.path("content");
    return new CaptureEntry(
        index,
        node.path("startedDateTime").asText(""),
        request.path("method").asText(),
        request.path("url").asText(),
        headers(request.path("headers")),
        request.path("bodySize").asLong(-1L),
        response.path("status").asInt(0),
        headers(response.path("headers")),
        content.path("mimeType").asText(""),
        response.path("bodySize").asLong(-1L),
        content.path("size").asLong(0L),
        timings(index, node.path("timings"), warnings),
        body(index, "request.postData", request.path("postData"), warnings),
        body(index, "response.content", content, warnings));
  }

  private static byte[] body(int index, String context, JsonNode node, List<String> warnings) {
    JsonNode text = node.path("text");
    if (!text.isTextual() || text.asText().isEmpty()) {
      return null;
    }
    String encoding = node.path("encoding").asText("");
    if (!"base64".equals(encoding.trim().toLowerCase(Locale.ROOT))) {
      return text.asText().getBytes(StandardCharsets.UTF_8);
    }
    try {
      return Base64.getDecoder().decode(WHITESPACE.matcher(text.asText()).replaceAll(""));
    } catch (IllegalArgumentException ex) {
      warnings.add("entry " + index + ": " + context + ".text is not valid base64; body dropped");
      return null;
    }
  }

  private static HeaderList headers(JsonNode node) {
    if (!node.isArray()) {
      return HeaderList.empty();
    }
    List<Header> headers = new ArrayList<>(node.size());
    for (JsonNode header : node) {
      String name = header.path("name").asText("");
      if (!name.isBlank()) {
        headers.add(new Header(name, header.path("value").asText("")));
      }
    }
    return new HeaderList(headers);
  }

  private static Map<String, Double> timings(int index, JsonNode node, List<String> warnings) {
    Map<String, Double> timings = new LinkedHashMap<>();
    if (!node.isObject()) {
      if (!node.isMissingNode() && !node.isNull()) {
        warnings.add("entry " + index + ": timings is not an object; duration set to 0");
      }
      return timings;
    }
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (field.getValue().isNumber()) {
        timings.put(field.getKey(), field.getValue().asDouble());
      } else if (!"comment".equals(field.getKey())) {
        warnings.add("entry " + index + ": ignored non-numeric timing '" + field.getKey() + "'");
      }
    }
    return timings;
  }
}
