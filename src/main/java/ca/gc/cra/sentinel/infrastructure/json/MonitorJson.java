package ca.gc.cra.sentinel.infrastructure.json;

import ca.gc.cra.sentinel.application.detect.ClassifierStatistics;
import ca.gc.cra.sentinel.application.query.CaptureHandle;
import ca.gc.cra.sentinel.application.query.Page;
import ca.gc.cra.sentinel.application.stream.StreamMessage;
import ca.gc.cra.sentinel.domain.block.BlockRule;
import ca.gc.cra.sentinel.domain.block.EndpointBlockRule;
import ca.gc.cra.sentinel.domain.block.IpBlockRule;
import ca.gc.cra.sentinel.domain.block.PatternBlockRule;
import ca.gc.cra.sentinel.domain.block.RuleId;
import ca.gc.cra.sentinel.domain.block.RuleKind;
import ca.gc.cra.sentinel.domain.detect.TunnelDetection;
import ca.gc.cra.sentinel.domain.events.MonitorEvent;
import ca.gc.cra.sentinel.domain.stats.IpCount;
import ca.gc.cra.sentinel.domain.stats.StatsSnapshot;
import ca.gc.cra.sentinel.domain.timeline.ResourceTiming;
import ca.gc.cra.sentinel.domain.timeline.Waterfall;
import ca.gc.cra.sentinel.domain.traffic.AnalyzedEntry;
import ca.gc.cra.sentinel.domain.traffic.BodyCapture;
import ca.gc.cra.sentinel.domain.traffic.Header;
import ca.gc.cra.sentinel.domain.traffic.HeaderList;
import ca.gc.cra.sentinel.domain.traffic.LogEntry;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> JSON wire format of the live stream envelopes and pull responses.
 * <p><strong>Role:</strong> Serialization adapter shared by the HTTP surface, the SSE sink and the archive.</p>
 * <p><strong>Thread-safety:</strong> Stateless; the Jackson factory is thread-safe.</p>
 *
 * @implNote Field names are camelCase. Envelopes are {@code {"type": <event type>, "data": <payload>}}.
 * @since 0.1.0
 */
public final class MonitorJson {
  private static final JsonFactory FACTORY = new JsonFactory();

  private MonitorJson() {}

  /** Writes one JSON value to a generator. */
  @FunctionalInterface
  public interface JsonWriter {
    void write(JsonGenerator gen) throws IOException;
  }

  /**
   * Renders a value into a UTF-8 byte array.
   *
   * @param writer value writer
   * @return JSON bytes
   * @throws IOException when serialization fails
   */
  public static byte[] render(JsonWriter writer) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream(512);
    write(out, writer);
    return out.toByteArray();
  }

  public static String renderString(JsonWriter writer) throws IOException {
    return new String(render(writer), StandardCharsets.UTF_8);
  }

  /** Streams a value to {@code out} without closing it. */
  public static void write(OutputStream out, JsonWriter writer) throws IOException {
    try (JsonGenerator gen = FACTORY.createGenerator(out)) {
      gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      writer.write(gen);
    }
  }

  public static byte[] envelope(MonitorEvent event) throws IOException {
    return render(gen -> writeEnvelope(gen, event));
  }

  /**
   * Writes the live stream envelope of {@code event}.
   *
   * @param gen target generator
   * @param event bus event
   * @throws IOException when writing fails
   */
  public static void writeEnvelope(JsonGenerator gen, MonitorEvent event) throws IOException {
    Objects.requireNonNull(event, "event");
    gen.writeStartObject();
    gen.writeStringField("type", event.type().wireName());
    gen.writeFieldName("data");
    switch (event.type()) {
      case LOG -> writeEntry(gen, ((MonitorEvent.Log) event).analyzed());
      case TUNNEL_ALERT -> writeAlert(gen, (MonitorEvent.TunnelAlert) event);
      case STATS_UPDATE -> writeStats(gen, ((MonitorEvent.StatsUpdate) event).snapshot());
      case BLOCK_ADDED -> writeRule(gen, ((MonitorEvent.BlockAdded) event).rule());
      case CONNECTED -> {
        MonitorEvent.Connected connected = (MonitorEvent.Connected) event;
        gen.writeStartObject();
        gen.writeStringField("subscriberId", connected.subscriberId());
        gen.writeStringField("message", connected.message());
        gen.writeStringField("connectedAt", connected.connectedAt().toString());
        gen.writeEndObject();
      }
      case PONG -> {
        gen.writeStartObject();
        gen.writeStringField("at", ((MonitorEvent.Pong) event).at().toString());
        gen.writeEndObject();
      }
    }
    gen.writeEndObject();
  }

  /**
   * Decodes an envelope received from the live stream.
   *
   * @param json envelope text
   * @return decoded message
   * @throws IllegalArgumentException when the text is not an envelope
   */
  @SuppressWarnings("unchecked")
  public static StreamMessage parseEnvelope(String json) {
    Map<String, Object> root = JsonDocuments.parseObject(json);
    String type = JsonDocuments.text(root, "type");
    if (type == null || type.isEmpty()) {
      throw new IllegalArgumentException("stream envelope is missing a type");
    }
    Object data = root.get("data");
    Map<String, Object> payload = data instanceof Map ? (Map<String, Object>) data : new LinkedHashMap<>();
    return new StreamMessage(type, payload);
  }

  /**
   * Writes a decoded document (maps, lists and scalars as produced by {@link JsonDocuments}).
   *
   * @param gen target generator
   * @param value tree node
   * @throws IOException when serialization fails
   */
  public static void writeTree(JsonGenerator gen, Object value) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof Map<?, ?> map) {
      gen.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        gen.writeFieldName(String.valueOf(entry.getKey()));
        writeTree(gen, entry.getValue());
      }
      gen.writeEndObject();
    } else if (value instanceof List<?> list) {
      gen.writeStartArray();
      for (Object item : list) {
        writeTree(gen, item);
      }
      gen.writeEndArray();
    } else if (value instanceof Boolean bool) {
      gen.writeBoolean(bool);
    } else if (value instanceof Number number) {
      gen.writeNumber(number.toString());
    } else {
      gen.writeString(value.toString());
    }
  }

  public static void writeEntry(JsonGenerator gen, AnalyzedEntry analyzed) throws IOException {
    LogEntry entry = analyzed.entry();
    gen.writeStartObject();
    gen.writeStringField("id", entry.id());
    gen.writeStringField("timestamp", entry.timestamp().toString());
    gen.writeStringField("sourceIp", entry.sourceIp());
    gen.writeStringField("method", entry.method());
    gen.writeStringField("path", entry.path());
    gen.writeStringField("query", entry.query());
    writeHeaders(gen, "headers", entry.requestHeaders());
    writeBody(gen, "body", entry.requestBody());
    gen.writeStringField("userAgent", entry.userAgent());
    gen.writeStringField("referer", entry.referer());
    gen.writeNumberField("status", entry.responseStatus());
    writeHeaders(gen, "responseHeaders", entry.responseHeaders());
    writeBody(gen, "responseBody", entry.responseBody());
    gen.writeNumberField("responseTimeMs", entry.responseTimeMs());
    gen.writeBooleanField("blocked", analyzed.denied());
    if (analyzed.denied()) {
      BlockRule rule = analyzed.decision().matchedRule().orElseThrow();
      gen.writeStringField("blockedBy", rule.id().toString());
    }
    if (analyzed.tunnelDetection() != null) {
      gen.writeFieldName("tunnelDetection");
      writeDetection(gen, analyzed.tunnelDetection());
    }
    gen.writeEndObject();
  }

  public static void writeDetection(JsonGenerator gen, TunnelDetection detection) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("detectionId", detection.detectionId());
    gen.writeStringField("entryId", detection.entryId());
    gen.writeStringField("sourceIp", detection.sourceIp());
    gen.writeStringField("detectedAt", detection.detectedAt().toString());
    gen.writeBooleanField("detected", detection.detected());
    gen.writeStringField("tunnelType", detection.tunnelType().wireName());
    gen.writeStringField("confidence", detection.confidence().wireName());
    gen.writeNumberField("riskScore", detection.riskScore());
    gen.writeArrayFieldStart("indicators");
    for (String indicator : detection.indicators()) {
      gen.writeString(indicator);
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }

  public static void writeStats(JsonGenerator gen, StatsSnapshot snapshot) throws IOException {
    gen.writeStartObject();
    gen.writeNumberField("totalRequests", snapshot.totalRequests());
    gen.writeNumberField("tunnelDetections", snapshot.tunnelDetections());
    gen.writeNumberField("deniedRequests", snapshot.deniedRequests());
    gen.writeNumberField("averageResponseTimeMs", snapshot.averageResponseTimeMs());
    gen.writeObjectFieldStart("statusCodes");
    for (Map.Entry<Integer, Long> entry : snapshot.statusCounts().entrySet()) {
      gen.writeNumberField(Integer.toString(entry.getKey()), entry.getValue());
    }
    gen.writeEndObject();
    gen.writeArrayFieldStart("topIps");
    for (IpCount ip : snapshot.topIps()) {
      gen.writeStartObject();
      gen.writeStringField("ip", ip.ip());
      gen.writeNumberField("count", ip.count());
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeStringField("generatedAt", snapshot.generatedAt().toString());
    gen.writeEndObject();
  }

  public static void writeClassifierStatistics(JsonGenerator gen, ClassifierStatistics statistics)
      throws IOException {
    gen.writeStartObject();
    gen.writeNumberField("requestsAnalyzed", statistics.requestsAnalyzed());
    gen.writeNumberField("tunnelsDetected", statistics.tunnelsDetected());
    gen.writeNumberField("beaconsDetected", statistics.beaconsDetected());
    gen.writeEndObject();
  }

  public static void writeRule(JsonGenerator gen, BlockRule rule) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("kind", rule.kind().wireName());
    gen.writeStringField("key", rule.key());
    if (rule instanceof IpBlockRule ip) {
      gen.writeStringField("ip", ip.ip());
    } else if (rule instanceof EndpointBlockRule endpoint) {
      gen.writeStringField("method", endpoint.method());
      gen.writeStringField("pattern", endpoint.pattern());
    } else if (rule instanceof PatternBlockRule pattern) {
      gen.writeStringField("field", pattern.field().wireName());
      gen.writeStringField("value", pattern.value());
    }
    gen.writeStringField("reason", rule.reason());
    gen.writeStringField("createdAt", rule.createdAt().toString());
    gen.writeStringField("createdBy", rule.createdBy());
    gen.writeEndObject();
  }

  public static void writeRules(JsonGenerator gen, Map<RuleKind, List<BlockRule>> rules) throws IOException {
    gen.writeStartObject();
    for (Map.Entry<RuleKind, List<BlockRule>> entry : rules.entrySet()) {
      gen.writeArrayFieldStart(entry.getKey().wireName());
      for (BlockRule rule : entry.getValue()) {
        writeRule(gen, rule);
      }
      gen.writeEndArray();
    }
    gen.writeEndObject();
  }

  public static void writeRuleId(JsonGenerator gen, RuleId id) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("kind", id.kind().wireName());
    gen.writeStringField("key", id.key());
    gen.writeBooleanField("removed", true);
    gen.writeEndObject();
  }

  public static void writeWaterfall(JsonGenerator gen, Waterfall waterfall) throws IOException {
    gen.writeStartObject();
    gen.writeNumberField("totalDurationMs", waterfall.totalDurationMs());
    gen.writeArrayFieldStart("entries");
    for (ResourceTiming timing : waterfall.entries()) {
      gen.writeStartObject();
      gen.writeNumberField("index", timing.index());
      gen.writeStringField("url", timing.url());
      gen.writeStringField("method", timing.method());
      gen.writeStringField("mimeCategory", timing.mimeCategory());
      gen.writeNumberField("status", timing.status());
      gen.writeNumberField("sizeBytes", timing.sizeBytes());
      gen.writeNumberField("durationMs", timing.durationMs());
      gen.writeNumberField("startOffsetMs", timing.startOffsetMs());
      gen.writeNumberField("endOffsetMs", timing.endOffsetMs());
      gen.writeStringField("domain", timing.domain());
      gen.writeEndObject();
    }
    gen.writeEndArray();
    gen.writeArrayFieldStart("warnings");
    for (String warning : waterfall.warnings()) {
      gen.writeString(warning);
    }
    gen.writeEndArray();
    gen.writeEndObject();
  }

  public static void writeCaptureHandle(JsonGenerator gen, CaptureHandle handle) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("waterfallId", handle.waterfallId());
    gen.writeFieldName("waterfall");
    writeWaterfall(gen, handle.waterfall());
    gen.writeEndObject();
  }

  /**
   * Writes a page wrapper {@code {items, total, limit, offset, hasMore}}.
   *
   * @param gen target generator
   * @param page page to write
   * @param itemWriter writer for each item
   * @param <T> item type
   * @throws IOException when writing fails
   */
  public static <T> void writePage(JsonGenerator gen, Page<T> page, ItemWriter<T> itemWriter) throws IOException {
    gen.writeStartObject();
    gen.writeArrayFieldStart("items");
    for (T item : page.items()) {
      itemWriter.write(gen, item);
    }
    gen.writeEndArray();
    gen.writeNumberField("total", page.total());
    gen.writeNumberField("limit", page.limit());
    gen.writeNumberField("offset", page.offset());
    gen.writeBooleanField("hasMore", page.hasMore());
    gen.writeEndObject();
  }

  public static void writeError(JsonGenerator gen, String code, String message) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("error", code);
    gen.writeStringField("message", message == null ? "" : message);
    gen.writeEndObject();
  }

  /** Writes one typed item. */
  @FunctionalInterface
  public interface ItemWriter<T> {
    void write(JsonGenerator gen, T item) throws IOException;
  }

  private static void writeAlert(JsonGenerator gen, MonitorEvent.TunnelAlert alert) throws IOException {
    gen.writeStartObject();
    gen.writeFieldName("detection");
    writeDetection(gen, alert.detection());
    gen.writeStringField("method", alert.entry().method());
    gen.writeStringField("path", alert.entry().path());
    gen.writeStringField("timestamp", alert.entry().timestamp().toString());
    gen.writeEndObject();
  }

  static void writeHeaders(JsonGenerator gen, String field, HeaderList headers) throws IOException {
    gen.writeObjectFieldStart(field);
    Map<String, String> merged = new LinkedHashMap<>();
    for (Header header : headers.entries()) {
      merged.merge(header.name(), header.value(), (a, b) -> a + ", " + b);
    }
    for (Map.Entry<String, String> entry : merged.entrySet()) {
      gen.writeStringField(entry.getKey(), entry.getValue());
    }
    gen.writeEndObject();
  }

  private static void writeBody(JsonGenerator gen, String field, BodyCapture body) throws IOException {
    gen.writeStringField(field, body.text());
    gen.writeNumberField(field + "Size", body.size());
    gen.writeBooleanField(field + "Truncated", body.truncated());
  }
}
