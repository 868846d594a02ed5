package ca.gc.cra.sentinel.infrastructure.json;

import ca.gc.cra.sentinel.domain.detect.TunnelDetection;
import ca.gc.cra.sentinel.domain.traffic.AnalyzedEntry;
import ca.gc.cra.sentinel.domain.traffic.BodyCapture;
import ca.gc.cra.sentinel.domain.traffic.Header;
import ca.gc.cra.sentinel.domain.traffic.HeaderList;
import ca.gc.cra.sentinel.domain.traffic.LogEntry;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Writes analyzed entries as a JSON array, CSV rows or an HTTP archive document.
 *
 * @since 0.1.0
 */
public final class LogExporter {
  static final String CSV_HEADER = "id,timestamp,sourceIp,method,path,query,status,responseTimeMs,"
      + "userAgent,referer,blocked,tunnelType,confidence,riskScore";
  private static final String CREATOR = "SENTINEL";
  private static final String CREATOR_VERSION = "0.1.0";

  /**
   * Exports {@code entries} in order.
   *
   * @param entries entries to export
   * @param format target format
   * @param out destination; left open
   * @throws IOException when writing fails
   */
  public void export(List<AnalyzedEntry> entries, ExportFormat format, OutputStream out) throws IOException {
    Objects.requireNonNull(entries, "entries");
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(out, "out");
    switch (format) {
      case JSON -> MonitorJson.write(out, gen -> {
        gen.writeStartArray();
        for (AnalyzedEntry entry : entries) {
          MonitorJson.writeEntry(gen, entry);
        }
        gen.writeEndArray();
      });
      case CSV -> writeCsv(entries, out);
      case HAR -> MonitorJson.write(out, gen -> writeHar(gen, entries));
    }
  }

  private void writeCsv(List<AnalyzedEntry> entries, OutputStream out) throws IOException {
    Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
    writer.write(CSV_HEADER);
    writer.write("\r\n");
    for (AnalyzedEntry analyzed : entries) {
      LogEntry entry = analyzed.entry();
      TunnelDetection detection = analyzed.tunnelDetection();
      String[] cells = {
          entry.id(),
          entry.timestamp().toString(),
          entry.sourceIp(),
          entry.method(),
          entry.path(),
          entry.query(),
          Integer.toString(entry.responseStatus()),
          Double.toString(entry.responseTimeMs()),
          entry.userAgent(),
          entry.referer(),
          Boolean.toString(analyzed.denied()),
          detection == null ? "" : detection.tunnelType().wireName(),
          detection == null ? "" : detection.confidence().wireName(),
          detection == null ? "" : Integer.toString(detection.riskScore())
      };
      for (int i = 0; i < cells.length; i++) {
        if (i > 0) {
          writer.write(',');
        }
        writer.write(csvCell(cells[i]));
      }
      writer.write("\r\n");
    }
    writer.flush();
  }

  static String csvCell(String value) {
    if (value.indexOf(',') < 0 && value.indexOf('"') < 0 && value.indexOf('\n') < 0 && value.indexOf('\r') < 0) {
      return value;
    }
    return '"' + value.replace("\"", "\"\"") + '"';
  }

  private void writeHar(JsonGenerator gen, List<AnalyzedEntry> entries) throws IOException {
    gen.writeStartObject();
    gen.writeObjectFieldStart("log");
    gen.writeStringField("version", "1.2");
    gen.writeObjectFieldStart("creator");
    gen.writeStringField("name", CREATOR);
    gen.writeStringField("version", CREATOR_VERSION);
    gen.writeEndObject();
    gen.writeArrayFieldStart("entries");
    for (AnalyzedEntry analyzed : entries) {
      writeHarEntry(gen, analyzed.entry());
    }
    gen.writeEndArray();
    gen.writeEndObject();
    gen.writeEndObject();
  }

  private void writeHarEntry(JsonGenerator gen, LogEntry entry) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("startedDateTime", entry.timestamp().toString());
    gen.writeNumberField("time", entry.responseTimeMs());

    gen.writeObjectFieldStart("request");
    gen.writeStringField("method", entry.method());
    gen.writeStringField("url", absoluteUrl(entry));
    gen.writeStringField("httpVersion", "HTTP/1.1");
    writeHarHeaders(gen, entry.requestHeaders());
    gen.writeArrayFieldStart("queryString");
    if (!entry.query().isEmpty()) {
      for (String pair : entry.query().split("&")) {
        if (pair.isEmpty()) {
          continue;
        }
        int eq = pair.indexOf('=');
        gen.writeStartObject();
        gen.writeStringField("name", decode(eq < 0 ? pair : pair.substring(0, eq)));
        gen.writeStringField("value", eq < 0 ? "" : decode(pair.substring(eq + 1)));
        gen.writeEndObject();
      }
    }
    gen.writeEndArray();
    gen.writeNumberField("headersSize", -1);
    gen.writeNumberField("bodySize", entry.requestBody().size());
    if (!entry.requestBody().isEmpty()) {
      gen.writeObjectFieldStart("postData");
      gen.writeStringField("mimeType", entry.requestHeaders().first("Content-Type").orElse(""));
      gen.writeStringField("text", entry.requestBody().text());
      gen.writeEndObject();
    }
    gen.writeEndObject();

    gen.writeObjectFieldStart("response");
    gen.writeNumberField("status", entry.responseStatus());
    gen.writeStringField("statusText", "");
    gen.writeStringField("httpVersion", "HTTP/1.1");
    writeHarHeaders(gen, entry.responseHeaders());
    BodyCapture body = entry.responseBody();
    gen.writeObjectFieldStart("content");
    gen.writeNumberField("size", body.size());
    gen.writeStringField("mimeType", entry.responseHeaders().first("Content-Type").orElse(""));
    gen.writeStringField("text", body.text());
    gen.writeEndObject();
    gen.writeStringField("redirectURL", entry.responseHeaders().first("Location").orElse(""));
    gen.writeNumberField("headersSize", -1);
    gen.writeNumberField("bodySize", body.size());
    gen.writeEndObject();

    gen.writeObjectFieldStart("cache");
    gen.writeEndObject();
    gen.writeObjectFieldStart("timings");
    gen.writeNumberField("send", 0);
    gen.writeNumberField("wait", entry.responseTimeMs());
    gen.writeNumberField("receive", 0);
    gen.writeEndObject();
    gen.writeEndObject();
  }

  private static void writeHarHeaders(JsonGenerator gen, HeaderList headers) throws IOException {
    gen.writeArrayFieldStart("headers");
    for (Header header : headers.entries()) {
      gen.writeStartObject();
      gen.writeStringField("name", header.name());
      gen.writeStringField("value", header.value());
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  static String absoluteUrl(LogEntry entry) {
    String host = entry.requestHeaders().first("Host").orElse("localhost");
    return "http://" + host + entry.target();
  }

  private static String decode(String raw) {
    try {
      return URLDecoder.decode(raw, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException ex) {
      return raw;
    }
  }
}
