package ca.gc.cra.sentinel.infrastructure.http;

import ca.gc.cra.sentinel.application.bus.EventBus;
import ca.gc.cra.sentinel.application.bus.SubscriberPump;
import ca.gc.cra.sentinel.application.bus.Subscription;
import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.application.query.BlockRuleRequest;
import ca.gc.cra.sentinel.application.query.MonitoringQueryService;
import ca.gc.cra.sentinel.application.query.Page;
import ca.gc.cra.sentinel.application.query.QueryResult;
import ca.gc.cra.sentinel.domain.traffic.AnalyzedEntry;
import ca.gc.cra.sentinel.domain.traffic.RawExchange;
import ca.gc.cra.sentinel.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.sentinel.infrastructure.json.ExportFormat;
import ca.gc.cra.sentinel.infrastructure.json.JsonDocuments;
import ca.gc.cra.sentinel.infrastructure.json.LogExporter;
import ca.gc.cra.sentinel.infrastructure.json.MonitorJson;
import ca.gc.cra.sentinel.infrastructure.json.ObservationJson;
import ca.gc.cra.sentinel.infrastructure.stream.SseEventSink;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> JDK {@link HttpServer} exposing the pull interfaces under {@code /api/network} and the
 * live stream as server-sent events.
 * <p><strong>Role:</strong> Delivery adapter; all validation and error classification happens in
 * {@link MonitoringQueryService}. {@code NOT_FOUND}, {@code INVALID_INPUT} and {@code TRANSIENT} map to 404, 400
 * and 503.</p>
 * <p><strong>Thread-safety:</strong> Requests run on a daemon pool; each open stream occupies one thread until the
 * client disconnects or the bus closes.</p>
 *
 * <pre>
 * GET    /api/network/logs?limit&amp;offset
 * GET    /api/network/logs/search?q&amp;limit&amp;offset
 * GET    /api/network/logs/export?format&amp;limit
 * GET    /api/network/logs/{id}
 * GET    /api/network/tunnels?minConfidence&amp;limit&amp;offset
 * GET    /api/network/stats
 * GET    /api/network/blocks
 * POST   /api/network/blocks
 * DELETE /api/network/blocks/{kind}/{key}
 * POST   /api/network/captures
 * GET    /api/network/captures/{id}/waterfall?mimeCategory&amp;sort
 * GET    /api/network/stream
 * POST   /api/network/stream/{subscriberId}/ping
 * POST   /api/network/observations
 * </pre>
 *
 * @since 0.1.0
 */
public final class MonitoringHttpServer implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(MonitoringHttpServer.class);

  static final String BASE_PATH = "/api/network";
  static final int MAX_RULE_BYTES = 64 * 1024;
  static final int MAX_CAPTURE_BYTES = 64 * 1024 * 1024;
  static final int MAX_OBSERVATION_BYTES = 4 * 1024 * 1024;
  private static final String JSON = "application/json; charset=utf-8";
  private static final String ACTOR_HEADER = "X-Actor";

  private final MonitoringQueryService queries;
  private final EventBus bus;
  private final LogExporter exporter;
  private final MetricsPort metrics;
  private final String host;
  private final int port;
  private final Predicate<RawExchange> intake;

  private HttpServer server;
  private ExecutorService executor;

  /**
   * Creates the adapter; nothing is bound until {@link #start()}.
   *
   * @param queries pull operations
   * @param bus live event bus
   * @param exporter log exporter
   * @param metrics metrics sink
   * @param host bind host
   * @param port bind port; {@code 0} picks a free port
   * @param intake receives observations posted by the edge; returns {@code false} when it had to drop one
   */
  public MonitoringHttpServer(
      MonitoringQueryService queries,
      EventBus bus,
      LogExporter exporter,
      MetricsPort metrics,
      String host,
      int port,
      Predicate<RawExchange> intake) {
    this.intake = Objects.requireNonNull(intake, "intake");
    this.queries = Objects.requireNonNull(queries, "queries");
    this.bus = Objects.requireNonNull(bus, "bus");
    this.exporter = Objects.requireNonNull(exporter, "exporter");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.host = Objects.requireNonNull(host, "host");
    this.port = port;
  }

  /**
   * Binds and starts serving.
   *
   * @return bound port
   * @throws IOException when the address cannot be bound
   */
  public synchronized int start() throws IOException {
    if (server != null) {
      throw new IllegalStateException("HTTP server already started");
    }
    HttpServer created = HttpServer.create(new InetSocketAddress(host, port), 0);
    executor = ExecutorFactories.newDaemonPool("sentinel-http", (thread, ex) -> {
      metrics.increment("http.handler.uncaught");
      log.error("HTTP handler thread {} failed", thread.getName(), ex);
    });
    created.setExecutor(executor);
    created.createContext(BASE_PATH, this::handle);
    created.start();
    server = created;
    int bound = created.getAddress().getPort();
    log.info("Monitoring API listening on http://{}:{}{}", host, bound, BASE_PATH);
    return bound;
  }

  @Override
  public synchronized void close() {
    if (server == null) {
      return;
    }
    server.stop(1);
    executor.shutdownNow();
    server = null;
    log.info("Monitoring API stopped");
  }

  private void handle(HttpExchange exchange) throws IOException {
    MDC.put("pipeline", "http");
    try {
      metrics.increment("http.request");
      route(exchange);
    } catch (MethodNotAllowed ex) {
      sendError(exchange, 405, "METHOD_NOT_ALLOWED", ex.getMessage());
    } catch (IllegalArgumentException ex) {
      sendError(exchange, 400, "INVALID_INPUT", ex.getMessage());
    } catch (RuntimeException ex) {
      metrics.increment("http.request.failed");
      log.error("Unhandled failure for {} {}", exchange.getRequestMethod(), exchange.getRequestURI().getPath(), ex);
      sendError(exchange, 500, "INTERNAL", "internal error");
    } finally {
      exchange.close();
      MDC.remove("pipeline");
    }
  }

  private void route(HttpExchange exchange) throws IOException {
    String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
    List<String> segments = segments(exchange.getRequestURI().getRawPath());
    Map<String, String> params = queryParams(exchange.getRequestURI().getRawQuery());
    String resource = segments.isEmpty() ? "" : segments.get(0);

    switch (resource) {
      case "logs" -> routeLogs(exchange, method, segments, params);
      case "tunnels" -> {
        requireMethod(exchange, method, "GET");
        Integer limit = intParam(params, "limit");
        Integer offset = intParam(params, "offset");
        sendResult(exchange, queries.tunnelDetections(params.get("minConfidence"), limit, offset),
            (gen, page) -> MonitorJson.writePage(gen, page, MonitorJson::writeDetection));
      }
      case "stats" -> {
        requireMethod(exchange, method, "GET");
        sendResult(exchange, queries.stats(), (gen, snapshot) -> {
          gen.writeStartObject();
          gen.writeFieldName("traffic");
          MonitorJson.writeStats(gen, snapshot);
          gen.writeFieldName("classifier");
          MonitorJson.writeClassifierStatistics(gen, queries.classifierStatistics());
          gen.writeNumberField("subscribers", bus.subscriberCount());
          gen.writeEndObject();
        });
      }
      case "blocks" -> routeBlocks(exchange, method, segments);
      case "captures" -> routeCaptures(exchange, method, segments, params);
      case "stream" -> routeStream(exchange, method, segments);
      case "observations" -> {
        requireMethod(exchange, method, "POST");
        ingest(exchange);
      }
      default -> sendError(exchange, 404, "NOT_FOUND", "unknown resource " + exchange.getRequestURI().getPath());
    }
  }

  private void ingest(HttpExchange exchange) throws IOException {
    RawExchange raw = ObservationJson.parse(new ByteArrayInputStream(readBody(exchange, MAX_OBSERVATION_BYTES)));
    if (!intake.test(raw)) {
      sendError(exchange, 503, "TRANSIENT", "observation queue is full");
      return;
    }
    metrics.increment("http.observation.accepted");
    byte[] body = MonitorJson.render(gen -> {
      gen.writeStartObject();
      gen.writeBooleanField("accepted", true);
      gen.writeEndObject();
    });
    exchange.getResponseHeaders().set("Content-Type", JSON);
    send(exchange, 202, body);
  }

  private void routeLogs(HttpExchange exchange, String method, List<String> segments, Map<String, String> params)
      throws IOException {
    requireMethod(exchange, method, "GET");
    Integer limit = intParam(params, "limit");
    Integer offset = intParam(params, "offset");
    if (segments.size() == 1) {
      sendResult(exchange, queries.recentLogs(limit, offset),
          (gen, page) -> MonitorJson.writePage(gen, page, MonitorJson::writeEntry));
    } else if (segments.size() == 2 && "search".equals(segments.get(1))) {
      sendResult(exchange, queries.searchLogs(params.get("q"), limit, offset),
          (gen, page) -> MonitorJson.writePage(gen, page, MonitorJson::writeEntry));
    } else if (segments.size() == 2 && "export".equals(segments.get(1))) {
      export(exchange, params, limit);
    } else if (segments.size() == 2) {
      sendResult(exchange, queries.logById(segments.get(1)), MonitorJson::writeEntry);
    } else {
      sendError(exchange, 404, "NOT_FOUND", "unknown log resource");
    }
  }

  private void export(HttpExchange exchange, Map<String, String> params, Integer limit) throws IOException {
    ExportFormat format = ExportFormat.fromWire(params.get("format"));
    QueryResult<Page<AnalyzedEntry>> page =
        queries.recentLogs(limit == null ? MonitoringQueryService.MAX_LIMIT : limit, 0);
    if (!page.isOk()) {
      sendFailure(exchange, page);
      return;
    }
    ByteArrayOutputStream body = new ByteArrayOutputStream();
    exporter.export(page.value().items(), format, body);
    exchange.getResponseHeaders().set("Content-Type", format.contentType());
    exchange.getResponseHeaders().set("Content-Disposition",
        "attachment; filename=\"network-logs." + format.extension() + "\"");
    send(exchange, 200, body.toByteArray());
  }

  private void routeBlocks(HttpExchange exchange, String method, List<String> segments) throws IOException {
    if (segments.size() == 1 && "GET".equals(method)) {
      sendResult(exchange, queries.blockRules(), MonitorJson::writeRules);
    } else if (segments.size() == 1 && "POST".equals(method)) {
      Map<String, Object> body = JsonDocuments.parseObject(new ByteArrayInputStream(readBody(exchange, MAX_RULE_BYTES)));
      String createdBy = JsonDocuments.text(body, "createdBy");
      if (createdBy == null) {
        createdBy = exchange.getRequestHeaders().getFirst(ACTOR_HEADER);
      }
      BlockRuleRequest request = new BlockRuleRequest(
          JsonDocuments.text(body, "kind"),
          JsonDocuments.text(body, "value"),
          JsonDocuments.text(body, "method"),
          JsonDocuments.text(body, "field"),
          JsonDocuments.text(body, "reason"),
          createdBy);
      sendResult(exchange, queries.addBlockRule(request), 201, MonitorJson::writeRule);
    } else if (segments.size() == 3 && "DELETE".equals(method)) {
      sendResult(exchange, queries.removeBlockRule(segments.get(1), segments.get(2)), MonitorJson::writeRuleId);
    } else {
      sendError(exchange, 405, "METHOD_NOT_ALLOWED", method + " not supported here");
    }
  }

  private void routeCaptures(
      HttpExchange exchange, String method, List<String> segments, Map<String, String> params) throws IOException {
    if (segments.size() == 1) {
      requireMethod(exchange, method, "POST");
      byte[] capture = readBody(exchange, MAX_CAPTURE_BYTES);
      sendResult(exchange, queries.submitCapture(new ByteArrayInputStream(capture)), 201,
          MonitorJson::writeCaptureHandle);
    } else if (segments.size() == 3 && "waterfall".equals(segments.get(2))) {
      requireMethod(exchange, method, "GET");
      sendResult(exchange, queries.waterfall(segments.get(1), params.get("mimeCategory"), params.get("sort")),
          MonitorJson::writeWaterfall);
    } else {
      sendError(exchange, 404, "NOT_FOUND", "unknown capture resource");
    }
  }

  private void routeStream(HttpExchange exchange, String method, List<String> segments) throws IOException {
    if (segments.size() == 1) {
      requireMethod(exchange, method, "GET");
      stream(exchange);
    } else if (segments.size() == 3 && "ping".equals(segments.get(2))) {
      requireMethod(exchange, method, "POST");
      Optional<Subscription> subscription = bus.find(segments.get(1));
      if (subscription.isEmpty()) {
        sendError(exchange, 404, "NOT_FOUND", "no active subscriber " + segments.get(1));
        return;
      }
      subscription.get().ping();
      exchange.sendResponseHeaders(204, -1);
    } else {
      sendError(exchange, 404, "NOT_FOUND", "unknown stream resource");
    }
  }

  private void stream(HttpExchange exchange) throws IOException {
    Subscription subscription = bus.subscribe(String.valueOf(exchange.getRemoteAddress()));
    exchange.getResponseHeaders().set("Content-Type", "text/event-stream; charset=utf-8");
    exchange.getResponseHeaders().set("Cache-Control", "no-cache");
    exchange.sendResponseHeaders(200, 0);
    log.info("Stream subscriber {} connected from {}", subscription.id(), exchange.getRemoteAddress());
    new SubscriberPump(subscription, new SseEventSink(exchange.getResponseBody()), metrics).run();
    log.info("Stream subscriber {} disconnected", subscription.id());
  }

  private <T> void sendResult(HttpExchange exchange, QueryResult<T> result, MonitorJson.ItemWriter<T> writer)
      throws IOException {
    sendResult(exchange, result, 200, writer);
  }

  private <T> void sendResult(
      HttpExchange exchange, QueryResult<T> result, int status, MonitorJson.ItemWriter<T> writer) throws IOException {
    if (!result.isOk()) {
      sendFailure(exchange, result);
      return;
    }
    byte[] body = MonitorJson.render(gen -> writer.write(gen, result.value()));
    exchange.getResponseHeaders().set("Content-Type", JSON);
    send(exchange, status, body);
  }

  private void sendFailure(HttpExchange exchange, QueryResult<?> result) throws IOException {
    int status = switch (result.error()) {
      case NOT_FOUND -> 404;
      case INVALID_INPUT -> 400;
      case TRANSIENT -> 503;
    };
    sendError(exchange, status, result.error().name(), result.message());
  }

  private void sendError(HttpExchange exchange, int status, String code, String message) throws IOException {
    metrics.increment("http.response." + status);
    byte[] body = MonitorJson.render(gen -> MonitorJson.writeError(gen, code, message));
    exchange.getResponseHeaders().set("Content-Type", JSON);
    send(exchange, status, body);
  }

  private static void send(HttpExchange exchange, int status, byte[] body) throws IOException {
    exchange.sendResponseHeaders(status, body.length == 0 ? -1 : body.length);
    if (body.length > 0) {
      try (OutputStream out = exchange.getResponseBody()) {
        out.write(body);
      }
    }
  }

  private void requireMethod(HttpExchange exchange, String actual, String expected) {
    if (!expected.equals(actual)) {
      throw new MethodNotAllowed(actual);
    }
  }

  private static byte[] readBody(HttpExchange exchange, int maxBytes) throws IOException {
    try (InputStream in = exchange.getRequestBody()) {
      byte[] body = in.readNBytes(maxBytes + 1);
      if (body.length > maxBytes) {
        throw new IllegalArgumentException("request body exceeds " + maxBytes + " bytes");
      }
      return body;
    }
  }

  static List<String> segments(String rawPath) {
    String path = rawPath == null ? "" : rawPath;
    if (path.startsWith(BASE_PATH)) {
      path = path.substring(BASE_PATH.length());
    }
    List<String> segments = new ArrayList<>();
    for (String part : path.split("/")) {
      if (!part.isEmpty()) {
        segments.add(URLDecoder.decode(part, StandardCharsets.UTF_8));
      }
    }
    return segments;
  }

  static Map<String, String> queryParams(String rawQuery) {
    Map<String, String> params = new HashMap<>();
    if (rawQuery == null || rawQuery.isEmpty()) {
      return params;
    }
    for (String pair : rawQuery.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      int eq = pair.indexOf('=');
      String key = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), StandardCharsets.UTF_8);
      String value = eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
      params.putIfAbsent(key, value);
    }
    return params;
  }

  private static Integer intParam(Map<String, String> params, String name) {
    String raw = params.get(name);
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      return Integer.valueOf(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer (was " + raw + ")", ex);
    }
  }

  private static final class MethodNotAllowed extends RuntimeException {
    MethodNotAllowed(String method) {
      super(method + " not supported here");
    }
  }
}
