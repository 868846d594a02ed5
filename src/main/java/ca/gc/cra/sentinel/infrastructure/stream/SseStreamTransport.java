package ca.gc.cra.sentinel.infrastructure.stream;

import ca.gc.cra.sentinel.application.stream.StreamMessage;
import ca.gc.cra.sentinel.application.stream.StreamTransport;
import ca.gc.cra.sentinel.domain.events.EventType;
import ca.gc.cra.sentinel.infrastructure.json.MonitorJson;
import ca.gc.cra.sentinel.logging.Logs;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link StreamTransport} reading a monitor's server-sent event stream with the JDK HTTP client.
 *
 * <p>Heartbeats are posted to {@code /api/network/stream/{subscriberId}/ping}; the subscriber id is taken from
 * the {@code connected} event that opens every stream.</p>
 *
 * @since 0.1.0
 */
public final class SseStreamTransport implements StreamTransport {
  private static final Logger log = LoggerFactory.getLogger(SseStreamTransport.class);
  static final String STREAM_PATH = "/api/network/stream";
  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

  private final URI baseUri;
  private final HttpClient client;
  private final ExecutorService readers;

  /**
   * Creates a transport.
   *
   * @param baseUri monitor base URI such as {@code http://localhost:8080}
   * @param client HTTP client
   * @param readers executor running one blocking reader per open session
   */
  public SseStreamTransport(URI baseUri, HttpClient client, ExecutorService readers) {
    String base = Objects.requireNonNull(baseUri, "baseUri").toString();
    this.baseUri = URI.create(base.endsWith("/") ? base.substring(0, base.length() - 1) : base);
    this.client = Objects.requireNonNull(client, "client");
    this.readers = Objects.requireNonNull(readers, "readers");
  }

  public static HttpClient defaultClient() {
    return HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build();
  }

  @Override
  public Session open(Consumer<StreamMessage> onMessage, Consumer<Throwable> onClosed) throws IOException {
    HttpRequest request = HttpRequest.newBuilder(URI.create(baseUri + STREAM_PATH))
        .header("Accept", "text/event-stream")
        .GET()
        .build();
    HttpResponse<InputStream> response;
    try {
      response = client.send(request, HttpResponse.BodyHandlers.ofInputStream());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IOException("interrupted while connecting to " + baseUri, ex);
    }
    if (response.statusCode() != 200) {
      response.body().close();
      throw new IOException("stream endpoint returned HTTP " + response.statusCode());
    }
    SseSession session = new SseSession(response.body());
    readers.execute(() -> session.read(onMessage, onClosed));
    log.info("Connected to live stream at {}", baseUri);
    return session;
  }

  private final class SseSession implements Session {
    private final InputStream body;
    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile String subscriberId;

    SseSession(InputStream body) {
      this.body = body;
    }

    void read(Consumer<StreamMessage> onMessage, Consumer<Throwable> onClosed) {
      Throwable failure = null;
      try (BufferedReader reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8))) {
        StringBuilder data = new StringBuilder();
        String line;
        while ((line = reader.readLine()) != null) {
          if (line.isEmpty()) {
            dispatch(data, onMessage);
            data.setLength(0);
          } else if (line.startsWith("data:")) {
            if (data.length() > 0) {
              data.append('\n');
            }
            data.append(line.substring(5).stripLeading());
          }
        }
        dispatch(data, onMessage);
        failure = new IOException("stream ended by server");
      } catch (IOException ex) {
        failure = ex;
      } finally {
        if (closed.compareAndSet(false, true)) {
          onClosed.accept(failure);
        }
      }
    }

    private void dispatch(StringBuilder data, Consumer<StreamMessage> onMessage) {
      if (data.length() == 0) {
        return;
      }
      StreamMessage message;
      try {
        message = MonitorJson.parseEnvelope(data.toString());
      } catch (IllegalArgumentException ex) {
        log.warn("Ignoring malformed stream frame: {}", Logs.printable(data.toString(), 256));
        return;
      }
      if (EventType.CONNECTED.wireName().equals(message.type())) {
        Object id = message.data().get("subscriberId");
        subscriberId = id == null ? null : id.toString();
      }
      onMessage.accept(message);
    }

    @Override
    public void ping() throws IOException {
      String id = subscriberId;
      if (id == null) {
        log.debug("Skipping heartbeat; subscriber id not yet known");
        return;
      }
      String path = STREAM_PATH + '/' + URLEncoder.encode(id, StandardCharsets.UTF_8) + "/ping";
      HttpRequest request = HttpRequest.newBuilder(URI.create(baseUri + path))
          .header("Content-Type", "application/json")
          .POST(HttpRequest.BodyPublishers.ofString("{\"type\":\"ping\"}"))
          .build();
      try {
        HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
        if (response.statusCode() / 100 != 2) {
          throw new IOException("ping returned HTTP " + response.statusCode());
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new IOException("interrupted while sending ping", ex);
      }
    }

    @Override
    public void close() {
      if (!closed.compareAndSet(false, true)) {
        return;
      }
      try {
        body.close();
      } catch (IOException ex) {
        log.debug("Failed to close stream body", ex);
      }
    }
  }
}
