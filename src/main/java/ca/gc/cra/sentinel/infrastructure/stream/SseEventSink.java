package ca.gc.cra.sentinel.infrastructure.stream;

import ca.gc.cra.sentinel.application.port.EventSink;
import ca.gc.cra.sentinel.domain.events.MonitorEvent;
import ca.gc.cra.sentinel.infrastructure.json.MonitorJson;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes bus events to a server-sent events response: one {@code event:} line with the wire type and one
 * {@code data:} line carrying the JSON envelope.
 *
 * @since 0.1.0
 */
public final class SseEventSink implements EventSink {
  private static final Logger log = LoggerFactory.getLogger(SseEventSink.class);

  private final OutputStream out;

  public SseEventSink(OutputStream out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  @Override
  public void send(MonitorEvent event) throws IOException {
    byte[] envelope = MonitorJson.envelope(event);
    out.write(("event: " + event.type().wireName() + "\ndata: ").getBytes(StandardCharsets.UTF_8));
    out.write(envelope);
    out.write("\n\n".getBytes(StandardCharsets.UTF_8));
    out.flush();
  }

  @Override
  public void close() {
    try {
      out.close();
    } catch (IOException ex) {
      log.debug("SSE stream already closed", ex);
    }
  }
}
