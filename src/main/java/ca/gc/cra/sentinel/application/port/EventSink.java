package ca.gc.cra.sentinel.application.port;

import ca.gc.cra.sentinel.domain.events.MonitorEvent;
import java.io.IOException;

/**
 * <strong>What:</strong> Transport-side destination for one subscriber's events (an SSE response, a socket, a log).
 * <p><strong>Role:</strong> Adapter port driven by a {@code SubscriberPump}; an {@link IOException} marks a transient
 * transport failure and causes the subscriber to be dropped from the bus.</p>
 * <p><strong>Thread-safety:</strong> Called from a single pump thread per subscriber.</p>
 *
 * @since 0.1.0
 */
public interface EventSink extends AutoCloseable {
  /**
   * Delivers one event.
   *
   * @param event event taken from the subscriber queue
   * @throws IOException when the transport can no longer deliver
   */
  void send(MonitorEvent event) throws IOException;

  /** Releases transport resources; called once when the subscription ends. */
  @Override
  default void close() {}
}
