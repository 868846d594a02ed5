package ca.gc.cra.sentinel.application.bus;

import ca.gc.cra.sentinel.application.port.EventSink;
import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.domain.events.MonitorEvent;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Drains one subscription into its transport sink until the subscription closes or the transport fails.
 *
 * <p>A send failure is treated as transient transport loss: the subscriber is dropped and not retried. Clients
 * reconnect and receive a fresh subscription without replay.</p>
 *
 * @since 0.1.0
 */
public final class SubscriberPump implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(SubscriberPump.class);

  private final Subscription subscription;
  private final EventSink sink;
  private final MetricsPort metrics;

  public SubscriberPump(Subscription subscription, EventSink sink, MetricsPort metrics) {
    this.subscription = Objects.requireNonNull(subscription, "subscription");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void run() {
    MDC.put("pipeline", "stream");
    try {
      while (!Thread.currentThread().isInterrupted()) {
        Optional<MonitorEvent> next = subscription.receive();
        if (next.isEmpty()) {
          break;
        }
        sink.send(next.get());
        metrics.increment("bus.event.delivered");
      }
    } catch (IOException ex) {
      metrics.increment("bus.subscriber.failed");
      log.warn("Dropping subscriber {} after send failure: {}", subscription.id(), ex.getMessage());
      log.debug("Send failure detail for subscriber {}", subscription.id(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    } finally {
      subscription.close();
      sink.close();
      MDC.remove("pipeline");
    }
  }
}
