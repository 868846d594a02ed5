package ca.gc.cra.sentinel.application.bus;

import ca.gc.cra.sentinel.application.port.ClockPort;
import ca.gc.cra.sentinel.application.port.EventPublisher;
import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.domain.events.MonitorEvent;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Broadcast bus fanning monitoring events out to every live subscriber.
 * <p><strong>Why:</strong> Dashboards, the stats aggregator and stream clients all observe the same traffic without
 * coupling to the pipeline or to each other.</p>
 * <p><strong>Role:</strong> Implements {@link EventPublisher}; the single ingress of monitoring events.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe. {@link #publish(MonitorEvent)} never blocks on subscribers:
 * each {@link Subscription} is bounded and drops its oldest event on overflow.</p>
 * <p><strong>Observability:</strong> Emits {@code bus.event.published}, {@code bus.event.dropped},
 * {@code bus.subscriber.added} and {@code bus.subscriber.removed}.</p>
 *
 * @since 0.1.0
 */
public final class EventBus implements EventPublisher, AutoCloseable {
  /** Message carried by the {@code connected} event sent to every new subscriber. */
  public static final String CONNECTED_MESSAGE = "Connected to network monitoring stream";
  public static final int DEFAULT_MAX_QUEUE = 500;

  private static final Logger log = LoggerFactory.getLogger(EventBus.class);

  private final int maxQueue;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final CopyOnWriteArrayList<Subscription> subscribers = new CopyOnWriteArrayList<>();

  public EventBus(int maxQueue, ClockPort clock, MetricsPort metrics) {
    if (maxQueue <= 0) {
      throw new IllegalArgumentException("maxQueue must be positive");
    }
    this.maxQueue = maxQueue;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Opens a subscription whose first queued event is {@code connected}.
   *
   * @param label diagnostic label, e.g. the remote address of a stream client
   * @return open subscription; close it to detach
   */
  public Subscription subscribe(String label) {
    Subscription subscription =
        new Subscription(UUID.randomUUID().toString(), label, maxQueue, clock, metrics, this::detach);
    subscribers.add(subscription);
    subscription.offer(new MonitorEvent.Connected(subscription.id(), CONNECTED_MESSAGE, clock.now()));
    metrics.increment("bus.subscriber.added");
    log.info("Subscriber {} ({}) connected; {} active", subscription.id(), subscription.label(), subscribers.size());
    return subscription;
  }

  @Override
  public void publish(MonitorEvent event) {
    Objects.requireNonNull(event, "event");
    metrics.increment("bus.event.published");
    for (Subscription subscription : subscribers) {
      subscription.offer(event);
    }
  }

  public Optional<Subscription> find(String subscriptionId) {
    for (Subscription subscription : subscribers) {
      if (subscription.id().equals(subscriptionId)) {
        return Optional.of(subscription);
      }
    }
    return Optional.empty();
  }

  public int subscriberCount() {
    return subscribers.size();
  }

  /** Closes every open subscription. */
  @Override
  public void close() {
    for (Subscription subscription : subscribers) {
      subscription.close();
    }
  }

  private void detach(Subscription subscription) {
    if (subscribers.remove(subscription)) {
      metrics.increment("bus.subscriber.removed");
      log.info("Subscriber {} ({}) disconnected; {} active",
          subscription.id(), subscription.label(), subscribers.size());
    }
  }
}
