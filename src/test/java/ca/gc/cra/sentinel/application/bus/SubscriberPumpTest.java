package ca.gc.cra.sentinel.application.bus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sentinel.application.port.EventSink;
import ca.gc.cra.sentinel.domain.events.EventType;
import ca.gc.cra.sentinel.domain.events.MonitorEvent;
import ca.gc.cra.sentinel.testutil.ManualClock;
import ca.gc.cra.sentinel.testutil.RecordingMetricsPort;
import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.Test;

class SubscriberPumpTest {
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final EventBus bus = new EventBus(10, new ManualClock(0L), metrics);

  @Test
  void deliversUntilSubscriptionCloses() throws Exception {
    Subscription subscription = bus.subscribe("pump");
    RecordingSink sink = new RecordingSink(Integer.MAX_VALUE);
    bus.publish(new MonitorEvent.Pong(Instant.EPOCH));
    Thread pump = new Thread(new SubscriberPump(subscription, sink, metrics));
    pump.start();

    waitFor(() -> sink.events.size() == 2);
    subscription.close();
    pump.join(5_000L);

    assertEquals(List.of(EventType.CONNECTED, EventType.PONG),
        sink.events.stream().map(MonitorEvent::type).toList());
    assertTrue(sink.closed);
    assertEquals(2, metrics.count("bus.event.delivered"));
  }

  @Test
  void sendFailureDropsSubscriber() {
    Subscription subscription = bus.subscribe("broken");
    RecordingSink sink = new RecordingSink(0);

    new SubscriberPump(subscription, sink, metrics).run();

    assertTrue(subscription.isClosed());
    assertTrue(sink.closed);
    assertEquals(0, bus.subscriberCount());
    assertEquals(1, metrics.count("bus.subscriber.failed"));
  }

  private static void waitFor(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + 5_000_000_000L;
    while (!condition.getAsBoolean() && System.nanoTime() < deadline) {
      Thread.sleep(5L);
    }
  }

  private static final class RecordingSink implements EventSink {
    private final List<MonitorEvent> events = new CopyOnWriteArrayList<>();
    private final int failAfter;
    private volatile boolean closed;

    RecordingSink(int failAfter) {
      this.failAfter = failAfter;
    }

    @Override
    public void send(MonitorEvent event) throws IOException {
      if (events.size() >= failAfter) {
        throw new IOException("peer reset");
      }
      events.add(event);
    }

    @Override
    public void close() {
      closed = true;
    }
  }
}
