package ca.gc.cra.sentinel.application.stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sentinel.testutil.ManualClock;
import ca.gc.cra.sentinel.testutil.ManualScheduler;
import ca.gc.cra.sentinel.testutil.RecordingMetricsPort;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConnectionManagerTest {
  private final ManualClock clock = new ManualClock(0L);
  private final ManualScheduler scheduler = new ManualScheduler(clock);
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final FakeTransport transport = new FakeTransport();
  private final List<StreamMessage> received = new ArrayList<>();
  private final List<ConnectionState> states = new ArrayList<>();
  private ConnectionManager manager;

  @BeforeEach
  void setUp() {
    manager = new ConnectionManager(
        transport, new ReconnectBackoff(100, 2d, 1_000), 1_000, 2_500, clock, metrics, scheduler);
    manager.subscribe(new StreamListener() {
      @Override
      public void onMessage(StreamMessage message) {
        received.add(message);
      }

      @Override
      public void onStateChange(ConnectionState state) {
        states.add(state);
      }
    });
  }

  @Test
  void connectsAndDeliversMessages() {
    manager.start();
    transport.deliver(new StreamMessage("log", Map.of("id", "e1")));

    assertEquals(ConnectionState.CONNECTED, manager.state());
    assertEquals(List.of(ConnectionState.CONNECTING, ConnectionState.CONNECTED), states);
    assertEquals("e1", received.get(0).data().get("id"));
    assertEquals(1, metrics.count("stream.client.message"));
  }

  @Test
  void retriesFailedConnectsWithBackoff() {
    transport.failuresRemaining = 2;
    manager.start();
    assertEquals(1, transport.opens);
    assertEquals(ConnectionState.DISCONNECTED, manager.state());

    scheduler.advance(99);
    assertEquals(1, transport.opens);
    scheduler.advance(1);
    assertEquals(2, transport.opens);
    scheduler.advance(199);
    assertEquals(2, transport.opens);
    scheduler.advance(1);

    assertEquals(3, transport.opens);
    assertEquals(ConnectionState.CONNECTED, manager.state());
    assertEquals(2, metrics.count("stream.client.connect.failed"));
  }

  @Test
  void reconnectsAfterServerClosesSession() {
    manager.start();
    transport.serverClose(new IOException("eof"));

    assertEquals(ConnectionState.DISCONNECTED, manager.state());
    assertTrue(transport.sessions.get(0).closed);

    scheduler.advance(100);
    assertEquals(2, transport.opens);
    assertEquals(ConnectionState.CONNECTED, manager.state());
  }

  @Test
  void pingsWhileAliveAndDropsIdleSessions() {
    manager.start();
    scheduler.advance(2_000);
    assertEquals(2, transport.sessions.get(0).pings);
    assertEquals(ConnectionState.CONNECTED, manager.state());

    scheduler.advance(1_000);
    assertEquals(ConnectionState.DISCONNECTED, manager.state());
    assertEquals(1, metrics.count("stream.client.idle.timeout"));
    assertTrue(transport.sessions.get(0).closed);

    scheduler.advance(100);
    assertEquals(2, transport.opens);
  }

  @Test
  void messagesKeepSessionAlive() {
    manager.start();
    for (int i = 0; i < 5; i++) {
      scheduler.advance(900);
      transport.deliver(new StreamMessage("pong", Map.of()));
    }

    assertEquals(ConnectionState.CONNECTED, manager.state());
    assertEquals(0, metrics.count("stream.client.idle.timeout"));
  }

  @Test
  void failedPingTriggersReconnect() {
    manager.start();
    transport.sessions.get(0).failPing = true;
    scheduler.advance(1_000);

    assertEquals(ConnectionState.DISCONNECTED, manager.state());
    assertEquals(1, metrics.count("stream.client.ping.failed"));
  }

  @Test
  void listenerFailureDoesNotStopOtherListeners() {
    manager.subscribe(message -> {
      throw new IllegalStateException("boom");
    });
    manager.start();
    transport.deliver(new StreamMessage("log", Map.of()));
    transport.deliver(new StreamMessage("log", Map.of()));

    assertEquals(2, received.size());
    assertEquals(2, metrics.count("stream.client.listener.failed"));
  }

  @Test
  void unsubscribedListenerStopsReceiving() {
    List<StreamMessage> extra = new ArrayList<>();
    StreamListener listener = extra::add;
    manager.subscribe(listener);
    manager.start();
    transport.deliver(new StreamMessage("log", Map.of()));
    manager.unsubscribe(listener);
    transport.deliver(new StreamMessage("log", Map.of()));

    assertEquals(1, extra.size());
    assertEquals(2, received.size());
  }

  @Test
  void closeEndsSessionAndStopsReconnecting() {
    manager.start();
    manager.close();

    assertTrue(transport.sessions.get(0).closed);
    assertEquals(ConnectionState.DISCONNECTED, manager.state());
    assertTrue(scheduler.isShutdown());
    assertThrows(IllegalStateException.class, manager::start);
  }

  private static final class FakeTransport implements StreamTransport {
    private final List<FakeSession> sessions = new ArrayList<>();
    private int opens;
    private int failuresRemaining;
    private Consumer<StreamMessage> onMessage;
    private Consumer<Throwable> onClosed;

    @Override
    public Session open(Consumer<StreamMessage> onMessage, Consumer<Throwable> onClosed) throws IOException {
      opens++;
      if (failuresRemaining > 0) {
        failuresRemaining--;
        throw new IOException("connection refused");
      }
      this.onMessage = onMessage;
      this.onClosed = onClosed;
      FakeSession session = new FakeSession();
      sessions.add(session);
      return session;
    }

    void deliver(StreamMessage message) {
      onMessage.accept(message);
    }

    void serverClose(Throwable cause) {
      onClosed.accept(cause);
    }
  }

  private static final class FakeSession implements StreamTransport.Session {
    private int pings;
    private boolean failPing;
    private boolean closed;

    @Override
    public void ping() throws IOException {
      if (failPing) {
        throw new IOException("broken pipe");
      }
      pings++;
    }

    @Override
    public void close() {
      closed = true;
    }
  }
}
