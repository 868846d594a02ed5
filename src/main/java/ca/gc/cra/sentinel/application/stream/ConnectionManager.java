package ca.gc.cra.sentinel.application.stream;

import ca.gc.cra.sentinel.application.port.ClockPort;
import ca.gc.cra.sentinel.application.port.MetricsPort;
import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Keeps one live stream session to a monitor open and fans its messages out to listeners.
 * <p><strong>Why:</strong> Consumers of the stream should not each handle reconnects, heartbeats and liveness.</p>
 * <p><strong>Role:</strong> Client-side state machine {@code DISCONNECTED -> CONNECTING -> CONNECTED ->
 * DISCONNECTED} over a {@link StreamTransport}. Lost sessions are re-established with {@link ReconnectBackoff};
 * a ping is sent every heartbeat interval and a session silent for longer than the idle timeout is dropped.</p>
 * <p><strong>Thread-safety:</strong> State transitions run on the supplied single-threaded scheduler; messages
 * are delivered on the transport thread. Delivery is at-most-once with no replay after a reconnect.</p>
 *
 * @since 0.1.0
 */
public final class ConnectionManager implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

  public static final long DEFAULT_HEARTBEAT_MILLIS = 30_000L;
  public static final long DEFAULT_IDLE_TIMEOUT_MILLIS = 90_000L;

  private final StreamTransport transport;
  private final ReconnectBackoff backoff;
  private final long heartbeatMillis;
  private final long idleTimeoutMillis;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final ScheduledExecutorService scheduler;
  private final List<StreamListener> listeners = new CopyOnWriteArrayList<>();

  private volatile ConnectionState state = ConnectionState.DISCONNECTED;
  private volatile long lastActivityMillis;
  private volatile boolean stopped;
  private volatile boolean started;
  // Only touched on the scheduler thread.
  private StreamTransport.Session session;
  private long generation;
  private int failedAttempts;
  private ScheduledFuture<?> heartbeat;

  /**
   * Creates a manager.
   *
   * @param transport stream transport
   * @param backoff reconnection backoff
   * @param heartbeatMillis interval between pings
   * @param idleTimeoutMillis silence after which a session is considered dead; must exceed the heartbeat
   * @param clock time source for liveness
   * @param metrics metrics sink
   * @param scheduler single-threaded scheduler owned by this manager
   */
  public ConnectionManager(
      StreamTransport transport,
      ReconnectBackoff backoff,
      long heartbeatMillis,
      long idleTimeoutMillis,
      ClockPort clock,
      MetricsPort metrics,
      ScheduledExecutorService scheduler) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.backoff = Objects.requireNonNull(backoff, "backoff");
    if (heartbeatMillis <= 0) {
      throw new IllegalArgumentException("heartbeatMillis must be positive");
    }
    if (idleTimeoutMillis <= heartbeatMillis) {
      throw new IllegalArgumentException("idleTimeoutMillis must exceed heartbeatMillis");
    }
    this.heartbeatMillis = heartbeatMillis;
    this.idleTimeoutMillis = idleTimeoutMillis;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
  }

  public void subscribe(StreamListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void unsubscribe(StreamListener listener) {
    listeners.remove(listener);
  }

  public ConnectionState state() {
    return state;
  }

  /** Starts connecting. Instances are not restartable. */
  public void start() {
    if (stopped) {
      throw new IllegalStateException("connection manager closed");
    }
    if (started) {
      return;
    }
    started = true;
    submit(this::connect);
  }

  private void connect() {
    if (stopped || session != null) {
      return;
    }
    transition(ConnectionState.CONNECTING);
    long current = ++generation;
    try {
      StreamTransport.Session opened = transport.open(
          message -> onMessage(current, message),
          cause -> submit(() -> onSessionLost(current, cause)));
      if (stopped) {
        opened.close();
        return;
      }
      session = opened;
      failedAttempts = 0;
      lastActivityMillis = clock.nowMillis();
      heartbeat = scheduler.scheduleAtFixedRate(
          () -> heartbeat(current), heartbeatMillis, heartbeatMillis, TimeUnit.MILLISECONDS);
      metrics.increment("stream.client.connected");
      transition(ConnectionState.CONNECTED);
    } catch (IOException | RuntimeException ex) {
      metrics.increment("stream.client.connect.failed");
      log.warn("Stream connection attempt {} failed: {}", failedAttempts + 1, ex.getMessage());
      transition(ConnectionState.DISCONNECTED);
      scheduleReconnect();
    }
  }

  private void onMessage(long sessionGeneration, StreamMessage message) {
    if (stopped) {
      return;
    }
    lastActivityMillis = clock.nowMillis();
    metrics.increment("stream.client.message");
    for (StreamListener listener : listeners) {
      try {
        listener.onMessage(message);
      } catch (RuntimeException ex) {
        metrics.increment("stream.client.listener.failed");
        log.warn("Stream listener {} failed on {} message (session {})",
            listener, message.type(), sessionGeneration, ex);
      }
    }
  }

  private void heartbeat(long sessionGeneration) {
    if (stopped || sessionGeneration != generation || session == null) {
      return;
    }
    long silentFor = clock.nowMillis() - lastActivityMillis;
    if (silentFor > idleTimeoutMillis) {
      metrics.increment("stream.client.idle.timeout");
      log.warn("No stream traffic for {} ms; reconnecting", silentFor);
      onSessionLost(sessionGeneration, null);
      return;
    }
    try {
      session.ping();
    } catch (IOException ex) {
      metrics.increment("stream.client.ping.failed");
      log.warn("Stream heartbeat failed: {}", ex.getMessage());
      onSessionLost(sessionGeneration, ex);
    }
  }

  private void onSessionLost(long sessionGeneration, Throwable cause) {
    if (sessionGeneration != generation || session == null) {
      return;
    }
    closeSession();
    metrics.increment("stream.client.disconnected");
    if (cause != null) {
      log.info("Stream session ended: {}", cause.getMessage());
    }
    transition(ConnectionState.DISCONNECTED);
    if (!stopped) {
      scheduleReconnect();
    }
  }

  private void scheduleReconnect() {
    if (stopped) {
      return;
    }
    long delay = backoff.delayMillis(failedAttempts++);
    log.info("Reconnecting in {} ms", delay);
    try {
      scheduler.schedule(this::connect, delay, TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException ex) {
      log.debug("Scheduler stopped; not reconnecting");
    }
  }

  private void closeSession() {
    if (heartbeat != null) {
      heartbeat.cancel(false);
      heartbeat = null;
    }
    StreamTransport.Session current = session;
    session = null;
    generation++;
    if (current != null) {
      current.close();
    }
  }

  private void transition(ConnectionState next) {
    if (state == next) {
      return;
    }
    ConnectionState previous = state;
    state = next;
    log.debug("Stream connection {} -> {}", previous, next);
    for (StreamListener listener : listeners) {
      try {
        listener.onStateChange(next);
      } catch (RuntimeException ex) {
        log.warn("Stream listener {} failed on state change to {}", listener, next, ex);
      }
    }
  }

  private void submit(Runnable task) {
    try {
      scheduler.execute(task);
    } catch (RejectedExecutionException ex) {
      log.debug("Scheduler stopped; dropping connection task");
    }
  }

  /** Closes the session, stops reconnecting and shuts the scheduler down. */
  @Override
  public void close() {
    if (stopped) {
      return;
    }
    stopped = true;
    try {
      scheduler.submit(() -> {
        closeSession();
        transition(ConnectionState.DISCONNECTED);
      }).get(5, TimeUnit.SECONDS);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    } catch (Exception ex) {
      log.warn("Failed to close stream session cleanly", ex);
    } finally {
      scheduler.shutdownNow();
    }
  }
}
