package ca.gc.cra.sentinel.application.bus;

import ca.gc.cra.sentinel.application.port.ClockPort;
import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.domain.events.MonitorEvent;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * <strong>What:</strong> One subscriber's bounded event queue.
 * <p><strong>Why:</strong> Slow subscribers must never stall the publisher or each other, so each owns its queue
 * and loses its oldest events when it falls behind.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe. The bus offers from publisher threads while one consumer
 * receives.</p>
 *
 * @since 0.1.0
 */
public final class Subscription implements AutoCloseable {
  private final String id;
  private final String label;
  private final int maxQueue;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Consumer<Subscription> onClose;
  private final ArrayDeque<MonitorEvent> queue;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private final AtomicBoolean closed = new AtomicBoolean();
  private long dropped;

  Subscription(
      String id, String label, int maxQueue, ClockPort clock, MetricsPort metrics, Consumer<Subscription> onClose) {
    if (maxQueue <= 0) {
      throw new IllegalArgumentException("maxQueue must be positive");
    }
    this.id = Objects.requireNonNull(id, "id");
    this.label = label == null || label.isBlank() ? "subscriber" : label;
    this.maxQueue = maxQueue;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.onClose = Objects.requireNonNull(onClose, "onClose");
    this.queue = new ArrayDeque<>(Math.min(maxQueue, 64));
  }

  public String id() {
    return id;
  }

  public String label() {
    return label;
  }

  /**
   * Enqueues an event, discarding the oldest queued event when full.
   *
   * @return {@code false} when the subscription is closed
   */
  boolean offer(MonitorEvent event) {
    if (closed.get()) {
      return false;
    }
    lock.lock();
    try {
      if (closed.get()) {
        return false;
      }
      if (queue.size() >= maxQueue) {
        queue.pollFirst();
        dropped++;
        metrics.increment("bus.event.dropped");
      }
      queue.addLast(event);
      notEmpty.signal();
      return true;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits for the next event.
   *
   * @return next event, or empty once the subscription is closed
   * @throws InterruptedException when the waiting thread is interrupted
   */
  public Optional<MonitorEvent> receive() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (queue.isEmpty() && !closed.get()) {
        notEmpty.await();
      }
      return Optional.ofNullable(queue.pollFirst());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Waits up to {@code timeout} for the next event.
   *
   * @return next event, or empty on timeout or close
   * @throws InterruptedException when the waiting thread is interrupted
   */
  public Optional<MonitorEvent> poll(Duration timeout) throws InterruptedException {
    long remaining = timeout.toNanos();
    lock.lockInterruptibly();
    try {
      while (queue.isEmpty() && !closed.get()) {
        if (remaining <= 0L) {
          return Optional.empty();
        }
        remaining = notEmpty.awaitNanos(remaining);
      }
      return Optional.ofNullable(queue.pollFirst());
    } finally {
      lock.unlock();
    }
  }

  /** Answers a client {@code ping} by queueing a {@code pong} for this subscriber only. */
  public void ping() {
    offer(new MonitorEvent.Pong(clock.now()));
  }

  /** Events currently queued, oldest first. */
  public List<MonitorEvent> pending() {
    lock.lock();
    try {
      return List.copyOf(queue);
    } finally {
      lock.unlock();
    }
  }

  public long droppedCount() {
    lock.lock();
    try {
      return dropped;
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    return closed.get();
  }

  /** Releases the queue, wakes a blocked receiver and detaches from the bus. Idempotent. */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    lock.lock();
    try {
      queue.clear();
      notEmpty.signalAll();
    } finally {
      lock.unlock();
    }
    onClose.accept(this);
  }

  @Override
  public String toString() {
    return "Subscription[" + id + ", " + label + "]";
  }
}
