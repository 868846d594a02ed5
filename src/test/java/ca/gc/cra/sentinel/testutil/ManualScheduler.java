package ca.gc.cra.sentinel.testutil;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.AbstractExecutorService;
import java.util.concurrent.Callable;
import java.util.concurrent.Delayed;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Single-threaded scheduler driven by a {@link ManualClock}. Immediate tasks run inline on the caller;
 * delayed tasks run only when {@link #advance(long)} moves the clock past their due time.
 */
public final class ManualScheduler extends AbstractExecutorService implements ScheduledExecutorService {
  private final ManualClock clock;
  private final Deque<Runnable> immediate = new ArrayDeque<>();
  private final List<Task> pending = new ArrayList<>();
  private boolean running;
  private boolean shutdown;

  public ManualScheduler(ManualClock clock) {
    this.clock = clock;
  }

  @Override
  public void execute(Runnable command) {
    if (shutdown) {
      throw new RejectedExecutionException("scheduler shut down");
    }
    immediate.add(command);
    drain();
  }

  @Override
  public ScheduledFuture<?> schedule(Runnable command, long delay, TimeUnit unit) {
    return enqueue(command, unit.toMillis(delay), 0L);
  }

  @Override
  public <V> ScheduledFuture<V> schedule(Callable<V> callable, long delay, TimeUnit unit) {
    throw new UnsupportedOperationException("callable scheduling not needed by tests");
  }

  @Override
  public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay, long period, TimeUnit unit) {
    return enqueue(command, unit.toMillis(initialDelay), unit.toMillis(period));
  }

  @Override
  public ScheduledFuture<?> scheduleWithFixedDelay(Runnable command, long initialDelay, long delay, TimeUnit unit) {
    return enqueue(command, unit.toMillis(initialDelay), unit.toMillis(delay));
  }

  /** Moves the clock forward, running every task that falls due on the way in due-time order. */
  public void advance(long millis) {
    long target = clock.nowMillis() + millis;
    while (true) {
      Task next = pending.stream()
          .filter(task -> task.dueAt <= target)
          .min(Comparator.comparingLong(task -> task.dueAt))
          .orElse(null);
      if (next == null) {
        break;
      }
      pending.remove(next);
      clock.set(next.dueAt);
      if (next.period > 0) {
        next.dueAt += next.period;
        pending.add(next);
      } else {
        next.done = true;
      }
      immediate.add(next.command);
      drain();
    }
    clock.set(target);
  }

  public int pendingCount() {
    return pending.size();
  }

  @Override
  public void shutdown() {
    shutdown = true;
    pending.clear();
  }

  @Override
  public List<Runnable> shutdownNow() {
    shutdown();
    return List.of();
  }

  @Override
  public boolean isShutdown() {
    return shutdown;
  }

  @Override
  public boolean isTerminated() {
    return shutdown;
  }

  @Override
  public boolean awaitTermination(long timeout, TimeUnit unit) {
    return shutdown;
  }

  private Task enqueue(Runnable command, long delayMillis, long periodMillis) {
    if (shutdown) {
      throw new RejectedExecutionException("scheduler shut down");
    }
    Task task = new Task(command, clock.nowMillis() + Math.max(0L, delayMillis), periodMillis);
    pending.add(task);
    return task;
  }

  private void drain() {
    if (running) {
      return;
    }
    running = true;
    try {
      Runnable next;
      while ((next = immediate.poll()) != null) {
        next.run();
      }
    } finally {
      running = false;
    }
  }

  private final class Task implements ScheduledFuture<Object> {
    private final Runnable command;
    private final long period;
    private long dueAt;
    private boolean cancelled;
    private boolean done;

    private Task(Runnable command, long dueAt, long period) {
      this.command = command;
      this.dueAt = dueAt;
      this.period = period;
    }

    @Override
    public long getDelay(TimeUnit unit) {
      return unit.convert(dueAt - clock.nowMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public int compareTo(Delayed other) {
      return Long.compare(getDelay(TimeUnit.MILLISECONDS), other.getDelay(TimeUnit.MILLISECONDS));
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
      cancelled = true;
      return pending.remove(this);
    }

    @Override
    public boolean isCancelled() {
      return cancelled;
    }

    @Override
    public boolean isDone() {
      return done || cancelled;
    }

    @Override
    public Object get() {
      return null;
    }

    @Override
    public Object get(long timeout, TimeUnit unit) {
      return null;
    }
  }
}
