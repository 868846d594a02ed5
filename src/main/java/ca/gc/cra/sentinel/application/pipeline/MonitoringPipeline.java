package ca.gc.cra.sentinel.application.pipeline;

import ca.gc.cra.sentinel.application.detect.IpActivityArena;
import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.domain.traffic.RawExchange;
import ca.gc.cra.sentinel.infrastructure.exec.ExecutorFactories;
import java.lang.Thread.UncaughtExceptionHandler;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Executes live monitoring: observations are partitioned by source address onto a fixed pool of workers, each
 * owning its queue and per-IP activity arena.
 * <p>Partitioning preserves per-IP ordering and confines per-IP rate state to one thread. {@link #submit} never
 * blocks: when a partition queue is full the observation is dropped and counted.</p>
 * <p>Workers run on an ExecutorService-backed pool (threads named <code>sentinel-live-</code>). A failure while
 * processing one entry is logged, counted as {@code pipeline.entry.failed} and skipped.</p>
 *
 * @since 0.1.0
 */
public final class MonitoringPipeline implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(MonitoringPipeline.class);

  private static final double EMA_ALPHA = 0.85d;
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);
  private static final long WORKER_IDLE_POLL_MILLIS = 25L;
  private static final int DROP_LOG_THRESHOLD = 1_000;

  private final ExchangeProcessor processor;
  private final Supplier<IpActivityArena> arenaFactory;
  private final MetricsPort metrics;
  private final PipelineSettings settings;
  private final List<BlockingQueue<RawExchange>> partitions;
  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicInteger queueHighWaterMark = new AtomicInteger();
  private final AtomicInteger dropLogLimiter = new AtomicInteger();
  private final LongAdder processed = new LongAdder();
  private final LongAdder dropped = new LongAdder();
  private final LongAdder failed = new LongAdder();
  private final AtomicLong latencyEmaNanos = new AtomicLong(Double.doubleToRawLongBits(0d));
  private final String workerThreadPrefix;
  private final UncaughtExceptionHandler uncaughtHandler;

  private volatile ExecutorService executor;

  /**
   * Creates the pipeline.
   *
   * @param processor per-observation stage chain
   * @param arenaFactory supplies one per-IP arena per worker
   * @param metrics metrics sink
   * @param settings worker and queue sizing
   */
  public MonitoringPipeline(
      ExchangeProcessor processor,
      Supplier<IpActivityArena> arenaFactory,
      MetricsPort metrics,
      PipelineSettings settings) {
    this.processor = Objects.requireNonNull(processor, "processor");
    this.arenaFactory = Objects.requireNonNull(arenaFactory, "arenaFactory");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.partitions = new ArrayList<>(settings.workers());
    for (int i = 0; i < settings.workers(); i++) {
      partitions.add(new ArrayBlockingQueue<>(settings.partitionQueueCapacity()));
    }
    this.workerThreadPrefix = "sentinel-live-" + Integer.toHexString(System.identityHashCode(this));
    this.uncaughtHandler = this::handleWorkerCrash;
  }

  /** Starts the partition workers. Instances are not restartable. */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Monitoring pipeline already started");
    }
    executor = ExecutorFactories.newWorkerPool(settings.workers(), workerThreadPrefix, uncaughtHandler);
    for (int i = 0; i < settings.workers(); i++) {
      executor.execute(new PartitionWorker(i, partitions.get(i), arenaFactory.get()));
    }
    metrics.observe("pipeline.worker.active", settings.workers());
    log.info("Started {} partition workers with queue capacity {}",
        settings.workers(), settings.partitionQueueCapacity());
  }

  /**
   * Hands an observation to the worker owning its source address.
   *
   * @param raw observation
   * @return {@code false} when the partition queue was full and the observation was dropped
   * @throws IllegalStateException when the pipeline is not running
   */
  public boolean submit(RawExchange raw) {
    Objects.requireNonNull(raw, "raw");
    if (!started.get() || stopRequested.get()) {
      throw new IllegalStateException("Monitoring pipeline is not running");
    }
    int partition = partitionOf(processor.partitionKey(raw));
    BlockingQueue<RawExchange> queue = partitions.get(partition);
    if (!queue.offer(raw)) {
      dropped.increment();
      metrics.increment("pipeline.enqueue.dropped");
      logDrop(partition);
      return false;
    }
    metrics.increment("pipeline.enqueued");
    int depth = queue.size();
    metrics.observe("pipeline.queue.depth", depth);
    updateQueueHighWater(depth);
    return true;
  }

  /**
   * Hands an observation to its worker, waiting up to {@code timeout} for queue space. Used by offline replay,
   * where dropping would lose capture entries.
   *
   * @param raw observation
   * @param timeout maximum wait for queue space
   * @return {@code false} when no space became available in time
   * @throws InterruptedException when interrupted while waiting
   */
  public boolean submit(RawExchange raw, Duration timeout) throws InterruptedException {
    Objects.requireNonNull(raw, "raw");
    Objects.requireNonNull(timeout, "timeout");
    if (!started.get() || stopRequested.get()) {
      throw new IllegalStateException("Monitoring pipeline is not running");
    }
    int partition = partitionOf(processor.partitionKey(raw));
    BlockingQueue<RawExchange> queue = partitions.get(partition);
    if (!queue.offer(raw, timeout.toMillis(), TimeUnit.MILLISECONDS)) {
      dropped.increment();
      metrics.increment("pipeline.enqueue.dropped");
      logDrop(partition);
      return false;
    }
    metrics.increment("pipeline.enqueued");
    updateQueueHighWater(queue.size());
    return true;
  }

  int partitionOf(String sourceIp) {
    return Math.floorMod(sourceIp.hashCode(), partitions.size());
  }

  public long processedCount() {
    return processed.sum();
  }

  public long droppedCount() {
    return dropped.sum();
  }

  public long failedCount() {
    return failed.sum();
  }

  /** Stops accepting observations, drains queued work and stops the workers. */
  @Override
  public void close() {
    if (!started.get() || !stopRequested.compareAndSet(false, true)) {
      return;
    }
    log.info("Stopping partition workers");
    ExecutorService pool = executor;
    if (pool != null) {
      pool.shutdown();
      boolean terminated = false;
      try {
        terminated = pool.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        if (!terminated) {
          metrics.increment("pipeline.shutdown.force");
          log.warn("Partition workers active after {} ms; forcing shutdown", SHUTDOWN_TIMEOUT.toMillis());
          pool.shutdownNow();
          terminated = pool.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        }
      } catch (InterruptedException ie) {
        metrics.increment("pipeline.shutdown.interrupted");
        Thread.currentThread().interrupt();
      }
      if (!terminated) {
        log.error("Partition workers failed to terminate cleanly");
      }
    }
    executor = null;
    metrics.observe("pipeline.worker.active", 0);
    metrics.observe("pipeline.queue.highWater", queueHighWaterMark.get());
    log.info("Monitoring pipeline stopped; processed={} dropped={} failed={}",
        processed.sum(), dropped.sum(), failed.sum());
  }

  private final class PartitionWorker implements Runnable {
    private final int index;
    private final BlockingQueue<RawExchange> queue;
    private final IpActivityArena arena;

    PartitionWorker(int index, BlockingQueue<RawExchange> queue, IpActivityArena arena) {
      this.index = index;
      this.queue = queue;
      this.arena = arena;
    }

    @Override
    public void run() {
      MDC.put("pipeline", "live");
      MDC.put("partition", Integer.toString(index));
      try {
        while (true) {
          if (stopRequested.get() && queue.isEmpty()) {
            break;
          }
          RawExchange raw = queue.poll(WORKER_IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
          if (raw != null) {
            processOne(raw);
          }
        }
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        if (!stopRequested.get()) {
          metrics.increment("pipeline.worker.interrupted");
        }
      } finally {
        MDC.remove("partition");
        MDC.remove("pipeline");
      }
    }

    private void processOne(RawExchange raw) {
      long startNanos = System.nanoTime();
      try {
        processor.process(raw, arena);
        processed.increment();
        metrics.increment("pipeline.entry.processed");
        long elapsed = System.nanoTime() - startNanos;
        metrics.observe("pipeline.entry.latencyNanos", elapsed);
        metrics.observe("pipeline.entry.latencyEmaNanos", updateEma(elapsed));
      } catch (RuntimeException ex) {
        failed.increment();
        metrics.increment("pipeline.entry.failed");
        log.warn("Failed to process observation {} on partition {}", raw, index, ex);
      }
    }
  }

  private void logDrop(int partition) {
    int count = dropLogLimiter.incrementAndGet();
    if (count == 1 || count % DROP_LOG_THRESHOLD == 0) {
      log.warn("Partition {} queue saturated (capacity={}); {} observations dropped so far",
          partition, settings.partitionQueueCapacity(), dropped.sum());
    }
  }

  private void updateQueueHighWater(int depth) {
    int previous;
    do {
      previous = queueHighWaterMark.get();
      if (depth <= previous) {
        return;
      }
    } while (!queueHighWaterMark.compareAndSet(previous, depth));
    metrics.observe("pipeline.queue.highWater", depth);
  }

  private long updateEma(long sample) {
    while (true) {
      long currentBits = latencyEmaNanos.get();
      double current = Double.longBitsToDouble(currentBits);
      double next = current == 0d ? sample : (EMA_ALPHA * current + (1 - EMA_ALPHA) * sample);
      if (latencyEmaNanos.compareAndSet(currentBits, Double.doubleToRawLongBits(next))) {
        return Math.round(next);
      }
    }
  }

  private void handleWorkerCrash(Thread thread, Throwable throwable) {
    metrics.increment("pipeline.worker.uncaught");
    log.error("Partition worker {} threw an uncaught exception", thread.getName(), throwable);
  }
}
