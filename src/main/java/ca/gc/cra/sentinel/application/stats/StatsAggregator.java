package ca.gc.cra.sentinel.application.stats;

import ca.gc.cra.sentinel.application.bus.EventBus;
import ca.gc.cra.sentinel.application.bus.Subscription;
import ca.gc.cra.sentinel.application.port.ClockPort;
import ca.gc.cra.sentinel.application.port.EventPublisher;
import ca.gc.cra.sentinel.application.port.MetricsPort;
import ca.gc.cra.sentinel.domain.events.MonitorEvent;
import ca.gc.cra.sentinel.domain.stats.IpCount;
import ca.gc.cra.sentinel.domain.stats.StatsSnapshot;
import ca.gc.cra.sentinel.domain.traffic.AnalyzedEntry;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Rolling traffic statistics computed from {@code log} events.
 * <p><strong>Why:</strong> Operators need status distribution, denial and detection counts, latency and the
 * noisiest clients without querying an external store.</p>
 * <p><strong>Role:</strong> Bus subscriber; publishes {@code stats_update} on a fixed cadence and serves snapshots
 * on demand.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep a window bounded by count and, optionally, by age.</li>
 *   <li>Count each entry id at most once.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Window access is synchronized; the aggregator thread writes while pull callers
 * read snapshots.</p>
 *
 * @since 0.1.0
 */
public final class StatsAggregator implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(StatsAggregator.class);

  private final StatsSettings settings;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final ArrayDeque<Sample> window = new ArrayDeque<>();
  private final LinkedHashSet<String> seenIds = new LinkedHashSet<>();
  private final int seenCapacity;
  private final Object lifecycle = new Object();

  private Subscription subscription;
  private ExecutorService consumer;
  private ScheduledExecutorService scheduler;

  public StatsAggregator(StatsSettings settings, ClockPort clock, MetricsPort metrics) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.seenCapacity = Math.max(settings.windowSize() * 2, 1_024);
  }

  /**
   * Subscribes to {@code bus}, consumes on a thread from {@code consumerFactory} and publishes snapshots on
   * {@code schedulerFactory}'s scheduler.
   *
   * @param bus event bus to observe and publish to
   * @param consumerFactory supplies the executor running the consumer loop
   * @param schedulerFactory supplies the scheduler publishing updates
   */
  public void start(
      EventBus bus,
      Function<String, ExecutorService> consumerFactory,
      Supplier<ScheduledExecutorService> schedulerFactory) {
    synchronized (lifecycle) {
      if (subscription != null) {
        throw new IllegalStateException("aggregator already started");
      }
      Subscription source = bus.subscribe("stats-aggregator");
      subscription = source;
      consumer = consumerFactory.apply("sentinel-stats");
      consumer.submit(() -> consume(source));
      scheduler = schedulerFactory.get();
      scheduler.scheduleAtFixedRate(
          () -> publishSnapshot(bus),
          settings.publishIntervalMillis(),
          settings.publishIntervalMillis(),
          TimeUnit.MILLISECONDS);
    }
    log.info("Stats aggregator started (window={} entries, {}s, publish every {} ms)",
        settings.windowSize(), settings.windowSeconds(), settings.publishIntervalMillis());
  }

  /**
   * Applies one bus event; anything other than {@code log} is ignored.
   *
   * @param event bus event
   */
  public void onEvent(MonitorEvent event) {
    if (event instanceof MonitorEvent.Log logEvent) {
      record(logEvent.analyzed());
    }
  }

  /**
   * Adds an analyzed entry to the window unless its id was already counted.
   *
   * @param analyzed entry to count
   * @return {@code false} for a duplicate
   */
  public synchronized boolean record(AnalyzedEntry analyzed) {
    String id = analyzed.entry().id();
    if (!seenIds.add(id)) {
      metrics.increment("stats.entry.duplicate");
      return false;
    }
    if (seenIds.size() > seenCapacity) {
      Iterator<String> oldest = seenIds.iterator();
      oldest.next();
      oldest.remove();
    }
    window.addLast(new Sample(
        clock.nowMillis(),
        analyzed.entry().sourceIp(),
        analyzed.entry().responseStatus(),
        analyzed.entry().responseTimeMs(),
        analyzed.denied(),
        analyzed.detection().isPresent()));
    while (window.size() > settings.windowSize()) {
      window.pollFirst();
    }
    return true;
  }

  /** Computes a snapshot of the current window. */
  public synchronized StatsSnapshot snapshot() {
    long now = clock.nowMillis();
    evictExpired(now);
    long total = window.size();
    long tunnels = 0L;
    long denied = 0L;
    double responseTimeSum = 0d;
    Map<Integer, Long> statusCounts = new TreeMap<>();
    Map<String, Long> perIp = new HashMap<>();
    for (Sample sample : window) {
      if (sample.tunnel()) {
        tunnels++;
      }
      if (sample.denied()) {
        denied++;
      }
      responseTimeSum += sample.responseTimeMs();
      statusCounts.merge(sample.status(), 1L, Long::sum);
      perIp.merge(sample.sourceIp(), 1L, Long::sum);
    }
    List<IpCount> ranked = new ArrayList<>();
    perIp.forEach((ip, count) -> ranked.add(new IpCount(ip, count)));
    ranked.sort(Comparator.comparingLong(IpCount::count).reversed().thenComparing(IpCount::ip));
    List<IpCount> top = ranked.size() > settings.topIps() ? ranked.subList(0, settings.topIps()) : ranked;
    double average = total == 0L ? 0d : responseTimeSum / total;
    return new StatsSnapshot(total, tunnels, denied, average, statusCounts, top, clock.now());
  }

  public StatsSettings settings() {
    return settings;
  }

  @Override
  public void close() {
    synchronized (lifecycle) {
      if (scheduler != null) {
        scheduler.shutdownNow();
        scheduler = null;
      }
      if (subscription != null) {
        subscription.close();
      }
      if (consumer != null) {
        consumer.shutdown();
        try {
          if (!consumer.awaitTermination(2, TimeUnit.SECONDS)) {
            consumer.shutdownNow();
          }
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
          consumer.shutdownNow();
        }
        consumer = null;
      }
    }
  }

  private void consume(Subscription source) {
    MDC.put("pipeline", "stats");
    try {
      while (!Thread.currentThread().isInterrupted()) {
        Optional<MonitorEvent> next = source.receive();
        if (next.isEmpty()) {
          break;
        }
        onEvent(next.get());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    } finally {
      MDC.remove("pipeline");
    }
  }

  private void publishSnapshot(EventPublisher publisher) {
    try {
      publisher.publish(new MonitorEvent.StatsUpdate(snapshot()));
      metrics.increment("stats.update.published");
    } catch (RuntimeException ex) {
      log.warn("Failed to publish stats update", ex);
    }
  }

  private void evictExpired(long now) {
    if (settings.windowSeconds() == 0L) {
      return;
    }
    long cutoff = now - settings.windowSeconds() * 1_000L;
    while (!window.isEmpty() && window.peekFirst().observedAtMillis() < cutoff) {
      window.pollFirst();
    }
  }

  private record Sample(
      long observedAtMillis, String sourceIp, int status, double responseTimeMs, boolean denied, boolean tunnel) {}
}
