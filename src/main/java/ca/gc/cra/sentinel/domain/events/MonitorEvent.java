package ca.gc.cra.sentinel.domain.events;

import ca.gc.cra.sentinel.domain.block.BlockRule;
import ca.gc.cra.sentinel.domain.detect.TunnelDetection;
import ca.gc.cra.sentinel.domain.stats.StatsSnapshot;
import ca.gc.cra.sentinel.domain.traffic.AnalyzedEntry;
import ca.gc.cra.sentinel.domain.traffic.LogEntry;
import java.time.Instant;
import java.util.Objects;

/**
 * <strong>What:</strong> Event carried by the broadcast bus to live subscribers.
 * <p><strong>Role:</strong> Sealed sum type; consumers dispatch on {@link #type()} with an exhaustive
 * {@code switch} over {@link EventType}.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable.</p>
 *
 * @since 0.1.0
 */
public sealed interface MonitorEvent
    permits MonitorEvent.Log,
        MonitorEvent.TunnelAlert,
        MonitorEvent.StatsUpdate,
        MonitorEvent.BlockAdded,
        MonitorEvent.Connected,
        MonitorEvent.Pong {

  EventType type();

  /**
   * One analyzed exchange, denied or not.
   *
   * @param analyzed entry with decision and optional verdict
   */
  record Log(AnalyzedEntry analyzed) implements MonitorEvent {
    public Log {
      Objects.requireNonNull(analyzed, "analyzed");
    }

    @Override
    public EventType type() {
      return EventType.LOG;
    }
  }

  /**
   * Classifier verdict published ahead of the corresponding {@link Log}.
   *
   * @param detection verdict
   * @param entry entry the verdict refers to
   */
  record TunnelAlert(TunnelDetection detection, LogEntry entry) implements MonitorEvent {
    public TunnelAlert {
      Objects.requireNonNull(detection, "detection");
      Objects.requireNonNull(entry, "entry");
    }

    @Override
    public EventType type() {
      return EventType.TUNNEL_ALERT;
    }
  }

  record StatsUpdate(StatsSnapshot snapshot) implements MonitorEvent {
    public StatsUpdate {
      Objects.requireNonNull(snapshot, "snapshot");
    }

    @Override
    public EventType type() {
      return EventType.STATS_UPDATE;
    }
  }

  record BlockAdded(BlockRule rule) implements MonitorEvent {
    public BlockAdded {
      Objects.requireNonNull(rule, "rule");
    }

    @Override
    public EventType type() {
      return EventType.BLOCK_ADDED;
    }
  }

  /**
   * Sent once to each new subscription.
   *
   * @param subscriberId identifier of the new subscription
   * @param message greeting text
   * @param connectedAt subscription time
   */
  record Connected(String subscriberId, String message, Instant connectedAt) implements MonitorEvent {
    public Connected {
      Objects.requireNonNull(subscriberId, "subscriberId");
      message = message == null ? "" : message;
      Objects.requireNonNull(connectedAt, "connectedAt");
    }

    @Override
    public EventType type() {
      return EventType.CONNECTED;
    }
  }

  /** Heartbeat reply to a subscriber {@code ping}. */
  record Pong(Instant at) implements MonitorEvent {
    public Pong {
      Objects.requireNonNull(at, "at");
    }

    @Override
    public EventType type() {
      return EventType.PONG;
    }
  }
}
