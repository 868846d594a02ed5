package ca.gc.cra.sentinel.application.timeline;

import ca.gc.cra.sentinel.domain.timeline.Waterfall;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Bounded store of reconstructed waterfalls keyed by generated id; the oldest submission is evicted first.
 *
 * @since 0.1.0
 */
public final class WaterfallStore {
  public static final int DEFAULT_CAPACITY = 100;

  private final int capacity;
  private final LinkedHashMap<String, Waterfall> waterfalls;

  public WaterfallStore(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.capacity = capacity;
    this.waterfalls = new LinkedHashMap<>() {
      @Override
      protected boolean removeEldestEntry(Map.Entry<String, Waterfall> eldest) {
        return size() > WaterfallStore.this.capacity;
      }
    };
  }

  public synchronized String put(Waterfall waterfall) {
    Objects.requireNonNull(waterfall, "waterfall");
    String id = UUID.randomUUID().toString();
    waterfalls.put(id, waterfall);
    return id;
  }

  public synchronized Optional<Waterfall> get(String id) {
    return Optional.ofNullable(waterfalls.get(id));
  }

  public synchronized int size() {
    return waterfalls.size();
  }
}
