package ca.gc.cra.sentinel.application.query;

import ca.gc.cra.sentinel.domain.traffic.AnalyzedEntry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded in-memory window of the most recent analyzed entries; the oldest entry is evicted first.
 *
 * <p>This is the only traffic history SENTINEL keeps; long-term retention belongs to the archive.</p>
 *
 * @since 0.1.0
 */
public final class RecentEntryWindow {
  public static final int DEFAULT_CAPACITY = 1_000;

  private final int capacity;
  private final LinkedHashMap<String, AnalyzedEntry> entries;

  public RecentEntryWindow(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("recentWindow must be positive");
    }
    this.capacity = capacity;
    this.entries = new LinkedHashMap<>() {
      @Override
      protected boolean removeEldestEntry(Map.Entry<String, AnalyzedEntry> eldest) {
        return size() > RecentEntryWindow.this.capacity;
      }
    };
  }

  public synchronized void add(AnalyzedEntry analyzed) {
    Objects.requireNonNull(analyzed, "analyzed");
    entries.put(analyzed.entry().id(), analyzed);
  }

  public synchronized Optional<AnalyzedEntry> find(String id) {
    return Optional.ofNullable(entries.get(id));
  }

  /** Snapshot of the window, newest first. */
  public synchronized List<AnalyzedEntry> newestFirst() {
    List<AnalyzedEntry> snapshot = new ArrayList<>(entries.values());
    Collections.reverse(snapshot);
    return snapshot;
  }

  public synchronized int size() {
    return entries.size();
  }

  public int capacity() {
    return capacity;
  }
}
