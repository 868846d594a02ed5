package ca.gc.cra.sentinel.application.detect;

/**
 * <strong>What:</strong> Fixed-capacity ring of the most recent exchanges observed from one client address.
 * <p><strong>Role:</strong> Per-IP state handed read-only to indicator checks; written only by the owning
 * {@link IpActivityArena}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Confined to the pipeline worker that owns the arena.</p>
 *
 * @since 0.1.0
 */
public final class IpActivity {
  private final long[] timestamps;
  private final long[] requestSizes;
  private final long[] responseSizes;
  private int head;
  private int size;

  IpActivity(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.timestamps = new long[capacity];
    this.requestSizes = new long[capacity];
    this.responseSizes = new long[capacity];
  }

  void record(long timestampMillis, long requestBytes, long responseBytes) {
    timestamps[head] = timestampMillis;
    requestSizes[head] = requestBytes;
    responseSizes[head] = responseBytes;
    head = (head + 1) % timestamps.length;
    if (size < timestamps.length) {
      size++;
    }
  }

  void reset() {
    head = 0;
    size = 0;
  }

  /** Number of exchanges currently retained. */
  public int size() {
    return size;
  }

  /**
   * Returns the timestamp of the {@code index}-th retained exchange, oldest first.
   *
   * @param index position in {@code [0, size())}
   * @return epoch milliseconds
   */
  public long timestampAt(int index) {
    return timestamps[slot(index)];
  }

  public long requestSizeAt(int index) {
    return requestSizes[slot(index)];
  }

  public long responseSizeAt(int index) {
    return responseSizes[slot(index)];
  }

  private int slot(int index) {
    if (index < 0 || index >= size) {
      throw new IndexOutOfBoundsException("index " + index + " outside [0," + size + ")");
    }
    int oldest = (head - size + timestamps.length) % timestamps.length;
    return (oldest + index) % timestamps.length;
  }
}
