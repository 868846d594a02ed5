package ca.gc.cra.sentinel.application.detect;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * <strong>What:</strong> Arena of fixed-size activity rings indexed by client address with least-recently-used
 * eviction.
 * <p><strong>Why:</strong> Rate based indicators (request bursts, beaconing) need per-IP history while memory must
 * stay bounded under address churn.</p>
 * <p><strong>Role:</strong> One arena per pipeline worker. Because work is partitioned by source address every
 * address is owned by exactly one arena.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confined to its worker.</p>
 * <p><strong>Performance:</strong> O(1) lookup and eviction; evicted rings are recycled rather than reallocated.</p>
 *
 * @since 0.1.0
 */
public final class IpActivityArena {
  public static final int DEFAULT_MAX_TRACKED_IPS = 10_000;
  public static final int DEFAULT_HISTORY_PER_IP = 100;

  private final int maxTrackedIps;
  private final int historyPerIp;
  private final Deque<IpActivity> free = new ArrayDeque<>();
  private final LinkedHashMap<String, IpActivity> rings;

  public IpActivityArena(int maxTrackedIps, int historyPerIp) {
    if (maxTrackedIps <= 0) {
      throw new IllegalArgumentException("maxTrackedIps must be positive");
    }
    if (historyPerIp <= 0) {
      throw new IllegalArgumentException("historyPerIp must be positive");
    }
    this.maxTrackedIps = maxTrackedIps;
    this.historyPerIp = historyPerIp;
    this.rings = new LinkedHashMap<>(Math.min(maxTrackedIps, 1024), 0.75f, true) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<String, IpActivity> eldest) {
        if (size() <= IpActivityArena.this.maxTrackedIps) {
          return false;
        }
        IpActivity recycled = eldest.getValue();
        recycled.reset();
        free.push(recycled);
        return true;
      }
    };
  }

  public static IpActivityArena withDefaults() {
    return new IpActivityArena(DEFAULT_MAX_TRACKED_IPS, DEFAULT_HISTORY_PER_IP);
  }

  /**
   * Records one exchange for {@code ip} and returns its ring.
   *
   * @param ip client address
   * @param timestampMillis exchange time
   * @param requestBytes original request body size
   * @param responseBytes original response body size
   * @return ring holding the new observation as its newest element
   */
  public IpActivity record(String ip, long timestampMillis, long requestBytes, long responseBytes) {
    IpActivity activity = rings.get(ip);
    if (activity == null) {
      IpActivity recycled = free.poll();
      activity = recycled != null ? recycled : new IpActivity(historyPerIp);
      rings.put(ip, activity);
    }
    activity.record(timestampMillis, requestBytes, responseBytes);
    return activity;
  }
}
