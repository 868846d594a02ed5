package ca.gc.cra.sentinel.domain.stats;

import java.util.Objects;

/**
 * Request count for a single client address inside the stats window.
 *
 * @param ip client address
 * @param count requests observed in the window
 */
public record IpCount(String ip, long count) {
  public IpCount {
    Objects.requireNonNull(ip, "ip");
    if (count < 0) {
      throw new IllegalArgumentException("count must not be negative");
    }
  }
}
