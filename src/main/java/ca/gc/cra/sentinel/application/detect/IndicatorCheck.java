package ca.gc.cra.sentinel.application.detect;

import ca.gc.cra.sentinel.domain.traffic.LogEntry;
import java.util.Optional;

/**
 * Independent tunnel indicator.
 *
 * <p>Implementations are pure functions of the entry and the per-IP activity of its source; they never perform
 * I/O and never mutate the activity ring.</p>
 *
 * @since 0.1.0
 */
public interface IndicatorCheck {
  /** Stable check name used in rule files and metrics. */
  String name();

  /**
   * Evaluates the indicator.
   *
   * @param entry entry under classification
   * @param activity recent exchanges from the entry's source, the entry itself being the newest
   * @return hit when the indicator fired
   */
  Optional<IndicatorHit> evaluate(LogEntry entry, IpActivity activity);

  /**
   * Rejects parameters that can never be met with {@code historyPerIp} retained exchanges per address.
   *
   * @param historyPerIp ring capacity of the activity arena
   * @throws IllegalArgumentException naming the offending parameter
   */
  default void requireHistory(int historyPerIp) {
  }
}
