package ca.gc.cra.sentinel.application.query;

import ca.gc.cra.sentinel.domain.timeline.Waterfall;
import java.util.Objects;

/**
 * Reference to a stored waterfall returned by capture submission.
 *
 * @param waterfallId generated id usable with waterfall retrieval
 * @param waterfall reconstructed waterfall in capture order
 * @since 0.1.0
 */
public record CaptureHandle(String waterfallId, Waterfall waterfall) {
  public CaptureHandle {
    Objects.requireNonNull(waterfallId, "waterfallId");
    Objects.requireNonNull(waterfall, "waterfall");
  }
}
