package ca.gc.cra.sentinel.domain.timeline;

import java.util.Comparator;
import java.util.Locale;

/**
 * Display orderings supported by waterfall views.
 *
 * @since 0.1.0
 */
public enum WaterfallSort {
  CAPTURED(Comparator.comparingInt(ResourceTiming::index)),
  DURATION(Comparator.comparingDouble(ResourceTiming::durationMs).reversed()
      .thenComparingInt(ResourceTiming::index)),
  SIZE(Comparator.comparingLong(ResourceTiming::sizeBytes).reversed()
      .thenComparingInt(ResourceTiming::index)),
  DOMAIN(Comparator.comparing(ResourceTiming::domain).thenComparingInt(ResourceTiming::index));

  private final Comparator<ResourceTiming> comparator;

  WaterfallSort(Comparator<ResourceTiming> comparator) {
    this.comparator = comparator;
  }

  public Comparator<ResourceTiming> comparator() {
    return comparator;
  }

  public static WaterfallSort fromWire(String raw) {
    if (raw == null || raw.isBlank()) {
      return CAPTURED;
    }
    String normalized = raw.trim().toUpperCase(Locale.ROOT);
    if ("TIME".equals(normalized)) {
      return DURATION;
    }
    for (WaterfallSort sort : values()) {
      if (sort.name().equals(normalized)) {
        return sort;
      }
    }
    throw new IllegalArgumentException("sort must be captured, duration, size, or domain (was " + raw + ")");
  }
}
