package ca.gc.cra.sentinel.domain.timeline;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Reconstructed timeline of one capture.
 *
 * @param entries rows in capture order, or in the order requested by a view
 * @param totalDurationMs end offset of the last captured row; {@code 0} for an empty capture
 * @param warnings validation warnings for skipped entries
 * @since 0.1.0
 */
public record Waterfall(List<ResourceTiming> entries, double totalDurationMs, List<String> warnings) {
  public Waterfall {
    entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
    warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings"));
    if (totalDurationMs < 0d) {
      throw new IllegalArgumentException("totalDurationMs must not be negative");
    }
  }

  public static Waterfall empty(List<String> warnings) {
    return new Waterfall(List.of(), 0d, warnings);
  }

  public boolean isEmpty() {
    return entries.isEmpty();
  }

  /**
   * Returns a view restricted to one MIME category. Offsets and the total duration stay as reconstructed.
   *
   * @param mimeCategory category such as {@code image}; blank keeps every row
   * @return filtered view
   */
  public Waterfall filterByCategory(String mimeCategory) {
    if (mimeCategory == null || mimeCategory.isBlank()) {
      return this;
    }
    String wanted = mimeCategory.trim().toLowerCase(Locale.ROOT);
    List<ResourceTiming> filtered = entries.stream()
        .filter(timing -> timing.mimeCategory().equals(wanted))
        .toList();
    return new Waterfall(filtered, totalDurationMs, warnings);
  }

  /**
   * Returns a view ordered by {@code sort}. Offsets and the total duration stay as reconstructed.
   *
   * @param sort requested ordering
   * @return sorted view
   */
  public Waterfall sortedBy(WaterfallSort sort) {
    Objects.requireNonNull(sort, "sort");
    List<ResourceTiming> sorted = entries.stream().sorted(sort.comparator()).toList();
    return new Waterfall(sorted, totalDurationMs, warnings);
  }
}
