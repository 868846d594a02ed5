package ca.gc.cra.sentinel.config;

import ca.gc.cra.sentinel.domain.timeline.WaterfallSort;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings for the offline {@code waterfall} command.
 *
 * @param input HAR capture to reconstruct
 * @param sort display ordering
 * @param mimeCategory category filter; empty shows every entry
 * @since 0.1.0
 */
public record WaterfallConfig(Path input, WaterfallSort sort, Optional<String> mimeCategory) {
  public WaterfallConfig {
    Objects.requireNonNull(input, "input");
    Objects.requireNonNull(sort, "sort");
    Objects.requireNonNull(mimeCategory, "mimeCategory");
  }

  /**
   * Builds the config from flattened key/value pairs.
   *
   * @param kv merged configuration map
   * @return validated configuration
   */
  public static WaterfallConfig fromMap(Map<String, String> kv) {
    Objects.requireNonNull(kv, "kv");
    Path input = MonitorConfig.parsePath("in", kv.get("in"));
    WaterfallSort sort = WaterfallSort.fromWire(kv.get("sort"));
    Optional<String> category = MonitorConfig.optionalText(kv.get("mimeCategory"))
        .map(value -> value.toLowerCase(Locale.ROOT))
        .filter(value -> !"all".equals(value));
    return new WaterfallConfig(input, sort, category);
  }
}
