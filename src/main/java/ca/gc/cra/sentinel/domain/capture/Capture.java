package ca.gc.cra.sentinel.domain.capture;

import java.util.List;
import java.util.Objects;

/**
 * Closed traffic capture: exchanges in capture order plus warnings for entries that were rejected while parsing.
 *
 * @param entries valid exchanges in capture order
 * @param warnings one message per skipped or degraded entry
 * @since 0.1.0
 */
public record Capture(List<CaptureEntry> entries, List<String> warnings) {
  public Capture {
    entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
    warnings = List.copyOf(Objects.requireNonNull(warnings, "warnings"));
  }

  public static Capture of(List<CaptureEntry> entries) {
    return new Capture(entries, List.of());
  }
}
