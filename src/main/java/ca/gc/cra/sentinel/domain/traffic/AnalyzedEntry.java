package ca.gc.cra.sentinel.domain.traffic;

import ca.gc.cra.sentinel.domain.block.BlockDecision;
import ca.gc.cra.sentinel.domain.detect.TunnelDetection;
import java.util.Objects;
import java.util.Optional;

/**
 * Log entry together with the enforcement decision and optional classifier verdict reached for it.
 *
 * @param entry observed exchange
 * @param decision allow or deny outcome of block enforcement
 * @param tunnelDetection verdict when at least one indicator fired; {@code null} otherwise
 * @since 0.1.0
 */
public record AnalyzedEntry(LogEntry entry, BlockDecision decision, TunnelDetection tunnelDetection) {
  public AnalyzedEntry {
    Objects.requireNonNull(entry, "entry");
    decision = Objects.requireNonNullElse(decision, BlockDecision.allow());
    if (tunnelDetection != null && !tunnelDetection.entryId().equals(entry.id())) {
      throw new IllegalArgumentException("detection " + tunnelDetection.detectionId()
          + " does not reference entry " + entry.id());
    }
  }

  public boolean denied() {
    return decision.denied();
  }

  public Optional<TunnelDetection> detection() {
    return Optional.ofNullable(tunnelDetection);
  }
}
